package com.mindtrends.monitor.output;

import com.mindtrends.monitor.config.TrendsMonitorProperties;
import com.mindtrends.monitor.config.TrendsMonitorProperties.Output.OutputMode;
import com.mindtrends.monitor.model.PipelineResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutputRouter")
class OutputRouterTest {

    @Mock private ClickHouseWriter clickHouseWriter;
    @Mock private CsvWriter csvWriter;

    private TrendsMonitorProperties properties;
    private OutputRouter router;

    @BeforeEach
    void setUp() {
        properties = new TrendsMonitorProperties();
        router = new OutputRouter(clickHouseWriter, csvWriter, properties);
    }

    @Test
    @DisplayName("CSV mode never touches ClickHouse")
    void csvOnly() {
        PipelineResult result = OutputFixtures.result();
        properties.getOutput().setMode(OutputMode.CSV);

        router.write(result);
        router.writePipelineRun(result.run());

        verify(csvWriter).write(result);
        verify(clickHouseWriter, never()).write(any());
        verify(clickHouseWriter, never()).writePipelineRun(any());
    }

    @Test
    @DisplayName("A failing sink does not stop the other one or the caller")
    void sinkFailureIsContained() {
        PipelineResult result = OutputFixtures.result();
        properties.getOutput().setMode(OutputMode.BOTH);
        doThrow(new IllegalStateException("connection refused")).when(clickHouseWriter).write(result);

        assertThatCode(() -> router.write(result)).doesNotThrowAnyException();

        verify(csvWriter).write(result);
    }
}
