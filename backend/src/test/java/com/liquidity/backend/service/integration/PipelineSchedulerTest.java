package com.liquidity.backend.service.integration;

import com.liquidity.backend.exception.PipelineAlreadyRunningException;
import com.liquidity.backend.service.ScheduledTaskGuard;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineSchedulerTest {

    @Test
    void overlappingRunIsSkipped() {
        EngineIntegrationHub hub = mock(EngineIntegrationHub.class);
        when(hub.executeIntegratedPipeline()).thenThrow(new PipelineAlreadyRunningException());
        PipelineScheduler scheduler = new PipelineScheduler(hub, new ScheduledTaskGuard());

        assertThatCode(scheduler::runPipeline).doesNotThrowAnyException();
        verify(hub).executeIntegratedPipeline();
    }

    @Test
    void failingRunDoesNotEscapeScheduler() {
        EngineIntegrationHub hub = mock(EngineIntegrationHub.class);
        when(hub.executeIntegratedPipeline()).thenThrow(new IllegalStateException("cycle"));
        PipelineScheduler scheduler = new PipelineScheduler(hub, new ScheduledTaskGuard());

        assertThatCode(scheduler::runPipeline).doesNotThrowAnyException();
    }
}
