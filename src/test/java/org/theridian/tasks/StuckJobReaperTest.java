package org.theridian.tasks;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.theridian.service.jobs.JobLifecycleService;
import org.theridian.service.metrics.MetricRecorder;

import java.util.Map;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StuckJobReaper Tests")
class StuckJobReaperTest {

    @Mock
    private JobLifecycleService jobLifecycleService;

    @Mock
    private MetricRecorder metricRecorder;

    @InjectMocks
    private StuckJobReaper reaper;

    @Test
    @DisplayName("Should record a heartbeat and reap stuck jobs on every sweep")
    void testSweep() {
        when(jobLifecycleService.reapStuckJobs()).thenReturn(2);

        reaper.sweep();

        verify(metricRecorder).counter("system_health_check", Map.of("component", "worker"));
        verify(jobLifecycleService).reapStuckJobs();
    }
}
