package com.wanradar.ingestion.job;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class RefreshSchedulerLifecycleTest {

    private final RefreshScheduler ports = mock(RefreshScheduler.class);
    private final RefreshScheduler devices = mock(RefreshScheduler.class);

    @Test
    void startsEverySchedulerWhenEnabled() {
        RefreshSchedulerLifecycle lifecycle = new RefreshSchedulerLifecycle(List.of(ports, devices), true);

        lifecycle.startAll();

        verify(ports).start();
        verify(devices).start();
    }

    @Test
    void startsNothingWhenDisabled() {
        RefreshSchedulerLifecycle lifecycle = new RefreshSchedulerLifecycle(List.of(ports, devices), false);

        lifecycle.startAll();

        verify(ports, never()).start();
        verify(devices, never()).start();
    }

    @Test
    void stopsEverySchedulerOnShutdown() {
        RefreshSchedulerLifecycle lifecycle = new RefreshSchedulerLifecycle(List.of(ports, devices), true);

        lifecycle.stopAll();

        verify(ports).stop();
        verify(devices).stop();
    }
}
