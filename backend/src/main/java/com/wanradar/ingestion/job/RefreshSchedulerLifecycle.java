package com.wanradar.ingestion.job;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import java.util.List;

/**
 * Starts the refresh schedulers once the application is ready (when refresh is enabled) and stops them on shutdown.
 */
@Slf4j
public class RefreshSchedulerLifecycle {

    private final List<RefreshScheduler> schedulers;
    private final boolean enabled;

    public RefreshSchedulerLifecycle(List<RefreshScheduler> schedulers, boolean enabled) {
        this.schedulers = List.copyOf(schedulers);
        this.enabled = enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startAll() {
        if (!enabled) {
            log.info("Background refresh disabled; {} schedulers not started", schedulers.size());
            return;
        }
        schedulers.forEach(RefreshScheduler::start);
    }

    @PreDestroy
    public void stopAll() {
        schedulers.forEach(RefreshScheduler::stop);
    }

    public List<RefreshScheduler> getSchedulers() {
        return schedulers;
    }
}
