package com.liquidity.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keeps periodic tasks alive: a failing run is logged and the schedule continues.
 */
@Service
@Slf4j
public class ScheduledTaskGuard {

    public void run(String taskName, Runnable task) {
        try {
            task.run();
        } catch (Throwable t) {
            log.error("Scheduled task failed task={}", taskName, t);
        }
    }
}
