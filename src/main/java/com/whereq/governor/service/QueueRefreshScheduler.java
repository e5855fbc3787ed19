package com.whereq.governor.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically re-evaluates delayed jobs so they get promoted when observed load drops,
 * not only when another job finishes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "governor.refresh", name = "enabled", havingValue = "true", matchIfMissing = true)
public class QueueRefreshScheduler {

    private final BudgetManager budgetManager;

    @Scheduled(fixedDelayString = "${governor.refresh.interval-ms:2000}")
    public void refresh() {
        try {
            budgetManager.refreshQueue();
        } catch (RuntimeException e) {
            log.error("Periodic queue refresh failed", e);
        }
    }
}
