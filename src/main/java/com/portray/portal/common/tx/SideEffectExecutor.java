package com.portray.portal.common.tx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs best-effort writes (audit entries, activation logs, notifications) once the
 * surrounding transaction has committed, each in a transaction of its own.
 * A failing write is logged and dropped; it never reaches the caller.
 * Outside a transaction the write runs immediately.
 */
@Component
public class SideEffectExecutor {

    private static final Logger log = LoggerFactory.getLogger(SideEffectExecutor.class);

    private final TransactionTemplate requiresNew;

    public SideEffectExecutor(PlatformTransactionManager transactionManager) {
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void afterCommit(String description, Runnable write) {
        Runnable guarded = () -> {
            try {
                requiresNew.executeWithoutResult(status -> write.run());
            } catch (RuntimeException e) {
                log.error("Failed to {}", description, e);
            }
        };

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    guarded.run();
                }
            });
        } else {
            guarded.run();
        }
    }
}
