package com.portray.portal.common.tx;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class SideEffectExecutorTest {

    private PlatformTransactionManager transactionManager;
    private SideEffectExecutor executor;
    private final List<String> committed = new ArrayList<>();

    @BeforeEach
    void setUp() {
        transactionManager = mock(PlatformTransactionManager.class);
        when(transactionManager.getTransaction(any())).thenAnswer(inv -> new SimpleTransactionStatus());
        executor = new SideEffectExecutor(transactionManager);
    }

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    /** Commits the primary unit of work, then fires the after-commit callbacks the way the manager does. */
    private void commitPrimary(String change) {
        List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
        committed.add(change);
        synchronizations.forEach(TransactionSynchronization::afterCommit);
    }

    @Test
    @DisplayName("Failing follow-up write is rolled back on its own and the committed change stands")
    void failedWriteKeepsPrimaryCommit() {
        TransactionSynchronizationManager.initSynchronization();
        List<String> logged = new ArrayList<>();

        executor.afterCommit("write activation log", () -> {
            throw new IllegalStateException("activation_logs unavailable");
        });
        executor.afterCommit("notify terminal change", () -> logged.add("notified"));

        // nothing runs before the commit
        assertTrue(logged.isEmpty());
        verify(transactionManager, never()).getTransaction(any());

        assertDoesNotThrow(() -> commitPrimary("terminal T-1 ACTIVE"));

        assertEquals(List.of("terminal T-1 ACTIVE"), committed);
        assertEquals(List.of("notified"), logged);
        verify(transactionManager, times(2)).getTransaction(
                argThat(def -> def.getPropagationBehavior() == TransactionDefinition.PROPAGATION_REQUIRES_NEW));
        verify(transactionManager).rollback(any(TransactionStatus.class));
        verify(transactionManager).commit(any(TransactionStatus.class));
    }

    @Test
    @DisplayName("Rolled back primary transaction drops the queued writes")
    void rollbackRunsNothing() {
        TransactionSynchronizationManager.initSynchronization();
        List<String> logged = new ArrayList<>();

        executor.afterCommit("write audit entry", () -> logged.add("audit"));
        TransactionSynchronizationManager.getSynchronizations()
                .forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

        assertTrue(logged.isEmpty());
        verifyNoInteractions(transactionManager);
    }

    @Test
    @DisplayName("Without a surrounding transaction the write runs at once and failures are still contained")
    void runsImmediatelyOutsideTransaction() {
        List<String> logged = new ArrayList<>();

        executor.afterCommit("write audit entry", () -> logged.add("audit"));
        assertDoesNotThrow(() -> executor.afterCommit("write audit entry", () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(List.of("audit"), logged);
        verify(transactionManager).commit(any(TransactionStatus.class));
        verify(transactionManager).rollback(any(TransactionStatus.class));
    }
}
