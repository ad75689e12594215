package com.give.payout.application.guard;

import com.give.payout.application.config.PayoutProperties;
import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import com.give.payout.domain.store.AccessControlStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes every mutating router call and runs it in one transaction.
 *
 * Calls from other threads queue on a fair lock (bounded by the configured
 * timeout). A call arriving on a thread that is already inside the guard, such
 * as a transfer hook calling back into the router, is rejected instead of
 * nesting. The transaction commits before the lock is released, so the next
 * caller always sees the committed ledger.
 */
@Component
public class ExecutionGuard {

    private static final Logger log = LoggerFactory.getLogger(ExecutionGuard.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private final ThreadLocal<Runnable> enlisted = new ThreadLocal<>();
    private final AccessControlStore accessControlStore;
    private final TransactionOperations transactionOperations;
    private final Duration lockTimeout;

    public ExecutionGuard(AccessControlStore accessControlStore,
                          TransactionOperations transactionOperations,
                          PayoutProperties properties) {
        this.accessControlStore = accessControlStore;
        this.transactionOperations = transactionOperations;
        this.lockTimeout = properties.getGuard().getLockTimeout();
    }

    /**
     * Run a mutating operation. Fails with SYSTEM_PAUSED while the router is paused.
     */
    public <T> T execute(String operation, Supplier<T> action) {
        return run(operation, true, action);
    }

    /**
     * Run an administrative operation; these stay available while paused
     */
    public <T> T executeAdministrative(String operation, Supplier<T> action) {
        return run(operation, false, action);
    }

    /**
     * Register work to run inside the transaction of the next guarded operation
     * on this thread, after the pause check and before the operation itself.
     * The work commits or rolls back together with that operation.
     */
    public void enlist(Runnable work) {
        enlisted.set(work);
    }

    /**
     * Drop enlisted work that no guarded operation has picked up.
     *
     * @return true if work was still pending
     */
    public boolean discardEnlisted() {
        boolean pending = enlisted.get() != null;
        enlisted.remove();
        return pending;
    }

    public boolean isBusy() {
        return lock.isLocked();
    }

    private <T> T run(String operation, boolean rejectWhenPaused, Supplier<T> action) {
        if (lock.isHeldByCurrentThread()) {
            log.warn("Rejected reentrant call to {}", operation);
            throw new PayoutException(PayoutErrorCode.REENTRANT_CALL,
                    operation + " called while another router operation is in progress on this thread");
        }

        acquire(operation);
        try {
            return transactionOperations.execute(status -> {
                if (rejectWhenPaused && accessControlStore.isPaused()) {
                    throw new PayoutException(PayoutErrorCode.SYSTEM_PAUSED, "Router is paused, " + operation + " rejected");
                }
                Runnable work = enlisted.get();
                if (work != null) {
                    enlisted.remove();
                    work.run();
                }
                return action.get();
            });
        } finally {
            lock.unlock();
        }
    }

    private void acquire(String operation) {
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PayoutException(PayoutErrorCode.LEDGER_BUSY, "Interrupted while waiting to run " + operation, e);
        }
        if (!acquired) {
            throw new PayoutException(PayoutErrorCode.LEDGER_BUSY,
                    "Timed out after " + lockTimeout.toMillis() + "ms waiting to run " + operation);
        }
    }
}
