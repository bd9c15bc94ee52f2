package com.agrilink.community.service;

import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Ties file system work to the outcome of the surrounding transaction.
 * Stored files are deleted only once their rows are gone, and new uploads are removed when
 * the rows referencing them roll back.
 */
final class AfterTransaction {

    private AfterTransaction() {
    }

    /**
     * Run after commit, or right away when no transaction is active.
     */
    static void commit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    /**
     * Run after rollback. Without a transaction there is nothing to roll back.
     */
    static void rollback(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_ROLLED_BACK) {
                    action.run();
                }
            }
        });
    }
}
