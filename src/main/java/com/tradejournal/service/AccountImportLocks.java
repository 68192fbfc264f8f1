package com.tradejournal.service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * One lock per (owner, account) so that two imports into the same account cannot both seed
 * their duplicate check from the same snapshot and insert the same trade twice.
 *
 * <p>Imports into different accounts proceed in parallel. An account's entry lives only while
 * some import holds or waits for its lock.
 */
@Component
public class AccountImportLocks {

    private final ConcurrentHashMap<String, AccountLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String ownerId, String account, Supplier<T> action) {
        String key = ownerId + "::" + account;
        // users is only read and written inside compute, which runs atomically per key
        AccountLock accountLock = locks.compute(key, (k, existing) -> {
            AccountLock held = existing != null ? existing : new AccountLock();
            held.users++;
            return held;
        });
        accountLock.lock.lock();
        try {
            return action.get();
        } finally {
            accountLock.lock.unlock();
            locks.computeIfPresent(key, (k, held) -> --held.users == 0 ? null : held);
        }
    }

    /** Number of accounts with an import in progress or waiting. */
    public int activeAccounts() {
        return locks.size();
    }

    private static final class AccountLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
