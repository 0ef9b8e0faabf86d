/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks the reconciliations in progress and makes sure that a given resource is never reconciled by two controller
 * loops at the same time. The diff computed by a reconciliation is not protected against concurrent modification, so
 * this serialization is what keeps two passes from racing on the same cloud resource.
 */
public class ReconciliationLockManager {
    private static final Logger LOGGER = LogManager.getLogger(ReconciliationLockManager.class);

    /*test*/ final ConcurrentHashMap<String, ReconciliationLock> locks = new ConcurrentHashMap<>();

    /**
     * Tries to lock the lock for given key. The counter of interested parties is increased inside the
     * locks.compute(...) call so that the lock cannot be removed from the map in between.
     *
     * @param key   The key for which the lock should be obtained
     * @param time  How many units of time should we wait for the lock
     * @param unit  The unit of the waiting time
     *
     * @return  True if the lock was successfully obtained. False otherwise
     *
     * @throws InterruptedException if interrupted while waiting for the lock
     */
    public boolean tryLock(String key, long time, TimeUnit unit) throws InterruptedException {
        ReconciliationLock rLock = locks.compute(key, (k, v) -> v == null ? new ReconciliationLock() : v.incrementQueueAndGet());
        LOGGER.debug("Trying to obtain lock {}", key);
        return rLock.tryLock(time, unit);
    }

    /**
     * Unlocks the lock for given key. When nobody else is waiting for the lock, it is removed from the map.
     *
     * @param key   The key of the lock which should be unlocked
     */
    public void unlock(String key)    {
        locks.compute(key, (k, v) -> {
            if (v == null)  {
                LOGGER.warn("Lock with key {} does not exist and cannot be unlocked", key);
                return null;
            } else {
                LOGGER.debug("Releasing lock {}", key);
                return v.unlock() == 0 ? null : v;
            }
        });
    }

    /**
     * Lock together with the number of parties which hold it or wait for it
     */
    static class ReconciliationLock    {
        private final Lock lock = new ReentrantLock();
        /*test*/ final AtomicInteger lockQueue = new AtomicInteger(1); // Starts at 1 because it is created by a tryLock() call

        private ReconciliationLock incrementQueueAndGet()   {
            lockQueue.incrementAndGet();
            return this;
        }

        private boolean tryLock(long time, TimeUnit unit) throws InterruptedException {
            boolean locked = false;

            try {
                locked = lock.tryLock(time, unit);
                return locked;
            } finally {
                if (!locked) {
                    lockQueue.decrementAndGet();
                }
            }
        }

        private int unlock()   {
            lock.unlock();
            return lockQueue.decrementAndGet();
        }
    }
}
