package com.bountyboard.progression.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * 账本读写锁。
 * 写操作（append / backfill / recompute）在锁内完成整个数据库事务，提交后才释放；
 * 排行榜、查询、导出、校验持读锁，看不到进行到一半的多猎人更新。
 */
@Component
public class LedgerLock {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
