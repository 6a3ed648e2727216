package service.impl;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.LockSupport;

import exception.QueryCancelledException;
import exception.SchedulerException;
import model.LockAttempt;
import model.QueryKey;
import model.QueryRecord;
import model.QueryStatus;
import model.ScheduleState;
import model.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import service.DependencyIndex;
import service.QueryScheduler;
import service.TableLockManager;

/**
 * IMMV查询调度服务实现
 *
 * 查询开始时登记并等待准入；准入后对依赖基表非阻塞加锁，任一张失败则释放本轮的锁、
 * 标记GAVE_UP、归还名额、重调度后回到等待。不在持有其他锁的情况下阻塞等待锁，因此不会形成死锁环。
 */
public class IvmQuerySchedulerImpl implements QueryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(IvmQuerySchedulerImpl.class);

    // 查询登记表与调度计数器
    private final QueryRegistry registry;

    private final Rescheduler rescheduler = new Rescheduler();

    private final DependencyLockAcquirer lockAcquirer;

    // 查询实例序号
    private final AtomicLong sequence = new AtomicLong();

    // 配置参数
    private volatile int maxConcurrentQueries;
    private volatile int maxAffectedTablesPerQuery;
    private volatile long pollIntervalMicros;

    public IvmQuerySchedulerImpl(DependencyIndex dependencyIndex, TableLockManager lockManager) {
        this(new SchedulerConfig(), dependencyIndex, lockManager);
    }

    public IvmQuerySchedulerImpl(SchedulerConfig config, DependencyIndex dependencyIndex,
                                 TableLockManager lockManager) {
        if (config == null || dependencyIndex == null || lockManager == null) {
            throw new IllegalArgumentException("参数不能为空");
        }
        config.validate();
        this.registry = new QueryRegistry(config.getMaxRegisteredQueries());
        this.lockAcquirer = new DependencyLockAcquirer(dependencyIndex, lockManager);
        this.maxConcurrentQueries = config.getMaxConcurrentQueries();
        this.maxAffectedTablesPerQuery = config.getMaxAffectedTablesPerQuery();
        this.pollIntervalMicros = config.getPollIntervalMicros();

        logger.info("IMMV查询调度服务初始化完成: maxConcurrentQueries={}, maxAffectedTablesPerQuery={}, capacity={}, pollInterval={}us",
                maxConcurrentQueries, maxAffectedTablesPerQuery, registry.getCapacity(), pollIntervalMicros);
    }

    @Override
    public QueryKey onQueryStart(String ownerId, long transactionId, List<String> affectedImmvs) {
        if (ownerId == null || affectedImmvs == null) {
            throw new IllegalArgumentException("参数不能为空");
        }

        QueryKey key = new QueryKey(ownerId, sequence.incrementAndGet());

        Lock writeLock = registry.writeLock();
        writeLock.lock();
        try {
            registry.register(key, affectedImmvs, transactionId, maxAffectedTablesPerQuery);
            rescheduleLocked();
        } finally {
            writeLock.unlock();
        }

        try {
            acquireSlotAndLocks(key, transactionId, affectedImmvs);
        } catch (RuntimeException e) {
            releaseAndDeregister(key);
            throw e;
        }
        return key;
    }

    /**
     * 等待准入并获取全部依赖表的锁，失败则退让后重新等待
     */
    private void acquireSlotAndLocks(QueryKey key, long transactionId, List<String> affectedImmvs) {
        int attempts = 0;
        boolean locked = false;
        while (!locked) {
            awaitAvailable(key);
            attempts++;
            LockAttempt attempt = lockAcquirer.acquireAll(key.getOwnerId(), affectedImmvs);
            locked = completeAttempt(key, attempt);
            if (!locked && attempts == 1) {
                logger.warn("依赖表被占用，查询退让后重试: key={}, table={}", key, attempt.getContendedTable());
            }
        }

        logger.info("已获取全部依赖表的锁: key={}, xid={}, attempts={}, holding={}",
                key, transactionId, attempts, lockAcquirer.getLockManager().heldBy(key.getOwnerId()));
    }

    /**
     * 记录一轮加锁的结果：成功则进入RUNNING；失败则标记GAVE_UP、归还名额并重调度
     *
     * @return 是否已拿到全部锁
     */
    private boolean completeAttempt(QueryKey key, LockAttempt attempt) {
        Lock writeLock = registry.writeLock();
        writeLock.lock();
        try {
            QueryRecord record = registry.get(key);
            if (record == null) {
                // 加锁期间记录被回滚清理
                lockAcquirer.release(key.getOwnerId(), attempt.getNewlyLocked());
                throw new SchedulerException("查询记录已被清理: key=" + key);
            }

            if (attempt.isSuccess()) {
                record.setStatus(QueryStatus.RUNNING);
                record.setLockedTables(new LinkedHashSet<>(attempt.getNewlyLocked()));
                return true;
            }

            record.setStatus(QueryStatus.GAVE_UP);
            ScheduleState state = registry.getState();
            state.setRunningCount(state.getRunningCount() - 1);
            rescheduleLocked();
            return false;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 轮询等待本查询变为AVAILABLE
     * 没有查询在运行而本查询又未被准入时主动重调度，避免所有等待者都在休眠而无人触发准入
     */
    private void awaitAvailable(QueryKey key) {
        long pollNanos = TimeUnit.MICROSECONDS.toNanos(pollIntervalMicros);
        for (;;) {
            QueryStatus status;
            int running;

            Lock readLock = registry.readLock();
            readLock.lock();
            try {
                status = requireRecord(key).getStatus();
                running = registry.getState().getRunningCount();
            } finally {
                readLock.unlock();
            }

            if (running == 0 && status != QueryStatus.AVAILABLE) {
                Lock writeLock = registry.writeLock();
                writeLock.lock();
                try {
                    rescheduleLocked();
                    status = requireRecord(key).getStatus();
                } finally {
                    writeLock.unlock();
                }
                logger.debug("无运行中查询，触发重调度: key={}, status={}", key, status);
            }

            if (status == QueryStatus.AVAILABLE) {
                return;
            }

            LockSupport.parkNanos(pollNanos);
            if (Thread.interrupted()) {
                logger.warn("等待调度时被中断: key={}", key);
                Thread.currentThread().interrupt();
                throw new QueryCancelledException(key);
            }
        }
    }

    private QueryRecord requireRecord(QueryKey key) {
        QueryRecord record = registry.get(key);
        if (record == null) {
            throw new SchedulerException("查询记录已被清理: key=" + key);
        }
        return record;
    }

    @Override
    public void onQueryEnd(QueryKey key, boolean succeeded) {
        if (key == null) {
            return;
        }
        if (releaseAndDeregister(key)) {
            logger.info("查询结束: key={}, succeeded={}, runningCount={}", key, succeeded, getRunningCount());
        } else {
            logger.debug("查询已清理，忽略结束通知: key={}", key);
        }
    }

    @Override
    public void onTransactionAbort(String ownerId) {
        if (ownerId == null) {
            return;
        }

        List<QueryKey> keys = new ArrayList<>();
        Lock writeLock = registry.writeLock();
        writeLock.lock();
        try {
            for (QueryRecord record : registry.recordsOwnedBy(ownerId)) {
                keys.add(record.getKey());
            }
        } finally {
            writeLock.unlock();
        }

        int cleaned = 0;
        for (QueryKey key : keys) {
            if (releaseAndDeregister(key)) {
                cleaned++;
            }
        }
        logger.info("事务回滚清理: owner={}, cleaned={}, runningCount={}", ownerId, cleaned, getRunningCount());
    }

    /**
     * 释放本轮获取的表锁、注销记录、归还名额并重调度
     *
     * @return 记录是否由本次调用移除
     */
    private boolean releaseAndDeregister(QueryKey key) {
        Set<String> lockedTables;
        Lock readLock = registry.readLock();
        readLock.lock();
        try {
            QueryRecord record = registry.get(key);
            if (record == null) {
                return false;
            }
            lockedTables = new LinkedHashSet<>(record.getLockedTables());
        } finally {
            readLock.unlock();
        }

        // 先放锁，新准入的查询才能拿到
        lockAcquirer.release(key.getOwnerId(), lockedTables);

        Lock writeLock = registry.writeLock();
        writeLock.lock();
        try {
            QueryRecord removed = registry.deregister(key);
            if (removed == null) {
                return false;
            }
            if (removed.getStatus().holdsSlot()) {
                ScheduleState state = registry.getState();
                state.setRunningCount(state.getRunningCount() - 1);
            }
            rescheduleLocked();
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    private void rescheduleLocked() {
        rescheduler.reschedule(registry, maxConcurrentQueries);
        checkInvariantLocked();
    }

    private void checkInvariantLocked() {
        int running = registry.getState().getRunningCount();
        if (running < 0 || running > maxConcurrentQueries) {
            throw new IllegalStateException("运行中查询数越界: runningCount=" + running
                    + ", maxConcurrentQueries=" + maxConcurrentQueries);
        }
    }

    @Override
    public void setConfiguration(int maxConcurrentQueries, int maxAffectedTablesPerQuery, long pollIntervalMicros) {
        SchedulerConfig candidate = new SchedulerConfig(maxConcurrentQueries, maxAffectedTablesPerQuery,
                registry.getCapacity(), pollIntervalMicros);
        candidate.validate();

        Lock writeLock = registry.writeLock();
        writeLock.lock();
        try {
            int running = registry.getState().getRunningCount();
            if (running > maxConcurrentQueries) {
                throw new IllegalStateException("当前运行中查询数超过新的并发上限: runningCount=" + running
                        + ", maxConcurrentQueries=" + maxConcurrentQueries);
            }
            this.maxConcurrentQueries = maxConcurrentQueries;
            this.maxAffectedTablesPerQuery = maxAffectedTablesPerQuery;
            this.pollIntervalMicros = pollIntervalMicros;
            rescheduleLocked();
        } finally {
            writeLock.unlock();
        }

        logger.info("配置已更新: maxConcurrentQueries={}, maxAffectedTablesPerQuery={}, pollInterval={}us",
                maxConcurrentQueries, maxAffectedTablesPerQuery, pollIntervalMicros);
    }

    @Override
    public SchedulerConfig getConfiguration() {
        return new SchedulerConfig(maxConcurrentQueries, maxAffectedTablesPerQuery,
                registry.getCapacity(), pollIntervalMicros);
    }

    @Override
    public int getRunningCount() {
        return registry.getRunningCount();
    }

    @Override
    public List<QueryRecord> snapshot() {
        return registry.snapshot();
    }
}
