package service.impl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import exception.CapacityExceededException;
import model.QueryKey;
import model.QueryRecord;
import model.QueryStatus;
import model.ScheduleState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 查询登记表与调度计数器
 * 两者共用一把读写锁；每个方法自行加锁，调用方也可以在外层持有写锁把多步操作合成一个临界区
 */
public class QueryRegistry {

    private static final Logger logger = LoggerFactory.getLogger(QueryRegistry.class);

    // 登记表与计数器共用的锁
    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock(true);

    // 查询记录，按登记顺序保存
    private final Map<QueryKey, QueryRecord> records = new LinkedHashMap<>();

    private final ScheduleState state = new ScheduleState();

    // 登记表容量
    private final int capacity;

    public QueryRegistry(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("登记表容量必须为正数: " + capacity);
        }
        this.capacity = capacity;
    }

    public Lock writeLock() {
        return rwLock.writeLock();
    }

    public Lock readLock() {
        return rwLock.readLock();
    }

    public boolean isWriteLockedByCurrentThread() {
        return rwLock.isWriteLockedByCurrentThread();
    }

    /**
     * 登记查询，初始状态为WAITING并分配下一个到达序号
     *
     * @throws CapacityExceededException 登记表已满或IMMV数量超过上限，此时登记表不变
     */
    public QueryRecord register(QueryKey key, Collection<String> affectedTables, long transactionId,
                                int maxAffectedTables) {
        // 去重并保持顺序
        List<String> tables = new ArrayList<>(new LinkedHashSet<>(affectedTables));

        rwLock.writeLock().lock();
        try {
            if (tables.size() > maxAffectedTables) {
                logger.warn("涉及的IMMV数量超过上限: key={}, count={}, limit={}",
                        key, tables.size(), maxAffectedTables);
                throw new CapacityExceededException("涉及的IMMV数量超过上限", maxAffectedTables, tables.size());
            }
            if (records.containsKey(key)) {
                throw new IllegalStateException("查询已登记: " + key);
            }
            if (records.size() >= capacity) {
                logger.warn("查询登记表已满: key={}, capacity={}", key, capacity);
                throw new CapacityExceededException("查询登记表已满", capacity, records.size() + 1);
            }

            QueryRecord record = new QueryRecord();
            record.setKey(key);
            record.setStatus(QueryStatus.WAITING);
            record.setAffectedTables(tables);
            record.setTransactionId(transactionId);
            record.setArrivalOrder(state.takeArrivalOrder());
            record.setRegisterTime(System.currentTimeMillis());
            records.put(key, record);

            logger.info("查询已登记: key={}, xid={}, arrivalOrder={}, affectedTables={}",
                    key, transactionId, record.getArrivalOrder(), tables);
            return record;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * 注销查询
     *
     * @return 被移除的记录；已不存在时返回null
     */
    public QueryRecord deregister(QueryKey key) {
        rwLock.writeLock().lock();
        try {
            QueryRecord removed = records.remove(key);
            if (removed != null) {
                logger.debug("查询已注销: key={}, status={}", key, removed.getStatus());
            }
            return removed;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * 取出记录本身（不是副本），调用方必须持有锁后再读写其字段
     */
    public QueryRecord get(QueryKey key) {
        rwLock.readLock().lock();
        try {
            return records.get(key);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    /**
     * 登记表中的全部记录本身，供重调度算法在写锁内遍历
     */
    public Collection<QueryRecord> records() {
        if (!rwLock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("访问登记表记录必须持有写锁");
        }
        return Collections.unmodifiableCollection(records.values());
    }

    /**
     * 某会话登记的全部记录本身，调用方必须持有写锁
     */
    public List<QueryRecord> recordsOwnedBy(String ownerId) {
        List<QueryRecord> owned = new ArrayList<>();
        for (QueryRecord record : records()) {
            if (record.getOwnerId().equals(ownerId)) {
                owned.add(record);
            }
        }
        return owned;
    }

    /**
     * 全部记录的副本
     */
    public List<QueryRecord> snapshot() {
        rwLock.readLock().lock();
        try {
            List<QueryRecord> copies = new ArrayList<>(records.size());
            for (QueryRecord record : records.values()) {
                copies.add(record.copy());
            }
            return copies;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public int size() {
        rwLock.readLock().lock();
        try {
            return records.size();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * 调度计数器，调用方必须持有锁后再读写
     */
    public ScheduleState getState() {
        return state;
    }

    public int getRunningCount() {
        rwLock.readLock().lock();
        try {
            return state.getRunningCount();
        } finally {
            rwLock.readLock().unlock();
        }
    }
}
