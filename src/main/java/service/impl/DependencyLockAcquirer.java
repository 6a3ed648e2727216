package service.impl;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import model.LockAttempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import service.DependencyIndex;
import service.TableLockManager;

/**
 * 依赖表加锁协议
 * 对查询涉及的IMMV所依赖的每张基表非阻塞地获取排他锁；任一张失败则释放本轮新获取的全部锁并退让。
 * 本轮之前已持有的锁属于会话所在事务，不在这里释放。
 */
public class DependencyLockAcquirer {

    private static final Logger logger = LoggerFactory.getLogger(DependencyLockAcquirer.class);

    private final DependencyIndex dependencyIndex;
    private final TableLockManager lockManager;

    public DependencyLockAcquirer(DependencyIndex dependencyIndex, TableLockManager lockManager) {
        this.dependencyIndex = dependencyIndex;
        this.lockManager = lockManager;
    }

    /**
     * IMMV集合依赖的全部基表（去重，保持顺序）
     */
    public Set<String> dependencyTables(Collection<String> affectedImmvs) {
        Set<String> tables = new LinkedHashSet<>();
        for (String immvId : affectedImmvs) {
            Set<String> dependencies = dependencyIndex.dependenciesOf(immvId);
            if (dependencies == null || dependencies.isEmpty()) {
                // 不是IMMV
                continue;
            }
            tables.addAll(dependencies);
        }
        return tables;
    }

    /**
     * 尝试获取全部依赖表的锁
     *
     * @param ownerId 会话ID
     * @param affectedImmvs 查询涉及的IMMV
     * @return 成功时带有本轮新获取的锁；失败时本轮的锁已全部释放
     */
    public LockAttempt acquireAll(String ownerId, Collection<String> affectedImmvs) {
        Set<String> newlyLocked = new LinkedHashSet<>();

        for (String tableId : dependencyTables(affectedImmvs)) {
            if (lockManager.isHeldBy(ownerId, tableId)) {
                continue;
            }
            if (lockManager.tryExclusiveLock(ownerId, tableId)) {
                newlyLocked.add(tableId);
                logger.debug("获取表锁: owner={}, table={}", ownerId, tableId);
                continue;
            }

            // 退让：释放本轮获取的锁
            release(ownerId, newlyLocked);
            if (logger.isDebugEnabled()) {
                logger.debug("表锁被占用，释放本轮已获取的锁并退让: owner={}, table={}, released={}, holding={}",
                        ownerId, tableId, newlyLocked.size(), lockManager.heldBy(ownerId));
            }
            return LockAttempt.retreat(tableId, newlyLocked.size());
        }

        return LockAttempt.success(newlyLocked);
    }

    /**
     * 释放指定的表锁
     */
    public void release(String ownerId, Collection<String> tables) {
        for (String tableId : tables) {
            lockManager.releaseLock(ownerId, tableId);
        }
    }

    public TableLockManager getLockManager() {
        return lockManager;
    }
}
