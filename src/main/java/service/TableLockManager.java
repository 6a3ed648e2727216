package service;

import java.util.List;

/**
 * 表级排他锁管理器（外部协作者）
 * 锁的持有者是会话，同一会话内的多个查询共享其持有的锁
 */
public interface TableLockManager {

    /**
     * 非阻塞地尝试获取排他锁
     *
     * @return 获取成功返回true，锁被其他会话持有时立即返回false
     */
    boolean tryExclusiveLock(String ownerId, String tableId);

    /**
     * 释放排他锁；未持有时不做任何事
     */
    void releaseLock(String ownerId, String tableId);

    boolean isHeldBy(String ownerId, String tableId);

    /**
     * 会话当前持有的全部表锁（用于诊断日志）
     */
    List<String> heldBy(String ownerId);
}
