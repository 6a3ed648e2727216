package service;

import model.QueryKey;
import model.QueryRecord;
import model.SchedulerConfig;

import java.util.List;

/**
 * IMMV查询调度服务接口
 * 在查询执行前完成准入和依赖表加锁，执行结束后释放名额并重新调度
 */
public interface QueryScheduler {

    /**
     * 查询开始：登记、等待准入、获取所有依赖基表的排他锁
     * 返回时查询处于RUNNING状态，可能在此之前挂起等待
     *
     * @param ownerId 会话ID
     * @param transactionId 所属事务ID
     * @param affectedImmvs 查询读写的IMMV
     * @return 查询实例标识，结束时传给 {@link #onQueryEnd}
     * @throws exception.CapacityExceededException 登记表已满或IMMV数量超过上限
     * @throws exception.QueryCancelledException 等待期间线程被中断
     */
    QueryKey onQueryStart(String ownerId, long transactionId, List<String> affectedImmvs);

    /**
     * 查询结束（成功或失败）：注销、归还名额、释放本轮获取的锁、重新调度
     * 重复调用或记录已被清理时不做任何事
     *
     * @param key 查询实例标识
     * @param succeeded 查询是否成功
     */
    void onQueryEnd(QueryKey key, boolean succeeded);

    /**
     * 事务或子事务回滚：无条件清理该会话遗留的全部记录和锁
     *
     * @param ownerId 会话ID
     */
    void onTransactionAbort(String ownerId);

    /**
     * 设置配置参数
     *
     * @param maxConcurrentQueries 最大并发查询数
     * @param maxAffectedTablesPerQuery 单个查询最多涉及的IMMV数量
     * @param pollIntervalMicros 等待准入时的轮询间隔(微秒)
     */
    void setConfiguration(int maxConcurrentQueries, int maxAffectedTablesPerQuery, long pollIntervalMicros);

    SchedulerConfig getConfiguration();

    int getRunningCount();

    /**
     * 所有在途查询记录的副本
     */
    List<QueryRecord> snapshot();
}
