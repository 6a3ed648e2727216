package service.impl;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import model.QueryRecord;
import model.QueryStatus;
import model.ScheduleState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 准入/重调度算法
 *
 * 每一轮：
 * 1. 先把GAVE_UP记录恢复为WAITING，保留原到达序号，退让不会降低查询的优先级；
 * 2. 运行名额已满时不做准入；
 * 3. 否则按到达顺序把WAITING记录转为AVAILABLE，直到名额用完，每准入一个就占用一个名额。
 *
 * 必须在持有登记表写锁时调用，不阻塞，复杂度为登记表大小。
 */
public class Rescheduler {

    private static final Logger logger = LoggerFactory.getLogger(Rescheduler.class);

    private static final Comparator<QueryRecord> ARRIVAL_ORDER =
            Comparator.comparingLong(QueryRecord::getArrivalOrder);

    /**
     * 执行一轮重调度
     *
     * @return 本轮准入的查询数量
     */
    public int reschedule(QueryRegistry registry, int maxConcurrentQueries) {
        if (!registry.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("重调度必须持有登记表写锁");
        }

        ScheduleState state = registry.getState();
        List<QueryRecord> waiting = new ArrayList<>();
        int requeued = 0;
        for (QueryRecord record : registry.records()) {
            if (record.getStatus() == QueryStatus.GAVE_UP) {
                record.setStatus(QueryStatus.WAITING);
                requeued++;
            }
            if (record.getStatus() == QueryStatus.WAITING) {
                waiting.add(record);
            }
        }

        int admitted = 0;
        int freeSlots = maxConcurrentQueries - state.getRunningCount();
        if (freeSlots > 0 && !waiting.isEmpty()) {
            waiting.sort(ARRIVAL_ORDER);
            for (QueryRecord record : waiting) {
                if (freeSlots <= 0) {
                    break;
                }
                record.setStatus(QueryStatus.AVAILABLE);
                state.setRunningCount(state.getRunningCount() + 1);
                freeSlots--;
                admitted++;
                logger.debug("查询已准入: key={}, arrivalOrder={}", record.getKey(), record.getArrivalOrder());
            }
        }

        if (admitted > 0 || requeued > 0) {
            logger.debug("重调度完成: admitted={}, requeued={}, runningCount={}, waiting={}",
                    admitted, requeued, state.getRunningCount(), waiting.size() - admitted);
        }
        return admitted;
    }
}
