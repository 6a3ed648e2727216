package model;

import lombok.Data;

/**
 * 调度共享计数器，与查询登记表共用一把锁
 */
@Data
public class ScheduleState {
    private int runningCount;          // 占用运行名额的查询数量
    private long nextArrivalOrder;     // 下一个到达序号

    public long takeArrivalOrder() {
        return nextArrivalOrder++;
    }
}
