package model;

/**
 * 查询记录状态
 */
public enum QueryStatus {
    /**
     * 已登记，等待准入
     */
    WAITING,

    /**
     * 已准入，占用运行名额，准备加锁
     */
    AVAILABLE,

    /**
     * 已获得全部依赖表的锁，正在执行
     */
    RUNNING,

    /**
     * 加锁失败已退让，下一轮重调度时恢复为WAITING
     */
    GAVE_UP;

    /**
     * 是否占用运行名额
     */
    public boolean holdsSlot() {
        return this == AVAILABLE || this == RUNNING;
    }
}
