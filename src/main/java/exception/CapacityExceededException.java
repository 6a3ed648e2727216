package exception;

import lombok.Getter;

/**
 * 登记表已满，或单个查询涉及的IMMV数量超过上限
 */
@Getter
public class CapacityExceededException extends SchedulerException {

    private final int limit;           // 配置的上限
    private final int requested;       // 实际请求的数量

    public CapacityExceededException(String message, int limit, int requested) {
        super(message + ": limit=" + limit + ", requested=" + requested);
        this.limit = limit;
        this.requested = requested;
    }
}
