package exception;

import lombok.Getter;
import model.QueryKey;

/**
 * 等待准入期间线程被中断（宿主取消了查询）
 */
@Getter
public class QueryCancelledException extends SchedulerException {

    private final QueryKey key;

    public QueryCancelledException(QueryKey key) {
        super("等待调度时查询被取消: key=" + key);
        this.key = key;
    }
}
