package model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 执行括号返回的查询句柄
 */
@Data
@AllArgsConstructor
public class QueryHandle {
    private QueryKey key;              // 未纳入调度时为null
    private boolean started;           // 是否真正进入了调度

    public static QueryHandle bypassed() {
        return new QueryHandle(null, false);
    }

    public static QueryHandle started(QueryKey key) {
        return new QueryHandle(key, true);
    }
}
