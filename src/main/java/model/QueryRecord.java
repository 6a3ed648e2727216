package model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 在途查询记录
 * 所有字段只能在持有调度共享锁时读写
 */
@Data
public class QueryRecord {
    private QueryKey key;
    private QueryStatus status;
    private List<String> affectedTables = new ArrayList<>();    // 本查询读写的IMMV
    private long transactionId;                                  // 所属事务ID
    private long arrivalOrder;                                   // 到达顺序
    private long registerTime;                                   // 登记时间
    private Set<String> lockedTables = new LinkedHashSet<>();    // 本轮新获取的表锁

    public String getOwnerId() {
        return key.getOwnerId();
    }

    /**
     * 复制一份记录，用于在锁外观察
     */
    public QueryRecord copy() {
        QueryRecord copy = new QueryRecord();
        copy.setKey(key);
        copy.setStatus(status);
        copy.setAffectedTables(new ArrayList<>(affectedTables));
        copy.setTransactionId(transactionId);
        copy.setArrivalOrder(arrivalOrder);
        copy.setRegisterTime(registerTime);
        copy.setLockedTables(new LinkedHashSet<>(lockedTables));
        return copy;
    }
}
