package model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Collections;
import java.util.Set;

/**
 * 一轮加锁的结果
 */
@Data
@AllArgsConstructor
public class LockAttempt {
    private boolean success;           // 是否拿到全部依赖表的锁
    private Set<String> newlyLocked;   // 本轮新获取的锁（失败时已全部释放，为空）
    private String contendedTable;     // 加锁失败的表（仅失败时有值）
    private int releasedCount;         // 退让时释放的锁数量

    public static LockAttempt success(Set<String> newlyLocked) {
        return new LockAttempt(true, newlyLocked, null, 0);
    }

    public static LockAttempt retreat(String contendedTable, int releasedCount) {
        return new LockAttempt(false, Collections.emptySet(), contendedTable, releasedCount);
    }
}
