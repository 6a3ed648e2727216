package model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 查询实例标识：会话ID + 单调递增序号，记录存活期间不会复用
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor
public class QueryKey {
    private final String ownerId;            // 所属会话ID
    private final long sequence;             // 序号

    @Override
    public String toString() {
        return ownerId + "#" + sequence;
    }
}
