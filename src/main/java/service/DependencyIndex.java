package service;

import java.util.Set;

/**
 * IMMV依赖索引（外部只读）
 */
public interface DependencyIndex {

    /**
     * 查询IMMV依赖的基表
     *
     * @param immvId IMMV标识
     * @return 有序的基表集合；不是IMMV时返回空集合
     */
    Set<String> dependenciesOf(String immvId);
}
