package service.impl;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import service.DependencyIndex;

/**
 * 内存中的IMMV依赖索引
 */
public class InMemoryDependencyIndex implements DependencyIndex {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDependencyIndex.class);

    private final ConcurrentHashMap<String, Set<String>> dependencies = new ConcurrentHashMap<>();

    /**
     * 登记IMMV及其依赖的基表，依赖集合在IMMV创建时确定
     */
    public void register(String immvId, Collection<String> baseTables) {
        Set<String> tables = Collections.unmodifiableSet(new LinkedHashSet<>(baseTables));
        dependencies.put(immvId, tables);
        logger.info("IMMV依赖已登记: immv={}, baseTables={}", immvId, tables);
    }

    @Override
    public Set<String> dependenciesOf(String immvId) {
        return dependencies.getOrDefault(immvId, Collections.emptySet());
    }
}
