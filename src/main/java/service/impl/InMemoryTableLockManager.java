package service.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import service.TableLockManager;

/**
 * 内存中的表级排他锁管理器
 * 每张表最多一个持有会话
 */
public class InMemoryTableLockManager implements TableLockManager {

    // 表ID -> 持有者会话ID
    private final ConcurrentHashMap<String, String> owners = new ConcurrentHashMap<>();

    @Override
    public boolean tryExclusiveLock(String ownerId, String tableId) {
        String current = owners.putIfAbsent(tableId, ownerId);
        return current == null || current.equals(ownerId);
    }

    @Override
    public void releaseLock(String ownerId, String tableId) {
        owners.remove(tableId, ownerId);
    }

    @Override
    public boolean isHeldBy(String ownerId, String tableId) {
        return ownerId.equals(owners.get(tableId));
    }

    @Override
    public List<String> heldBy(String ownerId) {
        List<String> held = new ArrayList<>();
        for (Map.Entry<String, String> entry : owners.entrySet()) {
            if (entry.getValue().equals(ownerId)) {
                held.add(entry.getKey());
            }
        }
        Collections.sort(held);
        return held;
    }
}
