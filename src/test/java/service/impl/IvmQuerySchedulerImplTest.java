package service.impl;

import exception.CapacityExceededException;
import exception.QueryCancelledException;
import exception.SchedulerException;
import model.QueryKey;
import model.QueryRecord;
import model.QueryStatus;
import model.SchedulerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IMMV查询调度服务测试
 */
public class IvmQuerySchedulerImplTest {

    private InMemoryDependencyIndex dependencyIndex;
    private CountingLockManager lockManager;
    private IvmQuerySchedulerImpl scheduler;
    private ExecutorService executor;

    /**
     * 统计加锁尝试次数的锁管理器
     */
    private static class CountingLockManager extends InMemoryTableLockManager {
        private final AtomicInteger attempts = new AtomicInteger();

        @Override
        public boolean tryExclusiveLock(String ownerId, String tableId) {
            attempts.incrementAndGet();
            return super.tryExclusiveLock(ownerId, tableId);
        }
    }

    @BeforeEach
    void setUp() {
        dependencyIndex = new InMemoryDependencyIndex();
        dependencyIndex.register("v1", Collections.singletonList("t1"));
        dependencyIndex.register("v2", Collections.singletonList("t2"));
        dependencyIndex.register("v3", Collections.singletonList("t3"));
        dependencyIndex.register("v12", Arrays.asList("t1", "t2"));
        dependencyIndex.register("va", Arrays.asList("x", "y"));
        dependencyIndex.register("vb", Arrays.asList("y", "x"));

        lockManager = new CountingLockManager();
        scheduler = newScheduler(1, 16);
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private IvmQuerySchedulerImpl newScheduler(int maxConcurrentQueries, int capacity) {
        return new IvmQuerySchedulerImpl(new SchedulerConfig(maxConcurrentQueries, 4, capacity, 30),
                dependencyIndex, lockManager);
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("等待条件超时");
            }
            Thread.sleep(5);
        }
    }

    private QueryRecord recordOf(QueryKey key) {
        for (QueryRecord record : scheduler.snapshot()) {
            if (record.getKey().equals(key)) {
                return record;
            }
        }
        return null;
    }

    @Test
    @DisplayName("测试1: 无竞争时直接运行并持有依赖表的锁")
    void testUncontendedQueryRuns() {
        QueryKey key = scheduler.onQueryStart("s1", 100, Collections.singletonList("v12"));

        QueryRecord record = recordOf(key);
        assertNotNull(record);
        assertEquals(QueryStatus.RUNNING, record.getStatus());
        assertEquals(Arrays.asList("t1", "t2"), new ArrayList<>(record.getLockedTables()));
        assertEquals(1, scheduler.getRunningCount());
        assertTrue(lockManager.isHeldBy("s1", "t1"));

        scheduler.onQueryEnd(key, true);

        assertTrue(scheduler.snapshot().isEmpty());
        assertEquals(0, scheduler.getRunningCount());
        assertTrue(lockManager.heldBy("s1").isEmpty());
    }

    @Test
    @DisplayName("测试2: IMMV数量超过上限时拒绝且登记表不变")
    void testCapacityRejection() {
        List<String> tooMany = Arrays.asList("v1", "v2", "v3", "v12", "va");

        assertThrows(CapacityExceededException.class, () -> scheduler.onQueryStart("s1", 1, tooMany));

        assertTrue(scheduler.snapshot().isEmpty());
        assertEquals(0, scheduler.getRunningCount());
        assertTrue(lockManager.heldBy("s1").isEmpty());
    }

    @Test
    @DisplayName("测试3: 登记表已满时拒绝")
    void testRegistryFull() {
        scheduler = newScheduler(2, 2);
        QueryKey k1 = scheduler.onQueryStart("s1", 1, Collections.singletonList("v1"));
        QueryKey k2 = scheduler.onQueryStart("s2", 2, Collections.singletonList("v2"));

        assertThrows(CapacityExceededException.class,
                () -> scheduler.onQueryStart("s3", 3, Collections.singletonList("v3")));
        assertEquals(2, scheduler.snapshot().size());
        assertEquals(2, scheduler.getRunningCount());

        scheduler.onQueryEnd(k1, true);
        scheduler.onQueryEnd(k2, true);
        assertEquals(0, scheduler.getRunningCount());
    }

    @Test
    @DisplayName("测试4: 并发上限为1时按到达顺序运行")
    void testFairnessInArrivalOrder() throws Exception {
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        QueryKey first = scheduler.onQueryStart("sA", 1, Collections.singletonList("v1"));

        Future<?> second = executor.submit(() -> runQuery("sB", "v2", order));
        waitUntil(() -> scheduler.snapshot().size() == 2);
        Future<?> third = executor.submit(() -> runQuery("sC", "v3", order));
        waitUntil(() -> scheduler.snapshot().size() == 3);

        for (QueryRecord record : scheduler.snapshot()) {
            if (!record.getKey().equals(first)) {
                assertEquals(QueryStatus.WAITING, record.getStatus());
            }
        }

        order.add("sA");
        scheduler.onQueryEnd(first, true);

        second.get(5, TimeUnit.SECONDS);
        third.get(5, TimeUnit.SECONDS);
        assertEquals(Arrays.asList("sA", "sB", "sC"), order);
        assertEquals(0, scheduler.getRunningCount());
    }

    private void runQuery(String owner, String immv, List<String> order) {
        QueryKey key = scheduler.onQueryStart(owner, 0, Collections.singletonList(immv));
        order.add(owner);
        try {
            Thread.sleep(20);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            scheduler.onQueryEnd(key, true);
        }
    }

    @Test
    @DisplayName("测试5: 重复结束和结束后的回滚清理不破坏计数")
    void testIdempotentCleanup() {
        QueryKey key = scheduler.onQueryStart("s1", 1, Collections.singletonList("v1"));

        scheduler.onQueryEnd(key, true);
        scheduler.onQueryEnd(key, true);
        scheduler.onTransactionAbort("s1");

        assertEquals(0, scheduler.getRunningCount());
        assertTrue(scheduler.snapshot().isEmpty());

        QueryKey next = scheduler.onQueryStart("s2", 2, Collections.singletonList("v1"));
        assertEquals(1, scheduler.getRunningCount());
        scheduler.onQueryEnd(next, true);
        assertEquals(0, scheduler.getRunningCount());
    }

    @Test
    @DisplayName("测试6: 事务回滚清理运行中的查询")
    void testAbortSweepRunningQuery() {
        QueryKey key = scheduler.onQueryStart("s1", 1, Collections.singletonList("v12"));

        scheduler.onTransactionAbort("s1");

        assertTrue(scheduler.snapshot().isEmpty());
        assertEquals(0, scheduler.getRunningCount());
        assertTrue(lockManager.heldBy("s1").isEmpty());

        // 清理之后结束通知不产生影响
        scheduler.onQueryEnd(key, false);
        assertEquals(0, scheduler.getRunningCount());
    }

    @Test
    @DisplayName("测试7: 事务回滚清理等待中的查询")
    void testAbortSweepWaitingQuery() throws Exception {
        QueryKey running = scheduler.onQueryStart("s0", 1, Collections.singletonList("v1"));
        Future<QueryKey> waiting = executor.submit(
                () -> scheduler.onQueryStart("s1", 2, Collections.singletonList("v2")));
        waitUntil(() -> scheduler.snapshot().size() == 2);

        scheduler.onTransactionAbort("s1");

        ExecutionException e = assertThrows(ExecutionException.class, () -> waiting.get(5, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof SchedulerException);
        assertEquals(1, scheduler.snapshot().size());
        assertEquals(1, scheduler.getRunningCount());

        scheduler.onQueryEnd(running, true);
        assertEquals(0, scheduler.getRunningCount());
    }

    @Test
    @DisplayName("测试8: 依赖表顺序相反的两个查询不会死锁")
    void testReverseOrderDependenciesNoDeadlock() throws Exception {
        scheduler = newScheduler(2, 16);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger violations = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);

        List<Future<?>> futures = new ArrayList<>();
        for (String[] query : new String[][]{{"sA", "va"}, {"sB", "vb"}}) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 20; i++) {
                    QueryKey key = scheduler.onQueryStart(query[0], i, Collections.singletonList(query[1]));
                    try {
                        if (inside.incrementAndGet() > 1) {
                            violations.incrementAndGet();
                        }
                        Thread.sleep(1);
                        inside.decrementAndGet();
                    } finally {
                        scheduler.onQueryEnd(key, true);
                    }
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }

        assertEquals(0, violations.get());
        assertEquals(0, scheduler.getRunningCount());
        assertTrue(lockManager.heldBy("sA").isEmpty());
        assertTrue(lockManager.heldBy("sB").isEmpty());
    }

    @Test
    @DisplayName("测试9: 依赖表重叠的查询不会同时运行，计数始终在上限内")
    void testMutualExclusionUnderLoad() throws Exception {
        int maxConcurrent = 3;
        scheduler = newScheduler(maxConcurrent, 16);
        dependencyIndex.register("m0", Arrays.asList("p1", "p2"));
        dependencyIndex.register("m1", Arrays.asList("p2", "p3"));
        dependencyIndex.register("m2", Arrays.asList("p3", "p4"));
        dependencyIndex.register("m3", Collections.singletonList("p5"));

        Map<String, AtomicInteger> occupancy = new ConcurrentHashMap<>();
        AtomicInteger violations = new AtomicInteger();
        AtomicInteger outOfRange = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);

        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 6; t++) {
            final String owner = "s" + t;
            final String immv = "m" + (t % 4);
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 15; i++) {
                    QueryKey key = scheduler.onQueryStart(owner, i, Collections.singletonList(immv));
                    try {
                        int running = scheduler.getRunningCount();
                        if (running < 1 || running > maxConcurrent) {
                            outOfRange.incrementAndGet();
                        }
                        for (String table : dependencyIndex.dependenciesOf(immv)) {
                            if (occupancy.computeIfAbsent(table, k -> new AtomicInteger()).incrementAndGet() > 1) {
                                violations.incrementAndGet();
                            }
                        }
                        Thread.sleep(1);
                        for (String table : dependencyIndex.dependenciesOf(immv)) {
                            occupancy.get(table).decrementAndGet();
                        }
                    } finally {
                        scheduler.onQueryEnd(key, true);
                    }
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }

        assertEquals(0, violations.get());
        assertEquals(0, outOfRange.get());
        assertEquals(0, scheduler.getRunningCount());
        assertTrue(scheduler.snapshot().isEmpty());
    }

    @Test
    @DisplayName("测试10: 全部退让且无运行查询时自动恢复准入")
    void testSelfHealingAfterGiveUp() throws Exception {
        // 外部会话占住t1，查询反复加锁失败
        assertTrue(lockManager.tryExclusiveLock("external", "t1"));
        lockManager.attempts.set(0);

        Future<QueryKey> future = executor.submit(
                () -> scheduler.onQueryStart("s1", 1, Collections.singletonList("v1")));

        // 每次退让后运行数归零，只有等待者自己触发重调度才能再次被准入
        waitUntil(() -> lockManager.attempts.get() >= 3);
        assertTrue(scheduler.getRunningCount() <= 1);
        assertFalse(future.isDone());

        lockManager.releaseLock("external", "t1");
        QueryKey key = future.get(5, TimeUnit.SECONDS);

        assertEquals(QueryStatus.RUNNING, recordOf(key).getStatus());
        scheduler.onQueryEnd(key, true);
        assertEquals(0, scheduler.getRunningCount());
    }

    @Test
    @DisplayName("测试11: 等待期间被中断时取消并清理")
    void testCancellationWhileWaiting() throws Exception {
        QueryKey running = scheduler.onQueryStart("s0", 1, Collections.singletonList("v1"));
        AtomicReference<QueryCancelledException> caught = new AtomicReference<>();
        AtomicReference<Boolean> interrupted = new AtomicReference<>(false);

        Thread waiter = new Thread(() -> {
            try {
                scheduler.onQueryStart("s1", 2, Collections.singletonList("v2"));
            } catch (QueryCancelledException e) {
                caught.set(e);
                interrupted.set(Thread.currentThread().isInterrupted());
            }
        });
        waiter.start();
        waitUntil(() -> scheduler.snapshot().size() == 2);

        waiter.interrupt();
        waiter.join(5000);

        assertNotNull(caught.get());
        assertEquals("s1", caught.get().getKey().getOwnerId());
        assertTrue(interrupted.get());
        assertEquals(1, scheduler.snapshot().size());
        assertEquals(1, scheduler.getRunningCount());

        scheduler.onQueryEnd(running, true);
    }

    @Test
    @DisplayName("测试12: 调高并发上限后立即准入等待中的查询")
    void testRaiseConcurrencyAdmitsWaiting() throws Exception {
        QueryKey running = scheduler.onQueryStart("s0", 1, Collections.singletonList("v1"));
        Future<QueryKey> waiting = executor.submit(
                () -> scheduler.onQueryStart("s1", 2, Collections.singletonList("v2")));
        waitUntil(() -> scheduler.snapshot().size() == 2);

        scheduler.setConfiguration(2, 4, 30);

        QueryKey second = waiting.get(5, TimeUnit.SECONDS);
        assertEquals(2, scheduler.getRunningCount());
        assertEquals(2, scheduler.getConfiguration().getMaxConcurrentQueries());

        // 运行数超过新上限时拒绝调低
        assertThrows(IllegalStateException.class, () -> scheduler.setConfiguration(1, 4, 30));

        scheduler.onQueryEnd(running, true);
        scheduler.onQueryEnd(second, true);
        assertEquals(0, scheduler.getRunningCount());
    }

    @Test
    @DisplayName("测试13: 参数验证")
    void testParameterValidation() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.onQueryStart(null, 1, Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> scheduler.onQueryStart("s1", 1, null));
        assertThrows(IllegalArgumentException.class, () -> scheduler.setConfiguration(0, 4, 30));
        assertThrows(IllegalArgumentException.class, () -> scheduler.setConfiguration(1, 0, 30));
        assertThrows(IllegalArgumentException.class, () -> scheduler.setConfiguration(1, 4, 0));
        assertThrows(IllegalArgumentException.class,
                () -> new IvmQuerySchedulerImpl(new SchedulerConfig(1, 4, 0, 30), dependencyIndex, lockManager));
    }

    @Test
    @DisplayName("测试14: 不涉及IMMV的查询也受并发上限约束")
    void testQueryWithoutImmvs() {
        QueryKey key = scheduler.onQueryStart("s1", 1, Collections.emptyList());

        assertEquals(QueryStatus.RUNNING, recordOf(key).getStatus());
        assertTrue(recordOf(key).getLockedTables().isEmpty());
        assertEquals(1, scheduler.getRunningCount());

        scheduler.onQueryEnd(key, false);
        assertEquals(0, scheduler.getRunningCount());
    }

    @Test
    @DisplayName("测试15: 有长时间运行的查询时，退让的查询在表释放后仍能占用空闲名额")
    void testRetreatedQueryAdmittedBesideLongRunningQuery() throws Exception {
        scheduler = newScheduler(2, 16);
        QueryKey longRunning = scheduler.onQueryStart("sB", 1, Collections.singletonList("v2"));
        assertTrue(lockManager.tryExclusiveLock("external", "t1"));
        lockManager.attempts.set(0);

        Future<QueryKey> retreating = executor.submit(
                () -> scheduler.onQueryStart("sA", 2, Collections.singletonList("v1")));
        waitUntil(() -> lockManager.attempts.get() >= 3);
        assertFalse(retreating.isDone());

        lockManager.releaseLock("external", "t1");

        // sB仍在运行，sA不需要等它结束
        QueryKey key = retreating.get(2, TimeUnit.SECONDS);
        assertEquals(QueryStatus.RUNNING, recordOf(key).getStatus());
        assertEquals(QueryStatus.RUNNING, recordOf(longRunning).getStatus());
        assertEquals(2, scheduler.getRunningCount());

        scheduler.onQueryEnd(key, true);
        scheduler.onQueryEnd(longRunning, true);
        assertEquals(0, scheduler.getRunningCount());
    }
}
