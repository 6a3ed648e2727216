package adapter;

import java.util.concurrent.Callable;

import model.QueryHandle;
import model.QueryKey;
import model.QueryStartRequest;
import model.SessionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import service.QueryScheduler;

/**
 * 执行括号
 * 执行引擎在查询执行前后、事务回滚时调用，把引擎事件转换为调度服务调用。
 * 每个逻辑上的顶层查询只进入调度一次；工具类命令、EXPLAIN、并行工作进程和嵌套执行不纳入调度。
 */
public class ExecutionBracket {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionBracket.class);

    // 调度服务
    private final QueryScheduler scheduler;

    public ExecutionBracket(QueryScheduler scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("调度服务不能为空");
        }
        this.scheduler = scheduler;
        logger.info("执行括号初始化完成");
    }

    /**
     * 在调度保护下执行查询
     * 无论执行成功还是抛出异常，都会注销查询并归还名额，异常原样抛出
     *
     * @param session 会话状态
     * @param request 查询参数
     * @param execution 查询执行体
     * @return 执行体的返回值
     */
    public <T> T execute(SessionContext session, QueryStartRequest request, Callable<T> execution) throws Exception {
        QueryHandle handle = onQueryStart(session, request);

        boolean succeeded = false;
        session.setNestingLevel(session.getNestingLevel() + 1);
        try {
            T result = execution.call();
            succeeded = true;
            return result;
        } finally {
            session.setNestingLevel(session.getNestingLevel() - 1);
            onQueryEnd(handle, succeeded);
        }
    }

    /**
     * 查询开始
     *
     * @return 查询句柄；未纳入调度时句柄的started为false
     */
    public QueryHandle onQueryStart(SessionContext session, QueryStartRequest request) {
        if (session == null || request == null) {
            throw new IllegalArgumentException("参数不能为空");
        }

        if (!shouldEnforce(session, request)) {
            logger.debug("查询不纳入调度: session={}, queryId={}, nestingLevel={}, utility={}",
                    session.getSessionId(), request.getQueryId(), session.getNestingLevel(), session.isUtility());
            return QueryHandle.bypassed();
        }

        QueryKey key = scheduler.onQueryStart(session.getSessionId(), request.getTransactionId(),
                request.getAffectedImmvs());
        logger.info("查询进入执行: session={}, queryId={}, key={}", session.getSessionId(), request.getQueryId(), key);
        return QueryHandle.started(key);
    }

    /**
     * 查询结束；只有真正进入了调度的查询才需要清理
     */
    public void onQueryEnd(QueryHandle handle, boolean succeeded) {
        if (handle == null || !handle.isStarted()) {
            return;
        }
        scheduler.onQueryEnd(handle.getKey(), succeeded);
    }

    /**
     * 执行工具类命令，期间会话内的查询都不纳入调度
     */
    public <T> T runUtility(SessionContext session, Callable<T> command) throws Exception {
        boolean previous = session.isUtility();
        session.setUtility(true);
        try {
            return command.call();
        } finally {
            session.setUtility(previous);
        }
    }

    /**
     * 事务回滚
     */
    public void onTransactionAbort(SessionContext session) {
        logger.info("事务回滚，清理会话调度状态: session={}", session.getSessionId());
        scheduler.onTransactionAbort(session.getSessionId());
    }

    /**
     * 子事务回滚，与事务回滚一样做无条件清理
     */
    public void onSubtransactionAbort(SessionContext session) {
        logger.info("子事务回滚，清理会话调度状态: session={}", session.getSessionId());
        scheduler.onTransactionAbort(session.getSessionId());
    }

    private boolean shouldEnforce(SessionContext session, QueryStartRequest request) {
        return request.getSourceText() != null
                && !request.getSourceText().isEmpty()
                && !request.isExplainOnly()
                && !request.isParallelWorker()
                && !session.isUtility()
                && session.getNestingLevel() == 0;
    }
}
