package model;

import lombok.Data;

/**
 * 会话级状态，只由所属会话线程访问
 */
@Data
public class SessionContext {
    private final String sessionId;
    private int nestingLevel;          // 执行器嵌套深度
    private boolean utility;           // 是否正在执行工具类命令

    public SessionContext(String sessionId) {
        this.sessionId = sessionId;
    }
}
