package model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 调度配置
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerConfig {
    private int maxConcurrentQueries = 1;          // 最大并发查询数
    private int maxAffectedTablesPerQuery = 16;    // 单个查询最多涉及的IMMV数量
    private int maxRegisteredQueries = 128;        // 登记表容量，构造后不可修改
    private long pollIntervalMicros = 30;          // 等待准入时的轮询间隔(微秒)

    public void validate() {
        if (maxConcurrentQueries <= 0) {
            throw new IllegalArgumentException("maxConcurrentQueries必须为正数: " + maxConcurrentQueries);
        }
        if (maxAffectedTablesPerQuery <= 0) {
            throw new IllegalArgumentException("maxAffectedTablesPerQuery必须为正数: " + maxAffectedTablesPerQuery);
        }
        if (maxRegisteredQueries <= 0) {
            throw new IllegalArgumentException("maxRegisteredQueries必须为正数: " + maxRegisteredQueries);
        }
        if (pollIntervalMicros <= 0) {
            throw new IllegalArgumentException("pollIntervalMicros必须为正数: " + pollIntervalMicros);
        }
    }
}
