package model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 执行引擎发起查询时传入的参数
 */
@Data
public class QueryStartRequest {
    private String queryId;                                  // 引擎侧的查询ID，仅用于日志
    private String sourceText;                               // 查询原文
    private long transactionId;                              // 所属事务ID
    private List<String> affectedImmvs = new ArrayList<>();  // 本查询读写的IMMV
    private boolean explainOnly;                             // 仅生成计划，不执行
    private boolean parallelWorker;                          // 在并行工作进程中执行
}
