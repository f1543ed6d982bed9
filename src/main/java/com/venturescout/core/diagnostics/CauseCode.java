package com.venturescout.core.diagnostics;

/**
 * 模块说明：CauseCode（enum）。
 * 主要职责：标记单个候选在评分过程中的诊断原因，随结果一起输出。
 */
public enum CauseCode {
    NONE,
    SIMILARITY_UNAVAILABLE,
    SCORER_FAILURE
}
