package com.agentgate.core.dispatch;

import com.agentgate.api.tool.ToolExecutionResult;
import com.agentgate.api.tool.ToolExecutionStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

/**
 * 执行统计（按需从历史计算）
 *
 * @param toolName           统计范围；全局统计时为 null
 * @param totalExecutions    总次数
 * @param successCount       成功
 * @param failureCount       失败（FAILED）
 * @param timeoutCount       超时（TIMEOUT）
 * @param successRate        成功率，百分比
 * @param avgExecutionTimeMs 平均耗时，保留两位小数
 * @param avgAttempts        平均尝试次数，保留两位小数
 */
public record ExecutionStats(
        String toolName,
        int totalExecutions,
        int successCount,
        int failureCount,
        int timeoutCount,
        double successRate,
        double avgExecutionTimeMs,
        double avgAttempts) {

    public static ExecutionStats of(List<ToolExecutionResult> results) {
        return compute(null, results);
    }

    public static ExecutionStats forTool(List<ToolExecutionResult> results, String toolName) {
        return compute(toolName, results.stream().filter(r -> r.toolName().equals(toolName)).toList());
    }

    private static ExecutionStats compute(String toolName, List<ToolExecutionResult> results) {
        if (results.isEmpty()) {
            return new ExecutionStats(toolName, 0, 0, 0, 0, 0.0, 0.0, 0.0);
        }
        int total = results.size();
        int success = 0;
        int failed = 0;
        int timeout = 0;
        long totalTime = 0;
        long totalAttempts = 0;
        for (ToolExecutionResult r : results) {
            if (r.status() == ToolExecutionStatus.SUCCESS) success++;
            else if (r.status() == ToolExecutionStatus.FAILED) failed++;
            else if (r.status() == ToolExecutionStatus.TIMEOUT) timeout++;
            totalTime += r.executionTimeMs();
            totalAttempts += r.attempts();
        }
        return new ExecutionStats(toolName, total, success, failed, timeout,
                success * 100.0 / total,
                round2((double) totalTime / total),
                round2((double) totalAttempts / total));
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "ExecutionStats{tool=%s, total=%d, success=%d, failed=%d, timeout=%d, rate=%.1f%%}",
                toolName == null ? "*" : toolName, totalExecutions, successCount, failureCount, timeoutCount,
                successRate);
    }
}
