package alertengine.health;

import lombok.Data;

import java.time.Instant;

/**
 * 规则健康状态类
 */
@Data
public class RuleHealthStatus {
    private String ruleName;
    private String status;  // RUNNING, FAILED, STOPPED
    private Instant lastExecutionTime;
    private int consecutiveFailures;
    private String lastError;
    private Instant lastErrorTime;
    private long averageExecutionTime;
    private long executionCount;
    private long failureCount;
    private long skippedCount;
    private int firingCount;
}
