package alertengine.health;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 健康检查状态类
 */
@Data
public class HealthStatus {
    private String status;  // HEALTHY, DEGRADED, UNHEALTHY
    private boolean running;
    private Instant lastCheckTime;
    private long ruleSetVersion;
    private int rejectedRules;
    private Map<String, RuleHealthStatus> ruleHealth;
    private List<DeliveryFailure> recentDeliveryFailures;
    private long transitionQueueOverflows;
    private int pendingNotifications;
    private List<String> issues = new ArrayList<>();

    @Data
    public static class DeliveryFailure {
        private final String notificationId;
        private final String receiver;
        private final String groupKey;
        private final int attempts;
        private final String reason;
        private final Instant at;
    }
}
