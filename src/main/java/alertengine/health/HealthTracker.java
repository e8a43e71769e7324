package alertengine.health;

import alertengine.notify.DeliveryFailedEvent;
import alertengine.notify.DeliveryFailureListener;
import alertengine.rule.RuleSet;
import com.google.common.collect.EvictingQueue;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 健康状态跟踪: 规则执行结果、投递失败、队列溢出
 */
@Slf4j
public class HealthTracker implements DeliveryFailureListener {

    public static final String RUNNING = "RUNNING";
    public static final String FAILED = "FAILED";
    public static final String STOPPED = "STOPPED";

    private final Map<String, RuleHealthStatus> ruleHealth = new ConcurrentHashMap<>();
    private final EvictingQueue<HealthStatus.DeliveryFailure> deliveryFailures;
    private final Duration failureWindow;

    public HealthTracker(int failureHistorySize, Duration failureWindow) {
        this.deliveryFailures = EvictingQueue.create(failureHistorySize);
        this.failureWindow = failureWindow;
    }

    private RuleHealthStatus statusOf(String ruleName) {
        return ruleHealth.computeIfAbsent(ruleName, name -> {
            RuleHealthStatus status = new RuleHealthStatus();
            status.setRuleName(name);
            status.setStatus(RUNNING);
            return status;
        });
    }

    public void recordSuccess(String ruleName, Instant at, long elapsedMillis, int firingCount) {
        RuleHealthStatus status = statusOf(ruleName);
        synchronized (status) {
            updateExecution(status, at, elapsedMillis);
            status.setStatus(RUNNING);
            status.setConsecutiveFailures(0);
            status.setFiringCount(firingCount);
        }
    }

    public void recordFailure(String ruleName, Instant at, long elapsedMillis, String error) {
        RuleHealthStatus status = statusOf(ruleName);
        synchronized (status) {
            updateExecution(status, at, elapsedMillis);
            status.setStatus(FAILED);
            status.setConsecutiveFailures(status.getConsecutiveFailures() + 1);
            status.setFailureCount(status.getFailureCount() + 1);
            status.setLastError(error);
            status.setLastErrorTime(at);
        }
    }

    /**
     * 上一次执行尚未结束, 本次跳过
     */
    public void recordSkipped(String ruleName) {
        RuleHealthStatus status = statusOf(ruleName);
        synchronized (status) {
            status.setSkippedCount(status.getSkippedCount() + 1);
        }
    }

    public void markStopped(String ruleName) {
        RuleHealthStatus status = ruleHealth.get(ruleName);
        if (status != null) {
            synchronized (status) {
                status.setStatus(STOPPED);
            }
        }
    }

    public void remove(String ruleName) {
        ruleHealth.remove(ruleName);
    }

    private void updateExecution(RuleHealthStatus status, Instant at, long elapsedMillis) {
        long count = status.getExecutionCount();
        status.setAverageExecutionTime((status.getAverageExecutionTime() * count + elapsedMillis) / (count + 1));
        status.setExecutionCount(count + 1);
        status.setLastExecutionTime(at);
    }

    @Override
    public void onDeliveryFailed(DeliveryFailedEvent event) {
        synchronized (deliveryFailures) {
            deliveryFailures.add(new HealthStatus.DeliveryFailure(event.getNotificationId(), event.getReceiver(),
                    event.getGroupKey(), event.getAttempts(), event.getLastReason(), event.getAt()));
        }
    }

    public List<HealthStatus.DeliveryFailure> recentDeliveryFailures() {
        synchronized (deliveryFailures) {
            List<HealthStatus.DeliveryFailure> failures = new ArrayList<>(deliveryFailures);
            Collections.reverse(failures);
            return failures;
        }
    }

    public RuleHealthStatus ruleHealth(String ruleName) {
        RuleHealthStatus status = ruleHealth.get(ruleName);
        return status == null ? null : copy(status);
    }

    /**
     * 汇总整体健康状态
     */
    public HealthStatus report(Instant now, boolean running, RuleSet ruleSet, long queueOverflows, int pendingNotifications) {
        HealthStatus health = new HealthStatus();
        health.setLastCheckTime(now);
        health.setRunning(running);
        health.setRuleSetVersion(ruleSet.getVersion());
        health.setRejectedRules(ruleSet.getRejections().size());
        health.setTransitionQueueOverflows(queueOverflows);
        health.setPendingNotifications(pendingNotifications);

        Map<String, RuleHealthStatus> rules = new TreeMap<>();
        ruleHealth.forEach((name, status) -> rules.put(name, copy(status)));
        health.setRuleHealth(rules);
        List<HealthStatus.DeliveryFailure> failures = recentDeliveryFailures();
        health.setRecentDeliveryFailures(failures);

        List<String> issues = new ArrayList<>();
        if (!running) {
            issues.add("告警引擎未运行");
        }
        long failedRules = 0;
        for (RuleHealthStatus status : rules.values()) {
            if (FAILED.equals(status.getStatus())) {
                failedRules++;
                issues.add(String.format("规则 %s 连续失败%d次: %s",
                        status.getRuleName(), status.getConsecutiveFailures(), status.getLastError()));
            }
        }
        long recentFailures = failures.stream()
                .filter(failure -> failure.getAt().isAfter(now.minus(failureWindow)))
                .count();
        if (recentFailures > 0) {
            issues.add(String.format("最近%s内通知投递失败%d次", failureWindow, recentFailures));
        }
        if (!ruleSet.getRejections().isEmpty()) {
            issues.add(String.format("规则配置被拒绝%d条", ruleSet.getRejections().size()));
        }
        if (queueOverflows > 0) {
            issues.add(String.format("迁移队列溢出%d次", queueOverflows));
        }
        health.setIssues(issues);

        boolean allRulesFailing = !rules.isEmpty() && failedRules == rules.values().stream()
                .filter(status -> !STOPPED.equals(status.getStatus()))
                .count();
        if (issues.isEmpty()) {
            health.setStatus("HEALTHY");
        } else if (!running || allRulesFailing) {
            health.setStatus("UNHEALTHY");
        } else {
            health.setStatus("DEGRADED");
        }
        return health;
    }

    private RuleHealthStatus copy(RuleHealthStatus status) {
        synchronized (status) {
            RuleHealthStatus copy = new RuleHealthStatus();
            copy.setRuleName(status.getRuleName());
            copy.setStatus(status.getStatus());
            copy.setLastExecutionTime(status.getLastExecutionTime());
            copy.setConsecutiveFailures(status.getConsecutiveFailures());
            copy.setLastError(status.getLastError());
            copy.setLastErrorTime(status.getLastErrorTime());
            copy.setAverageExecutionTime(status.getAverageExecutionTime());
            copy.setExecutionCount(status.getExecutionCount());
            copy.setFailureCount(status.getFailureCount());
            copy.setSkippedCount(status.getSkippedCount());
            copy.setFiringCount(status.getFiringCount());
            return copy;
        }
    }

    /**
     * 记录健康检查日志
     */
    public void logHealthStatus(HealthStatus health) {
        if ("HEALTHY".equals(health.getStatus())) {
            log.info("健康检查通过，系统运行正常");
        } else {
            log.warn("健康检查发现问题：{}，状态：{}", String.join(", ", health.getIssues()), health.getStatus());
        }
    }
}
