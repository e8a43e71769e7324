package alertengine.state;

import alertengine.query.LabelSet;
import alertengine.rule.Rule;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 告警状态机
 * <p>
 * 每条规则一把锁, 同一规则的并发评估串行执行, 不同规则之间互不竞争.
 * 每个 (规则, 标签集合) 只对应一个实例, 重复评估只更新不新增.
 * <pre>
 * Inactive -> Pending -> Firing -> Resolved -> 丢弃
 *                |
 *                +-> Inactive (for 时间内出现一次未越限)
 * </pre>
 */
@Slf4j
public class AlertStateMachine {

    private final Map<String, RuleState> rules = new ConcurrentHashMap<>();

    private static class RuleState {
        private Rule rule;
        private final Map<String, AlertInstance> instances = new LinkedHashMap<>();
        // 规则已下线, 之后到达的评估结果全部丢弃, 直到重新 register
        private boolean discarded;

        RuleState(Rule rule) {
            this.rule = rule;
        }
    }

    public static String instanceKey(String ruleName, LabelSet labels) {
        return ruleName + labels.key();
    }

    /**
     * 规则上线或重新启用, 替换掉下线时留下的标记
     */
    public void register(Rule rule) {
        rules.compute(rule.getName(), (name, existing) -> {
            if (existing == null) {
                return new RuleState(rule);
            }
            synchronized (existing) {
                if (existing.discarded) {
                    return new RuleState(rule);
                }
                existing.rule = rule;
                return existing;
            }
        });
    }

    public List<AlertTransition> apply(Rule rule, Map<LabelSet, Double> breaching, Instant now) {
        return apply(rule, breaching, now, transitions -> {
        });
    }

    /**
     * 应用一次评估结果
     *
     * @param rule      规则
     * @param breaching 本次越限的告警标签及其数值
     * @param now       评估时间
     * @param publisher 在规则锁内收到本次迁移, 与 discardRule 发出的最终恢复不会乱序
     * @return 本次产生的状态迁移 (包括 Firing 实例的数值刷新); 规则已下线时为空
     */
    public List<AlertTransition> apply(Rule rule, Map<LabelSet, Double> breaching, Instant now,
                                       Consumer<List<AlertTransition>> publisher) {
        RuleState ruleState = rules.computeIfAbsent(rule.getName(), name -> new RuleState(rule));
        List<AlertTransition> transitions = new ArrayList<>();

        synchronized (ruleState) {
            if (ruleState.discarded) {
                log.info("规则已下线, 丢弃迟到的评估结果: {}", rule.getName());
                return Collections.emptyList();
            }
            ruleState.rule = rule;

            // 上一轮已经发出恢复的实例, 本轮丢弃
            ruleState.instances.values().removeIf(instance -> instance.getState() == AlertState.RESOLVED);

            Set<String> seen = new HashSet<>();
            for (Map.Entry<LabelSet, Double> entry : breaching.entrySet()) {
                String key = instanceKey(rule.getName(), entry.getKey());
                seen.add(key);
                AlertInstance instance = ruleState.instances.computeIfAbsent(key,
                        k -> new AlertInstance(k, rule.getName(), entry.getKey()));
                step(ruleState, instance, true, entry.getValue(), now, transitions);
            }

            for (AlertInstance instance : new ArrayList<>(ruleState.instances.values())) {
                if (!seen.contains(instance.getKey())) {
                    step(ruleState, instance, false, Double.NaN, now, transitions);
                }
            }

            ruleState.instances.values().removeIf(instance -> instance.getState() == AlertState.INACTIVE);
            publisher.accept(transitions);
        }
        return transitions;
    }

    private void step(RuleState ruleState, AlertInstance instance, boolean breach, double value,
                      Instant now, List<AlertTransition> transitions) {
        Rule rule = ruleState.rule;
        try {
            verify(instance);
            instance.setLastEvaluatedAt(now);
            if (breach) {
                instance.setValue(value);
                onBreach(rule, instance, now, transitions);
            } else {
                onClear(rule, instance, now, transitions);
            }
            verify(instance);
        } catch (StateInconsistencyException e) {
            log.error("告警实例状态不一致, 已丢弃该实例: rule={}, labels={}, state={}, activeSince={}, firedAt={}, resolvedAt={}",
                    rule.getName(), instance.getLabels(), instance.getState(), instance.getActiveSince(),
                    instance.getFiredAt(), instance.getResolvedAt(), e);
            ruleState.instances.remove(instance.getKey());
        }
    }

    private void onBreach(Rule rule, AlertInstance instance, Instant now, List<AlertTransition> transitions) {
        switch (instance.getState()) {
            case INACTIVE:
                instance.setState(AlertState.PENDING);
                instance.setActiveSince(now);
                transitions.add(new AlertTransition(AlertState.INACTIVE, AlertState.PENDING, instance.snapshot(rule)));
                promoteIfDue(rule, instance, now, transitions);
                break;
            case PENDING:
                promoteIfDue(rule, instance, now, transitions);
                break;
            case FIRING:
                transitions.add(new AlertTransition(AlertState.FIRING, AlertState.FIRING, instance.snapshot(rule)));
                break;
            default:
                throw new StateInconsistencyException(instance.getKey(),
                        "已恢复的实例不应再次参与评估: " + instance.getKey());
        }
    }

    private void promoteIfDue(Rule rule, AlertInstance instance, Instant now, List<AlertTransition> transitions) {
        Duration elapsed = Duration.between(instance.getActiveSince(), now);
        if (elapsed.compareTo(rule.getForDuration()) >= 0) {
            instance.setState(AlertState.FIRING);
            instance.setFiredAt(now);
            log.info("告警触发: rule={}, labels={}, value={}", rule.getName(), instance.getLabels(), instance.getValue());
            transitions.add(new AlertTransition(AlertState.PENDING, AlertState.FIRING, instance.snapshot(rule)));
        }
    }

    private void onClear(Rule rule, AlertInstance instance, Instant now, List<AlertTransition> transitions) {
        switch (instance.getState()) {
            case PENDING:
                // 未满 for 时间, 不累计
                instance.setState(AlertState.INACTIVE);
                instance.setActiveSince(null);
                transitions.add(new AlertTransition(AlertState.PENDING, AlertState.INACTIVE, instance.snapshot(rule)));
                break;
            case FIRING:
                instance.setState(AlertState.RESOLVED);
                instance.setResolvedAt(now);
                log.info("告警恢复: rule={}, labels={}", rule.getName(), instance.getLabels());
                transitions.add(new AlertTransition(AlertState.FIRING, AlertState.RESOLVED, instance.snapshot(rule)));
                break;
            case INACTIVE:
                break;
            default:
                throw new StateInconsistencyException(instance.getKey(),
                        "已恢复的实例不应再次参与评估: " + instance.getKey());
        }
    }

    /**
     * 校验实例的时间戳与状态一致
     */
    private void verify(AlertInstance instance) {
        switch (instance.getState()) {
            case INACTIVE:
                if (instance.getFiredAt() != null || instance.getResolvedAt() != null) {
                    throw new StateInconsistencyException(instance.getKey(), "Inactive实例不应带有触发/恢复时间");
                }
                break;
            case PENDING:
                if (instance.getActiveSince() == null || instance.getFiredAt() != null) {
                    throw new StateInconsistencyException(instance.getKey(), "Pending实例必须只有activeSince");
                }
                break;
            case FIRING:
                if (instance.getActiveSince() == null || instance.getFiredAt() == null
                        || instance.getResolvedAt() != null) {
                    throw new StateInconsistencyException(instance.getKey(), "Firing实例时间戳不完整");
                }
                break;
            case RESOLVED:
                if (instance.getFiredAt() == null || instance.getResolvedAt() == null) {
                    throw new StateInconsistencyException(instance.getKey(), "Resolved实例时间戳不完整");
                }
                break;
            default:
                throw new StateInconsistencyException(instance.getKey(), "未知状态: " + instance.getState());
        }
    }

    public List<AlertTransition> discardRule(String ruleName, Instant now) {
        return discardRule(ruleName, now, transitions -> {
        });
    }

    /**
     * 规则被删除或停用: 丢弃所有实例, 对 Firing 实例发出最终恢复.
     * 留下下线标记, 正在查询中的评估稍后到达时不会重新建出实例.
     */
    public List<AlertTransition> discardRule(String ruleName, Instant now, Consumer<List<AlertTransition>> publisher) {
        RuleState ruleState = rules.computeIfAbsent(ruleName, name -> new RuleState(null));
        List<AlertTransition> transitions = new ArrayList<>();
        synchronized (ruleState) {
            if (ruleState.discarded) {
                return Collections.emptyList();
            }
            ruleState.discarded = true;
            for (AlertInstance instance : ruleState.instances.values()) {
                if (instance.getState() == AlertState.FIRING) {
                    instance.setState(AlertState.RESOLVED);
                    instance.setResolvedAt(now);
                    transitions.add(new AlertTransition(AlertState.FIRING, AlertState.RESOLVED,
                            instance.snapshot(ruleState.rule)));
                }
            }
            ruleState.instances.clear();
            publisher.accept(transitions);
        }
        log.info("规则实例已丢弃: rule={}, 最终恢复数={}", ruleName, transitions.size());
        return transitions;
    }

    /**
     * 规则定义更新, 保留已有实例
     */
    public void updateRule(Rule rule) {
        RuleState ruleState = rules.get(rule.getName());
        if (ruleState != null) {
            synchronized (ruleState) {
                if (!ruleState.discarded) {
                    ruleState.rule = rule;
                }
            }
        }
    }

    public List<AlertSnapshot> snapshot() {
        List<AlertSnapshot> snapshots = new ArrayList<>();
        for (RuleState ruleState : rules.values()) {
            synchronized (ruleState) {
                for (AlertInstance instance : ruleState.instances.values()) {
                    snapshots.add(instance.snapshot(ruleState.rule));
                }
            }
        }
        return snapshots;
    }

    public List<AlertSnapshot> snapshot(String ruleName) {
        RuleState ruleState = rules.get(ruleName);
        if (ruleState == null) {
            return Collections.emptyList();
        }
        synchronized (ruleState) {
            return ruleState.instances.values().stream()
                    .map(instance -> instance.snapshot(ruleState.rule))
                    .collect(Collectors.toList());
        }
    }

    public List<AlertSnapshot> firingAlerts() {
        return snapshot().stream()
                .filter(AlertSnapshot::isFiring)
                .collect(Collectors.toList());
    }

    public int instanceCount() {
        int count = 0;
        for (RuleState ruleState : rules.values()) {
            synchronized (ruleState) {
                count += ruleState.instances.size();
            }
        }
        return count;
    }

    /**
     * 直接改写实例状态, 供同包测试构造不一致场景
     */
    void overrideState(String ruleName, LabelSet labels, AlertState state) {
        RuleState ruleState = rules.get(ruleName);
        synchronized (ruleState) {
            AlertInstance instance = ruleState.instances.get(instanceKey(ruleName, labels));
            if (instance != null) {
                instance.setState(state);
            }
        }
    }
}
