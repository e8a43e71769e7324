package alertengine.state;

import alertengine.query.LabelSet;
import alertengine.rule.Rule;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * 告警实例, 由 AlertStateMachine 独占, 所有修改都在规则锁内完成
 */
@Getter
@Setter(AccessLevel.PACKAGE)
class AlertInstance {
    private final String key;
    private final String ruleName;
    private final LabelSet labels;
    private AlertState state = AlertState.INACTIVE;
    private Instant activeSince;
    private Instant firedAt;
    private Instant resolvedAt;
    private double value = Double.NaN;
    private Instant lastEvaluatedAt;

    AlertInstance(String key, String ruleName, LabelSet labels) {
        this.key = key;
        this.ruleName = ruleName;
        this.labels = labels;
    }

    AlertSnapshot snapshot(Rule rule) {
        return AlertSnapshot.builder()
                .key(key)
                .ruleName(ruleName)
                .labels(labels)
                .groupLabels(rule.groupLabels(labels))
                .severity(rule.getSeverity())
                .state(state)
                .activeSince(activeSince)
                .firedAt(firedAt)
                .resolvedAt(resolvedAt)
                .value(value)
                .lastEvaluatedAt(lastEvaluatedAt)
                .receiver(rule.getReceiver())
                .annotations(rule.getAnnotations())
                .build();
    }
}
