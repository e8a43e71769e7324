package alertengine.state;

import alertengine.query.LabelSet;
import alertengine.rule.Severity;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * 告警实例的只读快照, 下游组件只能看到快照
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class AlertSnapshot {
    private final String key;
    private final String ruleName;
    private final LabelSet labels;
    private final LabelSet groupLabels;
    private final Severity severity;
    private final AlertState state;
    private final Instant activeSince;
    private final Instant firedAt;
    private final Instant resolvedAt;
    private final double value;
    private final Instant lastEvaluatedAt;
    private final String receiver;
    private final Map<String, String> annotations;

    public boolean isFiring() {
        return state == AlertState.FIRING;
    }

    public boolean isResolved() {
        return state == AlertState.RESOLVED;
    }
}
