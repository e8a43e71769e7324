package alertengine.silence;

import alertengine.query.LabelSet;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * 运维人员创建的静默窗口, 创建后不可修改
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class Silence {
    private final String id;
    @Singular
    private final List<LabelMatcher> matchers;
    private final Instant startsAt;
    private final Instant endsAt;
    private final String createdBy;
    private final String comment;
    private final Instant createdAt;

    /**
     * 窗口为 [startsAt, endsAt)
     */
    public boolean isActive(Instant now) {
        return !now.isBefore(startsAt) && now.isBefore(endsAt);
    }

    public SilenceState state(Instant now) {
        if (now.isBefore(startsAt)) {
            return SilenceState.PENDING;
        }
        return now.isBefore(endsAt) ? SilenceState.ACTIVE : SilenceState.EXPIRED;
    }

    public boolean matches(LabelSet labels) {
        for (LabelMatcher matcher : matchers) {
            if (!matcher.matches(labels)) {
                return false;
            }
        }
        return true;
    }
}
