package alertengine.silence;

import alertengine.query.LabelSet;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Objects;

/**
 * 抑制规则: 存在匹配 source 的 Firing 告警时, 抑制匹配 target 的告警
 * equal 中的标签在 source 和 target 上必须取值相同
 */
@Getter
@ToString
@Builder
public class InhibitRule {
    @Singular
    private final List<LabelMatcher> sourceMatchers;
    @Singular
    private final List<LabelMatcher> targetMatchers;
    @Singular("equalLabel")
    private final List<String> equal;

    public boolean matchesSource(LabelSet labels) {
        return matchesAll(sourceMatchers, labels);
    }

    public boolean matchesTarget(LabelSet labels) {
        return matchesAll(targetMatchers, labels);
    }

    public boolean sameEqualLabels(LabelSet source, LabelSet target) {
        for (String name : equal) {
            if (!Objects.equals(source.get(name), target.get(name))) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesAll(List<LabelMatcher> matchers, LabelSet labels) {
        for (LabelMatcher matcher : matchers) {
            if (!matcher.matches(labels)) {
                return false;
            }
        }
        return true;
    }
}
