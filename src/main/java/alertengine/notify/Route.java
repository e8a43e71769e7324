package alertengine.notify;

import alertengine.query.LabelSet;
import alertengine.silence.LabelMatcher;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * 路由: 分组的公共标签满足所有匹配器时, 发给指定接收者
 */
@Getter
@ToString
@Builder
public class Route {
    @Singular
    private final List<LabelMatcher> matchers;
    private final String receiver;

    public boolean matches(LabelSet labels) {
        for (LabelMatcher matcher : matchers) {
            if (!matcher.matches(labels)) {
                return false;
            }
        }
        return true;
    }
}
