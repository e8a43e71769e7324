package alertengine.group;

import alertengine.query.LabelSet;
import alertengine.rule.Severity;
import alertengine.state.AlertSnapshot;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 分组引擎产出的一次待发送通知, 持有分组成员的快照
 */
@Getter
@ToString
@Builder
public class GroupNotification {
    private final String groupKey;
    private final String ruleName;
    private final LabelSet groupLabels;
    private final Severity severity;
    // 规则指定的接收者, 为空时由路由决定
    private final String receiver;
    private final NotificationKind kind;
    private final List<AlertSnapshot> firing;
    private final List<AlertSnapshot> resolved;
    private final Instant createdAt;

    public List<AlertSnapshot> members() {
        List<AlertSnapshot> members = new ArrayList<>(firing);
        members.addAll(resolved);
        return members;
    }

    /**
     * 所有成员共有的标签, 路由按它匹配
     */
    public LabelSet commonLabels() {
        List<AlertSnapshot> members = members();
        if (members.isEmpty()) {
            return groupLabels;
        }
        Map<String, String> common = new HashMap<>(members.get(0).getLabels().asMap());
        for (AlertSnapshot member : members.subList(1, members.size())) {
            common.entrySet().removeIf(e -> !Objects.equals(e.getValue(), member.getLabels().get(e.getKey())));
        }
        return LabelSet.of(common);
    }
}
