package alertengine.group;

import alertengine.query.LabelSet;
import alertengine.state.AlertSnapshot;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * 分组的只读视图, 供管理接口展示
 */
@Getter
@Builder
public class AlertGroupView {
    private final String key;
    private final String ruleName;
    private final LabelSet groupLabels;
    private final List<AlertSnapshot> members;
    private final Instant createdAt;
    private final Instant lastNotifiedAt;
    private final int notificationCount;
}
