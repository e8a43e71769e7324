package alertengine.group;

import alertengine.query.LabelSet;
import alertengine.silence.Suppressor;
import alertengine.state.AlertSnapshot;
import alertengine.state.AlertState;
import alertengine.state.AlertTransition;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 分组与去重引擎
 * <p>
 * 按 (规则, group_by 投影) 把告警实例聚合成分组, 三个定时器控制发送节奏:
 * <ul>
 *     <li>group_wait: 分组首次通知前的等待, 合并同一时间窗口内的触发</li>
 *     <li>group_interval: 成员变化后两次通知的最小间隔</li>
 *     <li>repeat_interval: 成员未变化时的重发间隔</li>
 * </ul>
 * 抑制在每次 flush 时重新计算. 只由分发线程调用, 方法级同步只为管理接口的并发读取.
 */
@Slf4j
public class GroupingEngine {

    @Getter
    private final Duration groupWait;
    @Getter
    private final Duration groupInterval;
    @Getter
    private final Duration repeatInterval;

    private final Map<String, AlertGroup> groups = new LinkedHashMap<>();

    public GroupingEngine(Duration groupWait, Duration groupInterval, Duration repeatInterval) {
        this.groupWait = groupWait;
        this.groupInterval = groupInterval;
        this.repeatInterval = repeatInterval;
    }

    private static class AlertGroup {
        private final String key;
        private final String ruleName;
        private final LabelSet groupLabels;
        private final Instant createdAt;
        private final Map<String, AlertSnapshot> members = new LinkedHashMap<>();
        // 上一次通知中作为 firing 发出的成员
        private Set<String> notifiedFiring = new HashSet<>();
        private Instant lastNotifiedAt;
        private int notificationCount;

        AlertGroup(String key, String ruleName, LabelSet groupLabels, Instant createdAt) {
            this.key = key;
            this.ruleName = ruleName;
            this.groupLabels = groupLabels;
            this.createdAt = createdAt;
        }

        boolean hasFiringMember() {
            return members.values().stream().anyMatch(AlertSnapshot::isFiring);
        }

        AlertGroupView view() {
            return AlertGroupView.builder()
                    .key(key)
                    .ruleName(ruleName)
                    .groupLabels(groupLabels)
                    .members(new ArrayList<>(members.values()))
                    .createdAt(createdAt)
                    .lastNotifiedAt(lastNotifiedAt)
                    .notificationCount(notificationCount)
                    .build();
        }
    }

    public static String groupKey(String ruleName, LabelSet groupLabels) {
        return ruleName + groupLabels.key();
    }

    /**
     * 接收一次状态迁移
     */
    public synchronized void accept(AlertTransition transition, Instant now) {
        AlertSnapshot alert = transition.getAlert();
        String key = groupKey(alert.getRuleName(), alert.getGroupLabels());
        if (transition.getTo() == AlertState.FIRING) {
            AlertGroup group = groups.computeIfAbsent(key,
                    k -> new AlertGroup(k, alert.getRuleName(), alert.getGroupLabels(), now));
            group.members.put(alert.getKey(), alert);
        } else if (transition.getTo() == AlertState.RESOLVED) {
            AlertGroup group = groups.get(key);
            if (group != null && group.members.containsKey(alert.getKey())) {
                group.members.put(alert.getKey(), alert);
            }
        }
    }

    public void acceptAll(Collection<AlertTransition> transitions, Instant now) {
        for (AlertTransition transition : transitions) {
            accept(transition, now);
        }
    }

    /**
     * 迁移队列溢出后, 以状态机快照为准重建分组成员
     */
    public synchronized void resync(Collection<AlertSnapshot> snapshots, Instant now) {
        Map<String, AlertSnapshot> live = new LinkedHashMap<>();
        for (AlertSnapshot snapshot : snapshots) {
            if (snapshot.isFiring() || snapshot.isResolved()) {
                live.put(snapshot.getKey(), snapshot);
            }
        }

        // 快照中已不存在的 Firing 成员, 说明恢复迁移被丢弃, 按恢复处理
        for (AlertGroup group : groups.values()) {
            for (Map.Entry<String, AlertSnapshot> entry : group.members.entrySet()) {
                AlertSnapshot member = entry.getValue();
                if (member.isFiring() && !live.containsKey(entry.getKey())) {
                    entry.setValue(member.toBuilder()
                            .state(AlertState.RESOLVED)
                            .resolvedAt(now)
                            .build());
                }
            }
        }

        for (AlertSnapshot snapshot : live.values()) {
            AlertState from = snapshot.isFiring() ? AlertState.PENDING : AlertState.FIRING;
            accept(new AlertTransition(from, snapshot.getState(), snapshot), now);
        }
        log.info("分组已从状态快照重新同步: 实例数={}, 分组数={}", live.size(), groups.size());
    }

    /**
     * 检查所有分组的定时器, 返回到期的通知
     */
    public synchronized List<GroupNotification> flush(Instant now, Suppressor suppressor) {
        List<GroupNotification> notifications = new ArrayList<>();
        Iterator<AlertGroup> it = groups.values().iterator();
        while (it.hasNext()) {
            AlertGroup group = it.next();
            GroupNotification notification = flushGroup(group, now, suppressor);
            if (notification != null) {
                notifications.add(notification);
            }
            if (group.members.isEmpty()) {
                it.remove();
            }
        }
        return notifications;
    }

    private GroupNotification flushGroup(AlertGroup group, Instant now, Suppressor suppressor) {
        List<AlertSnapshot> visibleFiring = new ArrayList<>();
        List<AlertSnapshot> visibleResolved = new ArrayList<>();
        Set<String> silencedResolved = new HashSet<>();
        for (AlertSnapshot member : group.members.values()) {
            boolean suppressed = suppressor.isSuppressed(member, now);
            if (member.isFiring() && !suppressed) {
                visibleFiring.add(member);
            } else if (member.isResolved() && suppressed) {
                silencedResolved.add(member.getKey());
            } else if (member.isResolved() && group.notifiedFiring.contains(member.getKey())) {
                visibleResolved.add(member);
            }
        }

        GroupNotification notification = null;
        if (group.lastNotifiedAt == null) {
            if (!group.hasFiringMember()) {
                // 首次通知前全部恢复, 直接丢弃
                log.debug("分组在首次通知前已全部恢复, 丢弃: {}", group.key);
                group.members.clear();
                return null;
            }
            if (!now.isBefore(group.createdAt.plus(groupWait)) && !visibleFiring.isEmpty()) {
                notification = send(group, NotificationKind.FIRING, visibleFiring, visibleResolved, now);
            }
        } else {
            boolean changed = !visibleResolved.isEmpty() || visibleFiring.stream()
                    .anyMatch(member -> !group.notifiedFiring.contains(member.getKey()));
            if (changed && !now.isBefore(group.lastNotifiedAt.plus(groupInterval))) {
                NotificationKind kind = group.hasFiringMember() ? NotificationKind.UPDATE : NotificationKind.RESOLVED;
                notification = send(group, kind, visibleFiring, visibleResolved, now);
            } else if (!changed && !visibleFiring.isEmpty()
                    && !now.isBefore(group.lastNotifiedAt.plus(repeatInterval))) {
                notification = send(group, NotificationKind.REPEAT, visibleFiring, visibleResolved, now);
            }
        }

        // 清理不会再出现在通知里的恢复成员
        group.members.values().removeIf(member -> member.isResolved()
                && (!group.notifiedFiring.contains(member.getKey()) || silencedResolved.contains(member.getKey())));
        return notification;
    }

    private GroupNotification send(AlertGroup group, NotificationKind kind, List<AlertSnapshot> firing,
                                   List<AlertSnapshot> resolved, Instant now) {
        AlertSnapshot sample = !firing.isEmpty() ? firing.get(0) : resolved.get(0);
        GroupNotification notification = GroupNotification.builder()
                .groupKey(group.key)
                .ruleName(group.ruleName)
                .groupLabels(group.groupLabels)
                .severity(sample.getSeverity())
                .receiver(sample.getReceiver())
                .kind(kind)
                .firing(firing)
                .resolved(resolved)
                .createdAt(now)
                .build();

        group.notifiedFiring = firing.stream().map(AlertSnapshot::getKey).collect(Collectors.toSet());
        group.lastNotifiedAt = now;
        group.notificationCount++;
        log.info("分组通知: group={}, kind={}, firing={}, resolved={}",
                group.key, kind, firing.size(), resolved.size());
        return notification;
    }

    public synchronized List<AlertGroupView> groups() {
        return groups.values().stream().map(AlertGroup::view).collect(Collectors.toList());
    }

    public synchronized int size() {
        return groups.size();
    }
}
