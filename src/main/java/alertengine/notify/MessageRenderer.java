package alertengine.notify;

import alertengine.group.GroupNotification;
import alertengine.group.NotificationKind;
import alertengine.query.LabelSet;
import alertengine.state.AlertSnapshot;
import org.apache.commons.collections4.MapUtils;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 通知渲染: 钉钉 markdown 正文 + webhook JSON 载荷
 */
public class MessageRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z_][a-zA-Z0-9_]*)}");

    private final DateTimeFormatter timeFormatter;

    public MessageRenderer(ZoneId zone) {
        this.timeFormatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(zone);
    }

    public RenderedMessage render(GroupNotification notification) {
        String title = title(notification);
        return RenderedMessage.builder()
                .title(title)
                .text(markdown(title, notification))
                .payload(payload(title, notification))
                .build();
    }

    private String title(GroupNotification notification) {
        String prefix = notification.getKind() == NotificationKind.RESOLVED ? "【恢复】" : "【告警】";
        return prefix + notification.getRuleName();
    }

    private String markdown(String title, GroupNotification notification) {
        StringBuilder text = new StringBuilder();
        String icon = notification.getKind() == NotificationKind.RESOLVED ? "✅" : "🚨";
        text.append("# ").append(icon).append(' ').append(title).append("\n\n");
        text.append("**告警名称**: ").append(notification.getRuleName()).append("  \n\n");
        text.append("**告警级别**: ").append(notification.getSeverity().label()).append("  \n\n");
        text.append("**通知类型**: ").append(kindText(notification.getKind())).append("  \n\n");
        text.append("**时间**: ").append(format(notification.getCreatedAt())).append("  \n\n");
        if (!notification.getGroupLabels().isEmpty()) {
            text.append("**分组**: ").append(notification.getGroupLabels()).append("  \n\n");
        }

        if (!notification.getFiring().isEmpty()) {
            text.append("### 触发中 (").append(notification.getFiring().size()).append(")\n\n");
            for (AlertSnapshot alert : notification.getFiring()) {
                text.append("- ").append(alert.getLabels())
                        .append(" 当前值: ").append(formatValue(alert.getValue()))
                        .append(" 开始于: ").append(format(alert.getActiveSince()))
                        .append('\n');
                appendAnnotations(text, alert);
            }
            text.append('\n');
        }
        if (!notification.getResolved().isEmpty()) {
            text.append("### 已恢复 (").append(notification.getResolved().size()).append(")\n\n");
            for (AlertSnapshot alert : notification.getResolved()) {
                text.append("- ").append(alert.getLabels())
                        .append(" 恢复于: ").append(format(alert.getResolvedAt()))
                        .append('\n');
            }
            text.append('\n');
        }
        text.append("---\n");
        return text.toString();
    }

    private void appendAnnotations(StringBuilder text, AlertSnapshot alert) {
        Map<String, String> annotations = renderAnnotations(alert);
        String summary = annotations.get("summary");
        if (summary != null) {
            text.append("  > ").append(summary).append('\n');
        }
        String description = annotations.get("description");
        if (description != null) {
            text.append("  > ").append(description).append('\n');
        }
    }

    private Map<String, Object> payload(String title, GroupNotification notification) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", title);
        payload.put("status", notification.getKind() == NotificationKind.RESOLVED ? "resolved" : "firing");
        payload.put("kind", notification.getKind().name());
        payload.put("rule_name", notification.getRuleName());
        payload.put("severity", notification.getSeverity().label());
        payload.put("group_key", notification.getGroupKey());
        payload.put("group_labels", notification.getGroupLabels().asMap());
        payload.put("common_labels", notification.commonLabels().asMap());
        payload.put("timestamp", notification.getCreatedAt().toString());

        List<Map<String, Object>> alerts = new ArrayList<>();
        for (AlertSnapshot alert : notification.members()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("state", alert.getState().name().toLowerCase());
            item.put("labels", alert.getLabels().asMap());
            item.put("annotations", renderAnnotations(alert));
            item.put("value", formatValue(alert.getValue()));
            item.put("active_since", toString(alert.getActiveSince()));
            item.put("fired_at", toString(alert.getFiredAt()));
            item.put("resolved_at", toString(alert.getResolvedAt()));
            alerts.add(item);
        }
        payload.put("alerts", alerts);
        payload.put("text", markdown(title, notification));
        return payload;
    }

    /**
     * 注解模板中的 {标签名} 替换为告警标签值, {value} 替换为当前值, 未知占位符保持原样
     */
    public Map<String, String> renderAnnotations(AlertSnapshot alert) {
        Map<String, String> rendered = new LinkedHashMap<>();
        if (MapUtils.isEmpty(alert.getAnnotations())) {
            return rendered;
        }
        alert.getAnnotations().forEach((name, template) ->
                rendered.put(name, renderTemplate(template, alert.getLabels(), alert.getValue())));
        return rendered;
    }

    static String renderTemplate(String template, LabelSet labels, double value) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuffer sb = new StringBuffer();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement;
            if ("value".equals(name)) {
                replacement = formatValue(value);
            } else if (labels.get(name) != null) {
                replacement = labels.get(name);
            } else {
                replacement = matcher.group(0);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    static String formatValue(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private String kindText(NotificationKind kind) {
        switch (kind) {
            case FIRING:
                return "触发";
            case UPDATE:
                return "更新";
            case REPEAT:
                return "重复提醒";
            default:
                return "恢复";
        }
    }

    private String format(Instant instant) {
        return instant == null ? "-" : timeFormatter.format(instant);
    }

    private static String toString(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
