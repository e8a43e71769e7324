package alertengine.group;

/**
 * 分组通知类型
 */
public enum NotificationKind {
    // 分组首次通知
    FIRING,
    // 成员变化后的后续通知
    UPDATE,
    // 成员未变化, 按 repeat_interval 重发
    REPEAT,
    // 所有成员已恢复
    RESOLVED
}
