package alertengine.notify;

public enum NotificationStatus {
    PENDING,
    DELIVERED,
    FAILED,
    // 等待投递或重试期间成员被静默/抑制, 不再发送
    SUPPRESSED
}
