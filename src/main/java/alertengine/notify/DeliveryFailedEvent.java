package alertengine.notify;

import lombok.Data;

import java.time.Instant;

/**
 * 重试耗尽后发出的投递失败事件
 */
@Data
public class DeliveryFailedEvent {
    private final String notificationId;
    private final String receiver;
    private final String groupKey;
    private final int attempts;
    private final String lastReason;
    private final Instant at;
}
