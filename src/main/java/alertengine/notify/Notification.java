package alertengine.notify;

import alertengine.group.GroupNotification;
import alertengine.group.NotificationKind;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 一次通知及其投递记录, 状态只由 NotificationRouter 修改
 */
@Getter
public class Notification {
    private final String id;
    private final String receiver;
    private final NotificationKind kind;
    private final GroupNotification group;
    private final RenderedMessage message;
    private final Instant createdAt;
    private final List<DeliveryAttempt> attempts = new CopyOnWriteArrayList<>();
    private volatile NotificationStatus status = NotificationStatus.PENDING;
    private volatile Instant nextAttemptAt;

    Notification(String id, String receiver, GroupNotification group, RenderedMessage message, Instant createdAt) {
        this.id = id;
        this.receiver = receiver;
        this.kind = group.getKind();
        this.group = group;
        this.message = message;
        this.createdAt = createdAt;
        this.nextAttemptAt = createdAt;
    }

    public int getAttemptCount() {
        return attempts.size();
    }

    public List<DeliveryAttempt> getAttempts() {
        return Collections.unmodifiableList(attempts);
    }

    public DeliveryAttempt getLastAttempt() {
        return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
    }

    public long getFailedAttemptCount() {
        return attempts.stream().filter(attempt -> !attempt.isSuccess()).count();
    }

    void record(DeliveryAttempt attempt) {
        attempts.add(attempt);
    }

    void setStatus(NotificationStatus status) {
        this.status = status;
    }

    void setNextAttemptAt(Instant nextAttemptAt) {
        this.nextAttemptAt = nextAttemptAt;
    }
}
