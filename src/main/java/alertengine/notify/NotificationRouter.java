package alertengine.notify;

import alertengine.group.GroupNotification;
import alertengine.query.LabelSet;
import alertengine.silence.Suppressor;
import alertengine.state.AlertSnapshot;
import com.google.common.collect.EvictingQueue;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 通知路由器
 * <p>
 * 为分组通知选择接收者并渲染消息, 交给发送通道投递. 失败后按退避时间重新排队,
 * 重试不占用工作线程; 重试耗尽时发出投递失败事件.
 */
@Slf4j
public class NotificationRouter {

    private final ReceiverRegistry receivers;
    private final List<Route> routes;
    private final String defaultReceiver;
    private final MessageRenderer renderer;
    private final NotificationTransport transport;
    private final RetryPolicy retryPolicy;
    private final Executor dispatchExecutor;

    private final PriorityQueue<Notification> queue =
            new PriorityQueue<>(Comparator.comparing(Notification::getNextAttemptAt));
    private final Set<String> inFlight = new HashSet<>();
    private final EvictingQueue<Notification> history;
    private final List<DeliveryFailureListener> failureListeners = new CopyOnWriteArrayList<>();

    public NotificationRouter(ReceiverRegistry receivers, List<Route> routes, String defaultReceiver,
                              MessageRenderer renderer, NotificationTransport transport,
                              RetryPolicy retryPolicy, Executor dispatchExecutor, int historySize) {
        this.receivers = receivers;
        this.routes = new ArrayList<>(routes);
        this.defaultReceiver = defaultReceiver;
        this.renderer = renderer;
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.dispatchExecutor = dispatchExecutor;
        this.history = EvictingQueue.create(historySize);
    }

    public void addFailureListener(DeliveryFailureListener listener) {
        failureListeners.add(listener);
    }

    /**
     * 接收者选择顺序: 规则指定 -> 第一条匹配的路由 -> 默认接收者
     */
    String resolveReceiver(GroupNotification group) {
        if (group.getReceiver() != null) {
            if (receivers.contains(group.getReceiver())) {
                return group.getReceiver();
            }
            log.warn("规则 {} 指定的接收者 {} 未配置, 改用路由匹配", group.getRuleName(), group.getReceiver());
        }
        LabelSet labels = group.commonLabels();
        for (Route route : routes) {
            if (route.matches(labels) && receivers.contains(route.getReceiver())) {
                return route.getReceiver();
            }
        }
        return defaultReceiver;
    }

    /**
     * 提交一次分组通知, 立即可投递
     */
    public Notification submit(GroupNotification group, Instant now) {
        String receiverName = resolveReceiver(group);
        RenderedMessage message = renderer.render(group);
        Notification notification = new Notification(UUID.randomUUID().toString(), receiverName, group, message, now);

        if (!receivers.contains(receiverName)) {
            String reason = "未找到接收者: " + receiverName;
            log.error("通知无法投递: group={}, {}", group.getGroupKey(), reason);
            notification.record(new DeliveryAttempt(1, now, false, reason));
            fail(notification, reason, now);
            return notification;
        }

        synchronized (this) {
            queue.add(notification);
        }
        log.debug("通知已入队: id={}, receiver={}, group={}, kind={}",
                notification.getId(), receiverName, group.getGroupKey(), group.getKind());
        return notification;
    }

    public int processDue(Instant now) {
        return processDue(now, Suppressor.NONE);
    }

    /**
     * 投递所有到期的通知. 每次尝试前重新判断抑制, 排队等待重试期间新建的静默同样生效.
     *
     * @return 本次发起的投递数
     */
    public int processDue(Instant now, Suppressor suppressor) {
        List<Notification> polled = new ArrayList<>();
        synchronized (this) {
            while (!queue.isEmpty() && !queue.peek().getNextAttemptAt().isAfter(now)) {
                polled.add(queue.poll());
            }
        }

        List<Notification> due = new ArrayList<>();
        for (Notification notification : polled) {
            if (isSuppressed(notification.getGroup(), suppressor, now)) {
                notification.setStatus(NotificationStatus.SUPPRESSED);
                notification.setNextAttemptAt(null);
                addHistory(notification);
                log.info("通知成员已被静默或抑制, 取消投递: id={}, group={}, 已尝试={}",
                        notification.getId(), notification.getGroup().getGroupKey(), notification.getAttemptCount());
                continue;
            }
            synchronized (this) {
                if (inFlight.add(notification.getId())) {
                    due.add(notification);
                }
            }
        }

        for (Notification notification : due) {
            try {
                dispatchExecutor.execute(() -> attempt(notification, now));
            } catch (RejectedExecutionException e) {
                log.warn("分发线程池已满, 通知稍后重试: id={}", notification.getId());
                synchronized (this) {
                    inFlight.remove(notification.getId());
                    queue.add(notification);
                }
            }
        }
        return due.size();
    }

    /**
     * 有 firing 成员时看 firing 成员, 纯恢复通知看恢复成员; 全部被抑制才算抑制
     */
    static boolean isSuppressed(GroupNotification group, Suppressor suppressor, Instant now) {
        List<AlertSnapshot> members = !group.getFiring().isEmpty() ? group.getFiring() : group.getResolved();
        return !members.isEmpty() && members.stream().allMatch(member -> suppressor.isSuppressed(member, now));
    }

    private void attempt(Notification notification, Instant now) {
        int attemptNumber = notification.getAttemptCount() + 1;
        Receiver receiver = receivers.get(notification.getReceiver());
        DeliveryResult result;
        if (receiver == null) {
            result = DeliveryResult.failure("接收者已被移除: " + notification.getReceiver());
        } else {
            try {
                result = transport.send(receiver, notification.getMessage());
            } catch (RuntimeException e) {
                log.error("发送通道异常: receiver={}", notification.getReceiver(), e);
                result = DeliveryResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }

        notification.record(new DeliveryAttempt(attemptNumber, now, result.isSuccess(), result.getReason()));
        synchronized (this) {
            inFlight.remove(notification.getId());
        }

        if (result.isSuccess()) {
            notification.setStatus(NotificationStatus.DELIVERED);
            addHistory(notification);
            log.info("通知投递成功: id={}, receiver={}, group={}, 尝试次数={}",
                    notification.getId(), notification.getReceiver(),
                    notification.getGroup().getGroupKey(), attemptNumber);
        } else if (retryPolicy.exhausted(attemptNumber)) {
            fail(notification, result.getReason(), now);
        } else {
            Instant next = now.plus(retryPolicy.backoff(attemptNumber));
            notification.setNextAttemptAt(next);
            synchronized (this) {
                queue.add(notification);
            }
            log.warn("通知投递失败, 将于 {} 重试: id={}, receiver={}, 第{}次, 原因={}",
                    next, notification.getId(), notification.getReceiver(), attemptNumber, result.getReason());
        }
    }

    private void fail(Notification notification, String reason, Instant now) {
        notification.setStatus(NotificationStatus.FAILED);
        notification.setNextAttemptAt(null);
        addHistory(notification);

        DeliveryFailedEvent event = new DeliveryFailedEvent(notification.getId(), notification.getReceiver(),
                notification.getGroup().getGroupKey(), notification.getAttemptCount(), reason, now);
        log.error("通知投递最终失败: id={}, receiver={}, group={}, 尝试次数={}, 原因={}",
                event.getNotificationId(), event.getReceiver(), event.getGroupKey(), event.getAttempts(), reason);
        for (DeliveryFailureListener listener : failureListeners) {
            try {
                listener.onDeliveryFailed(event);
            } catch (Exception e) {
                log.error("处理投递失败事件异常: {}", event.getNotificationId(), e);
            }
        }
    }

    private synchronized void addHistory(Notification notification) {
        history.add(notification);
    }

    public synchronized List<Notification> pending() {
        List<Notification> pending = new ArrayList<>(queue);
        pending.sort(Comparator.comparing(Notification::getNextAttemptAt));
        return pending;
    }

    /**
     * 最近完成 (成功或最终失败) 的通知, 新的在前
     */
    public synchronized List<Notification> history() {
        List<Notification> recent = new ArrayList<>(history);
        Collections.reverse(recent);
        return recent;
    }

    public synchronized int pendingCount() {
        return queue.size() + inFlight.size();
    }
}
