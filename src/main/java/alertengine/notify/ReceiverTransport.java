package alertengine.notify;

import lombok.extern.slf4j.Slf4j;

/**
 * 默认发送通道: 委托给接收者自身的发送实现
 */
@Slf4j
public class ReceiverTransport implements NotificationTransport {

    @Override
    public DeliveryResult send(Receiver receiver, RenderedMessage message) {
        try {
            receiver.send(message);
            return DeliveryResult.success();
        } catch (DispatchException e) {
            log.warn("通知发送失败: receiver={}, reason={}", receiver.getName(), e.getMessage());
            return DeliveryResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("通知发送异常: receiver={}", receiver.getName(), e);
            return DeliveryResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
