package alertengine.notify;

/**
 * 通知发送通道, 失败以结果返回而不是抛出
 */
public interface NotificationTransport {

    DeliveryResult send(Receiver receiver, RenderedMessage message);
}
