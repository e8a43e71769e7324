package alertengine.notify;

@FunctionalInterface
public interface DeliveryFailureListener {
    void onDeliveryFailed(DeliveryFailedEvent event);
}
