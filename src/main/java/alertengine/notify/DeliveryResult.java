package alertengine.notify;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class DeliveryResult {

    private static final DeliveryResult SUCCESS = new DeliveryResult(true, null);

    private final boolean success;
    private final String reason;

    public static DeliveryResult success() {
        return SUCCESS;
    }

    public static DeliveryResult failure(String reason) {
        return new DeliveryResult(false, reason);
    }
}
