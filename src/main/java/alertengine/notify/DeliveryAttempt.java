package alertengine.notify;

import lombok.Data;

import java.time.Instant;

@Data
public class DeliveryAttempt {
    private final int attempt;
    private final Instant at;
    private final boolean success;
    private final String reason;
}
