package alertengine.notify;

import alertengine.common.AlertException;
import lombok.Getter;

/**
 * 通知发送失败, 由路由器按退避策略重试
 */
@Getter
public class DispatchException extends AlertException {
    private final String receiver;

    public DispatchException(String receiver, String message) {
        super(message);
        this.receiver = receiver;
    }

    public DispatchException(String receiver, String message, Throwable cause) {
        super(message, cause);
        this.receiver = receiver;
    }
}
