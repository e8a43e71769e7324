package alertengine.common;

/**
 * 告警引擎异常基类
 */
public class AlertException extends RuntimeException {
    public AlertException(String message) {
        super(message);
    }

    public AlertException(String message, Throwable cause) {
        super(message, cause);
    }
}
