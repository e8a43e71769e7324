package alertengine.state;

/**
 * 告警实例状态
 */
public enum AlertState {
    INACTIVE,
    PENDING,
    FIRING,
    RESOLVED
}
