package alertengine.silence;

/**
 * 静默状态
 */
public enum SilenceState {
    PENDING,
    ACTIVE,
    EXPIRED
}
