package alertengine.silence;

import alertengine.state.AlertSnapshot;

import java.time.Instant;

/**
 * 通知前的抑制判断, 每次分发时重新计算, 不缓存
 */
@FunctionalInterface
public interface Suppressor {

    Suppressor NONE = (alert, now) -> false;

    boolean isSuppressed(AlertSnapshot alert, Instant now);
}
