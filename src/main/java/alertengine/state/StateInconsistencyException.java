package alertengine.state;

import alertengine.common.AlertException;
import lombok.Getter;

/**
 * 告警实例状态不一致, 只影响该实例的跟踪
 */
@Getter
public class StateInconsistencyException extends AlertException {
    private final String instanceKey;

    public StateInconsistencyException(String instanceKey, String message) {
        super(message);
        this.instanceKey = instanceKey;
    }
}
