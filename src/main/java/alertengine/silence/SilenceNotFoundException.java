package alertengine.silence;

import alertengine.common.AlertException;

public class SilenceNotFoundException extends AlertException {
    public SilenceNotFoundException(String id) {
        super("静默不存在: " + id);
    }
}
