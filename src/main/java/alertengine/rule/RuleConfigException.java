package alertengine.rule;

import alertengine.common.AlertException;
import lombok.Getter;

/**
 * 规则配置异常 - 单条规则无效, 不影响同批次的其他规则
 */
@Getter
public class RuleConfigException extends AlertException {
    private final String path;
    private final String ruleName;

    public RuleConfigException(String message) {
        this(null, null, message, null);
    }

    public RuleConfigException(String path, String ruleName, String message) {
        this(path, ruleName, message, null);
    }

    public RuleConfigException(String path, String ruleName, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.ruleName = ruleName;
    }
}
