package alertengine.rule;

import lombok.Data;

/**
 * 被拒绝的规则诊断信息
 */
@Data
public class RuleRejection {
    private final String path;
    private final String ruleName;
    // 规则在文件中的位置, 整个文件无法解析时为 -1
    private final int index;
    private final String message;
}
