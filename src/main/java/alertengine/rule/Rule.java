package alertengine.rule;

import alertengine.query.LabelSet;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * 告警规则, 加载后不可变
 */
@Getter
@ToString
@EqualsAndHashCode(exclude = "sourcePath")
@Builder(toBuilder = true)
public class Rule {

    public static final String ALERT_NAME_LABEL = "alertname";
    public static final String SEVERITY_LABEL = "severity";

    private static final Pattern LABEL_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private final String name;

    // 查询表达式
    private final String expr;

    private final ComparisonOperator operator;

    private final double threshold;

    // 持续越限多久才进入Firing, 0表示首次越限即触发
    @Builder.Default
    private final Duration forDuration = Duration.ZERO;

    private final Duration interval;

    @Singular
    private final Map<String, String> labels;

    @Singular
    private final Map<String, String> annotations;

    @Builder.Default
    private final Severity severity = Severity.WARNING;

    @Singular("groupByLabel")
    private final List<String> groupBy;

    // 为空时走路由匹配
    private final String receiver;

    @Builder.Default
    private final boolean enabled = true;

    @JsonIgnore
    private final String sourcePath;

    /**
     * 校验规则配置
     */
    public void validate() throws RuleConfigException {
        if (StringUtils.isBlank(name)) {
            throw new RuleConfigException(sourcePath, name, "规则名称不能为空");
        }
        if (StringUtils.isBlank(expr)) {
            throw new RuleConfigException(sourcePath, name, "规则必须配置查询表达式expr");
        }
        if (operator == null) {
            throw new RuleConfigException(sourcePath, name, "规则必须配置比较运算符op");
        }
        if (!Double.isFinite(threshold)) {
            throw new RuleConfigException(sourcePath, name, "阈值必须是有限数值: " + threshold);
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new RuleConfigException(sourcePath, name, "执行间隔必须为正数: " + interval);
        }
        if (forDuration == null || forDuration.isNegative()) {
            throw new RuleConfigException(sourcePath, name, "for持续时间不能为负数: " + forDuration);
        }
        if (severity == null) {
            throw new RuleConfigException(sourcePath, name, "告警级别不能为空");
        }
        for (String label : labels.keySet()) {
            checkLabelName(label);
            if (ALERT_NAME_LABEL.equals(label)) {
                throw new RuleConfigException(sourcePath, name, "标签alertname为保留标签");
            }
        }
        for (String label : groupBy) {
            checkLabelName(label);
        }
    }

    private void checkLabelName(String label) {
        if (label == null || !LABEL_NAME.matcher(label).matches()) {
            throw new RuleConfigException(sourcePath, name, "无效的标签名: " + label);
        }
    }

    public boolean breaches(double value) {
        return operator.breaches(value, threshold);
    }

    /**
     * 告警实例标签 = 序列标签 + 规则标签 + alertname + severity
     */
    public LabelSet alertLabels(LabelSet seriesLabels) {
        Map<String, String> extra = new TreeMap<>(labels);
        extra.put(ALERT_NAME_LABEL, name);
        extra.putIfAbsent(SEVERITY_LABEL, severity.label());
        return seriesLabels.merge(extra);
    }

    /**
     * 分组键: 告警标签在 group_by 上的投影
     */
    public LabelSet groupLabels(LabelSet alertLabels) {
        return alertLabels.project(groupBy);
    }
}
