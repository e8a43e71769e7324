package alertengine.silence;

import alertengine.query.LabelSet;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 标签匹配器, 支持 =, !=, =~, !~
 * 正则为整串匹配, 不存在的标签按空字符串处理
 */
@Getter
@EqualsAndHashCode(of = {"name", "type", "value"})
public class LabelMatcher {

    private static final Pattern EXPRESSION = Pattern.compile("^\\s*([a-zA-Z_][a-zA-Z0-9_]*)\\s*(=~|!~|!=|=)\\s*(.*?)\\s*$");

    public enum MatchType {
        EQUAL("="),
        NOT_EQUAL("!="),
        REGEX("=~"),
        NOT_REGEX("!~");

        private final String symbol;

        MatchType(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public static MatchType fromSymbol(String symbol) {
            for (MatchType type : values()) {
                if (type.symbol.equals(symbol)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("不支持的匹配类型: " + symbol);
        }
    }

    private final String name;
    private final MatchType type;
    private final String value;
    @JsonIgnore
    private final Pattern pattern;

    @JsonCreator
    public LabelMatcher(@JsonProperty("name") String name,
                        @JsonProperty("type") MatchType type,
                        @JsonProperty("value") String value) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("匹配器标签名不能为空");
        }
        if (type == null) {
            throw new IllegalArgumentException("匹配器类型不能为空");
        }
        this.name = name;
        this.type = type;
        this.value = value == null ? "" : value;
        if (type == MatchType.REGEX || type == MatchType.NOT_REGEX) {
            try {
                this.pattern = Pattern.compile("^(?:" + this.value + ")$");
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("无效的正则表达式: " + this.value, e);
            }
        } else {
            this.pattern = null;
        }
    }

    public static LabelMatcher equal(String name, String value) {
        return new LabelMatcher(name, MatchType.EQUAL, value);
    }

    public static LabelMatcher regex(String name, String value) {
        return new LabelMatcher(name, MatchType.REGEX, value);
    }

    /**
     * 解析 name=value、name!="value"、name=~"a|b" 形式的表达式
     */
    public static LabelMatcher parse(String expression) {
        Matcher m = EXPRESSION.matcher(expression == null ? "" : expression);
        if (!m.matches()) {
            throw new IllegalArgumentException("无效的匹配表达式: " + expression);
        }
        String value = m.group(3);
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1);
        }
        return new LabelMatcher(m.group(1), MatchType.fromSymbol(m.group(2)), value);
    }

    public boolean matches(LabelSet labels) {
        String actual = StringUtils.defaultString(labels.get(name));
        switch (type) {
            case EQUAL:
                return actual.equals(value);
            case NOT_EQUAL:
                return !actual.equals(value);
            case REGEX:
                return pattern.matcher(actual).matches();
            case NOT_REGEX:
                return !pattern.matcher(actual).matches();
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return name + type.symbol + "\"" + value + "\"";
    }
}
