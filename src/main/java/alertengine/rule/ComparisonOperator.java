package alertengine.rule;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 阈值比较运算符
 */
public enum ComparisonOperator {
    GT(">") {
        @Override
        boolean compare(double value, double threshold) {
            return value > threshold;
        }
    },
    GE(">=") {
        @Override
        boolean compare(double value, double threshold) {
            return value >= threshold;
        }
    },
    LT("<") {
        @Override
        boolean compare(double value, double threshold) {
            return value < threshold;
        }
    },
    LE("<=") {
        @Override
        boolean compare(double value, double threshold) {
            return value <= threshold;
        }
    },
    EQ("==") {
        @Override
        boolean compare(double value, double threshold) {
            return value == threshold;
        }
    };

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    abstract boolean compare(double value, double threshold);

    /**
     * NaN 永远不算越限
     */
    public boolean breaches(double value, double threshold) {
        if (Double.isNaN(value)) {
            return false;
        }
        return compare(value, threshold);
    }

    /**
     * 支持符号写法 (">=") 和名称写法 ("ge")
     */
    public static ComparisonOperator fromString(String value) {
        String text = value.trim();
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(text) || operator.name().equalsIgnoreCase(text)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("不支持的比较运算符: " + value);
    }
}
