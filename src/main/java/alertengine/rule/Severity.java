package alertengine.rule;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 告警级别
 */
public enum Severity {
    CRITICAL,
    WARNING,
    INFO;

    public static Severity fromString(String value) {
        for (Severity severity : values()) {
            if (severity.name().equalsIgnoreCase(value.trim())) {
                return severity;
            }
        }
        throw new IllegalArgumentException("不支持的告警级别: " + value);
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
