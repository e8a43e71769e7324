package alertengine.utils;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalUnit;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 时间周期解析工具
 * 支持 "30s"、"1m30s"、"500ms"、"2h"、"1d" 以及 {"minutes": 5} 两种写法
 */
public final class DurationUtils {

    private static final Pattern PART = Pattern.compile("(\\d+)(ms|s|m|h|d)");

    private static final Map<String, TemporalUnit> SUFFIX_UNITS = Map.of(
            "ms", ChronoUnit.MILLIS, "s", ChronoUnit.SECONDS, "m", ChronoUnit.MINUTES,
            "h", ChronoUnit.HOURS, "d", ChronoUnit.DAYS);

    private static final Map<String, TemporalUnit> NAMED_UNITS = Map.of(
            "milliseconds", ChronoUnit.MILLIS, "seconds", ChronoUnit.SECONDS, "minutes", ChronoUnit.MINUTES,
            "hours", ChronoUnit.HOURS, "days", ChronoUnit.DAYS);

    private DurationUtils() {
    }

    /**
     * 数字按秒, 字符串按后缀, 映射按单位全名
     */
    @SuppressWarnings("unchecked")
    public static Duration parse(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Duration) {
            return (Duration) value;
        }
        if (value instanceof Number) {
            // 纯数字按秒处理
            return Duration.ofSeconds(((Number) value).longValue());
        }
        if (value instanceof String) {
            return parseString((String) value);
        }
        if (value instanceof Map) {
            return parseMap((Map<String, Object>) value);
        }
        throw new IllegalArgumentException("无效的时间周期格式: " + value);
    }

    public static Duration parseString(String value) {
        String text = value.trim().toLowerCase();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("时间周期不能为空");
        }
        if (text.chars().allMatch(Character::isDigit)) {
            return Duration.ofSeconds(Long.parseLong(text));
        }

        Matcher matcher = PART.matcher(text);
        Duration total = Duration.ZERO;
        int consumed = 0;
        // 各段必须首尾相接, "1m x" 这类残缺写法整体拒绝
        while (matcher.find() && matcher.start() == consumed) {
            total = total.plus(Long.parseLong(matcher.group(1)), SUFFIX_UNITS.get(matcher.group(2)));
            consumed = matcher.end();
        }
        if (consumed != text.length()) {
            throw new IllegalArgumentException("无效的时间周期格式: " + value);
        }
        return total;
    }

    /**
     * {hours: 1, minutes: 30} 形式, 键为单位全名
     */
    public static Duration parseMap(Map<String, Object> map) {
        Duration total = Duration.ZERO;
        for (Map.Entry<String, Object> part : map.entrySet()) {
            TemporalUnit unit = NAMED_UNITS.get(part.getKey().toLowerCase());
            if (unit == null) {
                throw new IllegalArgumentException("无效的时间单位: " + part.getKey());
            }
            if (!(part.getValue() instanceof Number)) {
                throw new IllegalArgumentException("无效的时间数值: " + part.getValue());
            }
            total = total.plus(((Number) part.getValue()).longValue(), unit);
        }
        return total;
    }

    /**
     * 格式化为 1h2m3s 形式, 用于日志和通知正文
     */
    public static String format(Duration duration) {
        if (duration == null) {
            return "";
        }
        if (duration.isZero()) {
            return "0s";
        }
        StringBuilder sb = new StringBuilder();
        long days = duration.toDays();
        if (days > 0) {
            sb.append(days).append('d');
        }
        if (duration.toHoursPart() > 0) {
            sb.append(duration.toHoursPart()).append('h');
        }
        if (duration.toMinutesPart() > 0) {
            sb.append(duration.toMinutesPart()).append('m');
        }
        if (duration.toSecondsPart() > 0) {
            sb.append(duration.toSecondsPart()).append('s');
        }
        if (duration.toMillisPart() > 0) {
            sb.append(duration.toMillisPart()).append("ms");
        }
        return sb.toString();
    }
}
