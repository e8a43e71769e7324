package alertengine.query;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 查询时间范围, start 与 end 相同时为即时查询
 */
@Getter
@ToString
public class TimeRange {
    private final Instant start;
    private final Instant end;
    private final Duration step;

    private TimeRange(Instant start, Instant end, Duration step) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("查询结束时间早于开始时间");
        }
        this.start = start;
        this.end = end;
        this.step = step;
    }

    public static TimeRange instant(Instant at) {
        return new TimeRange(at, at, null);
    }

    public static TimeRange range(Instant start, Instant end, Duration step) {
        if (step == null || step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("范围查询的step必须为正数");
        }
        return new TimeRange(start, end, step);
    }

    public boolean isInstant() {
        return step == null;
    }
}
