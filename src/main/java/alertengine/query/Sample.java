package alertengine.query;

import lombok.Data;

import java.time.Instant;

/**
 * 查询返回的单个样本: (标签集合, 数值, 时间戳)
 */
@Data
public class Sample {
    private final LabelSet labels;
    private final double value;
    private final Instant timestamp;
}
