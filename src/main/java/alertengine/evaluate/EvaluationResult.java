package alertengine.evaluate;

import alertengine.query.LabelSet;
import alertengine.query.Sample;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Map;

/**
 * 一次规则评估的结果
 */
@Getter
@ToString
@RequiredArgsConstructor
public class EvaluationResult {
    private final String ruleName;
    // 每个序列的最新样本, 按序列标签
    private final Map<LabelSet, Sample> latest;
    // 越限的告警标签 -> 当前值
    private final Map<LabelSet, Double> breaching;
}
