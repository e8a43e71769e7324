package alertengine.evaluate;

import alertengine.query.LabelSet;
import alertengine.query.MetricQueryClient;
import alertengine.query.QueryException;
import alertengine.query.Sample;
import alertengine.query.TimeRange;
import alertengine.rule.Rule;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 规则评估器: 取每个序列的最新样本, 与阈值比较
 * 没有数据的序列视为未越限
 */
@Slf4j
public class RuleEvaluator {

    private final MetricQueryClient queryClient;

    public RuleEvaluator(MetricQueryClient queryClient) {
        this.queryClient = queryClient;
    }

    public EvaluationResult evaluate(Rule rule, Instant now) throws QueryException {
        List<Sample> samples = queryClient.query(rule.getExpr(), TimeRange.instant(now));
        return evaluate(rule, samples);
    }

    public EvaluationResult evaluate(Rule rule, List<Sample> samples) {
        Map<LabelSet, Sample> latest = latestPerSeries(samples);
        Map<LabelSet, Double> breaching = new LinkedHashMap<>();
        for (Sample sample : latest.values()) {
            if (!rule.breaches(sample.getValue())) {
                continue;
            }
            LabelSet alertLabels = rule.alertLabels(sample.getLabels());
            Double previous = breaching.putIfAbsent(alertLabels, sample.getValue());
            if (previous != null) {
                log.debug("规则 {} 的多个序列映射到同一告警标签 {}, 保留首个值", rule.getName(), alertLabels);
            }
        }
        log.debug("规则评估完成: rule={}, 序列数={}, 越限数={}", rule.getName(), latest.size(), breaching.size());
        return new EvaluationResult(rule.getName(), Collections.unmodifiableMap(latest),
                Collections.unmodifiableMap(breaching));
    }

    static Map<LabelSet, Sample> latestPerSeries(List<Sample> samples) {
        Map<LabelSet, Sample> latest = new LinkedHashMap<>();
        for (Sample sample : samples) {
            latest.merge(sample.getLabels(), sample,
                    (current, candidate) -> candidate.getTimestamp().isBefore(current.getTimestamp()) ? current : candidate);
        }
        return latest;
    }
}
