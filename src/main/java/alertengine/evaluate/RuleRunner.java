package alertengine.evaluate;

import alertengine.health.HealthTracker;
import alertengine.query.QueryException;
import alertengine.rule.Rule;
import alertengine.state.AlertState;
import alertengine.state.AlertStateMachine;
import alertengine.state.AlertTransition;
import alertengine.state.TransitionQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 规则执行器 - 负责执行单个规则的检查逻辑
 * 上一次执行未结束时跳过本次, 同一规则不会并发评估
 */
public class RuleRunner {
    private static final Logger logger = LoggerFactory.getLogger(RuleRunner.class);

    private volatile Rule rule;
    private final RuleEvaluator evaluator;
    private final AlertStateMachine stateMachine;
    private final TransitionQueue transitionQueue;
    private final HealthTracker health;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);
    private volatile boolean cancelled;

    public RuleRunner(Rule rule, RuleEvaluator evaluator, AlertStateMachine stateMachine,
                      TransitionQueue transitionQueue, HealthTracker health, Clock clock) {
        this.rule = rule;
        this.evaluator = evaluator;
        this.stateMachine = stateMachine;
        this.transitionQueue = transitionQueue;
        this.health = health;
        this.clock = clock;
    }

    public Rule getRule() {
        return rule;
    }

    public void setRule(Rule rule) {
        this.rule = rule;
    }

    /**
     * 规则下线后调用, 正在进行的评估结束时不再更新健康状态
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * 执行规则检查
     *
     * @return false 表示上一次执行尚未结束, 本次被跳过
     */
    public boolean execute() {
        Rule current = rule;
        if (!executing.compareAndSet(false, true)) {
            logger.warn("规则上一次执行尚未结束, 跳过本次: {}", current.getName());
            health.recordSkipped(current.getName());
            return false;
        }

        Instant now = clock.instant();
        long start = System.nanoTime();
        try {
            logger.debug("开始执行规则: {}", current.getName());
            EvaluationResult result = evaluator.evaluate(current, now);
            List<AlertTransition> transitions = stateMachine.apply(current, result.getBreaching(), now, this::publish);
            if (!cancelled) {
                health.recordSuccess(current.getName(), now, elapsedMillis(start), countFiring(transitions));
            }
        } catch (QueryException e) {
            // 保持实例状态不变, 下个周期重试
            logger.warn("规则查询失败: rule={}, expr={}, 原因={}", current.getName(), e.getExpression(), e.getMessage());
            if (!cancelled) {
                health.recordFailure(current.getName(), now, elapsedMillis(start), e.getMessage());
            }
        } catch (RuntimeException e) {
            logger.error("规则执行失败: {}", current.getName(), e);
            if (!cancelled) {
                health.recordFailure(current.getName(), now, elapsedMillis(start), e.toString());
            }
        } finally {
            executing.set(false);
        }
        return true;
    }

    /**
     * 只向下游发布 Firing / Resolved 相关的迁移, 在状态机的规则锁内调用
     */
    private void publish(List<AlertTransition> transitions) {
        for (AlertTransition transition : transitions) {
            if (transition.getTo() == AlertState.FIRING || transition.getTo() == AlertState.RESOLVED) {
                transitionQueue.offer(transition);
            }
        }
    }

    private int countFiring(List<AlertTransition> transitions) {
        return (int) transitions.stream().filter(t -> t.getTo() == AlertState.FIRING).count();
    }

    private long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
