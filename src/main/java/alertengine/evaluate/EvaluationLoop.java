package alertengine.evaluate;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 同一执行间隔的规则共享一个调度循环, 每个周期把规则提交到工作线程池
 */
@Slf4j
class EvaluationLoop {

    @Getter
    private final Duration interval;
    private final Executor workers;
    private final Map<String, RuleRunner> runners = new ConcurrentHashMap<>();
    private ScheduledFuture<?> future;

    EvaluationLoop(Duration interval, Executor workers) {
        this.interval = interval;
        this.workers = workers;
    }

    void start(ScheduledExecutorService scheduler, long initialDelayMillis) {
        future = scheduler.scheduleAtFixedRate(this::tick, initialDelayMillis, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("评估循环已启动: 间隔={}ms", interval.toMillis());
    }

    void tick() {
        for (RuleRunner runner : runners.values()) {
            try {
                workers.execute(runner::execute);
            } catch (RejectedExecutionException e) {
                log.warn("工作线程池拒绝任务, 规则本周期未执行: {}", runner.getRule().getName());
            }
        }
    }

    void add(RuleRunner runner) {
        runners.put(runner.getRule().getName(), runner);
    }

    void remove(String ruleName) {
        runners.remove(ruleName);
    }

    boolean isEmpty() {
        return runners.isEmpty();
    }

    int size() {
        return runners.size();
    }

    void cancel() {
        if (future != null) {
            future.cancel(false);
        }
        log.info("评估循环已停止: 间隔={}ms", interval.toMillis());
    }
}
