package alertengine.evaluate;

import alertengine.group.GroupNotification;
import alertengine.group.GroupingEngine;
import alertengine.health.HealthStatus;
import alertengine.health.HealthTracker;
import alertengine.notify.NotificationRouter;
import alertengine.rule.Rule;
import alertengine.rule.RuleChangeListener;
import alertengine.rule.RuleLoader;
import alertengine.rule.RuleRejection;
import alertengine.rule.RuleSet;
import alertengine.silence.SilenceStore;
import alertengine.silence.Suppressor;
import alertengine.state.AlertStateMachine;
import alertengine.state.AlertTransition;
import alertengine.state.TransitionQueue;
import com.google.common.util.concurrent.MoreExecutors;
import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * 告警引擎主类 - 组装评估、状态机、分组、静默与通知路由
 * <p>
 * 每个不同的执行间隔一个评估循环, 评估结果通过迁移队列交给独立的分发循环,
 * 发送慢不会拖慢下一次评估.
 */
public class AlertEngine implements AutoCloseable, RuleChangeListener {
    private static final Logger logger = LoggerFactory.getLogger(AlertEngine.class);

    private static final long MAX_INITIAL_DELAY_MILLIS = 15_000;
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    @Getter
    private final RuleLoader ruleLoader;
    private final RuleEvaluator evaluator;
    @Getter
    private final AlertStateMachine stateMachine;
    @Getter
    private final TransitionQueue transitionQueue;
    @Getter
    private final GroupingEngine groupingEngine;
    @Getter
    private final SilenceStore silenceStore;
    @Getter
    private final NotificationRouter router;
    private final HealthTracker health;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final Duration dispatchInterval;
    private final Duration healthCheckInterval;
    private final Duration rescanInterval;
    private final boolean watchRules;

    private final Map<String, RuleRunner> ruleRunners = new ConcurrentHashMap<>();
    private final Map<Duration, EvaluationLoop> loops = new ConcurrentHashMap<>();
    private volatile boolean running;

    @Builder
    public AlertEngine(RuleLoader ruleLoader, RuleEvaluator evaluator, AlertStateMachine stateMachine,
                       TransitionQueue transitionQueue, GroupingEngine groupingEngine, SilenceStore silenceStore,
                       NotificationRouter router, HealthTracker health, Clock clock,
                       ScheduledExecutorService scheduler, ExecutorService workers,
                       Duration dispatchInterval, Duration healthCheckInterval, Duration rescanInterval,
                       boolean watchRules) {
        this.ruleLoader = ruleLoader;
        this.evaluator = evaluator;
        this.stateMachine = stateMachine;
        this.transitionQueue = transitionQueue;
        this.groupingEngine = groupingEngine;
        this.silenceStore = silenceStore;
        this.router = router;
        this.health = health;
        this.clock = clock;
        this.scheduler = scheduler;
        this.workers = workers;
        this.dispatchInterval = dispatchInterval != null ? dispatchInterval : Duration.ofSeconds(1);
        this.healthCheckInterval = healthCheckInterval != null ? healthCheckInterval : Duration.ofSeconds(60);
        this.rescanInterval = rescanInterval != null ? rescanInterval : Duration.ofMinutes(5);
        this.watchRules = watchRules;

        this.router.addFailureListener(health);
        this.ruleLoader.addChangeListener(this);
    }

    /**
     * 启动引擎
     */
    public void start() {
        if (running) {
            logger.warn("告警引擎已经在运行");
            return;
        }

        try {
            logger.info("正在启动告警引擎...");
            running = true;

            // 加载所有规则, 新增规则通过监听回调完成调度
            ruleLoader.load();
            for (RuleRunner runner : ruleRunners.values()) {
                addToLoop(runner);
            }
            if (watchRules) {
                ruleLoader.startWatching(rescanInterval);
            }

            scheduler.scheduleWithFixedDelay(this::dispatchQuietly,
                    dispatchInterval.toMillis(), dispatchInterval.toMillis(), TimeUnit.MILLISECONDS);
            scheduler.scheduleAtFixedRate(this::periodicMaintenance,
                    healthCheckInterval.toMillis(), healthCheckInterval.toMillis(), TimeUnit.MILLISECONDS);

            logger.info("告警引擎启动成功: 规则数={}, 评估循环数={}", ruleRunners.size(), loops.size());
        } catch (Exception e) {
            running = false;
            logger.error("启动告警引擎失败", e);
            throw new IllegalStateException("启动失败", e);
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 重新加载规则, 内容未变化时不产生任何变更
     */
    public RuleSet reloadRules() {
        return ruleLoader.load();
    }

    /**
     * 立即执行一次指定规则
     */
    public boolean runRule(String ruleName) {
        RuleRunner runner = ruleRunners.get(ruleName);
        if (runner == null) {
            throw new IllegalArgumentException("规则不存在或未启用: " + ruleName);
        }
        return runner.execute();
    }

    /**
     * 分发循环的一个周期: 消费迁移队列 -> 分组 -> 静默过滤 -> 路由投递
     *
     * @return 本周期新产生的通知
     */
    public synchronized List<GroupNotification> dispatchOnce() {
        Instant now = clock.instant();
        boolean resync = transitionQueue.takeResyncRequest();
        List<AlertTransition> transitions = transitionQueue.drain();
        groupingEngine.acceptAll(transitions, now);
        if (resync) {
            logger.warn("迁移队列曾溢出, 从状态机快照重新同步分组");
            groupingEngine.resync(stateMachine.snapshot(), now);
        }

        // 本周期的分组和重试共用同一份静默与 Firing 快照
        Suppressor suppressor = silenceStore.snapshot();
        List<GroupNotification> notifications = groupingEngine.flush(now, suppressor);
        for (GroupNotification notification : notifications) {
            router.submit(notification, now);
        }
        router.processDue(now, suppressor);
        return notifications;
    }

    private void dispatchQuietly() {
        if (!running) {
            return;
        }
        try {
            dispatchOnce();
        } catch (Exception e) {
            logger.error("分发周期执行失败", e);
        }
    }

    /**
     * 周期任务: 清理过期静默并输出一次健康摘要
     */
    private void periodicMaintenance() {
        try {
            silenceStore.purgeExpired(clock.instant());
            health.logHealthStatus(health());
        } catch (Exception e) {
            logger.error("周期维护任务失败", e);
        }
    }

    public HealthStatus health() {
        return health.report(clock.instant(), running, ruleLoader.current(),
                transitionQueue.getOverflowCount(), router.pendingCount());
    }

    @Override
    public void onRuleAdded(Rule rule) {
        if (rule.isEnabled()) {
            logger.info("规则上线: {}", rule.getName());
            scheduleRule(rule);
        } else {
            logger.info("规则未启用, 不调度: {}", rule.getName());
        }
    }

    @Override
    public void onRuleUpdated(Rule previous, Rule rule) {
        logger.info("规则变更: {}", rule.getName());
        if (!rule.isEnabled()) {
            stopRule(rule.getName());
            return;
        }
        if (!previous.isEnabled()) {
            scheduleRule(rule);
            return;
        }

        // 标签或分组键变化会改变实例身份, 旧实例全部恢复后重新开始
        if (!Objects.equals(previous.getLabels(), rule.getLabels())
                || !Objects.equals(previous.getGroupBy(), rule.getGroupBy())
                || previous.getSeverity() != rule.getSeverity()) {
            stateMachine.discardRule(rule.getName(), clock.instant(), transitionQueue::offerAll);
            stateMachine.register(rule);
        } else {
            stateMachine.updateRule(rule);
        }

        RuleRunner runner = ruleRunners.get(rule.getName());
        if (runner == null) {
            scheduleRule(rule);
            return;
        }
        Duration previousInterval = runner.getRule().getInterval();
        runner.setRule(rule);
        if (running && !previousInterval.equals(rule.getInterval())) {
            removeFromLoop(rule.getName(), previousInterval);
            addToLoop(runner);
        }
    }

    @Override
    public void onRuleDeleted(Rule rule) {
        logger.info("规则下线: {}", rule.getName());
        stopRule(rule.getName());
        health.remove(rule.getName());
    }

    @Override
    public void onRuleLoadError(RuleRejection rejection) {
        logger.error("加载规则失败: 文件={}, 规则={}, 原因={}",
                rejection.getPath(), rejection.getRuleName(), rejection.getMessage());
    }

    /**
     * 为规则创建执行器, 引擎运行中时立即挂到对应间隔的循环上
     */
    private void scheduleRule(Rule rule) {
        stateMachine.register(rule);
        RuleRunner runner = new RuleRunner(rule, evaluator, stateMachine, transitionQueue, health, clock);
        ruleRunners.put(rule.getName(), runner);
        if (running) {
            addToLoop(runner);
        }
    }

    private void addToLoop(RuleRunner runner) {
        Duration interval = runner.getRule().getInterval();
        EvaluationLoop loop = loops.computeIfAbsent(interval, key -> {
            EvaluationLoop created = new EvaluationLoop(key, workers);
            created.start(scheduler, randomInitialDelay(key));
            return created;
        });
        loop.add(runner);
        logger.info("规则已调度: {}, 间隔: {}ms", runner.getRule().getName(), interval.toMillis());
    }

    private void removeFromLoop(String ruleName, Duration interval) {
        EvaluationLoop loop = loops.get(interval);
        if (loop == null) {
            return;
        }
        loop.remove(ruleName);
        if (loop.isEmpty()) {
            loops.remove(interval);
            loop.cancel();
        }
    }

    /**
     * 停止规则执行, 丢弃实例并对 Firing 实例发出最终恢复.
     * 已在查询中的评估稍后返回时, 状态机会丢弃它的结果.
     */
    private void stopRule(String ruleName) {
        RuleRunner runner = ruleRunners.remove(ruleName);
        if (runner != null) {
            runner.cancel();
            removeFromLoop(ruleName, runner.getRule().getInterval());
        }
        stateMachine.discardRule(ruleName, clock.instant(), transitionQueue::offerAll);
        health.markStopped(ruleName);
    }

    int loopCount() {
        return loops.size();
    }

    /**
     * 先停规则监听和评估循环, 再等线程池里已提交的评估与分发跑完
     */
    @Override
    public void close() {
        boolean wasRunning = running;
        running = false;
        ruleLoader.removeChangeListener(this);
        ruleLoader.close();
        if (!wasRunning) {
            return;
        }

        logger.info("告警引擎停止中, 取消 {} 个评估循环", loops.size());
        loops.values().forEach(EvaluationLoop::cancel);
        loops.clear();

        boolean clean = MoreExecutors.shutdownAndAwaitTermination(workers, SHUTDOWN_TIMEOUT)
                & MoreExecutors.shutdownAndAwaitTermination(scheduler, SHUTDOWN_TIMEOUT);
        if (clean) {
            logger.info("告警引擎已停止");
        } else {
            logger.warn("告警引擎停止超时, 仍有任务未结束");
        }
    }

    /**
     * 生成随机初始延迟, 打散同一时刻启动的循环
     */
    private long randomInitialDelay(Duration interval) {
        long bound = Math.min(interval.toMillis(), MAX_INITIAL_DELAY_MILLIS);
        return bound <= 0 ? 0 : ThreadLocalRandom.current().nextLong(bound);
    }
}
