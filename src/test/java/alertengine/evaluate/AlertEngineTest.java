package alertengine.evaluate;

import alertengine.group.GroupNotification;
import alertengine.group.GroupingEngine;
import alertengine.group.NotificationKind;
import alertengine.health.HealthStatus;
import alertengine.health.HealthTracker;
import alertengine.notify.DeliveryResult;
import alertengine.notify.LogReceiver;
import alertengine.notify.MessageRenderer;
import alertengine.notify.NotificationRouter;
import alertengine.notify.NotificationTransport;
import alertengine.notify.ReceiverRegistry;
import alertengine.notify.RenderedMessage;
import alertengine.notify.RetryPolicy;
import alertengine.query.LabelSet;
import alertengine.query.MetricQueryClient;
import alertengine.query.QueryException;
import alertengine.query.Sample;
import alertengine.query.TimeRange;
import alertengine.rule.RuleLoader;
import alertengine.silence.LabelMatcher;
import alertengine.silence.SilenceStore;
import alertengine.state.AlertStateMachine;
import alertengine.state.TransitionQueue;
import alertengine.utils.MutableClock;
import com.google.common.util.concurrent.MoreExecutors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertEngineTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final LabelSet API = LabelSet.of("service", "api");

    @TempDir
    Path rulesDir;

    private final MutableClock clock = new MutableClock(T0);
    private final FakeQueryClient queryClient = new FakeQueryClient();
    private final RecordingTransport transport = new RecordingTransport();
    private ScheduledExecutorService scheduler;
    private ExecutorService workers;
    private AlertEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        writeRule("cpu.yml", "name: cpu_high\nexpr: cpu_usage\nop: '>'\nthreshold: 80\nfor: 60s\n"
                + "interval: 30s\ngroup_by: [service]\nannotations:\n  summary: '{service} CPU {value}%'");

        scheduler = Executors.newSingleThreadScheduledExecutor();
        workers = Executors.newFixedThreadPool(2);

        AlertStateMachine stateMachine = new AlertStateMachine();
        ReceiverRegistry registry = new ReceiverRegistry();
        registry.register(new LogReceiver("log"));
        NotificationRouter router = new NotificationRouter(registry, Collections.emptyList(), "log",
                new MessageRenderer(ZoneOffset.UTC), transport,
                new RetryPolicy(3, Duration.ofSeconds(10), Duration.ofMinutes(1)),
                MoreExecutors.directExecutor(), 50);

        engine = AlertEngine.builder()
                .ruleLoader(new RuleLoader(rulesDir, Duration.ofSeconds(30), scheduler, clock))
                .evaluator(new RuleEvaluator(queryClient))
                .stateMachine(stateMachine)
                .transitionQueue(new TransitionQueue(100))
                .groupingEngine(new GroupingEngine(Duration.ofSeconds(30), Duration.ofMinutes(5), Duration.ofHours(4)))
                .silenceStore(new SilenceStore(stateMachine::firingAlerts, Duration.ofHours(1), clock))
                .router(router)
                .health(new HealthTracker(20, Duration.ofHours(1)))
                .clock(clock)
                .scheduler(scheduler)
                .workers(workers)
                .watchRules(false)
                .build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
        scheduler.shutdownNow();
        workers.shutdownNow();
    }

    private void writeRule(String file, String content) throws IOException {
        Files.write(rulesDir.resolve(file), content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 推进到指定秒数, 设置指标值, 执行一次评估和一次分发
     */
    private List<GroupNotification> step(int second, double cpu) {
        clock.set(T0.plusSeconds(second));
        queryClient.set("cpu_usage", new Sample(API, cpu, clock.instant()));
        engine.runRule("cpu_high");
        return engine.dispatchOnce();
    }

    @Test
    void breachFiresOnceAndResolvesOnce() {
        engine.reloadRules();

        assertThat(step(0, 90)).isEmpty();
        assertThat(step(30, 91)).isEmpty();
        // 60s 时进入 Firing, 分组还需等待 group_wait
        assertThat(step(60, 92)).isEmpty();
        assertThat(step(90, 93)).extracting(GroupNotification::getKind).containsExactly(NotificationKind.FIRING);
        assertThat(step(120, 94)).isEmpty();

        assertThat(step(150, 40)).isEmpty();
        clock.set(T0.plusSeconds(90).plus(Duration.ofMinutes(5)));
        assertThat(engine.dispatchOnce()).extracting(GroupNotification::getKind)
                .containsExactly(NotificationKind.RESOLVED);
        assertThat(step(420, 40)).isEmpty();

        assertThat(transport.titles()).containsExactly("【告警】cpu_high", "【恢复】cpu_high");
        assertThat(transport.messages.get(0).getText()).contains("api CPU 93%");
        assertThat(engine.getStateMachine().instanceCount()).isZero();
        assertThat(engine.getGroupingEngine().size()).isZero();
    }

    @Test
    void silencedAlertIsNotNotified() {
        engine.reloadRules();
        engine.getSilenceStore().create(List.of(LabelMatcher.equal("service", "api")), null,
                T0.plusSeconds(3600), "ops", "维护中");

        step(0, 90);
        step(60, 90);
        step(90, 90);

        assertThat(engine.getStateMachine().firingAlerts()).hasSize(1);
        assertThat(transport.messages).isEmpty();
    }

    @Test
    void notificationIsSentOnceSilenceWindowEnds() {
        engine.reloadRules();
        engine.getSilenceStore().create(List.of(LabelMatcher.equal("service", "api")), null,
                T0.plusSeconds(120), "ops", "发布窗口");

        assertThat(step(0, 90)).isEmpty();
        assertThat(step(60, 90)).isEmpty();
        // group_wait 已过但仍在静默期内
        assertThat(step(90, 90)).isEmpty();
        assertThat(transport.messages).isEmpty();

        assertThat(step(120, 90)).extracting(GroupNotification::getKind).containsExactly(NotificationKind.FIRING);
        assertThat(transport.messages).hasSize(1);
        assertThat(step(150, 90)).isEmpty();
        assertThat(transport.messages).hasSize(1);
    }

    @Test
    void evaluationInFlightWhenRuleIsDeletedLeavesNoAlert() throws Exception {
        engine.reloadRules();
        step(0, 90);

        clock.set(T0.plusSeconds(60));
        queryClient.blockNextQuery();
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> evaluation = caller.submit(() -> engine.runRule("cpu_high"));
            assertThat(queryClient.entered.await(5, TimeUnit.SECONDS)).isTrue();

            Files.delete(rulesDir.resolve("cpu.yml"));
            engine.reloadRules();
            queryClient.release.countDown();
            assertThat(evaluation.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            caller.shutdownNow();
        }

        assertThat(engine.getStateMachine().instanceCount()).isZero();
        clock.set(T0.plus(Duration.ofHours(5)));
        assertThat(engine.dispatchOnce()).isEmpty();
        assertThat(engine.getGroupingEngine().size()).isZero();
        assertThat(transport.messages).isEmpty();
        assertThat(engine.health().getRuleHealth()).doesNotContainKey("cpu_high");
    }

    @Test
    void deletingRuleResolvesItsFiringAlerts() throws IOException {
        engine.reloadRules();
        step(0, 90);
        step(60, 90);
        step(90, 90);
        assertThat(transport.messages).hasSize(1);

        Files.delete(rulesDir.resolve("cpu.yml"));
        clock.set(T0.plusSeconds(100));
        engine.reloadRules();

        assertThat(engine.getStateMachine().instanceCount()).isZero();
        assertThatThrownBy(() -> engine.runRule("cpu_high")).isInstanceOf(IllegalArgumentException.class);

        clock.set(T0.plusSeconds(90).plus(Duration.ofMinutes(5)));
        assertThat(engine.dispatchOnce()).extracting(GroupNotification::getKind)
                .containsExactly(NotificationKind.RESOLVED);
        assertThat(engine.health().getRuleHealth()).doesNotContainKey("cpu_high");
    }

    @Test
    void changedLabelsRestartInstances() throws IOException {
        engine.reloadRules();
        step(0, 90);
        step(60, 90);
        assertThat(engine.getStateMachine().firingAlerts()).hasSize(1);

        writeRule("cpu.yml", "name: cpu_high\nexpr: cpu_usage\nop: '>'\nthreshold: 80\nfor: 60s\n"
                + "interval: 30s\ngroup_by: [service]\nlabels:\n  team: infra");
        engine.reloadRules();

        assertThat(engine.getStateMachine().instanceCount()).isZero();
        step(90, 90);
        assertThat(engine.getStateMachine().snapshot()).singleElement()
                .satisfies(alert -> assertThat(alert.getLabels().get("team")).isEqualTo("infra"));
    }

    @Test
    void queryFailureKeepsStateAndIsReportedInHealth() {
        engine.reloadRules();
        step(0, 90);
        step(60, 90);

        queryClient.failing = true;
        clock.set(T0.plusSeconds(90));
        engine.runRule("cpu_high");

        assertThat(engine.getStateMachine().firingAlerts()).hasSize(1);
        HealthStatus health = engine.health();
        assertThat(health.getRuleHealth().get("cpu_high").getConsecutiveFailures()).isEqualTo(1);
        assertThat(health.getIssues()).isNotEmpty();
    }

    @Test
    void startSchedulesOneLoopPerInterval() throws IOException {
        writeRule("slow.yml", "name: slow\nexpr: up\nop: '<'\nthreshold: 1\ninterval: 5m");

        engine.start();

        assertThat(engine.isRunning()).isTrue();
        assertThat(engine.loopCount()).isEqualTo(2);
        assertThat(engine.health().getRuleSetVersion()).isEqualTo(1);
    }

    private static class FakeQueryClient implements MetricQueryClient {
        private final Map<String, List<Sample>> results = new ConcurrentHashMap<>();
        private volatile boolean failing;
        private volatile CountDownLatch entered;
        private volatile CountDownLatch release;
        private volatile CountDownLatch pending;

        void set(String expr, Sample... samples) {
            results.put(expr, List.of(samples));
        }

        /**
         * 下一次查询进入后挂起, 直到 release 被释放
         */
        void blockNextQuery() {
            release = new CountDownLatch(1);
            entered = new CountDownLatch(1);
            pending = release;
        }

        @Override
        public List<Sample> query(String expression, TimeRange range) throws QueryException {
            CountDownLatch gate = pending;
            if (gate != null) {
                pending = null;
                entered.countDown();
                try {
                    gate.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new QueryException(expression, "查询被中断");
                }
            }
            if (failing) {
                throw new QueryException(expression, "Prometheus不可达");
            }
            return results.getOrDefault(expression, Collections.emptyList());
        }
    }

    private static class RecordingTransport implements NotificationTransport {
        private final List<RenderedMessage> messages = new CopyOnWriteArrayList<>();

        @Override
        public DeliveryResult send(alertengine.notify.Receiver receiver, RenderedMessage message) {
            messages.add(message);
            return DeliveryResult.success();
        }

        List<String> titles() {
            List<String> titles = new ArrayList<>();
            messages.forEach(message -> titles.add(message.getTitle()));
            return titles;
        }
    }
}
