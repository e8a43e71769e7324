package alertengine.config;

import alertengine.evaluate.AlertEngine;
import alertengine.evaluate.RuleEvaluator;
import alertengine.group.GroupingEngine;
import alertengine.health.HealthTracker;
import alertengine.notify.MessageRenderer;
import alertengine.notify.NotificationRouter;
import alertengine.notify.ReceiverRegistry;
import alertengine.notify.ReceiverTransport;
import alertengine.notify.RetryPolicy;
import alertengine.notify.Route;
import alertengine.query.MetricQueryClient;
import alertengine.query.PrometheusQueryClient;
import alertengine.rule.RuleLoader;
import alertengine.silence.InhibitRule;
import alertengine.silence.LabelMatcher;
import alertengine.silence.SilenceStore;
import alertengine.state.AlertStateMachine;
import alertengine.state.TransitionQueue;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class AlertEngineConfiguration {

    @Autowired
    private ConfigFilePathManage configFilePathManage;

    @Bean
    public EngineConfig engineConfig() {
        EngineConfig config = EngineConfig.load(configFilePathManage.engineConfigPath);
        config.validate();
        log.info("加载引擎配置: {}", configFilePathManage.engineConfigPath);
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService engineScheduler(EngineConfig config) {
        return Executors.newScheduledThreadPool(
                config.getInt("threadpool.scheduler.size", 4),
                new ThreadFactoryBuilder().setNameFormat("alertengine-scheduler-%d").build()
        );
    }

    /**
     * 线程池满时直接拒绝, 评估循环跳过该规则本周期, 不在调度线程上执行查询
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService engineWorkers(EngineConfig config) {
        return new ThreadPoolExecutor(
                config.getInt("threadpool.core.size", 8),
                config.getInt("threadpool.max.size", 16),
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(config.getInt("threadpool.queue.capacity", 1000)),
                new ThreadFactoryBuilder().setNameFormat("alertengine-worker-%d").build(),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService notificationDispatcher(EngineConfig config) {
        int size = config.getInt("threadpool.dispatch.size", 4);
        return new ThreadPoolExecutor(
                size, size,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(config.getInt("threadpool.queue.capacity", 1000)),
                new ThreadFactoryBuilder().setNameFormat("alertengine-dispatch-%d").build(),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Bean
    public MetricQueryClient metricQueryClient(EngineConfig config) {
        Map<String, String> headers = new LinkedHashMap<>();
        config.getSubConfig("prometheus.headers").forEach((name, value) -> headers.put(name, String.valueOf(value)));
        return new PrometheusQueryClient(
                config.getString("prometheus.url"),
                config.getDuration("prometheus.timeout", Duration.ofSeconds(10)),
                headers
        );
    }

    @Bean
    public AlertStateMachine alertStateMachine() {
        return new AlertStateMachine();
    }

    @Bean
    public SilenceStore silenceStore(EngineConfig config, AlertStateMachine stateMachine, Clock clock) {
        SilenceStore store = new SilenceStore(stateMachine::firingAlerts,
                config.getDuration("silences.retention", Duration.ofHours(24)), clock);
        store.replaceInhibitRules(parseInhibitRules(config));
        return store;
    }

    @Bean
    public ReceiverRegistry receiverRegistry(EngineConfig config) {
        ReceiverRegistry registry = new ReceiverRegistry();
        for (Map<String, Object> receiver : config.getList("receivers")) {
            Object name = receiver.get("name");
            if (name == null) {
                throw new IllegalArgumentException("接收者必须指定name: " + receiver);
            }
            Object type = receiver.get("type");
            registry.create(name.toString(), type == null ? null : type.toString(), receiver);
        }
        return registry;
    }

    @Bean
    public HealthTracker healthTracker(EngineConfig config) {
        return new HealthTracker(
                config.getInt("health.failure_history_size", 50),
                config.getDuration("health.failure_window", Duration.ofHours(1))
        );
    }

    @Bean
    public NotificationRouter notificationRouter(EngineConfig config, ReceiverRegistry registry,
                                                 ExecutorService notificationDispatcher) {
        String defaultReceiver = config.getString("notification.default_receiver", "log");
        if (!registry.contains(defaultReceiver)) {
            throw new IllegalArgumentException("默认接收者未配置: " + defaultReceiver);
        }
        RetryPolicy retryPolicy = new RetryPolicy(
                config.getInt("notification.max_attempts", 5),
                config.getDuration("notification.initial_backoff", Duration.ofSeconds(10)),
                config.getDuration("notification.max_backoff", Duration.ofMinutes(5))
        );
        MessageRenderer renderer = new MessageRenderer(
                ZoneId.of(config.getString("notification.timezone", "Asia/Shanghai")));
        return new NotificationRouter(registry, parseRoutes(config), defaultReceiver, renderer,
                new ReceiverTransport(), retryPolicy, notificationDispatcher,
                config.getInt("notification.history_size", 200));
    }

    @Bean(destroyMethod = "close")
    public AlertEngine alertEngine(EngineConfig config, Clock clock, MetricQueryClient queryClient,
                                   AlertStateMachine stateMachine, SilenceStore silenceStore,
                                   NotificationRouter router, HealthTracker health,
                                   ScheduledExecutorService engineScheduler, ExecutorService engineWorkers) {
        RuleLoader ruleLoader = new RuleLoader(
                Paths.get(config.getString("rules.folder")),
                config.getDuration("rules.default_interval", Duration.ofSeconds(30)),
                engineScheduler,
                clock
        );
        GroupingEngine groupingEngine = new GroupingEngine(
                config.getDuration("grouping.group_wait", Duration.ofSeconds(30)),
                config.getDuration("grouping.group_interval", Duration.ofMinutes(5)),
                config.getDuration("grouping.repeat_interval", Duration.ofHours(4))
        );

        AlertEngine engine = AlertEngine.builder()
                .ruleLoader(ruleLoader)
                .evaluator(new RuleEvaluator(queryClient))
                .stateMachine(stateMachine)
                .transitionQueue(new TransitionQueue(config.getInt("engine.transition_queue_capacity", 10000)))
                .groupingEngine(groupingEngine)
                .silenceStore(silenceStore)
                .router(router)
                .health(health)
                .clock(clock)
                .scheduler(engineScheduler)
                .workers(engineWorkers)
                .dispatchInterval(config.getDuration("engine.dispatch_interval", Duration.ofSeconds(1)))
                .healthCheckInterval(config.getDuration("health.check.interval", Duration.ofSeconds(60)))
                .rescanInterval(config.getDuration("rules.rescan_interval", Duration.ofMinutes(5)))
                .watchRules(config.getBoolean("rules.watch", true))
                .build();

        try {
            engine.start();
        } catch (Exception e) {
            log.error("告警引擎启动错误", e);
            engine.close();
            throw e;
        }
        return engine;
    }

    /**
     * 解析路由配置, 按声明顺序匹配
     */
    static List<Route> parseRoutes(EngineConfig config) {
        List<Route> routes = new ArrayList<>();
        for (Map<String, Object> item : config.getList("routes")) {
            Object receiver = item.get("receiver");
            if (receiver == null) {
                throw new IllegalArgumentException("路由必须指定receiver: " + item);
            }
            routes.add(Route.builder()
                    .matchers(parseMatchers(item.get("matchers")))
                    .receiver(receiver.toString())
                    .build());
        }
        return routes;
    }

    static List<InhibitRule> parseInhibitRules(EngineConfig config) {
        List<InhibitRule> rules = new ArrayList<>();
        for (Map<String, Object> item : config.getList("inhibit_rules")) {
            List<LabelMatcher> source = parseMatchers(item.get("source_matchers"));
            List<LabelMatcher> target = parseMatchers(item.get("target_matchers"));
            if (source.isEmpty() || target.isEmpty()) {
                throw new IllegalArgumentException("抑制规则必须同时配置source_matchers和target_matchers: " + item);
            }
            InhibitRule.InhibitRuleBuilder builder = InhibitRule.builder()
                    .sourceMatchers(source)
                    .targetMatchers(target);
            Object equal = item.get("equal");
            if (equal instanceof List) {
                for (Object label : (List<?>) equal) {
                    builder.equalLabel(String.valueOf(label));
                }
            }
            rules.add(builder.build());
        }
        return rules;
    }

    private static List<LabelMatcher> parseMatchers(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("matchers 必须是列表: " + value);
        }
        List<LabelMatcher> matchers = new ArrayList<>();
        for (Object expression : (List<?>) value) {
            matchers.add(LabelMatcher.parse(String.valueOf(expression)));
        }
        return matchers;
    }
}
