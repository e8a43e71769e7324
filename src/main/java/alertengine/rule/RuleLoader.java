package alertengine.rule;

import alertengine.utils.DurationUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;

/**
 * 规则目录的加载与热更新
 * <p>
 * 每次加载生成一个新版本的 RuleSet 并整体替换, 读取方永远看到完整的规则集合.
 * 目录内容的hash未变化时不产生新版本.
 */
public class RuleLoader implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RuleLoader.class);

    private static final Set<String> KNOWN_FIELDS = new HashSet<>(Arrays.asList(
            "name", "expr", "op", "threshold", "for", "interval", "labels", "annotations",
            "severity", "group_by", "receiver", "enabled"));

    private final Path rulesDirectory;
    private final Duration defaultInterval;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final ObjectMapper yamlMapper;
    private final AtomicReference<RuleSet> current = new AtomicReference<>(RuleSet.EMPTY);
    private final List<RuleChangeListener> changeListeners = new CopyOnWriteArrayList<>();

    private volatile boolean watching = false;
    private WatchService watchService;
    private Thread watchThread;
    private ScheduledFuture<?> rescanTask;

    public RuleLoader(Path rulesDirectory, Duration defaultInterval, ScheduledExecutorService scheduler, Clock clock) {
        this.rulesDirectory = rulesDirectory;
        this.defaultInterval = defaultInterval;
        this.scheduler = scheduler;
        this.clock = clock;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    public RuleSet current() {
        return current.get();
    }

    /**
     * 加载所有规则, 内容未变化时直接返回当前版本
     */
    public synchronized RuleSet load() throws RuleConfigException {
        if (!Files.isDirectory(rulesDirectory)) {
            throw new RuleConfigException(rulesDirectory.toString(), null, "规则目录不存在: " + rulesDirectory);
        }

        Map<Path, byte[]> contents = readRuleFiles();
        String contentHash = calculateHash(contents);
        RuleSet previous = current.get();
        if (previous.getVersion() > 0 && contentHash.equals(previous.getContentHash())) {
            logger.debug("规则文件未变化, 跳过加载");
            return previous;
        }

        logger.info("规则目录有变化, 重新加载: {}", rulesDirectory);
        Map<String, Rule> rules = new LinkedHashMap<>();
        List<RuleRejection> rejections = new ArrayList<>();
        for (Map.Entry<Path, byte[]> entry : contents.entrySet()) {
            loadFile(entry.getKey(), entry.getValue(), rules, rejections);
        }

        RuleSet next = new RuleSet(previous.getVersion() + 1, clock.instant(),
                rules.values(), rejections, contentHash);
        current.set(next);
        logger.info("规则加载完成: 版本={}, 有效规则={}, 拒绝={}",
                next.getVersion(), next.size(), rejections.size());

        rejections.forEach(r -> fire("拒绝", r.getPath(), l -> l.onRuleLoadError(r)));
        notifyChanges(previous, next);
        return next;
    }

    private Map<Path, byte[]> readRuleFiles() {
        // 按文件名排序, 保证重名规则 "先定义者生效" 的顺序稳定
        Map<Path, byte[]> contents = new TreeMap<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(rulesDirectory, "*.{yaml,yml}")) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    contents.put(path, Files.readAllBytes(path));
                }
            }
        } catch (IOException e) {
            throw new RuleConfigException(rulesDirectory.toString(), null, "读取规则目录失败: " + e.getMessage(), e);
        }
        return contents;
    }

    /**
     * 计算整个目录的hash, 文件名也参与计算
     */
    private String calculateHash(Map<Path, byte[]> contents) {
        StringBuilder digest = new StringBuilder();
        contents.forEach((path, bytes) -> digest.append(path.getFileName())
                .append(':')
                .append(DigestUtils.md5Hex(bytes))
                .append('\n'));
        return DigestUtils.md5Hex(digest.toString());
    }

    /**
     * 加载单个规则文件, 无效规则逐条拒绝
     */
    private void loadFile(Path path, byte[] content, Map<String, Rule> rules, List<RuleRejection> rejections) {
        logger.debug("解析规则文件: {}", path);
        String text = new String(content, StandardCharsets.UTF_8);
        if (StringUtils.isBlank(text)) {
            return;
        }
        List<Object> documents;
        try {
            documents = ruleDocuments(yamlMapper.readValue(text, Object.class));
        } catch (IOException | RuleConfigException e) {
            logger.error("解析规则文件失败: {}", path, e);
            rejections.add(new RuleRejection(path.toString(), null, -1, "解析规则文件失败: " + e.getMessage()));
            return;
        }

        for (int i = 0; i < documents.size(); i++) {
            Object document = documents.get(i);
            String ruleName = null;
            try {
                if (!(document instanceof Map)) {
                    throw new RuleConfigException(path.toString(), null, "规则定义必须是映射结构");
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> ruleMap = (Map<String, Object>) document;
                ruleName = ruleMap.get("name") != null ? ruleMap.get("name").toString() : null;

                Rule rule = buildRule(ruleMap, path);
                rule.validate();

                Rule existing = rules.get(rule.getName());
                if (existing != null) {
                    throw new RuleConfigException(path.toString(), rule.getName(),
                            String.format("规则名称 '%s' 已存在于文件: %s", rule.getName(), existing.getSourcePath()));
                }
                rules.put(rule.getName(), rule);
                logger.debug("规则加载成功: {}", rule.getName());
            } catch (RuleConfigException e) {
                logger.warn("拒绝规则: 文件={}, 位置={}, 名称={}, 原因={}", path, i, ruleName, e.getMessage());
                rejections.add(new RuleRejection(path.toString(), ruleName, i, e.getMessage()));
            }
        }
    }

    /**
     * 支持三种文件结构: rules 列表、单条规则、顶层列表
     */
    @SuppressWarnings("unchecked")
    private List<Object> ruleDocuments(Object parsed) {
        if (parsed == null) {
            return Collections.emptyList();
        }
        if (parsed instanceof List) {
            return (List<Object>) parsed;
        }
        if (parsed instanceof Map) {
            Map<String, Object> map = (Map<String, Object>) parsed;
            if (map.containsKey("rules")) {
                Object rules = map.get("rules");
                if (rules == null) {
                    return Collections.emptyList();
                }
                if (!(rules instanceof List)) {
                    throw new RuleConfigException("rules 字段必须是列表");
                }
                return (List<Object>) rules;
            }
            return Collections.singletonList(map);
        }
        throw new RuleConfigException("无法识别的规则文件结构");
    }

    /**
     * 字段转换为 Rule, 类型错误统一包装成 RuleConfigException
     */
    private Rule buildRule(Map<String, Object> config, Path path) {
        String name = config.get("name") != null ? config.get("name").toString() : null;
        String source = path.toString();

        for (String field : config.keySet()) {
            if (!KNOWN_FIELDS.contains(field)) {
                logger.warn("规则 {} 包含未知字段 '{}', 已忽略", name, field);
            }
        }

        Rule.RuleBuilder builder = Rule.builder()
                .name(name)
                .expr(config.get("expr") != null ? config.get("expr").toString() : null)
                .sourcePath(source);

        try {
            Object op = config.get("op");
            if (op != null) {
                builder.operator(ComparisonOperator.fromString(op.toString()));
            }
            builder.threshold(parseThreshold(config.get("threshold")));

            if (config.containsKey("for")) {
                builder.forDuration(DurationUtils.parse(config.get("for")));
            }
            Object interval = config.get("interval");
            builder.interval(interval != null ? DurationUtils.parse(interval) : defaultInterval);

            if (config.containsKey("severity")) {
                builder.severity(Severity.fromString(String.valueOf(config.get("severity"))));
            }
            if (config.containsKey("enabled")) {
                builder.enabled(parseBoolean(config.get("enabled")));
            }
            Object receiver = config.get("receiver");
            if (receiver != null && StringUtils.isNotBlank(receiver.toString())) {
                builder.receiver(receiver.toString().trim());
            }
            builder.labels(stringMap(config.get("labels"), "labels"));
            builder.annotations(stringMap(config.get("annotations"), "annotations"));
            builder.groupBy(stringList(config.get("group_by")));
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new RuleConfigException(source, name, e.getMessage(), e);
        }
        return builder.build();
    }

    private double parseThreshold(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("规则必须配置阈值threshold");
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("无效的阈值: " + value);
        }
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = String.valueOf(value).trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        throw new IllegalArgumentException("enabled 必须是布尔值: " + value);
    }

    private Map<String, String> stringMap(Object value, String field) {
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException(field + " 必须是映射结构");
        }
        Map<String, String> result = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((k, v) -> {
            if (k != null && v != null) {
                result.put(k.toString(), v.toString());
            }
        });
        return result;
    }

    private List<String> stringList(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (value instanceof String) {
            return Collections.singletonList((String) value);
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("group_by 必须是标签名列表");
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            result.add(Objects.toString(item, null));
        }
        return result;
    }

    /**
     * 对比新旧版本, 通知新增、更新、删除
     */
    private void notifyChanges(RuleSet previous, RuleSet next) {
        for (Rule rule : next.all()) {
            Rule old = previous.get(rule.getName());
            if (old == null) {
                fire("新增", rule.getName(), l -> l.onRuleAdded(rule));
            } else if (!old.equals(rule)) {
                fire("更新", rule.getName(), l -> l.onRuleUpdated(old, rule));
            }
        }
        for (Rule old : previous.all()) {
            if (next.get(old.getName()) == null) {
                fire("删除", old.getName(), l -> l.onRuleDeleted(old));
            }
        }
    }

    private void fire(String action, String subject, Consumer<RuleChangeListener> event) {
        changeListeners.forEach(listener -> {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.error("规则变更回调异常: 动作={}, 对象={}, 监听器={}",
                        action, subject, listener.getClass().getSimpleName(), e);
            }
        });
    }

    /**
     * 启动文件监听, 同时定期执行完整性检查
     */
    public synchronized void startWatching(Duration rescanInterval) throws IOException {
        if (watching) {
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();
        rulesDirectory.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY);

        watching = true;
        watchThread = new Thread(this::watchLoop, "rule-watcher");
        watchThread.setDaemon(true);
        watchThread.start();

        rescanTask = scheduler.scheduleWithFixedDelay(
                this::reloadQuietly,
                rescanInterval.toMillis(),
                rescanInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        logger.info("规则文件监听已启动: {}", rulesDirectory);
    }

    private void watchLoop() {
        try {
            while (watching) {
                WatchKey key = watchService.take();
                boolean changed = false;

                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                        changed = true;
                        continue;
                    }
                    Path filename = (Path) event.context();
                    if (StringUtils.endsWithAny(StringUtils.lowerCase(filename.toString()), ".yaml", ".yml")) {
                        logger.info("检测到规则文件变更: {} {}", event.kind().name(), filename);
                        changed = true;
                    }
                }

                if (changed) {
                    // 延迟一下, 合并编辑器保存时产生的多次事件
                    scheduler.schedule(this::reloadQuietly, 500, TimeUnit.MILLISECONDS);
                }

                if (!key.reset()) {
                    logger.error("规则目录不再可访问");
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            logger.debug("规则文件监听已关闭");
        }
    }

    private void reloadQuietly() {
        try {
            load();
        } catch (Exception e) {
            logger.error("重新加载规则失败", e);
        }
    }

    public void addChangeListener(RuleChangeListener listener) {
        changeListeners.add(listener);
    }

    public void removeChangeListener(RuleChangeListener listener) {
        changeListeners.remove(listener);
    }

    @Override
    public synchronized void close() {
        watching = false;
        if (rescanTask != null) {
            rescanTask.cancel(false);
        }
        if (watchThread != null) {
            watchThread.interrupt();
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                logger.warn("关闭规则目录监听失败: {}", rulesDirectory, e);
            }
        }
    }
}
