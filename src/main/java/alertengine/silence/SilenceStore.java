package alertengine.silence;

import alertengine.state.AlertSnapshot;
import com.google.common.base.Suppliers;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 静默与抑制存储
 * <p>
 * 静默列表和抑制规则都是不可变列表, 写入时整体替换引用, 读取无锁且不会看到中间状态.
 * 写入只来自管理接口, 写方之间用对象锁串行.
 */
@Slf4j
public class SilenceStore implements Suppressor {

    private final AtomicReference<List<Silence>> silences = new AtomicReference<>(Collections.emptyList());
    private final AtomicReference<List<InhibitRule>> inhibitRules = new AtomicReference<>(Collections.emptyList());
    private final Supplier<List<AlertSnapshot>> firingAlerts;
    private final Duration retention;
    private final Clock clock;

    /**
     * @param firingAlerts 当前处于 Firing 的告警, 用于抑制规则的一跳查找
     * @param retention    过期静默保留多久后被清理
     */
    public SilenceStore(Supplier<List<AlertSnapshot>> firingAlerts, Duration retention, Clock clock) {
        this.firingAlerts = firingAlerts;
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * 创建静默
     */
    public synchronized Silence create(List<LabelMatcher> matchers, Instant startsAt, Instant endsAt,
                                       String createdBy, String comment) {
        if (CollectionUtils.isEmpty(matchers)) {
            throw new IllegalArgumentException("静默至少需要一个匹配器");
        }
        Instant now = clock.instant();
        Instant start = startsAt != null ? startsAt : now;
        if (endsAt == null || !endsAt.isAfter(start)) {
            throw new IllegalArgumentException("静默结束时间必须晚于开始时间");
        }
        if (!endsAt.isAfter(now)) {
            throw new IllegalArgumentException("静默结束时间必须晚于当前时间");
        }

        Silence silence = Silence.builder()
                .id(UUID.randomUUID().toString())
                .matchers(matchers)
                .startsAt(start)
                .endsAt(endsAt)
                .createdBy(createdBy)
                .comment(comment)
                .createdAt(now)
                .build();

        List<Silence> next = new ArrayList<>(silences.get());
        next.add(silence);
        silences.set(Collections.unmodifiableList(next));
        log.info("创建静默: id={}, matchers={}, {} ~ {}, creator={}",
                silence.getId(), matchers, start, endsAt, createdBy);
        return silence;
    }

    /**
     * 删除静默
     */
    public synchronized void delete(String id) {
        List<Silence> current = silences.get();
        List<Silence> next = current.stream()
                .filter(silence -> !silence.getId().equals(id))
                .collect(Collectors.toList());
        if (next.size() == current.size()) {
            throw new SilenceNotFoundException(id);
        }
        silences.set(Collections.unmodifiableList(next));
        log.info("删除静默: id={}", id);
    }

    public List<Silence> list() {
        return silences.get();
    }

    public Optional<Silence> get(String id) {
        return silences.get().stream()
                .filter(silence -> silence.getId().equals(id))
                .findFirst();
    }

    public void replaceInhibitRules(List<InhibitRule> rules) {
        inhibitRules.set(Collections.unmodifiableList(new ArrayList<>(rules)));
        log.info("加载抑制规则: {}条", rules.size());
    }

    public List<InhibitRule> getInhibitRules() {
        return inhibitRules.get();
    }

    /**
     * 清理过期超过保留时间的静默
     */
    public synchronized int purgeExpired(Instant now) {
        List<Silence> current = silences.get();
        Instant cutoff = now.minus(retention);
        List<Silence> next = current.stream()
                .filter(silence -> silence.getEndsAt().isAfter(cutoff))
                .collect(Collectors.toList());
        int purged = current.size() - next.size();
        if (purged > 0) {
            silences.set(Collections.unmodifiableList(next));
            log.info("清理过期静默: {}条", purged);
        }
        return purged;
    }

    @Override
    public boolean isSuppressed(AlertSnapshot alert, Instant now) {
        return snapshot().isSuppressed(alert, now);
    }

    /**
     * 固定当前的静默列表和抑制规则, 返回一次分发周期内使用的判断器.
     * Firing 告警只在第一次需要做抑制查找时取一次快照, 不随成员数重复获取.
     */
    public Suppressor snapshot() {
        List<Silence> currentSilences = silences.get();
        List<InhibitRule> currentRules = inhibitRules.get();
        Supplier<List<AlertSnapshot>> firing = Suppliers.memoize(firingAlerts::get);
        return (alert, now) -> silenced(currentSilences, alert, now)
                || inhibited(currentRules, firing, alert);
    }

    public boolean isSilenced(AlertSnapshot alert, Instant now) {
        return silenced(silences.get(), alert, now);
    }

    public boolean isInhibited(AlertSnapshot alert) {
        return inhibited(inhibitRules.get(), firingAlerts, alert);
    }

    private static boolean silenced(List<Silence> silences, AlertSnapshot alert, Instant now) {
        for (Silence silence : silences) {
            if (silence.isActive(now) && silence.matches(alert.getLabels())) {
                return true;
            }
        }
        return false;
    }

    /**
     * 一跳查找: 只看当前 Firing 的源告警, 不做传递闭包, 互相引用的抑制规则也不会成环
     */
    private static boolean inhibited(List<InhibitRule> rules, Supplier<List<AlertSnapshot>> firing,
                                     AlertSnapshot alert) {
        if (rules.isEmpty()) {
            return false;
        }
        List<InhibitRule> targeting = rules.stream()
                .filter(rule -> rule.matchesTarget(alert.getLabels()))
                .collect(Collectors.toList());
        if (targeting.isEmpty()) {
            return false;
        }
        for (AlertSnapshot source : firing.get()) {
            if (source.getKey().equals(alert.getKey())) {
                continue;
            }
            for (InhibitRule rule : targeting) {
                if (rule.matchesSource(source.getLabels())
                        && rule.sameEqualLabels(source.getLabels(), alert.getLabels())) {
                    return true;
                }
            }
        }
        return false;
    }
}
