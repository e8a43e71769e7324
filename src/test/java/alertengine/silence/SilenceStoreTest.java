package alertengine.silence;

import alertengine.query.LabelSet;
import alertengine.state.AlertSnapshot;
import alertengine.state.AlertState;
import alertengine.utils.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SilenceStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final List<AlertSnapshot> firing = new ArrayList<>();
    private SilenceStore store;

    @BeforeEach
    void setUp() {
        store = new SilenceStore(() -> firing, Duration.ofHours(1), clock);
    }

    private static AlertSnapshot alert(String... labels) {
        LabelSet set = LabelSet.of(labels);
        return AlertSnapshot.builder()
                .key("r" + set.key())
                .ruleName("r")
                .labels(set)
                .groupLabels(LabelSet.EMPTY)
                .state(AlertState.FIRING)
                .build();
    }

    @Test
    void silenceAppliesOnlyInsideWindow() {
        AlertSnapshot api = alert("service", "api");
        store.create(List.of(LabelMatcher.equal("service", "api")),
                T0.plusSeconds(60), T0.plusSeconds(120), "ops", "发布窗口");

        assertThat(store.isSuppressed(api, T0)).isFalse();
        assertThat(store.isSuppressed(api, T0.plusSeconds(60))).isTrue();
        assertThat(store.isSuppressed(api, T0.plusSeconds(119))).isTrue();
        assertThat(store.isSuppressed(api, T0.plusSeconds(120))).isFalse();
        assertThat(store.isSuppressed(alert("service", "web"), T0.plusSeconds(90))).isFalse();
    }

    @Test
    void regexSilenceMatchesAlternatives() {
        store.create(List.of(LabelMatcher.regex("service", "api|web")), null, T0.plusSeconds(300), "ops", null);

        assertThat(store.isSilenced(alert("service", "web"), T0)).isTrue();
        assertThat(store.isSilenced(alert("service", "db"), T0)).isFalse();
    }

    @Test
    void deleteRemovesSilence() {
        Silence silence = store.create(List.of(LabelMatcher.equal("service", "api")), null,
                T0.plusSeconds(300), "ops", null);

        store.delete(silence.getId());

        assertThat(store.list()).isEmpty();
        assertThat(store.isSuppressed(alert("service", "api"), T0)).isFalse();
        assertThatThrownBy(() -> store.delete(silence.getId())).isInstanceOf(SilenceNotFoundException.class);
    }

    @Test
    void createValidatesInput() {
        List<LabelMatcher> matchers = List.of(LabelMatcher.equal("a", "b"));
        assertThatThrownBy(() -> store.create(Collections.emptyList(), null, T0.plusSeconds(60), "ops", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.create(matchers, T0.plusSeconds(60), T0.plusSeconds(30), "ops", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.create(matchers, T0.minusSeconds(120), T0.minusSeconds(60), "ops", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void purgeDropsSilencesExpiredBeyondRetention() {
        Silence silence = store.create(List.of(LabelMatcher.equal("a", "b")), null, T0.plusSeconds(60), "ops", null);

        assertThat(store.purgeExpired(T0.plusSeconds(120))).isZero();
        assertThat(store.get(silence.getId())).isPresent();
        assertThat(silence.state(T0.plusSeconds(120))).isEqualTo(SilenceState.EXPIRED);

        assertThat(store.purgeExpired(T0.plusSeconds(60).plus(Duration.ofHours(2)))).isEqualTo(1);
        assertThat(store.get(silence.getId())).isEmpty();
    }

    @Test
    void inhibitionRequiresFiringSourceWithEqualLabels() {
        store.replaceInhibitRules(List.of(InhibitRule.builder()
                .sourceMatcher(LabelMatcher.equal("severity", "critical"))
                .targetMatcher(LabelMatcher.equal("severity", "warning"))
                .equalLabel("service")
                .build()));
        AlertSnapshot warning = alert("severity", "warning", "service", "api");

        assertThat(store.isInhibited(warning)).isFalse();

        firing.add(alert("severity", "critical", "service", "web"));
        assertThat(store.isInhibited(warning)).isFalse();

        firing.add(alert("severity", "critical", "service", "api"));
        assertThat(store.isInhibited(warning)).isTrue();
        assertThat(store.isSuppressed(warning, T0)).isTrue();
    }

    @Test
    void alertNeverInhibitsItself() {
        store.replaceInhibitRules(List.of(InhibitRule.builder()
                .sourceMatcher(LabelMatcher.equal("service", "api"))
                .targetMatcher(LabelMatcher.equal("service", "api"))
                .build()));
        AlertSnapshot api = alert("service", "api");
        firing.add(api);

        assertThat(store.isInhibited(api)).isFalse();
    }

    @Test
    void snapshotFetchesFiringAlertsOncePerCycle() {
        AtomicInteger fetches = new AtomicInteger();
        SilenceStore counting = new SilenceStore(() -> {
            fetches.incrementAndGet();
            return firing;
        }, Duration.ofHours(1), clock);
        counting.replaceInhibitRules(List.of(InhibitRule.builder()
                .sourceMatcher(LabelMatcher.equal("severity", "critical"))
                .targetMatcher(LabelMatcher.equal("severity", "warning"))
                .build()));
        firing.add(alert("severity", "critical", "service", "db"));

        Suppressor cycle = counting.snapshot();
        for (int i = 0; i < 10; i++) {
            assertThat(cycle.isSuppressed(alert("severity", "warning", "service", "s" + i), T0)).isTrue();
        }
        assertThat(cycle.isSuppressed(alert("severity", "info"), T0)).isFalse();

        assertThat(fetches.get()).isEqualTo(1);
    }

    @Test
    void snapshotSkipsFiringLookupWithoutInhibitRules() {
        AtomicInteger fetches = new AtomicInteger();
        SilenceStore counting = new SilenceStore(() -> {
            fetches.incrementAndGet();
            return firing;
        }, Duration.ofHours(1), clock);

        assertThat(counting.snapshot().isSuppressed(alert("service", "api"), T0)).isFalse();
        assertThat(fetches.get()).isZero();
    }
}
