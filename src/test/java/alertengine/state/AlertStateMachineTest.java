package alertengine.state;

import alertengine.query.LabelSet;
import alertengine.rule.ComparisonOperator;
import alertengine.rule.Rule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AlertStateMachineTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final AlertStateMachine machine = new AlertStateMachine();
    private final Rule rule = Rule.builder()
            .name("api_latency")
            .expr("p99")
            .operator(ComparisonOperator.GT)
            .threshold(0.5)
            .forDuration(Duration.ofSeconds(60))
            .interval(Duration.ofSeconds(30))
            .groupByLabel("service")
            .build();
    private final LabelSet labels = rule.alertLabels(LabelSet.of("service", "api"));

    private List<AlertTransition> breach(int second, double value) {
        return machine.apply(rule, Map.of(labels, value), T0.plusSeconds(second));
    }

    private List<AlertTransition> clear(int second) {
        return machine.apply(rule, Collections.emptyMap(), T0.plusSeconds(second));
    }

    @Test
    void firesAfterForDurationAndResolvesOnce() {
        assertThat(breach(0, 0.8)).extracting(AlertTransition::getTo).containsExactly(AlertState.PENDING);
        assertThat(breach(30, 0.9)).isEmpty();

        List<AlertTransition> fired = breach(60, 0.7);
        assertThat(fired).singleElement().satisfies(t -> {
            assertThat(t.getFrom()).isEqualTo(AlertState.PENDING);
            assertThat(t.getTo()).isEqualTo(AlertState.FIRING);
            assertThat(t.getAlert().getActiveSince()).isEqualTo(T0);
            assertThat(t.getAlert().getFiredAt()).isEqualTo(T0.plusSeconds(60));
            assertThat(t.getAlert().getValue()).isEqualTo(0.7);
        });

        assertThat(breach(90, 0.6)).singleElement().satisfies(t -> assertThat(t.isRefresh()).isTrue());

        List<AlertTransition> resolved = clear(120);
        assertThat(resolved).singleElement().satisfies(t -> {
            assertThat(t.getTo()).isEqualTo(AlertState.RESOLVED);
            assertThat(t.getAlert().getResolvedAt()).isEqualTo(T0.plusSeconds(120));
        });

        assertThat(clear(150)).isEmpty();
        assertThat(machine.instanceCount()).isZero();
    }

    @Test
    void singleClearResetsPendingTimer() {
        breach(0, 0.8);
        assertThat(clear(30)).extracting(AlertTransition::getTo).containsExactly(AlertState.INACTIVE);
        assertThat(breach(60, 0.8)).extracting(AlertTransition::getTo).containsExactly(AlertState.PENDING);
        assertThat(breach(90, 0.8)).isEmpty();
        assertThat(breach(120, 0.8)).extracting(AlertTransition::getTo).containsExactly(AlertState.FIRING);
    }

    @Test
    void zeroForFiresOnFirstBreach() {
        Rule immediate = rule.toBuilder().forDuration(Duration.ZERO).build();

        List<AlertTransition> transitions = machine.apply(immediate, Map.of(labels, 1.0), T0);

        assertThat(transitions).extracting(AlertTransition::getTo)
                .containsExactly(AlertState.PENDING, AlertState.FIRING);
    }

    @Test
    void repeatedEvaluationKeepsOneInstancePerLabelSet() {
        LabelSet other = rule.alertLabels(LabelSet.of("service", "web"));
        for (int i = 0; i < 5; i++) {
            machine.apply(rule, Map.of(labels, 1.0, other, 2.0), T0.plusSeconds(30L * i));
        }

        assertThat(machine.instanceCount()).isEqualTo(2);
        assertThat(machine.snapshot(rule.getName())).extracting(AlertSnapshot::getState)
                .containsOnly(AlertState.FIRING);
        assertThat(machine.firingAlerts()).hasSize(2);
    }

    @Test
    void snapshotCarriesRuleMetadata() {
        breach(0, 0.8);

        AlertSnapshot snapshot = machine.snapshot().get(0);
        assertThat(snapshot.getKey()).isEqualTo(AlertStateMachine.instanceKey(rule.getName(), labels));
        assertThat(snapshot.getGroupLabels()).isEqualTo(LabelSet.of("service", "api"));
        assertThat(snapshot.getSeverity()).isEqualTo(rule.getSeverity());
    }

    @Test
    void discardEmitsFinalResolutionForFiringOnly() {
        LabelSet pendingLabels = rule.alertLabels(LabelSet.of("service", "web"));
        breach(0, 0.8);
        breach(60, 0.8);
        machine.apply(rule, Map.of(labels, 0.8, pendingLabels, 0.9), T0.plusSeconds(90));

        List<AlertTransition> finals = machine.discardRule(rule.getName(), T0.plusSeconds(100));

        assertThat(finals).singleElement().satisfies(t -> {
            assertThat(t.getAlert().getLabels()).isEqualTo(labels);
            assertThat(t.getTo()).isEqualTo(AlertState.RESOLVED);
        });
        assertThat(machine.instanceCount()).isZero();
        assertThat(machine.discardRule(rule.getName(), T0.plusSeconds(110))).isEmpty();
    }

    @Test
    void lateEvaluationOfDiscardedRuleIsDroppedUntilRegisteredAgain() {
        breach(0, 0.8);
        breach(60, 0.8);
        machine.discardRule(rule.getName(), T0.plusSeconds(70));

        // 下线前已经发出的查询此时才返回
        assertThat(breach(75, 0.9)).isEmpty();
        assertThat(machine.instanceCount()).isZero();

        machine.register(rule);
        assertThat(breach(90, 0.9)).extracting(AlertTransition::getTo).containsExactly(AlertState.PENDING);
        assertThat(machine.instanceCount()).isEqualTo(1);
    }

    @Test
    void publisherSeesTransitionsBeforeDiscardRuns() {
        List<AlertTransition> published = new ArrayList<>();
        breach(0, 0.8);
        machine.apply(rule, Map.of(labels, 0.8), T0.plusSeconds(60), published::addAll);
        machine.discardRule(rule.getName(), T0.plusSeconds(70), published::addAll);

        assertThat(published).extracting(AlertTransition::getTo)
                .containsExactly(AlertState.FIRING, AlertState.RESOLVED);
    }

    @Test
    void inconsistentInstanceIsDroppedAndOthersContinue() {
        LabelSet healthy = rule.alertLabels(LabelSet.of("service", "web"));
        machine.apply(rule, Map.of(labels, 0.8, healthy, 0.8), T0);
        // Pending 实例没有 firedAt, 强制改成 Firing 后时间戳不一致
        machine.overrideState(rule.getName(), labels, AlertState.FIRING);

        List<AlertTransition> transitions = machine.apply(rule, Map.of(labels, 0.8, healthy, 0.8), T0.plusSeconds(60));

        assertThat(transitions).singleElement().satisfies(t -> {
            assertThat(t.getAlert().getLabels()).isEqualTo(healthy);
            assertThat(t.getTo()).isEqualTo(AlertState.FIRING);
        });
        assertThat(machine.snapshot(rule.getName())).extracting(AlertSnapshot::getLabels).containsExactly(healthy);

        assertThat(machine.apply(rule, Map.of(labels, 0.8, healthy, 0.8), T0.plusSeconds(90)))
                .extracting(AlertTransition::getTo)
                .contains(AlertState.PENDING);
    }
}
