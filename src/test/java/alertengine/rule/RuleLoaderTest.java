package alertengine.rule;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleLoaderTest {

    @TempDir
    Path dir;

    private RuleLoader loader;
    private final RecordingListener listener = new RecordingListener();

    @BeforeEach
    void setUp() {
        loader = new RuleLoader(dir, Duration.ofSeconds(30), null,
                Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
        loader.addChangeListener(listener);
    }

    private void write(String file, String content) throws IOException {
        Files.write(dir.resolve(file), content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void loadsSingleRuleFile() throws IOException {
        write("latency.yml", String.join("\n",
                "name: api_latency",
                "expr: histogram_quantile(0.99, rate(app_request_latency_seconds_bucket[5m]))",
                "op: '>'",
                "threshold: 0.5",
                "for: 1m",
                "severity: critical",
                "group_by: service",
                "labels:",
                "  team: api",
                "annotations:",
                "  summary: '{service} 延迟过高'"));

        RuleSet ruleSet = loader.load();

        assertThat(ruleSet.getVersion()).isEqualTo(1);
        Rule rule = ruleSet.get("api_latency");
        assertThat(rule.getOperator()).isEqualTo(ComparisonOperator.GT);
        assertThat(rule.getThreshold()).isEqualTo(0.5);
        assertThat(rule.getForDuration()).isEqualTo(Duration.ofMinutes(1));
        assertThat(rule.getInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(rule.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(rule.getGroupBy()).containsExactly("service");
        assertThat(rule.getLabels()).containsEntry("team", "api");
        assertThat(listener.added).containsExactly("api_latency");
    }

    @Test
    void invalidRuleIsRejectedWithoutAffectingOthers() throws IOException {
        write("rules.yaml", String.join("\n",
                "rules:",
                "  - name: good",
                "    expr: up",
                "    op: '<'",
                "    threshold: 1",
                "  - name: no_threshold",
                "    expr: up",
                "    op: '<'",
                "  - name: bad_op",
                "    expr: up",
                "    op: '<>'",
                "    threshold: 1"));

        RuleSet ruleSet = loader.load();

        assertThat(ruleSet.getRules()).containsOnlyKeys("good");
        assertThat(ruleSet.getRejections()).extracting(RuleRejection::getRuleName)
                .containsExactly("no_threshold", "bad_op");
        assertThat(ruleSet.getRejections()).extracting(RuleRejection::getIndex).containsExactly(1, 2);
        assertThat(listener.errors).hasSize(2);
    }

    @Test
    void unparsableFileIsRejectedAsWhole() throws IOException {
        write("broken.yml", "name: [unclosed");
        write("ok.yml", "name: ok\nexpr: up\nop: '>'\nthreshold: 0");

        RuleSet ruleSet = loader.load();

        assertThat(ruleSet.getRules()).containsOnlyKeys("ok");
        assertThat(ruleSet.getRejections()).singleElement()
                .satisfies(rejection -> assertThat(rejection.getIndex()).isEqualTo(-1));
    }

    @Test
    void duplicateNameKeepsFirstDefinition() throws IOException {
        write("a.yml", "name: dup\nexpr: first\nop: '>'\nthreshold: 1");
        write("b.yml", "name: dup\nexpr: second\nop: '>'\nthreshold: 1");

        RuleSet ruleSet = loader.load();

        assertThat(ruleSet.get("dup").getExpr()).isEqualTo("first");
        assertThat(ruleSet.getRejections()).hasSize(1);
    }

    @Test
    void unchangedContentKeepsVersion() throws IOException {
        write("r.yml", "name: r\nexpr: up\nop: '>'\nthreshold: 1");

        RuleSet first = loader.load();
        RuleSet second = loader.load();

        assertThat(second).isSameAs(first);
        assertThat(listener.added).containsExactly("r");
        assertThat(listener.updated).isEmpty();
    }

    @Test
    void reloadReportsUpdatesAndDeletes() throws IOException {
        write("a.yml", "name: a\nexpr: up\nop: '>'\nthreshold: 1");
        write("b.yml", "name: b\nexpr: up\nop: '>'\nthreshold: 1");
        loader.load();

        write("a.yml", "name: a\nexpr: up\nop: '>'\nthreshold: 2");
        Files.delete(dir.resolve("b.yml"));
        RuleSet next = loader.load();

        assertThat(next.getVersion()).isEqualTo(2);
        assertThat(next.get("a").getThreshold()).isEqualTo(2.0);
        assertThat(listener.updated).containsExactly("a");
        assertThat(listener.deleted).containsExactly("b");
    }

    @Test
    void blankFilesAndOtherExtensionsAreIgnored() throws IOException {
        write("empty.yml", "   \n");
        write("notes.txt", "name: x");

        RuleSet ruleSet = loader.load();

        assertThat(ruleSet.size()).isZero();
        assertThat(ruleSet.getRejections()).isEmpty();
    }

    @Test
    void missingDirectoryFails() {
        RuleLoader missing = new RuleLoader(dir.resolve("nope"), Duration.ofSeconds(30), null, Clock.systemUTC());
        assertThatThrownBy(missing::load).isInstanceOf(RuleConfigException.class);
    }

    private static class RecordingListener implements RuleChangeListener {
        private final List<String> added = new ArrayList<>();
        private final List<String> updated = new ArrayList<>();
        private final List<String> deleted = new ArrayList<>();
        private final List<RuleRejection> errors = new ArrayList<>();

        @Override
        public void onRuleAdded(Rule rule) {
            added.add(rule.getName());
        }

        @Override
        public void onRuleUpdated(Rule previous, Rule rule) {
            updated.add(rule.getName());
        }

        @Override
        public void onRuleDeleted(Rule rule) {
            deleted.add(rule.getName());
        }

        @Override
        public void onRuleLoadError(RuleRejection rejection) {
            errors.add(rejection);
        }
    }
}
