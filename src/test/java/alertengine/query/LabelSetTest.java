package alertengine.query;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LabelSetTest {

    @Test
    void keyIsIndependentOfInsertionOrder() {
        Map<String, String> first = new LinkedHashMap<>();
        first.put("b", "2");
        first.put("a", "1");
        Map<String, String> second = new LinkedHashMap<>();
        second.put("a", "1");
        second.put("b", "2");

        LabelSet left = LabelSet.of(first);
        LabelSet right = LabelSet.of(second);
        assertThat(left.key()).isEqualTo("{a=\"1\", b=\"2\"}");
        assertThat(left).isEqualTo(right).hasSameHashCodeAs(right);
        assertThat(left.fingerprint()).isEqualTo(right.fingerprint());
    }

    @Test
    void quotesAreEscapedInKey() {
        assertThat(LabelSet.of("path", "a\"b").key()).isEqualTo("{path=\"a\\\"b\"}");
    }

    @Test
    void projectIgnoresMissingLabels() {
        LabelSet labels = LabelSet.of("service", "api", "instance", "h1");
        assertThat(labels.project(List.of("service", "zone"))).isEqualTo(LabelSet.of("service", "api"));
        assertThat(labels.project(List.of())).isSameAs(LabelSet.EMPTY);
    }

    @Test
    void mergeOverridesExistingValues() {
        LabelSet merged = LabelSet.of("severity", "info", "host", "h1").merge(Map.of("severity", "critical"));
        assertThat(merged.get("severity")).isEqualTo("critical");
        assertThat(merged.get("host")).isEqualTo("h1");
    }
}
