package alertengine.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DurationUtilsTest {

    @Test
    void parsesCompoundStrings() {
        assertThat(DurationUtils.parse("30s")).isEqualTo(Duration.ofSeconds(30));
        assertThat(DurationUtils.parse("1m30s")).isEqualTo(Duration.ofSeconds(90));
        assertThat(DurationUtils.parse("500ms")).isEqualTo(Duration.ofMillis(500));
        assertThat(DurationUtils.parse("2h")).isEqualTo(Duration.ofHours(2));
        assertThat(DurationUtils.parse("1d")).isEqualTo(Duration.ofDays(1));
    }

    @Test
    void plainNumbersAreSeconds() {
        assertThat(DurationUtils.parse(45)).isEqualTo(Duration.ofSeconds(45));
        assertThat(DurationUtils.parse("45")).isEqualTo(Duration.ofSeconds(45));
    }

    @Test
    void parsesMapForm() {
        assertThat(DurationUtils.parse(Map.of("minutes", 5, "seconds", 10)))
                .isEqualTo(Duration.ofSeconds(310));
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> DurationUtils.parse("5 minutes")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DurationUtils.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DurationUtils.parse(Map.of("weeks", 1))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formatsCompactly() {
        assertThat(DurationUtils.format(Duration.ofSeconds(3723))).isEqualTo("1h2m3s");
        assertThat(DurationUtils.format(Duration.ZERO)).isEqualTo("0s");
        assertThat(DurationUtils.format(Duration.ofMillis(1500))).isEqualTo("1s500ms");
    }
}
