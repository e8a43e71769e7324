package alertengine.evaluate;

import alertengine.rule.ComparisonOperator;
import alertengine.rule.Rule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EvaluationLoopTest {

    private static RuleRunner runner(String name) {
        Rule rule = Rule.builder()
                .name(name)
                .expr("up")
                .operator(ComparisonOperator.LT)
                .threshold(1)
                .interval(Duration.ofSeconds(30))
                .build();
        RuleRunner runner = mock(RuleRunner.class);
        when(runner.getRule()).thenReturn(rule);
        return runner;
    }

    @Test
    void rejectedRuleIsSkippedForThisTickAndOthersStillSubmitted() {
        List<Runnable> accepted = new ArrayList<>();
        int[] offers = {0};
        // 第一次提交被拒绝, 之后接受
        Executor firstRejects = command -> {
            if (offers[0]++ == 0) {
                throw new RejectedExecutionException("队列已满");
            }
            accepted.add(command);
        };
        EvaluationLoop loop = new EvaluationLoop(Duration.ofSeconds(30), firstRejects);
        RuleRunner first = runner("first");
        RuleRunner second = runner("second");
        loop.add(first);
        loop.add(second);

        loop.tick();

        assertThat(offers[0]).isEqualTo(2);
        assertThat(accepted).hasSize(1);
        verify(first, never()).execute();
        verify(second, never()).execute();
    }
}
