package alertengine.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertEngineConfigurationTest {

    private final AlertEngineConfiguration configuration = new AlertEngineConfiguration();
    private ExecutorService workers;

    @AfterEach
    void tearDown() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    @Test
    void saturatedWorkerPoolRejectsInsteadOfRunningOnCaller() throws InterruptedException {
        workers = configuration.engineWorkers(EngineConfig.of(Map.of("threadpool", Map.of(
                "core", Map.of("size", 1),
                "max", Map.of("size", 1),
                "queue", Map.of("capacity", 1)))));
        assertThat(((ThreadPoolExecutor) workers).getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);

        CountDownLatch release = new CountDownLatch(1);
        Runnable blocking = () -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        workers.execute(blocking);
        workers.execute(blocking);

        Thread caller = Thread.currentThread();
        Thread[] ranOn = new Thread[1];
        assertThatThrownBy(() -> workers.execute(() -> ranOn[0] = Thread.currentThread()))
                .isInstanceOf(RejectedExecutionException.class);
        assertThat(ranOn[0]).isNotSameAs(caller);
        release.countDown();
    }
}
