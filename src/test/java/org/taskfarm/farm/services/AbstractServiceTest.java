package org.taskfarm.farm.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.taskfarm.farm.api.services.IService;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
class AbstractServiceTest {

    private static final Config OPTIONS = ConfigFactory.parseString("shutdownTimeout = 1");

    private static class LoopingService extends AbstractService {
        final AtomicBoolean wasInterrupted = new AtomicBoolean(false);
        final CountDownLatch running = new CountDownLatch(1);

        LoopingService() {
            super("looping", OPTIONS);
        }

        @Override
        protected void run() throws InterruptedException {
            running.countDown();
            try {
                while (true) {
                    Thread.sleep(10);
                }
            } catch (InterruptedException e) {
                wasInterrupted.set(true);
                throw e;
            }
        }
    }

    private static class FailingService extends AbstractService {

        FailingService() {
            super("failing", OPTIONS);
        }

        @Override
        protected void run() {
            recordError("BROKEN", "Service broke", "on purpose");
            throw new IllegalStateException("boom");
        }

        @Override
        protected void addCustomMetrics(Map<String, Number> metrics) {
            super.addCustomMetrics(metrics);
            metrics.put("custom", 7);
        }
    }

    @Test
    void startsAndStopsOnInterrupt() throws InterruptedException {
        LoopingService service = new LoopingService();
        assertThat(service.getCurrentState()).isEqualTo(IService.State.STOPPED);

        service.start();
        assertThat(service.running.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(service.getCurrentState()).isEqualTo(IService.State.RUNNING);

        service.stop();

        assertThat(service.getCurrentState()).isEqualTo(IService.State.STOPPED);
        assertThat(service.wasInterrupted).isTrue();
        assertThat(service.isHealthy()).isTrue();
    }

    @Test
    void cannotStartTwiceOrStopWhenNotRunning() throws InterruptedException {
        LoopingService service = new LoopingService();
        assertThatThrownBy(service::stop).isInstanceOf(IllegalStateException.class);

        service.start();
        assertThatThrownBy(service::start).isInstanceOf(IllegalStateException.class);
        service.stop();
    }

    @Test
    void exceptionMovesServiceToError() {
        FailingService service = new FailingService();
        service.start();

        await().atMost(2, TimeUnit.SECONDS)
            .until(() -> service.getCurrentState() == IService.State.ERROR);
        assertThat(service.isHealthy()).isFalse();
        assertThat(service.getMetrics()).containsEntry("error_count", 1).containsEntry("custom", 7);

        service.clearErrors();
        assertThat(service.getErrors()).isEmpty();
        assertThat(service.isHealthy()).isFalse();
    }

    @Test
    void errorMovesServiceToError() throws InterruptedException {
        AbstractService service = new AbstractService("crashing", OPTIONS) {
            @Override
            protected void run() {
                throw new StackOverflowError("deep recursion");
            }
        };
        service.start();

        assertThat(service.awaitTermination(2, TimeUnit.SECONDS)).isTrue();
        assertThat(service.getCurrentState()).isEqualTo(IService.State.ERROR);
        assertThat(service.getServiceName()).isEqualTo("crashing");
    }

    @Test
    void awaitTerminationOfUnstartedServiceReturnsImmediately() throws InterruptedException {
        assertThat(new LoopingService().awaitTermination(10, TimeUnit.MILLISECONDS)).isTrue();
    }
}
