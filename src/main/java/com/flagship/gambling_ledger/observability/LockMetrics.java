package com.flagship.gambling_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for the distributed lock.
 *
 * - lock.acquired / lock.contended / lock.timeout counters
 * - lock.wait.duration: time from first attempt to grant or give-up
 * - lock.held.duration: time between grant and release
 */
@Component
public class LockMetrics {

    private final MeterRegistry registry;

    private final Counter acquired;
    private final Counter contended;
    private final Counter timeouts;
    private final Timer heldTimer;

    public LockMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.acquired = Counter.builder("lock.acquired")
                .description("Number of locks granted")
                .register(registry);

        this.contended = Counter.builder("lock.contended")
                .description("Number of acquisition attempts that found the resource held")
                .register(registry);

        this.timeouts = Counter.builder("lock.timeout")
                .description("Number of acquisitions that gave up after all retries")
                .register(registry);

        this.heldTimer = Timer.builder("lock.held.duration")
                .description("Time a lock was held before release")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public Timer.Sample startWait() {
        return Timer.start(registry);
    }

    public void recordAcquired(Timer.Sample waitSample) {
        acquired.increment();
        waitSample.stop(registry.timer("lock.wait.duration", "result", "acquired"));
    }

    public void recordContention() {
        contended.increment();
    }

    public void recordTimeout(Timer.Sample waitSample) {
        timeouts.increment();
        waitSample.stop(registry.timer("lock.wait.duration", "result", "timeout"));
    }

    public void recordHeld(Duration duration) {
        heldTimer.record(duration);
    }
}
