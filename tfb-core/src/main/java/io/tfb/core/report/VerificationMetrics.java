package io.tfb.core.report;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.tfb.api.verification.Verification;
import io.tfb.api.verification.VerificationStatus;

/**
 * Counts reported verification outcomes per framework and status.
 */
public class VerificationMetrics {

    static final String METER_NAME = "tfb.verifications";

    private final MeterRegistry registry;

    public VerificationMetrics() {
        this(new SimpleMeterRegistry());
    }

    public VerificationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void record(Verification verification) {
        counter(verification.frameworkName(), verification.status()).increment();
    }

    public long count(String frameworkName, VerificationStatus status) {
        Counter counter = registry.find(METER_NAME)
                .tag("framework", frameworkName)
                .tag("status", status.name())
                .counter();
        return counter == null ? 0 : (long) counter.count();
    }

    /**
     * @return outcomes with the given status across all frameworks
     */
    public long count(VerificationStatus status) {
        return (long) registry.find(METER_NAME)
                .tag("status", status.name())
                .counters()
                .stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Counter counter(String frameworkName, VerificationStatus status) {
        return Counter.builder(METER_NAME)
                .description("Verification outcomes included in a summary")
                .tag("framework", frameworkName)
                .tag("status", status.name())
                .register(registry);
    }
}
