package io.energytoken.core.metrics;

import io.energytoken.core.error.ErrorCode;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public final class LedgerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter mints = registry.counter("ledger.mints");
    private static final Counter burns = registry.counter("ledger.burns");
    private static final Counter transfers = registry.counter("ledger.transfers");
    private static final DistributionSummary mintedNet = DistributionSummary.builder("ledger.mint.net")
            .baseUnit("tokens")
            .description("Net tokens issued per mint")
            .register(registry);
    private static final DistributionSummary mintFees = DistributionSummary.builder("ledger.mint.fee")
            .baseUnit("tokens")
            .description("Issuance fee skimmed per mint")
            .register(registry);

    private LedgerMetrics() {}

    public static void recordMint(long net, long fee) {
        mints.increment();
        mintedNet.record(net);
        mintFees.record(fee);
    }

    public static void recordBurn() {
        burns.increment();
    }

    public static void recordTransfer() {
        transfers.increment();
    }

    public static void recordRejection(String operation, ErrorCode code) {
        Counter.builder("ledger.rejections")
                .description("Operations refused by validation")
                .tag("operation", operation)
                .tag("code", code.name())
                .register(registry)
                .increment();
    }

    public static Timer.Sample startRequest() {
        return Timer.start(registry);
    }

    /** Request timer tagged by method, context path and response status. */
    public static void recordRequest(Timer.Sample sample, String method, String path, int status) {
        sample.stop(Timer.builder("http.server.requests")
                .description("API request duration")
                .tags("method", method, "path", path, "status", Integer.toString(status))
                .register(registry));
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                for (Tag t : m.getId().getTags()) {
                    sb.append(',').append(t.getKey()).append('=').append(t.getValue());
                }
                sb.append("} ").append(meas.getValue()).append("\n");
            }
        }
        return sb.toString();
    }
}
