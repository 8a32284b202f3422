package com.skyfare.fareservice.client;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

@Component
public class AmadeusClientMetrics {

    private final Counter requests;
    private final Counter errors;
    private final Counter rateLimited;
    private final Counter retriesExhausted;
    private final Timer latency;
    private final DistributionSummary retryAfter;

    public AmadeusClientMetrics(MeterRegistry registry) {
        this.requests = Counter.builder("amadeus.requests")
                .description("Amadeus API calls, retries included")
                .tag("client", "amadeus")
                .register(registry);

        this.errors = Counter.builder("amadeus.errors")
                .description("Amadeus API calls ending in a non-success outcome")
                .tag("client", "amadeus")
                .register(registry);

        this.rateLimited = Counter.builder("amadeus.rate_limited")
                .description("HTTP 429 responses from the Amadeus API")
                .tag("client", "amadeus")
                .register(registry);

        this.retriesExhausted = Counter.builder("amadeus.retries_exhausted")
                .description("Calls abandoned after the rate-limit retry ceiling")
                .tag("client", "amadeus")
                .register(registry);

        this.latency = Timer.builder("amadeus.latency")
                .description("Amadeus API latency per attempt")
                .tag("client", "amadeus")
                .register(registry);

        this.retryAfter = DistributionSummary.builder("amadeus.retry_after")
                .description("Retry-After hints sent with HTTP 429 responses")
                .baseUnit("seconds")
                .tag("client", "amadeus")
                .register(registry);
    }

    public void onRequest() { requests.increment(); }
    public void onError() { errors.increment(); }
    public void onRetriesExhausted() { retriesExhausted.increment(); }

    /**
     * Counts the 429 and records its Retry-After hint when one was sent.
     */
    public void onRateLimited(Duration retryAfterHint) {
        rateLimited.increment();
        if (retryAfterHint != null) {
            retryAfter.record(retryAfterHint.getSeconds());
        }
    }

    public <T> T recordLatency(Supplier<T> supplier) {
        return latency.record(supplier);
    }
}
