package com.example.signage.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the scheduling engine, the event bus and live delivery.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    @Bean
    public MeterBinder signageMetrics() {
        return registry -> {
            registry.counter("signage.jobs.fired", "status", "success");
            registry.counter("signage.jobs.fired", "status", "failed");

            registry.counter("signage.sse.sends", "status", "success");
            registry.counter("signage.sse.sends", "status", "failed");

            Timer.builder("signage.resolver.latency")
                    .description("Time taken to resolve the active schedule for a display")
                    .register(registry);
        };
    }

    @Bean
    public SignageMetricsCollector signageMetricsCollector(MeterRegistry registry) {
        return new SignageMetricsCollector(registry);
    }

    /**
     * Lazily registers and caches meters by name and tags.
     */
    public static class SignageMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

        public SignageMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment();
        }

        public void recordTimer(String name, long duration, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k ->
                Timer.builder(name).tags(tags).register(registry))
                  .record(duration, TimeUnit.MILLISECONDS);
        }

        public void setGauge(String name, double value, String... tags) {
            String key = name + "_" + String.join("_", tags);
            AtomicLong gauge = gauges.computeIfAbsent(key, k -> {
                AtomicLong newGauge = new AtomicLong();
                registry.gauge(name, Tags.of(tags), newGauge);
                return newGauge;
            });
            gauge.set((long) value);
        }

        public long getCounterValue(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            Counter counter = counters.get(key);
            return counter != null ? (long) counter.count() : 0;
        }
    }
}
