package it.unimib.datai.faaslocal.scheduler.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class SchedulerMetrics {
    private final MeterRegistry registry;
    private final Map<String, Counter> submitCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> startCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> exitCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> spawnFailureCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> abandonedCounters = new ConcurrentHashMap<>();

    public SchedulerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void submitted(String function) {
        counter(submitCounters, "faaslocal_invocations_submitted_total", function).increment();
    }

    public void started(String function) {
        counter(startCounters, "faaslocal_function_starts_total", function).increment();
    }

    public void exited(String function) {
        counter(exitCounters, "faaslocal_function_exits_total", function).increment();
    }

    public void spawnFailed(String function) {
        counter(spawnFailureCounters, "faaslocal_function_spawn_failures_total", function).increment();
    }

    public void abandoned(String function, int count) {
        counter(abandonedCounters, "faaslocal_invocations_abandoned_total", function).increment(count);
    }

    private Counter counter(Map<String, Counter> map, String name, String function) {
        return map.computeIfAbsent(function, key -> Counter.builder(name)
                .tag("function", function)
                .register(registry));
    }
}
