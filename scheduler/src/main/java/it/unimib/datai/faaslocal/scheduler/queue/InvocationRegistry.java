package it.unimib.datai.faaslocal.scheduler.queue;

import it.unimib.datai.faaslocal.common.model.Invocation;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Function name to pending invocations. A name is present while its process is running or about to start.
 */
public class InvocationRegistry {
    private final String serverAddress;
    private final Map<String, InvocationQueue> queues = new ConcurrentHashMap<>();
    private final Map<String, Meter.Id> gaugeIds = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public InvocationRegistry(String serverAddress, MeterRegistry meterRegistry) {
        this.serverAddress = trimTrailingSlash(serverAddress);
        this.meterRegistry = meterRegistry;
    }

    /**
     * Queues the invocation and reports whether its function needs a process.
     * Presence check and insertion run inside one {@code compute} call, so concurrent
     * submissions for an unseen name yield exactly one {@link FunctionStart}.
     *
     * @return the start signal when the function was absent, empty when its process is already running or starting
     */
    public Optional<FunctionStart> upsert(Invocation invocation) {
        String name = invocation.functionName();
        boolean[] created = new boolean[1];
        queues.compute(name, (key, existing) -> {
            InvocationQueue queue = existing;
            if (queue == null) {
                queue = new InvocationQueue(key);
                registerGauge(queue);
                created[0] = true;
            }
            queue.push(invocation);
            return queue;
        });
        if (!created[0]) {
            return Optional.empty();
        }
        return Optional.of(new FunctionStart(name, runtimeApiAddress(name)));
    }

    public Optional<Invocation> pop(String functionName) {
        InvocationQueue queue = queues.get(functionName);
        if (queue == null) {
            return Optional.empty();
        }
        return queue.pop();
    }

    /**
     * Forgets the function so the next invocation for it starts a fresh process.
     *
     * @return invocations that were still queued, oldest first
     */
    public List<Invocation> clean(String functionName) {
        InvocationQueue queue = queues.remove(functionName);
        Meter.Id gaugeId = gaugeIds.remove(functionName);
        if (gaugeId != null) {
            meterRegistry.remove(gaugeId);
        }
        return queue == null ? List.of() : queue.drain();
    }

    public boolean contains(String functionName) {
        return queues.containsKey(functionName);
    }

    public int queued(String functionName) {
        InvocationQueue queue = queues.get(functionName);
        return queue == null ? 0 : queue.size();
    }

    public String runtimeApiAddress(String functionName) {
        return serverAddress + "/" + functionName;
    }

    private void registerGauge(InvocationQueue queue) {
        Meter.Id id = Gauge.builder("faaslocal_function_queue_depth", queue, InvocationQueue::size)
                .tag("function", queue.functionName())
                .register(meterRegistry)
                .getId();
        gaugeIds.put(queue.functionName(), id);
    }

    private static String trimTrailingSlash(String address) {
        if (address == null) {
            throw new IllegalArgumentException("serverAddress is required");
        }
        return address.endsWith("/") ? address.substring(0, address.length() - 1) : address;
    }
}
