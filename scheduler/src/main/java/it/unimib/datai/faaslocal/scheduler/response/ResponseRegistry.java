package it.unimib.datai.faaslocal.scheduler.response;

import it.unimib.datai.faaslocal.common.model.InvocationResponse;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Request id to the completion handle of the caller still waiting for that invocation.
 * Entries are single use: {@link #pop} retrieves and deletes in one step.
 */
public class ResponseRegistry {
    private final Map<String, CompletableFuture<InvocationResponse>> pending = new ConcurrentHashMap<>();

    /**
     * Stores the handle, replacing any previous one for the same id.
     */
    public void push(String requestId, CompletableFuture<InvocationResponse> completion) {
        pending.put(requestId, completion);
    }

    public Optional<CompletableFuture<InvocationResponse>> pop(String requestId) {
        return Optional.ofNullable(pending.remove(requestId));
    }

    /**
     * Hands the response to whoever waits on the id.
     *
     * @return false when no caller is waiting for that id (already resolved or never registered)
     */
    public boolean resolve(String requestId, InvocationResponse response) {
        return pop(requestId)
                .map(completion -> completion.complete(response))
                .orElse(false);
    }

    public int size() {
        return pending.size();
    }
}
