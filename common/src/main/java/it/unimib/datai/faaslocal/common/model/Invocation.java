package it.unimib.datai.faaslocal.common.model;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One pending call to a named function.
 *
 * The completion handle is single-use: the caller layer waits on it until the function process
 * posts a response (or the scheduler fails the invocation).
 */
public record Invocation(
        String functionName,
        String requestId,
        InvocationRequest request,
        CompletableFuture<InvocationResponse> completion
) {
    public Invocation {
        if (functionName == null || functionName.isBlank()) {
            throw new IllegalArgumentException("functionName is required");
        }
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId is required");
        }
        Objects.requireNonNull(completion, "completion");
    }

    public static Invocation create(String functionName, String requestId, InvocationRequest request) {
        return new Invocation(functionName, requestId, request, new CompletableFuture<>());
    }
}
