package it.unimib.datai.faaslocal.scheduler.api;

import it.unimib.datai.faaslocal.common.model.ErrorInfo;
import it.unimib.datai.faaslocal.common.model.Invocation;
import it.unimib.datai.faaslocal.common.model.InvocationRequest;
import it.unimib.datai.faaslocal.common.model.InvocationResponse;
import it.unimib.datai.faaslocal.scheduler.LocalScheduler;
import it.unimib.datai.faaslocal.scheduler.queue.InvocationRegistry;
import it.unimib.datai.faaslocal.scheduler.response.ResponseRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry points used by the HTTP layer: callers submit invocations, function processes fetch the next
 * invocation and post back its response.
 */
public class RuntimeApi {
    private static final Logger log = LoggerFactory.getLogger(RuntimeApi.class);

    static final int FUNCTION_ERROR_STATUS = 500;
    static final int REJECTED_STATUS = 503;

    private final LocalScheduler scheduler;
    private final InvocationRegistry invocations;
    private final ResponseRegistry responses;

    public RuntimeApi(LocalScheduler scheduler, InvocationRegistry invocations, ResponseRegistry responses) {
        this.scheduler = scheduler;
        this.invocations = invocations;
        this.responses = responses;
    }

    /**
     * @return false when the scheduler did not accept the invocation
     */
    public boolean submit(Invocation invocation) {
        return scheduler.submit(invocation);
    }

    /**
     * Submits a new invocation and returns the handle completed with its response.
     * A rejected submission completes the handle right away with a 503 response.
     */
    public CompletableFuture<InvocationResponse> invoke(String functionName, String requestId, InvocationRequest request) {
        Invocation invocation = Invocation.create(functionName, requestId, request);
        if (!scheduler.submit(invocation)) {
            invocation.completion().complete(InvocationResponse.error(
                    REJECTED_STATUS, "SCHEDULER_STOPPED", "Scheduler is not accepting invocations"));
        }
        return invocation.completion();
    }

    /**
     * Next pending invocation for the function, oldest first. From here on the caller's handle is
     * tracked by request id until {@link #resolve} or {@link #fail}.
     */
    public Optional<Invocation> next(String functionName) {
        Optional<Invocation> next = invocations.pop(functionName);
        next.ifPresent(invocation -> responses.push(invocation.requestId(), invocation.completion()));
        return next;
    }

    /**
     * Delivers the response to the caller waiting on the request id.
     *
     * @return false when nobody waits for that id; nothing happens in that case
     */
    public boolean resolve(String requestId, InvocationResponse response) {
        boolean delivered = responses.resolve(requestId, response);
        if (!delivered) {
            log.debug("No pending invocation with request id {}", requestId);
        }
        return delivered;
    }

    /**
     * Reports an error raised by the function while handling the request.
     */
    public boolean fail(String requestId, ErrorInfo error) {
        return resolve(requestId,
                new InvocationResponse(FUNCTION_ERROR_STATUS, Map.of(), null, error));
    }

    public String runtimeApiAddress(String functionName) {
        return invocations.runtimeApiAddress(functionName);
    }
}
