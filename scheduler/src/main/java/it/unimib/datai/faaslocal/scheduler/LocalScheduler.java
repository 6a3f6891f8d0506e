package it.unimib.datai.faaslocal.scheduler;

import it.unimib.datai.faaslocal.common.model.Invocation;
import it.unimib.datai.faaslocal.common.model.InvocationResponse;
import it.unimib.datai.faaslocal.scheduler.process.FunctionSpawnException;
import it.unimib.datai.faaslocal.scheduler.process.FunctionSupervisor;
import it.unimib.datai.faaslocal.scheduler.process.FunctionSupervisorFactory;
import it.unimib.datai.faaslocal.scheduler.queue.FunctionStart;
import it.unimib.datai.faaslocal.scheduler.queue.InvocationRegistry;
import it.unimib.datai.faaslocal.scheduler.service.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumes invocation submissions and function death notifications on a single thread.
 *
 * A submission for a function without a process starts a {@link FunctionSupervisor} on the supervisor
 * pool; the loop never waits for it. A death notification forgets the function so that its next
 * invocation starts a fresh process.
 */
public class LocalScheduler implements SmartLifecycle, FunctionDeathNotifier {
    private static final Logger log = LoggerFactory.getLogger(LocalScheduler.class);

    static final int EXIT_STATUS = 502;
    static final String FUNCTION_EXITED = "FUNCTION_EXITED";
    static final String FUNCTION_SPAWN_FAILED = "FUNCTION_SPAWN_FAILED";

    private final InvocationRegistry registry;
    private final FunctionSupervisorFactory supervisorFactory;
    private final ShutdownSignal shutdown;
    private final SchedulerMetrics metrics;
    private final long shutdownGraceMs;
    private final BlockingQueue<SchedulerEvent> events = new LinkedBlockingQueue<>();
    private final ExecutorService loopExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "faaslocal-scheduler");
        t.setDaemon(false);
        return t;
    });
    private final AtomicInteger supervisorThreads = new AtomicInteger();
    private final ExecutorService supervisorExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "faaslocal-function-" + supervisorThreads.incrementAndGet());
        t.setDaemon(true);
        return t;
    });
    private final AtomicBoolean running = new AtomicBoolean(false);

    public LocalScheduler(InvocationRegistry registry,
                          FunctionSupervisorFactory supervisorFactory,
                          ShutdownSignal shutdown,
                          SchedulerMetrics metrics,
                          long shutdownGraceMs) {
        this.registry = registry;
        this.supervisorFactory = supervisorFactory;
        this.shutdown = shutdown;
        this.metrics = metrics;
        this.shutdownGraceMs = shutdownGraceMs;
    }

    /**
     * Hands the invocation to the loop without waiting for its function to start.
     *
     * @return false when the scheduler is not running and the invocation was not accepted
     */
    public boolean submit(Invocation invocation) {
        if (!running.get() || shutdown.isTriggered()) {
            log.warn("Scheduler not running, rejecting invocation {} for function {}",
                    invocation.requestId(), invocation.functionName());
            return false;
        }
        events.offer(SchedulerEvent.submitted(invocation));
        metrics.submitted(invocation.functionName());
        return true;
    }

    @Override
    public boolean notifyDeath(String functionName) {
        if (!running.get()) {
            return false;
        }
        return events.offer(SchedulerEvent.died(functionName, null));
    }

    @Override
    public void start() {
        if (loopExecutor.isShutdown()) {
            log.warn("Scheduler already shut down, it cannot be started again");
            return;
        }
        if (running.compareAndSet(false, true)) {
            log.info("Scheduler starting");
            shutdown.onShutdown(() -> events.offer(SchedulerEvent.shutdownRequested()));
            loopExecutor.submit(this::loop);
        }
    }

    @Override
    public void stop() {
        log.info("Scheduler stopping...");
        running.set(false);
        shutdown.trigger();
        loopExecutor.shutdown();
        supervisorExecutor.shutdown();
        try {
            if (!loopExecutor.awaitTermination(shutdownGraceMs, TimeUnit.MILLISECONDS)) {
                log.warn("Scheduler did not terminate in time, forcing shutdown");
                loopExecutor.shutdownNow();
            }
            if (!supervisorExecutor.awaitTermination(shutdownGraceMs, TimeUnit.MILLISECONDS)) {
                log.warn("Function supervisors did not terminate in time, forcing shutdown");
                supervisorExecutor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            log.warn("Scheduler shutdown interrupted");
            loopExecutor.shutdownNow();
            supervisorExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    boolean isTerminated() {
        return loopExecutor.isTerminated() && supervisorExecutor.isTerminated();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    private void loop() {
        log.info("Scheduler loop started");
        while (running.get()) {
            try {
                SchedulerEvent event = events.take();
                switch (event.kind()) {
                    case SUBMITTED -> registry.upsert(event.invocation()).ifPresent(this::startFunction);
                    case DIED -> forget(event.functionName(), event.failure());
                    case SHUTDOWN -> {
                        log.info("Terminating scheduler");
                        running.set(false);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Error in scheduler loop", e);
            }
        }
        // Running supervisors finish on the shutdown signal; no new ones are accepted.
        loopExecutor.shutdown();
        supervisorExecutor.shutdown();
        log.info("Scheduler loop exited");
    }

    private void startFunction(FunctionStart start) {
        FunctionSupervisor supervisor = supervisorFactory.create(start, this);
        try {
            CompletableFuture.runAsync(supervisor, supervisorExecutor)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            supervisorFailed(start.functionName(), unwrap(error));
                        }
                    });
        } catch (RejectedExecutionException e) {
            supervisorFailed(start.functionName(), e);
        }
    }

    private void supervisorFailed(String functionName, Throwable cause) {
        if (cause instanceof FunctionSpawnException) {
            log.error("Failed to start function {}: {}", functionName, cause.getMessage(), cause);
        } else {
            log.error("Supervisor for function {} failed", functionName, cause);
        }
        // A failed supervisor clears the entry the same way a process exit does.
        events.offer(SchedulerEvent.died(functionName, cause));
    }

    private void forget(String functionName, Throwable failure) {
        List<Invocation> abandoned = registry.clean(functionName);
        if (abandoned.isEmpty()) {
            return;
        }
        log.warn("Failing {} queued invocations for function {}", abandoned.size(), functionName);
        metrics.abandoned(functionName, abandoned.size());
        InvocationResponse response = failure == null
                ? InvocationResponse.error(EXIT_STATUS, FUNCTION_EXITED,
                        "Function " + functionName + " exited before handling the invocation")
                : InvocationResponse.error(EXIT_STATUS, FUNCTION_SPAWN_FAILED, failure.getMessage());
        abandoned.forEach(invocation -> invocation.completion().complete(response));
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private record SchedulerEvent(Kind kind, Invocation invocation, String functionName, Throwable failure) {
        enum Kind { SUBMITTED, DIED, SHUTDOWN }

        static SchedulerEvent submitted(Invocation invocation) {
            return new SchedulerEvent(Kind.SUBMITTED, invocation, invocation.functionName(), null);
        }

        static SchedulerEvent died(String functionName, Throwable failure) {
            return new SchedulerEvent(Kind.DIED, null, functionName, failure);
        }

        static SchedulerEvent shutdownRequested() {
            return new SchedulerEvent(Kind.SHUTDOWN, null, null, null);
        }
    }
}
