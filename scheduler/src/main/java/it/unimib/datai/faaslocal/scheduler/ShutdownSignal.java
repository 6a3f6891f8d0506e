package it.unimib.datai.faaslocal.scheduler;

import java.util.concurrent.CompletableFuture;

/**
 * Broadcast cancellation shared by the scheduler loop and every function supervisor.
 * Each task either polls {@link #isTriggered()} or races its own work against {@link #whenTriggered()}.
 */
public class ShutdownSignal {
    private final CompletableFuture<Void> triggered = new CompletableFuture<>();

    /**
     * @return true for the call that actually fired the signal
     */
    public boolean trigger() {
        return triggered.complete(null);
    }

    public boolean isTriggered() {
        return triggered.isDone();
    }

    /**
     * A future completed once the signal fires. Completing the returned copy does not fire the signal.
     */
    public CompletableFuture<Void> whenTriggered() {
        return triggered.copy();
    }

    public void onShutdown(Runnable action) {
        triggered.thenRun(action);
    }
}
