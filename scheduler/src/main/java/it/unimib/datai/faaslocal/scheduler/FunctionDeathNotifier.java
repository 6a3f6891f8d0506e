package it.unimib.datai.faaslocal.scheduler;

/**
 * Channel through which a supervisor reports that its process exited on its own.
 */
@FunctionalInterface
public interface FunctionDeathNotifier {
    /**
     * @return false when nobody listens anymore (the scheduler loop has stopped)
     */
    boolean notifyDeath(String functionName);
}
