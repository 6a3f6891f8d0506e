package it.unimib.datai.faaslocal.scheduler.queue;

/**
 * Signal produced by {@link InvocationRegistry#upsert} when a function has no process yet.
 *
 * @param functionName function whose process must be started
 * @param runtimeApi   runtime API address the process polls, unique to the function
 */
public record FunctionStart(String functionName, String runtimeApi) {
}
