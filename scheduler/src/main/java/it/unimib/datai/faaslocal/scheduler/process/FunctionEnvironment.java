package it.unimib.datai.faaslocal.scheduler.process;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Environment that makes a local process believe it runs inside the hosted function runtime.
 */
public final class FunctionEnvironment {
    public static final String LOG_LEVEL = "RUST_LOG";
    public static final String FUNCTION_VERSION = "FUNCTION_VERSION";
    public static final String FUNCTION_MEMORY_SIZE = "FUNCTION_MEMORY_SIZE";
    public static final String RUNTIME_API = "RUNTIME_API";
    public static final String FUNCTION_NAME = "FUNCTION_NAME";

    static final String DEFAULT_VERSION = "1";
    static final String DEFAULT_MEMORY_SIZE = "4096";

    private FunctionEnvironment() {}

    /**
     * Later layers override earlier ones; {@link #RUNTIME_API} and {@link #FUNCTION_NAME} are
     * applied last and cannot be overridden by the metadata.
     *
     * @param logLevel    log filter inherited from the parent process, null when unset
     * @param metadataEnv overrides declared in the project metadata
     */
    public static Map<String, String> compose(String functionName,
                                              String runtimeApi,
                                              String logLevel,
                                              Map<String, String> metadataEnv) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put(LOG_LEVEL, logLevel == null ? "" : logLevel);
        env.put(FUNCTION_VERSION, DEFAULT_VERSION);
        env.put(FUNCTION_MEMORY_SIZE, DEFAULT_MEMORY_SIZE);
        if (metadataEnv != null) {
            env.putAll(metadataEnv);
        }
        env.put(RUNTIME_API, runtimeApi);
        env.put(FUNCTION_NAME, functionName);
        return env;
    }
}
