package it.unimib.datai.faaslocal.scheduler.metadata;

import java.nio.file.Path;
import java.util.Map;

/**
 * Reads the environment a project declares for its functions.
 */
public interface FunctionMetadataReader {

    /**
     * @param manifestPath project manifest
     * @param binName      binary selected for the function, or null for the package default
     * @return environment overrides for the function process, never null
     * @throws FunctionMetadataException when the manifest cannot be read or parsed
     */
    Map<String, String> read(Path manifestPath, String binName);

    static FunctionMetadataReader empty() {
        return (manifestPath, binName) -> Map.of();
    }
}
