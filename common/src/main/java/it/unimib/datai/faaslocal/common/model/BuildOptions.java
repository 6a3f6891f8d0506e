package it.unimib.datai.faaslocal.common.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Build and launch configuration forwarded untouched to every function process supervisor.
 *
 * @param manifestPath project manifest the function metadata is read from
 * @param features     comma separated feature flags, may be null
 * @param release      build in release mode
 * @param watchArgs    extra arguments for the file-watch wrapper
 * @param noReload     run the function directly instead of under the file-watch wrapper
 */
public record BuildOptions(
        Path manifestPath,
        String features,
        boolean release,
        List<String> watchArgs,
        boolean noReload
) {
    public BuildOptions {
        watchArgs = watchArgs == null ? List.of() : List.copyOf(watchArgs);
    }
}
