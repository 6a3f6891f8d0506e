package it.unimib.datai.faaslocal.scheduler.config;

import it.unimib.datai.faaslocal.common.model.BuildOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.nio.file.Path;
import java.util.List;

@ConfigurationProperties(prefix = "faaslocal.watch")
public record WatchProperties(
        String runtimeApiBase,
        String manifestPath,
        String features,
        Boolean release,
        List<String> watchArgs,
        Boolean noReload,
        String cargoExecutable,
        Long shutdownGraceMs
) {
    static final String DEFAULT_RUNTIME_API_BASE = "http://127.0.0.1:9000/.rt";

    @ConstructorBinding
    public WatchProperties {
    }

    public WatchProperties(String runtimeApiBase, String manifestPath) {
        this(runtimeApiBase, manifestPath, null, null, null, null, null, null);
    }

    public String runtimeApiBaseOrDefault() {
        return runtimeApiBase != null && !runtimeApiBase.isBlank() ? runtimeApiBase : DEFAULT_RUNTIME_API_BASE;
    }

    public Path manifestPathOrDefault() {
        return Path.of(manifestPath != null && !manifestPath.isBlank() ? manifestPath : "Cargo.toml");
    }

    public String cargoExecutableOrDefault() {
        return cargoExecutable != null && !cargoExecutable.isBlank() ? cargoExecutable : "cargo";
    }

    public long shutdownGraceMsOrDefault() {
        return shutdownGraceMs != null && shutdownGraceMs > 0 ? shutdownGraceMs : 5000L;
    }

    public BuildOptions buildOptions() {
        return new BuildOptions(
                manifestPathOrDefault(),
                features,
                Boolean.TRUE.equals(release),
                watchArgs,
                Boolean.TRUE.equals(noReload)
        );
    }
}
