package it.unimib.datai.faaslocal.scheduler.metadata;

import java.nio.file.Path;

public final class FunctionMetadataException extends RuntimeException {
    private final Path manifestPath;

    public FunctionMetadataException(Path manifestPath, String message, Throwable cause) {
        super(message, cause);
        this.manifestPath = manifestPath;
    }

    public Path manifestPath() {
        return manifestPath;
    }
}
