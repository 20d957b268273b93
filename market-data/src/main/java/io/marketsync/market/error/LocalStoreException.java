package io.marketsync.market.error;

import java.nio.file.Path;

public class LocalStoreException extends SyncException {
    private final Path path;

    public LocalStoreException(FailureKind kind, Path path, String message, Throwable cause) {
        super(kind, message + ": " + path, cause);
        if (kind != FailureKind.LOCAL_READ && kind != FailureKind.LOCAL_WRITE) {
            throw new IllegalArgumentException("not a local store failure: " + kind);
        }
        this.path = path;
    }

    public static LocalStoreException read(Path path, String message, Throwable cause) {
        return new LocalStoreException(FailureKind.LOCAL_READ, path, message, cause);
    }

    public static LocalStoreException write(Path path, String message, Throwable cause) {
        return new LocalStoreException(FailureKind.LOCAL_WRITE, path, message, cause);
    }

    public Path path() { return path; }
}
