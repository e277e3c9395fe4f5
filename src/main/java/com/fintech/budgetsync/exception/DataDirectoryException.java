package com.fintech.budgetsync.exception;

import java.nio.file.Path;

/**
 * Thrown when the local data directory cannot be created or is not
 * readable and writable. Fatal for the cycle, and for startup.
 */
public class DataDirectoryException extends BudgetSyncException {

    private final Path dataDir;

    public DataDirectoryException(String message, Path dataDir) {
        super(message);
        this.dataDir = dataDir;
    }

    public DataDirectoryException(String message, Path dataDir, Throwable cause) {
        super(message, cause);
        this.dataDir = dataDir;
    }

    public Path getDataDir() {
        return dataDir;
    }
}
