package com.fintech.budgetsync.service;

import com.fintech.budgetsync.exception.DataDirectoryException;
import com.fintech.budgetsync.exception.LedgerConnectionException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the single session to the ledger service.
 * <p>
 * The ledger library supports one session at a time, so this manager tracks
 * the active session and tears down a stale one before opening another.
 * {@link #close} never throws: shutdown errors are logged, so it is safe in
 * {@code finally} blocks.
 */
@Service
@Slf4j
public class SessionManager {

    private final LedgerClient ledgerClient;
    private final AtomicInteger sessionSequence = new AtomicInteger();

    private volatile LedgerSession activeSession;

    public SessionManager(LedgerClient ledgerClient) {
        this.ledgerClient = ledgerClient;
    }

    /**
     * Creates the data directory if needed and checks it is readable and writable.
     *
     * @throws DataDirectoryException if the directory cannot be created or used
     */
    public void prepareDataDirectory(Path dataDir) {
        try {
            if (Files.isDirectory(dataDir)) {
                log.info("Using existing data directory {}.", dataDir);
            } else {
                log.info("Creating data directory {}", dataDir);
                Files.createDirectories(dataDir);
                log.info("Data directory created successfully.");
            }
        } catch (IOException e) {
            throw new DataDirectoryException("Unable to create data directory " + dataDir, dataDir, e);
        }

        if (!Files.isReadable(dataDir) || !Files.isWritable(dataDir)) {
            throw new DataDirectoryException(
                    "Data directory " + dataDir + " must be readable and writable", dataDir);
        }
    }

    /**
     * Opens a session. The data directory is prepared first, so a permission
     * problem surfaces before the server is contacted.
     *
     * @throws DataDirectoryException    if the data directory is unusable
     * @throws LedgerConnectionException if the server is unreachable or rejects the credentials
     */
    public LedgerSession open(Path dataDir, String serverUrl, String password) {
        prepareDataDirectory(dataDir);

        LedgerSession stale = activeSession;
        if (stale != null && stale.isOpen()) {
            log.warn("Ledger session {} is still open, closing it before opening a new one", stale.getId());
            close(stale);
        }

        log.info("Initializing ledger API against {}...", serverUrl);
        try {
            ledgerClient.init(dataDir, serverUrl, password);
        } catch (RuntimeException e) {
            throw new LedgerConnectionException(
                    "Unable to open ledger session against " + serverUrl + ": " + e.getMessage(), serverUrl, e);
        }

        LedgerSession session = new LedgerSession(
                sessionSequence.incrementAndGet(), ledgerClient, dataDir, serverUrl, password);
        activeSession = session;
        log.info("Ledger session {} opened.", session.getId());
        return session;
    }

    /**
     * Closes the session. Null and already-closed sessions are ignored.
     */
    public void close(LedgerSession session) {
        if (session == null || !session.isOpen()) {
            log.debug("No open ledger session to close");
            return;
        }

        session.markClosed();
        if (activeSession == session) {
            activeSession = null;
        }

        try {
            ledgerClient.shutdown();
            log.info("Ledger session {} closed.", session.getId());
        } catch (RuntimeException e) {
            log.error("Error shutting down ledger session {}", session.getId(), e);
        }
    }

    /**
     * Closes the session and opens a fresh one with the same server and credentials.
     */
    public LedgerSession reset(LedgerSession session, Path dataDir) {
        log.info("Resetting ledger session {}...", session.getId());
        close(session);
        return open(dataDir, session.getServerUrl(), session.getServerPassword());
    }

    /**
     * Tears down whatever the ledger library holds after a failed cycle.
     * Never throws.
     */
    public void emergencyShutdown() {
        LedgerSession session = activeSession;
        if (session != null) {
            close(session);
            return;
        }

        log.info("No tracked ledger session, shutting down the ledger API anyway");
        try {
            ledgerClient.shutdown();
        } catch (RuntimeException e) {
            log.error("Error during emergency shutdown of the ledger API", e);
        }
    }

    public LedgerSession getActiveSession() {
        return activeSession;
    }

    @PreDestroy
    public void closeOnExit() {
        LedgerSession session = activeSession;
        if (session != null) {
            log.info("Application stopping, closing ledger session {}", session.getId());
            close(session);
        }
    }
}
