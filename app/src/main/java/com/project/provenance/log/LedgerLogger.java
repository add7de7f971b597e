package com.project.provenance.log;

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ledger activity log, written to both console and file.
 *
 * The file is taken from system property {@value #LOG_FILE_PROPERTY}
 * (default {@value #DEFAULT_LOG_FILE}); the value {@code none} disables file output.
 */
public final class LedgerLogger {
    public static final String LOG_FILE_PROPERTY = "provenance.log.file";
    public static final String DEFAULT_LOG_FILE = "provenance-ledger.log";

    private static final ReentrantLock lock = new ReentrantLock();
    private static PrintWriter logWriter;

    static {
        String file = System.getProperty(LOG_FILE_PROPERTY, DEFAULT_LOG_FILE);
        if (!"none".equalsIgnoreCase(file)) {
            try {
                logWriter = new PrintWriter(new FileWriter(file, true));
            } catch (IOException e) {
                System.err.println("Failed to initialize ledger log file " + file + ": " + e.getMessage());
            }
        }
    }

    private LedgerLogger() {
    }

    public static void info(String operation, String message) {
        write("INFO", operation, message, null, false);
    }

    public static void warn(String operation, String message) {
        write("WARN", operation, message, null, true);
    }

    public static void error(String operation, String message, Throwable error) {
        write("ERROR", operation, message, error, true);
    }

    private static void write(String level, String operation, String message, Throwable error, boolean toStderr) {
        lock.lock();
        try {
            String logEntry = String.format("[%s] %s in %s: %s", Instant.now(), level, operation, message);

            PrintWriter console = new PrintWriter(toStderr ? System.err : System.out, true);
            console.println(logEntry);
            if (error != null) {
                console.println("  Exception: " + error.getClass().getName());
                error.printStackTrace(console);
            }

            if (logWriter != null) {
                logWriter.println(logEntry);
                if (error != null) {
                    logWriter.println("  Exception: " + error.getClass().getName());
                    error.printStackTrace(logWriter);
                }
                logWriter.flush();
            }
        } finally {
            lock.unlock();
        }
    }

    public static void close() {
        lock.lock();
        try {
            if (logWriter != null) {
                logWriter.close();
                logWriter = null;
            }
        } finally {
            lock.unlock();
        }
    }
}
