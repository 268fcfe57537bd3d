package com.flagship.statement_report.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Tags log lines with the current statement run and account.
 *
 * The run id is held in the SLF4J MDC under {@link #RUN_ID_MDC_KEY} and
 * printed by the log pattern, so every line of one batch can be found
 * together.
 */
public final class RunContext {

    public static final String RUN_ID_MDC_KEY = "runId";
    public static final String ACCOUNT_MDC_KEY = "accountNumber";

    private RunContext() {
        // Utility class
    }

    /**
     * Starts a new run and returns its id.
     */
    public static String begin() {
        String runId = generateRunId();
        MDC.put(RUN_ID_MDC_KEY, runId);
        return runId;
    }

    public static void enterAccount(int accountNumber) {
        MDC.put(ACCOUNT_MDC_KEY, String.valueOf(accountNumber));
    }

    public static void leaveAccount() {
        MDC.remove(ACCOUNT_MDC_KEY);
    }

    /**
     * Clears all run keys. Call at the end of every run.
     */
    public static void clear() {
        MDC.remove(ACCOUNT_MDC_KEY);
        MDC.remove(RUN_ID_MDC_KEY);
    }

    /**
     * Uses a shorter format for readability in logs.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
