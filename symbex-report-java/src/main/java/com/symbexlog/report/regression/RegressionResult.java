package com.symbexlog.report.regression;

import java.nio.file.Path;

/** Outcome of comparing one input's structure-only trace against its baseline. */
public final class RegressionResult {

    public enum Status { NOT_APPLICABLE, PASSED, FAILED }

    private final Status status;
    private final String message;
    private final int firstMismatchLine;
    private final Path expectedPath;
    private final Path actualPath;

    private RegressionResult(Status status, String message, int firstMismatchLine, Path expectedPath, Path actualPath) {
        this.status = status;
        this.message = message;
        this.firstMismatchLine = firstMismatchLine;
        this.expectedPath = expectedPath;
        this.actualPath = actualPath;
    }

    static RegressionResult notApplicable(Path expectedPath) {
        return new RegressionResult(Status.NOT_APPLICABLE, "", 0, expectedPath, null);
    }

    static RegressionResult passed(Path expectedPath, Path actualPath) {
        return new RegressionResult(Status.PASSED, "", 0, expectedPath, actualPath);
    }

    static RegressionResult failed(String message, int firstMismatchLine, Path expectedPath, Path actualPath) {
        return new RegressionResult(Status.FAILED, message, firstMismatchLine, expectedPath, actualPath);
    }

    public Status status()          { return status; }
    public boolean isFailure()      { return status == Status.FAILED; }

    /** Combined report; empty unless the check failed. */
    public String message()         { return message; }

    /** 1-based number of the first differing line, or 0 if the dumps agree. */
    public int firstMismatchLine()  { return firstMismatchLine; }
    public Path expectedPath()      { return expectedPath; }
    public Path actualPath()        { return actualPath; }

    @Override
    public String toString() {
        return status + (message.isEmpty() ? "" : ": " + message);
    }
}
