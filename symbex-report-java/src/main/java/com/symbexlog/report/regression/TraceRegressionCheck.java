package com.symbexlog.report.regression;

import com.symbexlog.recorder.TraceSession;
import com.symbexlog.report.render.TypeTreeRenderer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Regression check of the trace recorded for one input program.
 *
 * If {@code <baselineDir>/<input file name>.elog} exists, the structure-only
 * dump of the session is written next to it as {@code .alog} and compared
 * line by line. The check also fails if any reachable record lacks timing.
 * Without a baseline the check does not apply.
 */
public class TraceRegressionCheck {

    private final Path inputFile;
    private final Path baselineDir;

    public TraceRegressionCheck(Path inputFile, Path baselineDir) {
        this.inputFile = inputFile;
        this.baselineDir = baselineDir;
    }

    public Path expectedPath() {
        return baselineDir.resolve(inputFile.getFileName() + ".elog");
    }

    public Path actualPath() {
        return baselineDir.resolve(inputFile.getFileName() + ".alog");
    }

    /**
     * Runs the check once the whole input has been verified.
     *
     * @throws UncheckedIOException if the dumps cannot be written or read
     */
    public RegressionResult verify(TraceSession session) {
        Path expected = expectedPath();
        if (!Files.exists(expected)) {
            return RegressionResult.notApplicable(expected);
        }
        Path actual = actualPath();

        List<String> expectedLines;
        List<String> actualLines;
        try {
            try (Writer w = Files.newBufferedWriter(actual)) {
                w.write(new TypeTreeRenderer().render(session.units()));
            }
            expectedLines = Files.readAllLines(expected);
            actualLines = Files.readAllLines(actual);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compare trace dumps for " + inputFile + ": " + e.getMessage(), e);
        }

        StringBuilder message = new StringBuilder();
        int mismatch = firstMismatch(expectedLines, actualLines);
        if (mismatch != 0) {
            message.append("Trace regression failed, expected output does not match actual output. ")
                .append("First occurrence at line ").append(mismatch).append(".\n")
                .append("Compared files:\n")
                .append("expected: ").append(expected).append('\n')
                .append("actual:   ").append(actual).append('\n');
        }

        String incomplete = new ExecTimeChecker().render(session.units());
        if (!incomplete.isEmpty()) {
            message.append("ExecTimeChecker: ").append(incomplete).append('\n');
        }

        if (message.length() == 0) {
            return RegressionResult.passed(expected, actual);
        }
        return RegressionResult.failed(message.toString(), mismatch, expected, actual);
    }

    /** 1-based number of the first line that differs (a missing line counts), or 0. */
    static int firstMismatch(List<String> expected, List<String> actual) {
        int common = Math.min(expected.size(), actual.size());
        for (int i = 0; i < common; i++) {
            if (!expected.get(i).equals(actual.get(i))) {
                return i + 1;
            }
        }
        return expected.size() != actual.size() ? common + 1 : 0;
    }
}
