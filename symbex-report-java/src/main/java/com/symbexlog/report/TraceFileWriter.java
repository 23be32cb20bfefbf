package com.symbexlog.report;

import com.symbexlog.recorder.TraceBuilder;
import com.symbexlog.recorder.TraceConfig;
import com.symbexlog.recorder.TraceSession;
import com.symbexlog.report.graph.ChromeTraceRenderer;
import com.symbexlog.report.graph.GenericNode;
import com.symbexlog.report.graph.GenericNodeJsonRenderer;
import com.symbexlog.report.graph.GenericNodeRenderer;
import com.symbexlog.report.render.DotTreeRenderer;
import com.symbexlog.report.render.ExecutionTreeRenderer;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the trace artifacts of a session into the configured output directory:
 * {@code dot_input.dot}, {@code executionTreeData.js}, {@code chromeTrace.json}
 * and {@code genericNodes.json}.
 */
public class TraceFileWriter {

    public static final String DOT_FILE = "dot_input.dot";
    public static final String EXECUTION_TREE_FILE = "executionTreeData.js";
    public static final String CHROME_TRACE_FILE = "chromeTrace.json";
    public static final String GENERIC_NODES_FILE = "genericNodes.json";

    public static class TraceWriteException extends RuntimeException {
        public TraceWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final Path outputDir;

    public TraceFileWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public TraceFileWriter(TraceConfig config) {
        this(config.outputDir());
    }

    public Path writeDot(List<TraceBuilder> units) {
        return write(DOT_FILE, new DotTreeRenderer().render(units));
    }

    public Path writeExecutionTree(List<TraceBuilder> units) {
        return write(EXECUTION_TREE_FILE, new ExecutionTreeRenderer().render(units));
    }

    public Path writeChromeTrace(GenericNode members) {
        return write(CHROME_TRACE_FILE, new ChromeTraceRenderer().render(List.of(members)));
    }

    public Path writeGenericNodes(GenericNode members) {
        return write(GENERIC_NODES_FILE, new GenericNodeJsonRenderer().render(List.of(members)));
    }

    /**
     * Writes every artifact if the session is enabled and its configuration asks
     * for files. A failing artifact is reported and does not stop the others.
     *
     * @return the files that were written
     */
    public List<Path> writeAll(TraceSession session) {
        List<Path> written = new ArrayList<>();
        if (!session.isEnabled() || !session.config().writeFiles()) {
            return written;
        }
        List<TraceBuilder> units = session.units();

        tryWrite(DOT_FILE, () -> writeDot(units), written);
        tryWrite(EXECUTION_TREE_FILE, () -> writeExecutionTree(units), written);

        GenericNode members = buildGraph(units);
        if (members == null) {
            return written;
        }
        tryWrite(CHROME_TRACE_FILE, () -> writeChromeTrace(members), written);
        tryWrite(GENERIC_NODES_FILE, () -> writeGenericNodes(members), written);
        return written;
    }

    private static GenericNode buildGraph(List<TraceBuilder> units) {
        try {
            return new GenericNodeRenderer().render(units);
        } catch (IllegalStateException e) {
            System.err.println("[symbex-report] ERROR building generic node graph: " + e.getMessage());
            return null;
        }
    }

    private interface Artifact {
        Path write();
    }

    private static void tryWrite(String name, Artifact artifact, List<Path> written) {
        try {
            written.add(artifact.write());
        } catch (TraceWriteException e) {
            System.err.println("[symbex-report] ERROR writing " + name + ": " + e.getMessage());
        }
    }

    private Path write(String fileName, String content) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new TraceWriteException("Could not create output directory: " + outputDir, e);
        }
        Path path = outputDir.resolve(fileName);
        try (Writer w = Files.newBufferedWriter(path)) {
            w.write(content);
        } catch (IOException e) {
            throw new TraceWriteException("Failed to write " + fileName + ": " + e.getMessage(), e);
        }
        System.err.println("[symbex-report] " + fileName + " written: " + path);
        return path;
    }
}
