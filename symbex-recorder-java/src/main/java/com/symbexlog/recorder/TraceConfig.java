package com.symbexlog.recorder;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Session configuration of the trace recorder.
 *
 * @param enabled             whether units are recorded at all
 * @param outputDir           directory the trace artifacts are written to
 * @param writeFiles          whether trace artifacts are written
 * @param abortedBranchPolicy how aborted siblings take part in the merge after a fork
 * @param baselineDir         directory holding the expected structure-only dumps
 */
public record TraceConfig(
    boolean enabled,
    Path outputDir,
    boolean writeFiles,
    AbortedBranchPolicy abortedBranchPolicy,
    Path baselineDir
) {

    public static final Path DEFAULT_BASELINE_DIR = Paths.get("src", "test", "resources", "symbExLogTests");

    public static TraceConfig defaults() {
        return new TraceConfig(false, Paths.get("."), false, AbortedBranchPolicy.STRICT, DEFAULT_BASELINE_DIR);
    }

    public TraceConfig withEnabled(boolean enabled) {
        return new TraceConfig(enabled, outputDir, writeFiles, abortedBranchPolicy, baselineDir);
    }

    public TraceConfig withOutput(Path outputDir, boolean writeFiles) {
        return new TraceConfig(enabled, outputDir, writeFiles, abortedBranchPolicy, baselineDir);
    }

    /**
     * Parses {@code key=value} pairs separated by commas, e.g.
     * {@code enabled=true,output=/tmp/trace,write_files=true,aborted_branch_policy=exclude}.
     * Unknown keys are ignored; values that do not parse keep the default.
     */
    public static TraceConfig parseArgs(String args) {
        TraceConfig defaults = defaults();
        boolean enabled = defaults.enabled();
        Path outputDir = defaults.outputDir();
        boolean writeFiles = defaults.writeFiles();
        AbortedBranchPolicy policy = defaults.abortedBranchPolicy();
        Path baselineDir = defaults.baselineDir();

        if (args != null && !args.isBlank()) {
            for (String part : args.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length == 2) {
                    String value = kv[1].trim();
                    switch (kv[0].trim()) {
                        case "enabled"               -> enabled     = Boolean.parseBoolean(value);
                        case "output", "output_dir"  -> outputDir   = Paths.get(value);
                        case "write_files"           -> writeFiles  = Boolean.parseBoolean(value);
                        case "baseline_dir"          -> baselineDir = Paths.get(value);
                        case "aborted_branch_policy" -> {
                            try {
                                policy = AbortedBranchPolicy.parse(value);
                            } catch (IllegalArgumentException e) {
                                System.err.println("[symbex-recorder] WARNING: unknown aborted_branch_policy '"
                                    + value + "', keeping " + policy);
                            }
                        }
                        default -> { }
                    }
                }
            }
        }
        return new TraceConfig(enabled, outputDir, writeFiles, policy, baselineDir);
    }
}
