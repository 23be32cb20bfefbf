package com.symbexlog.recorder;

import com.google.gson.annotations.SerializedName;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Deserialized form of a JSON trace configuration file. Absent keys take the
 * defaults of {@link TraceConfig#defaults()}.
 */
public class TraceConfigFile {

    @SerializedName("enabled")
    private Boolean enabled;

    @SerializedName("output_dir")
    private String outputDir;

    @SerializedName("write_files")
    private Boolean writeFiles;

    /** {@code strict} or {@code exclude}. */
    @SerializedName("aborted_branch_policy")
    private String abortedBranchPolicy;

    @SerializedName("baseline_dir")
    private String baselineDir;

    public boolean isEnabled()       { return enabled != null && enabled; }
    public Path getOutputDir()       { return outputDir != null ? Paths.get(outputDir) : TraceConfig.defaults().outputDir(); }
    public boolean isWriteFiles()    { return writeFiles != null && writeFiles; }
    public Path getBaselineDir()     { return baselineDir != null ? Paths.get(baselineDir) : TraceConfig.DEFAULT_BASELINE_DIR; }

    public AbortedBranchPolicy getAbortedBranchPolicy() {
        return abortedBranchPolicy != null ? AbortedBranchPolicy.parse(abortedBranchPolicy) : AbortedBranchPolicy.STRICT;
    }

    public TraceConfig toConfig() {
        return new TraceConfig(isEnabled(), getOutputDir(), isWriteFiles(), getAbortedBranchPolicy(), getBaselineDir());
    }
}
