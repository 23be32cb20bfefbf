package com.symbexlog.recorder;

import com.symbexlog.recorder.model.ProgramNode;
import com.symbexlog.recorder.model.SymbolicState;
import com.symbexlog.recorder.model.Term;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * The traces of one verification session: one {@link TraceBuilder} per
 * verified unit, in verification order.
 *
 * Lifecycle: created empty by {@link #newSession()}, one unit appended per
 * {@link #insertMember}, read by the renderers once the run is over, and
 * emptied by {@link #reset()} before the next independent session. While
 * recording is disabled, the session hands out {@link TraceBuilder#noop()} and
 * keeps nothing.
 */
public final class TraceSession {

    private final List<TraceBuilder> units = new ArrayList<>();
    private final LongSupplier clock;

    private TraceConfig config;
    private boolean enabled;

    private TraceSession(LongSupplier clock) {
        this.clock = clock;
    }

    public static TraceSession newSession() {
        return new TraceSession(System::currentTimeMillis);
    }

    public static TraceSession newSession(TraceConfig config) {
        TraceSession session = newSession();
        session.setConfig(config);
        return session;
    }

    /** Session with a custom time source for timestamps. */
    public static TraceSession newSession(TraceConfig config, LongSupplier clock) {
        TraceSession session = new TraceSession(clock);
        session.setConfig(config);
        return session;
    }

    // -----------------------------------------------------------------------
    // Configuration
    // -----------------------------------------------------------------------

    /**
     * Assigns the configuration and takes the enabled flag from it. Only the
     * first call per session has an effect; {@link #reset()} clears it again.
     */
    public void setConfig(TraceConfig config) {
        if (this.config == null) {
            this.config = config;
            setEnabled(config.enabled());
        }
    }

    public void setConfig(Path outputDir, boolean writeFiles) {
        setConfig(TraceConfig.defaults().withEnabled(enabled).withOutput(outputDir, writeFiles));
    }

    public TraceConfig config() {
        return config != null ? config : TraceConfig.defaults();
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    // -----------------------------------------------------------------------
    // Units
    // -----------------------------------------------------------------------

    /**
     * Starts the trace of a method, predicate or function.
     *
     * @param member         the unit about to be verified
     * @param initialState   state before the unit's body is executed, usually empty
     * @param pathConditions path conditions at that point
     * @return the unit's builder, which is also the {@link #currentLog()} until the next unit starts
     */
    public TraceBuilder insertMember(ProgramNode member, SymbolicState initialState, Set<Term> pathConditions) {
        if (!enabled) {
            return TraceBuilder.noop();
        }
        TraceBuilder builder = new TraceBuilder(member, initialState, pathConditions, clock,
            config().abortedBranchPolicy());
        recordUnit(builder);
        return builder;
    }

    /** Appends a unit trace built elsewhere. */
    public void recordUnit(TraceBuilder builder) {
        units.add(builder);
    }

    /** The builder of the unit being verified, or the no-op builder if there is none. */
    public TraceBuilder currentLog() {
        if (!enabled || units.isEmpty()) {
            return TraceBuilder.noop();
        }
        return units.get(units.size() - 1);
    }

    /** Stamps the end time of the current unit. */
    public void endMember() {
        currentLog().endMember();
    }

    public List<TraceBuilder> units() {
        return Collections.unmodifiableList(units);
    }

    /** Drops the recorded units but keeps the configuration. */
    public void resetUnits() {
        units.clear();
    }

    /** Makes the session ready for an unrelated run: no units, no configuration, disabled. */
    public void reset() {
        units.clear();
        config = null;
        enabled = false;
    }
}
