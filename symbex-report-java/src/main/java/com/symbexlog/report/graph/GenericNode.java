package com.symbexlog.report.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Node of the derived trace graph. {@code children} express nesting,
 * {@code successors} express control flow; a successor need not be a
 * structural descendant, and several nodes may share one (a join point).
 */
public class GenericNode {

    private final String label;
    private final List<GenericNode> children = new ArrayList<>();
    private final List<GenericNode> successors = new ArrayList<>();

    private boolean syntactic;
    private boolean smtQuery;
    private long startTimeMs;
    private long endTimeMs;

    public GenericNode(String label) {
        this.label = label;
    }

    public String label()                 { return label; }
    public List<GenericNode> children()   { return children; }
    public List<GenericNode> successors() { return successors; }

    /** True for nodes that only group structure or timing and are no step of their own. */
    public boolean isSyntactic()          { return syntactic; }
    public boolean isSmtQuery()           { return smtQuery; }
    public long startTimeMs()             { return startTimeMs; }
    public long endTimeMs()               { return endTimeMs; }

    public void setSyntactic(boolean syntactic)   { this.syntactic = syntactic; }
    public void setSmtQuery(boolean smtQuery)     { this.smtQuery = smtQuery; }
    public void setStartTimeMs(long startTimeMs)  { this.startTimeMs = startTimeMs; }
    public void setEndTimeMs(long endTimeMs)      { this.endTimeMs = endTimeMs; }

    public boolean hasTiming() {
        return startTimeMs != 0 && endTimeMs != 0;
    }

    @Override
    public String toString() {
        return label;
    }
}
