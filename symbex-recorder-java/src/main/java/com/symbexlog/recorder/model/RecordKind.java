package com.symbexlog.recorder.model;

/**
 * Type tag of a {@link SymbolicRecord}. The tag string is what the
 * structure-only rendering prints.
 */
public enum RecordKind {
    METHOD("method"),
    PREDICATE("predicate"),
    FUNCTION("function"),
    EXECUTE("execute"),
    EVALUATE("evaluate"),
    PRODUCE("produce"),
    CONSUME("consume"),
    WELLFORMEDNESS_CHECK("WellformednessCheck"),
    GLOBAL_BRANCH("GlobalBranch"),
    LOCAL_BRANCH("LocalBranch"),
    CFG_BRANCH("CfgBranch"),
    CONDITIONAL_EDGE("ConditionalEdge"),
    UNCONDITIONAL_EDGE("UnconditionalEdge"),
    COMMENT("Comment"),
    METHOD_CALL("MethodCall"),
    DECIDER_ASSERT("DeciderAssert"),
    PROVER_ASSERT("ProverAssert"),
    DECIDER_ASSUME("DeciderAssume"),
    SINGLE_MERGE("SingleMerge");

    private final String typeString;

    RecordKind(String typeString) {
        this.typeString = typeString;
    }

    public String typeString() {
        return typeString;
    }

    public boolean isMember() {
        return this == METHOD || this == PREDICATE || this == FUNCTION;
    }
}
