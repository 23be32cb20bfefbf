package com.symbexlog.recorder.model;

/**
 * Handle on a node of the verified program, implemented by the executor.
 *
 * Records only hold the reference for display and for the logging filter;
 * they never own or mutate the node.
 */
public interface ProgramNode {

    NodeKind kind();

    /** Textual form of the node, e.g. {@code x := x + 1}. */
    String text();

    /** Member name for methods, predicates and functions; the text otherwise. */
    default String name() {
        return text();
    }

    /** Source position as {@code line:column}, or null if unknown. */
    default String position() {
        return null;
    }

    static ProgramNode of(NodeKind kind, String text) {
        return new SimpleProgramNode(kind, text, text, null);
    }

    static ProgramNode member(NodeKind kind, String name) {
        return new SimpleProgramNode(kind, name, name, null);
    }

    /** Plain value implementation, for executors without a richer AST type and for tests. */
    record SimpleProgramNode(NodeKind kind, String text, String name, String position) implements ProgramNode {
        @Override
        public String toString() {
            return text;
        }
    }
}
