package com.symbexlog.recorder.model;

/** Handle on a symbolic term of the executor's term algebra. Opaque to the recorder. */
public interface Term {

    /** Display form of the term. */
    String render();
}
