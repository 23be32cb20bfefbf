package com.symbexlog.recorder.model;

/** Handle on a heap chunk (a permission-carrying heap fragment) of the executor. */
public interface HeapChunk {

    String render();
}
