package com.example.collectfaster;

public enum CollectionState {
    IDLE,
    DISCOVERING,
    SEQUENTIAL,
    PARALLEL,
    POST_PROCESSING,
    DONE,
    FAILED
}
