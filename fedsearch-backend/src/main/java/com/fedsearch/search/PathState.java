package com.fedsearch.search;

public enum PathState {
    PENDING,
    RUNNING,
    DONE,
    FAILED,
    TIMEOUT
}
