package com.fedsearch.search;

public enum InvocationState {
    PENDING,
    RUNNING,
    AGGREGATED,
    RETURNED
}
