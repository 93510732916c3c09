package com.fedsearch.sql;

public enum Verdict {
    ACCEPTED,
    REJECTED
}
