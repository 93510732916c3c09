package com.fedsearch.sql;

public enum GenerationMethod {
    LLM,
    RULE_BASED
}
