package com.fedsearch.search;

public enum SourceType {
    SQL,
    DOC
}
