package com.fedsearch.search;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SourceStatus {
    SourceType source;
    StatusCode status;
    PathState pathState;
    String reason;
    long latencyMs;
    int resultCount;

    static SourceStatus skipped(SourceType source) {
        return SourceStatus.builder()
                .source(source)
                .status(StatusCode.SKIPPED)
                .pathState(PathState.PENDING)
                .reason("not requested")
                .build();
    }
}
