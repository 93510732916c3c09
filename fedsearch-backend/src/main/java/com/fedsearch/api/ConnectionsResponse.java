package com.fedsearch.api;

import com.fedsearch.connection.ConnectionDescriptor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ConnectionsResponse {
    private List<ConnectionDescriptor> connections;
    private String traceId;
}
