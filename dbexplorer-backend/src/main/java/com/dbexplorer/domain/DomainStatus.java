package com.dbexplorer.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class DomainStatus {
    String domainId;
    String label;
    boolean available;
    String table;
    Map<String, String> columns;
    String reason;
}
