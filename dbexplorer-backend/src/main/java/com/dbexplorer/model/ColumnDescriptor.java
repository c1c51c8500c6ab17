package com.dbexplorer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ColumnDescriptor {
    String name;
    ColumnCategory category;
    String dataType;
    boolean nullable;
}
