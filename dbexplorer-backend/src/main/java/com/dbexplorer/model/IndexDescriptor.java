package com.dbexplorer.model;

import lombok.Value;

@Value
public class IndexDescriptor {
    String name;
    String definition;
}
