package com.dbexplorer.util;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class JdbcConnectionInfo {
    private String url;
    private String username;
    private String password;
    private String dbType;
    private String driverClassName;
}
