package com.dbexplorer.api;

import com.dbexplorer.domain.DomainStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class HealthResponse {
    private boolean databaseOk;
    private long uptimeSeconds;
    private String lastQuery;
    private Instant lastQueryAt;
    private String timeZone;
    private int poolActive;
    private int poolIdle;
    private int poolMax;
    private List<DomainStatus> domains;
}
