package com.vespasync.sync.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRunFinishParam {
    private OffsetDateTime finishedAt;
    private String status;
    private String summaryJson;
    private String reportPath;
    private long runId;
}
