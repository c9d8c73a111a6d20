package com.vespasync.sync.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

import java.time.OffsetDateTime;

public interface SyncRunMapper {
    @Update("UPDATE sync_runs SET status='ABORTED', finished_at=#{finishedAt}, " +
            "notes=COALESCE(notes, '') || ';recovered_on_startup' WHERE status='RUNNING'")
    int recoverDanglingRuns(@Param("finishedAt") OffsetDateTime finishedAt);

    @Insert("INSERT INTO sync_runs(mode, started_at, status, notes) VALUES(#{mode}, #{startedAt}, #{status}, #{notes})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insertRun(SyncRunInsertParam run);

    @Update("UPDATE sync_runs SET finished_at=#{finishedAt}, status=#{status}, summary_json=#{summaryJson}, " +
            "report_path=#{reportPath} WHERE id=#{runId}")
    int updateRunFinish(SyncRunFinishParam row);
}
