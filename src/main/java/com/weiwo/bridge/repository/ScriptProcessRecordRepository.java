package com.weiwo.bridge.repository;

import com.weiwo.bridge.entity.ScriptProcessRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

/**
 * 任务执行审计记录数据访问接口
 */
@Repository
public interface ScriptProcessRecordRepository extends ReactiveCrudRepository<ScriptProcessRecord, Long> {

    @Query("SELECT * FROM script_process_record ORDER BY id DESC LIMIT :limit")
    Flux<ScriptProcessRecord> findRecent(int limit);

    @Query("SELECT * FROM script_process_record WHERE script_name = :scriptName ORDER BY id DESC LIMIT :limit")
    Flux<ScriptProcessRecord> findRecentByScriptName(String scriptName, int limit);
}
