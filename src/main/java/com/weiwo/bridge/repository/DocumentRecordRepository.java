package com.weiwo.bridge.repository;

import com.weiwo.bridge.entity.DocumentRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 文件台账响应式数据访问接口
 * 状态参数均为数据库中的小写文本（FileStatus#getValue）
 */
@Repository
public interface DocumentRecordRepository extends ReactiveCrudRepository<DocumentRecord, Long> {

    /**
     * 按绝对路径查询（自然键）
     */
    Mono<DocumentRecord> findByFilepath(String filepath);

    /**
     * 按状态查询，按插入顺序
     */
    @Query("SELECT * FROM document_status_table WHERE file_status = :status ORDER BY id LIMIT :limit")
    Flux<DocumentRecord> findByStatusOrderById(String status, int limit);

    /**
     * 待轮询记录的键集分页
     */
    @Query("SELECT * FROM document_status_table WHERE file_status IN ('pending', 'processing') "
            + "AND id > :afterId ORDER BY id LIMIT :limit")
    Flux<DocumentRecord> findActiveAfter(long afterId, int limit);

    /**
     * 发现任务使用的台账快照
     */
    @Query("SELECT * FROM document_status_table WHERE file_status <> 'deleted' ORDER BY filepath")
    Flux<DocumentRecord> findAllNotDeleted();

    @Query("SELECT * FROM document_status_table WHERE filepath LIKE :pattern ORDER BY id")
    Flux<DocumentRecord> findByFilepathLike(String pattern);

    @Query("SELECT COUNT(*) FROM document_status_table WHERE file_status = :status")
    Mono<Long> countByStatus(String status);

    @Query("SELECT * FROM document_status_table WHERE file_status = 'failed' "
            + "ORDER BY process_at DESC, id DESC LIMIT :limit")
    Flux<DocumentRecord> findRecentFailures(int limit);

    @Query("SELECT * FROM document_status_table ORDER BY id DESC LIMIT :limit OFFSET :offset")
    Flux<DocumentRecord> findPage(int limit, long offset);

    @Query("SELECT * FROM document_status_table WHERE file_status = :status "
            + "ORDER BY id DESC LIMIT :limit OFFSET :offset")
    Flux<DocumentRecord> findPageByStatus(String status, int limit, long offset);
}
