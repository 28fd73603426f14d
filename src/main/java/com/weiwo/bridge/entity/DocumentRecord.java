package com.weiwo.bridge.entity;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * 文件同步台账
 * 每个被跟踪的物理文件对应一行，filepath 为自然键，行永不物理删除
 */
@Table("document_status_table")
@Data
public class DocumentRecord {

    @Id
    private Long id;

    @Column("filename")
    private String filename;

    @Column("filepath")
    private String filepath;

    @Column("file_status")
    private FileStatus fileStatus = FileStatus.DISCOVER;

    @Column("created_at")
    private LocalDateTime createdAt;

    /** 文件修改时间，epoch 秒（含小数） */
    @Column("last_modified_time")
    private Double lastModifiedTime;

    @Column("process_at")
    private LocalDateTime processAt;

    @Column("finish_at")
    private LocalDateTime finishAt;

    @Column("failed_msg")
    private String failedMsg;

    @Column("file_size")
    private Long fileSize;

    @Column("file_hash")
    private String fileHash;

    @Column("file_store_path")
    private String fileStorePath;

    @Column("knowledge_id")
    private String knowledgeId;

    @Column("contract_title")
    private String contractTitle;

    @Column("contract_ord")
    private Integer contractOrd;

    @Column("database_name")
    private String databaseName;

    public boolean hasKnowledgeId() {
        return knowledgeId != null && !knowledgeId.isBlank();
    }
}
