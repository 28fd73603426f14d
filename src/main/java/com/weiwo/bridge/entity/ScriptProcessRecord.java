package com.weiwo.bridge.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * 任务执行审计记录，每次任务运行追加一行
 */
@Table("script_process_record")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScriptProcessRecord {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAIL = "fail";

    @Id
    private Long id;

    @Column("script_name")
    private String scriptName;

    /** 耗时（秒） */
    @Column("process_duration")
    private Double processDuration;

    @Column("process_count")
    private Integer processCount;

    @Column("insert_count")
    private Integer insertCount;

    @Column("update_count")
    private Integer updateCount;

    @Column("delete_count")
    private Integer deleteCount;

    @Column("process_timestamp")
    private LocalDateTime processTimestamp;

    @Column("status")
    private String status;

    @Column("failed_reason")
    private String failedReason;

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }
}
