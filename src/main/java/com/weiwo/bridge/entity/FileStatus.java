package com.weiwo.bridge.entity;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * 文档同步状态
 * 数据库中以小写文本存储（document_status_table.file_status）
 */
public enum FileStatus {

    DISCOVER("discover"),
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    DELETED("deleted");

    /** 等待外部系统处理的状态，轮询任务只处理这两种 */
    public static final Set<FileStatus> ACTIVE = EnumSet.of(PENDING, PROCESSING);

    private final String value;

    FileStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    /**
     * 按数据库文本解析状态
     */
    public static FileStatus fromValue(String value) {
        FileStatus status = fromValueOrNull(value);
        if (status == null) {
            throw new IllegalArgumentException("未知的文档状态: " + value);
        }
        return status;
    }

    /**
     * 宽松解析，外部接口返回的状态可能大小写不一致或是本地未定义的值
     */
    public static FileStatus fromValueOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FileStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
