package com.weiwo.bridge.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 知识条目信息（上传与查询接口的 data 部分）
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KnowledgeInfo(
    @JsonProperty("id") String id,
    @JsonProperty("parse_status") String parseStatus,
    @JsonProperty("file_hash") String fileHash,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("file_name") String fileName,
    @JsonProperty("error_message") String errorMessage
) {
}
