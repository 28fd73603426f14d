package com.weiwo.bridge.service;

import com.weiwo.bridge.dto.KnowledgeInfo;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * 知识库接入接口
 *
 * <p>失败统一以 {@link com.weiwo.bridge.exception.ExternalApiException} 结束，
 * 条目不存在时为 {@link com.weiwo.bridge.exception.KnowledgeNotFoundException}。</p>
 */
public interface KnowledgeApiClient {

    /**
     * 上传文件，返回外部系统创建的知识条目
     */
    Mono<KnowledgeInfo> uploadFile(String knowledgeBaseId, Path file, String fileName);

    /**
     * 查询知识条目解析状态
     */
    Mono<KnowledgeInfo> getKnowledge(String knowledgeId);

    /**
     * 删除知识条目，条目不存在视为成功
     */
    Mono<Void> deleteKnowledge(String knowledgeId);
}
