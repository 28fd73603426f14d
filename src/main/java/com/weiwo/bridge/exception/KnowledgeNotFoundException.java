package com.weiwo.bridge.exception;

/**
 * 外部系统中不存在该知识条目（HTTP 404）
 */
public class KnowledgeNotFoundException extends ExternalApiException {

    private final String knowledgeId;

    public KnowledgeNotFoundException(String apiName, String knowledgeId) {
        super(apiName, "knowledge " + knowledgeId + " not found", 404);
        this.knowledgeId = knowledgeId;
    }

    public String getKnowledgeId() {
        return knowledgeId;
    }
}
