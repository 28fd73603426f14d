package com.weiwo.bridge.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.weiwo.bridge.config.ApplicationProperties;
import com.weiwo.bridge.dto.ApiResponse;
import com.weiwo.bridge.dto.KnowledgeInfo;
import com.weiwo.bridge.exception.ApiException;
import com.weiwo.bridge.exception.ExternalApiException;
import com.weiwo.bridge.exception.KnowledgeNotFoundException;
import com.weiwo.bridge.service.KnowledgeApiClient;
import com.weiwo.bridge.utils.LoggingUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * 基于 WebClient 的知识库接口实现
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebClientKnowledgeApiClient implements KnowledgeApiClient {

    private static final ParameterizedTypeReference<ApiResponse<KnowledgeInfo>> KNOWLEDGE_RESPONSE =
            new ParameterizedTypeReference<>() {};

    private final WebClient knowledgeWebClient;
    private final ApplicationProperties applicationProperties;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<KnowledgeInfo> uploadFile(String knowledgeBaseId, Path file, String fileName) {
        String apiName = "上传知识文件";

        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", new FileSystemResource(file)).filename(fileName);
        body.part("fileName", fileName);
        body.part("enable_multimodel", String.valueOf(applicationProperties.getApi().isEnableMultimodel()));

        Mono<KnowledgeInfo> pipeline = knowledgeWebClient.post()
                .uri("/knowledge-bases/{kbId}/knowledge/file", knowledgeBaseId)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .retrieve()
                .bodyToMono(KNOWLEDGE_RESPONSE)
                .timeout(applicationProperties.getApi().getResponseTimeout())
                .flatMap(response -> unwrap(apiName, response))
                .flatMap(info -> {
                    if (info.id() == null || info.id().isBlank()) {
                        return Mono.error(new ExternalApiException(apiName, "response does not contain knowledge id", 200));
                    }
                    return Mono.just(info);
                })
                .onErrorMap(error -> mapError(apiName, null, error));

        return logExternalCall(apiName, fileName, pipeline);
    }

    @Override
    public Mono<KnowledgeInfo> getKnowledge(String knowledgeId) {
        String apiName = "查询知识状态";

        Mono<KnowledgeInfo> pipeline = knowledgeWebClient.get()
                .uri("/knowledge/{id}", knowledgeId)
                .retrieve()
                .bodyToMono(KNOWLEDGE_RESPONSE)
                .timeout(applicationProperties.getApi().getResponseTimeout())
                .flatMap(response -> unwrap(apiName, response))
                .onErrorMap(error -> mapError(apiName, knowledgeId, error));

        return logExternalCall(apiName, knowledgeId, pipeline);
    }

    @Override
    public Mono<Void> deleteKnowledge(String knowledgeId) {
        String apiName = "删除知识条目";

        Mono<Void> pipeline = knowledgeWebClient.delete()
                .uri("/knowledge/{id}", knowledgeId)
                .retrieve()
                .toBodilessEntity()
                .timeout(applicationProperties.getApi().getResponseTimeout())
                .then()
                .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                    log.info("知识条目在外部系统中已不存在，视为删除成功: knowledgeId={}", knowledgeId);
                    return Mono.empty();
                })
                .onErrorMap(error -> mapError(apiName, knowledgeId, error));

        return logExternalCall(apiName, knowledgeId, pipeline);
    }

    private Mono<KnowledgeInfo> unwrap(String apiName, ApiResponse<KnowledgeInfo> response) {
        if (!response.isSuccess()) {
            // 业务 code 不是 HTTP 状态，统一按 200 上报
            if (response.code() != null) {
                log.warn("{} 返回 success=false: code={} message={}", apiName, response.code(), response.getErrorMessage());
            }
            return Mono.error(new ExternalApiException(apiName, response.getErrorMessage(), HttpStatus.OK.value()));
        }
        if (response.data() == null) {
            return Mono.error(new ExternalApiException(apiName, "response data is empty", HttpStatus.OK.value()));
        }
        return Mono.just(response.data());
    }

    /**
     * 统一转换为 ExternalApiException，保留 HTTP 状态码供调用方区分暂时性与确定性错误
     */
    private Throwable mapError(String apiName, String knowledgeId, Throwable error) {
        if (error instanceof ApiException) {
            return error;
        }
        if (error instanceof WebClientResponseException ex) {
            int status = ex.getStatusCode().value();
            if (status == HttpStatus.NOT_FOUND.value() && knowledgeId != null) {
                return new KnowledgeNotFoundException(apiName, knowledgeId);
            }
            return new ExternalApiException(apiName, extractMessage(ex), status, ex);
        }
        return ExternalApiException.noResponse(apiName, error);
    }

    /**
     * 优先取响应体中的错误信息，否则使用状态码与原始响应体
     */
    private String extractMessage(WebClientResponseException ex) {
        String body = ex.getResponseBodyAsString();
        if (body != null && !body.isBlank()) {
            try {
                ApiResponse<?> response = objectMapper.readValue(body, ApiResponse.class);
                return response.getErrorMessage();
            } catch (Exception parseError) {
                log.debug("错误响应体不是JSON: {}", parseError.getMessage());
                return ex.getStatusCode().value() + " " + abbreviate(body);
            }
        }
        return ex.getStatusCode().value() + " " + ex.getStatusText();
    }

    private <T> Mono<T> logExternalCall(String apiName, String subject, Mono<T> publisher) {
        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            log.debug("调用外部接口 [{}] 参数: {}", apiName, subject);
            return publisher
                    .doOnSuccess(resp -> LoggingUtils.logExternalCall(apiName, System.currentTimeMillis() - start, true))
                    .doOnError(err -> {
                        LoggingUtils.logExternalCall(apiName, System.currentTimeMillis() - start, false);
                        log.warn("外部接口 [{}] 异常: subject={}, error={}", apiName, subject, err.getMessage());
                    });
        });
    }

    private static String abbreviate(String value) {
        return value.length() > 500 ? value.substring(0, 500) + "..." : value;
    }
}
