package com.weiwo.bridge.controller;

import com.weiwo.bridge.config.GlobalExceptionHandler;
import com.weiwo.bridge.entity.ScriptProcessRecord;
import com.weiwo.bridge.exception.BusinessException;
import com.weiwo.bridge.exception.ValidationException;
import com.weiwo.bridge.service.ErpSyncQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ErpSyncControllerTest {

    @Mock
    private ErpSyncQueryService erpSyncQueryService;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(new ErpSyncController(erpSyncQueryService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void runStageReturnsAuditRecord() {
        ScriptProcessRecord record = ScriptProcessRecord.builder()
                .scriptName("polling_task")
                .status(ScriptProcessRecord.STATUS_SUCCESS)
                .processCount(4)
                .build();
        when(erpSyncQueryService.runStage("poll")).thenReturn(Mono.just(record));

        webTestClient.post().uri("/api/v1/erp/run/poll")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.scriptName").isEqualTo("polling_task")
                .jsonPath("$.processCount").isEqualTo(4);
    }

    @Test
    void busyStageIsConflict() {
        when(erpSyncQueryService.runStage("discover"))
                .thenReturn(Mono.error(new BusinessException("任务正在运行: discover_files", 409)));

        webTestClient.post().uri("/api/v1/erp/run/discover")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.returnCode").isEqualTo(409)
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.traceId").exists();
    }

    @Test
    void retryOfMissingRecordIsNotFound() {
        when(erpSyncQueryService.retry(42L))
                .thenReturn(Mono.error(BusinessException.resourceNotFound("台账记录", "42")));

        webTestClient.post().uri("/api/v1/erp/documents/42/retry")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.returnCode").isEqualTo(404);
    }

    @Test
    void invalidStatusFilterIsBadRequest() {
        when(erpSyncQueryService.listDocuments("archived", 1, 20))
                .thenReturn(Mono.error(new ValidationException("未知的文档状态: archived")));

        webTestClient.get().uri("/api/v1/erp/documents?status=archived")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.returnCode").isEqualTo(400);
    }

    @Test
    void nonNumericIdIsBadRequest() {
        webTestClient.post().uri("/api/v1/erp/documents/abc/retry")
                .exchange()
                .expectStatus().isBadRequest();
    }
}
