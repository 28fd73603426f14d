package com.weiwo.bridge.controller;

import com.weiwo.bridge.dto.DashboardStatsResponse;
import com.weiwo.bridge.dto.DocumentPageResponse;
import com.weiwo.bridge.dto.RunLogResponse;
import com.weiwo.bridge.entity.DocumentRecord;
import com.weiwo.bridge.entity.ScriptProcessRecord;
import com.weiwo.bridge.service.ErpSyncQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * ERP 同步运维接口
 */
@RestController
@RequestMapping("/api/v1/erp")
@RequiredArgsConstructor
public class ErpSyncController {

    private final ErpSyncQueryService erpSyncQueryService;

    @GetMapping("/stats")
    public Mono<ResponseEntity<DashboardStatsResponse>> getStats() {
        return erpSyncQueryService.getStats()
                .map(ResponseEntity::ok);
    }

    @GetMapping("/documents")
    public Mono<ResponseEntity<DocumentPageResponse>> getDocuments(
            @RequestParam(required = false) String status,
            @RequestParam(required = false, defaultValue = "1") Integer page,
            @RequestParam(name = "per_page", required = false, defaultValue = "20") Integer perPage) {

        return erpSyncQueryService.listDocuments(status, page, perPage)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/logs")
    public Mono<ResponseEntity<RunLogResponse>> getLogs(
            @RequestParam(name = "script", required = false) String scriptName) {

        return erpSyncQueryService.getRecentRuns(scriptName)
                .map(ResponseEntity::ok);
    }

    /**
     * 手动触发任务：discover | submit | poll | contract
     */
    @PostMapping("/run/{stage}")
    public Mono<ResponseEntity<ScriptProcessRecord>> runStage(@PathVariable String stage) {
        return erpSyncQueryService.runStage(stage)
                .map(ResponseEntity::ok);
    }

    /**
     * 失败记录人工重试
     */
    @PostMapping("/documents/{id}/retry")
    public Mono<ResponseEntity<DocumentRecord>> retry(@PathVariable Long id) {
        return erpSyncQueryService.retry(id)
                .map(ResponseEntity::ok);
    }
}
