package com.weiwo.bridge.dto;

import com.weiwo.bridge.entity.DocumentRecord;
import com.weiwo.bridge.entity.ScriptProcessRecord;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class DashboardStatsResponse {
    /** 各状态数量，另含 total */
    private Map<String, Long> stats;
    private List<DocumentRecord> recentFails;
    private List<ScriptProcessRecord> recentRuns;
}
