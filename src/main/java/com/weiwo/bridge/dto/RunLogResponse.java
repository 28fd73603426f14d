package com.weiwo.bridge.dto;

import com.weiwo.bridge.entity.ScriptProcessRecord;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class RunLogResponse {
    private List<ScriptProcessRecord> logs;
}
