package com.weiwo.bridge.dto;

import com.weiwo.bridge.entity.DocumentRecord;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class DocumentPageResponse {
    private List<DocumentRecord> documents;
    private Long total;
    private Integer page;
    private Integer perPage;
}
