package com.advertis.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 模块运行记录 DTO。
 */
@Data
public class ModuleRunDTO {

    private Long runId;
    private String moduleId;
    private Long strategyId;
    private String userId;
    private String status;
    private String triggeredBy;
    private Map<String, Object> inputSnapshot;
    private Map<String, Object> outputData;
    private String errorMessage;
    private Long durationMs;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
