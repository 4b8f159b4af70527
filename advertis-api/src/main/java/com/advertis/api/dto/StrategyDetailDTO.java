package com.advertis.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 策略详情 DTO，槽位内容均已经过解析补全。
 */
@Data
public class StrategyDetailDTO {

    private Long strategyId;
    private String userId;
    private String name;
    private String description;
    private String sector;
    private String phase;
    private String status;
    private Map<String, String> answers;
    private List<SlotContentDTO> slots;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
