package com.advertis.api.dto;

import lombok.Data;

/**
 * 阶段迁移结果 DTO。
 */
@Data
public class PhaseTransitionResponseDTO {

    private Long strategyId;
    private String fromPhase;
    private String toPhase;
    private String status;
}
