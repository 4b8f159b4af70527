package com.advertis.api.dto;

import lombok.Data;

/**
 * 阶段推进/回退请求 DTO。
 */
@Data
public class PhaseTransitionRequestDTO {

    private String targetPhase;
}
