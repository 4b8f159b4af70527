package com.advertis.api.dto;

import lombok.Data;

/**
 * 模块执行结果 DTO。
 */
@Data
public class ModuleExecuteResponseDTO {

    private Boolean success;
    private Long runId;
    private String error;
}
