package com.advertis.api.dto;

import lombok.Data;

/**
 * 模块执行请求 DTO。
 */
@Data
public class ModuleExecuteRequestDTO {

    private Long strategyId;
}
