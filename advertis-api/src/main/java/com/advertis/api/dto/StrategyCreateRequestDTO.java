package com.advertis.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 策略创建请求 DTO。
 */
@Data
public class StrategyCreateRequestDTO {

    private String name;
    private String description;
    private String sector;
    private Map<String, String> answers;
}
