package com.advertis.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 流水线阶段 DTO。
 */
@Data
public class PhaseDTO {

    private String code;
    private String title;
    private Integer order;
    private Boolean skippable;
    private List<String> slotTypes;
}
