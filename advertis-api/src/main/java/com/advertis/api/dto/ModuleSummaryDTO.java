package com.advertis.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 模块目录条目 DTO。
 */
@Data
public class ModuleSummaryDTO {

    private String id;
    private String name;
    private String description;
    private String category;
    private Boolean autoTrigger;
    private List<String> inputs;
    private List<OutputTargetDTO> outputs;

    @Data
    public static class OutputTargetDTO {
        private String slotType;
        private String path;
        private String mergeStrategy;
    }
}
