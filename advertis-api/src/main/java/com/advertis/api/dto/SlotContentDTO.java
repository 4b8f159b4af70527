package com.advertis.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 槽位内容 DTO。
 * <p>
 * content 始终是结构完整的文档；parseSuccess=false 时 parseErrors 给出诊断信息。
 * </p>
 */
@Data
public class SlotContentDTO {

    private Long slotId;
    private String type;
    private String title;
    private String status;
    private Integer version;
    private JsonNode content;
    private Boolean parseSuccess;
    private List<String> parseErrors;
    private String errorMessage;
    private LocalDateTime generatedAt;
    private LocalDateTime updatedAt;
}
