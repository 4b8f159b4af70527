package com.advertis.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 槽位历史版本 DTO。
 */
@Data
public class SlotVersionDTO {

    private Long versionId;
    private Long slotId;
    private Integer version;
    private JsonNode content;
    private String source;
    private String createdBy;
    private LocalDateTime createdAt;
}
