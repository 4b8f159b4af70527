package com.advertis.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * 槽位内容手动保存请求 DTO。
 */
@Data
public class SlotSaveRequestDTO {

    private JsonNode content;

    /**
     * 可选，保存后的槽位状态编码。
     */
    private String status;
}
