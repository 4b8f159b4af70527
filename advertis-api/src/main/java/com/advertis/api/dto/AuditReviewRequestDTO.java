package com.advertis.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * 审计审阅确认请求 DTO：保存修订后的 R、T 槽位内容并推进到 implementation。
 */
@Data
public class AuditReviewRequestDTO {

    private JsonNode riskContent;
    private JsonNode trackContent;
}
