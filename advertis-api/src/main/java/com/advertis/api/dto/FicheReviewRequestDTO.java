package com.advertis.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * Fiche 审阅确认请求 DTO：保存修订后的问卷答案并推进到 audit-r。
 */
@Data
public class FicheReviewRequestDTO {

    private Map<String, String> answers;
}
