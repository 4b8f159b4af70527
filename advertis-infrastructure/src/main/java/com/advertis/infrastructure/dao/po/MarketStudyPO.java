package com.advertis.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 市场研究 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketStudyPO {

    private Long id;

    private Long strategyId;

    private String status;

    /**
     * 研究数据 (JSONB)
     */
    private String data;

    private LocalDateTime createdAt;
}
