package com.advertis.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 槽位历史版本 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotVersionPO {

    private Long id;

    /**
     * 槽位 ID (关联 slot.id)
     */
    private Long slotId;

    private Integer version;

    /**
     * 内容快照 (JSONB)
     */
    private String content;

    private String source;

    private String createdBy;

    private LocalDateTime createdAt;
}
