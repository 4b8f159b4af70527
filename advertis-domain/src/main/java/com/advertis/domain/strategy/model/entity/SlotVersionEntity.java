package com.advertis.domain.strategy.model.entity;

import com.advertis.types.enums.SlotVersionSourceEnum;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 槽位历史版本快照（只增不改）。
 */
@Data
public class SlotVersionEntity {

    private Long id;

    private Long slotId;

    /**
     * 快照时槽位的版本号
     */
    private Integer version;

    private JsonNode content;

    private SlotVersionSourceEnum source;

    private String createdBy;

    private LocalDateTime createdAt;

    public static SlotVersionEntity snapshotOf(SlotEntity slot, SlotVersionSourceEnum source, String createdBy) {
        SlotVersionEntity entity = new SlotVersionEntity();
        entity.setSlotId(slot.getId());
        entity.setVersion(slot.getVersion());
        entity.setContent(slot.getContent() == null ? null : slot.getContent().deepCopy());
        entity.setSource(source);
        entity.setCreatedBy(createdBy);
        entity.setCreatedAt(LocalDateTime.now());
        return entity;
    }
}
