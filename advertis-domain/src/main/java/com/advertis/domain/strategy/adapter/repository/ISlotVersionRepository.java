package com.advertis.domain.strategy.adapter.repository;

import com.advertis.domain.strategy.model.entity.SlotVersionEntity;

import java.util.List;

/**
 * 槽位历史版本仓储接口
 */
public interface ISlotVersionRepository {

    SlotVersionEntity save(SlotVersionEntity entity);

    SlotVersionEntity findById(Long id);

    /**
     * 查询槽位的历史版本，最新的在前
     */
    List<SlotVersionEntity> findBySlotId(Long slotId);
}
