package com.advertis.domain.strategy.adapter.repository;

import com.advertis.domain.strategy.model.entity.SlotEntity;
import com.advertis.types.enums.SlotTypeEnum;

import java.util.List;

/**
 * 槽位仓储接口
 */
public interface ISlotRepository {

    /**
     * 保存槽位
     */
    SlotEntity save(SlotEntity entity);

    /**
     * 根据 ID 查询
     */
    SlotEntity findById(Long id);

    /**
     * 查询策略的全部槽位，按槽位类型顺序排列
     */
    List<SlotEntity> findByStrategyId(Long strategyId);

    /**
     * 根据策略 ID 和槽位类型查询
     */
    SlotEntity findByStrategyIdAndType(Long strategyId, SlotTypeEnum type);

    /**
     * 更新槽位 (带乐观锁)，版本不符时抛出 CONFLICT 异常
     */
    SlotEntity update(SlotEntity entity);
}
