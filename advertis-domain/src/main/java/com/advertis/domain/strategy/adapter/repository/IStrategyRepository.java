package com.advertis.domain.strategy.adapter.repository;

import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.advertis.types.enums.StrategyStatusEnum;

import java.util.Map;

/**
 * 策略仓储接口
 */
public interface IStrategyRepository {

    /**
     * 保存策略
     */
    StrategyEntity save(StrategyEntity entity);

    /**
     * 根据 ID 查询
     */
    StrategyEntity findById(Long id);

    /**
     * 比较并更新阶段：仅当存储的阶段仍为 expectedPhase 时写入。
     *
     * @return 是否更新成功
     */
    boolean updatePhase(Long id, String expectedPhase, String targetPhase, StrategyStatusEnum status);

    /**
     * 更新问卷答案
     */
    boolean updateAnswers(Long id, Map<String, String> answers);
}
