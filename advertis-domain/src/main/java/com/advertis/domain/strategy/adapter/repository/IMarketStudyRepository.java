package com.advertis.domain.strategy.adapter.repository;

import com.advertis.domain.strategy.model.entity.MarketStudyEntity;

/**
 * 市场研究仓储接口（只读）
 */
public interface IMarketStudyRepository {

    /**
     * 查询策略最新的市场研究记录，不存在时返回 null
     */
    MarketStudyEntity findLatestByStrategyId(Long strategyId);
}
