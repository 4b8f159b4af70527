package com.advertis.test.support;

import com.advertis.domain.strategy.adapter.repository.IMarketStudyRepository;
import com.advertis.domain.strategy.model.entity.MarketStudyEntity;

import java.util.HashMap;
import java.util.Map;

/**
 * 内存市场研究仓储，每个策略只保留最新一条。
 */
public class InMemoryMarketStudyRepository implements IMarketStudyRepository {

    private final Map<Long, MarketStudyEntity> latest = new HashMap<>();

    public void put(MarketStudyEntity entity) {
        latest.put(entity.getStrategyId(), entity);
    }

    @Override
    public MarketStudyEntity findLatestByStrategyId(Long strategyId) {
        return latest.get(strategyId);
    }
}
