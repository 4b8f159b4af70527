package com.advertis.infrastructure.repository.strategy;

import com.advertis.domain.strategy.adapter.repository.IMarketStudyRepository;
import com.advertis.domain.strategy.model.entity.MarketStudyEntity;
import com.advertis.infrastructure.dao.MarketStudyDao;
import com.advertis.infrastructure.dao.po.MarketStudyPO;
import com.advertis.infrastructure.util.JsonCodec;
import org.springframework.stereotype.Repository;

/**
 * 市场研究仓储实现类（只读）。
 */
@Repository
public class MarketStudyRepositoryImpl implements IMarketStudyRepository {

    private final MarketStudyDao marketStudyDao;
    private final JsonCodec jsonCodec;

    public MarketStudyRepositoryImpl(MarketStudyDao marketStudyDao, JsonCodec jsonCodec) {
        this.marketStudyDao = marketStudyDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public MarketStudyEntity findLatestByStrategyId(Long strategyId) {
        MarketStudyPO po = marketStudyDao.selectLatestByStrategyId(strategyId);
        if (po == null) {
            return null;
        }
        MarketStudyEntity entity = new MarketStudyEntity();
        entity.setId(po.getId());
        entity.setStrategyId(po.getStrategyId());
        entity.setStatus(po.getStatus());
        entity.setData(jsonCodec.readMap(po.getData()));
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
