package com.advertis.infrastructure.dao;

import com.advertis.infrastructure.dao.po.MarketStudyPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 市场研究 DAO (只读)
 */
@Mapper
public interface MarketStudyDao {

    /**
     * 查询策略最新的市场研究记录
     */
    MarketStudyPO selectLatestByStrategyId(@Param("strategyId") Long strategyId);
}
