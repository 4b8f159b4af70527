package com.advertis.infrastructure.dao;

import com.advertis.infrastructure.dao.po.SlotPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 槽位 DAO
 */
@Mapper
public interface SlotDao {

    /**
     * 插入槽位
     */
    int insert(SlotPO po);

    /**
     * 根据 ID 更新 (带乐观锁)
     */
    int updateWithVersion(SlotPO po);

    /**
     * 根据 ID 查询
     */
    SlotPO selectById(@Param("id") Long id);

    /**
     * 根据策略 ID 查询
     */
    List<SlotPO> selectByStrategyId(@Param("strategyId") Long strategyId);

    /**
     * 根据策略 ID 和槽位类型查询
     */
    SlotPO selectByStrategyIdAndType(@Param("strategyId") Long strategyId, @Param("type") String type);
}
