package com.advertis.infrastructure.dao;

import com.advertis.infrastructure.dao.po.StrategyPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 策略 DAO
 */
@Mapper
public interface StrategyDao {

    /**
     * 插入策略
     */
    int insert(StrategyPO po);

    /**
     * 根据 ID 查询
     */
    StrategyPO selectById(@Param("id") Long id);

    /**
     * 比较并更新阶段 (phase = expectedPhase 时才写入)
     */
    int updatePhaseIfMatch(@Param("id") Long id,
                           @Param("expectedPhase") String expectedPhase,
                           @Param("targetPhase") String targetPhase,
                           @Param("status") String status);

    /**
     * 更新问卷答案
     */
    int updateAnswers(@Param("id") Long id, @Param("answers") String answers);
}
