package com.advertis.infrastructure.dao;

import com.advertis.infrastructure.dao.po.ModuleRunPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 模块运行记录 DAO
 */
@Mapper
public interface ModuleRunDao {

    /**
     * 插入运行记录
     */
    int insert(ModuleRunPO po);

    /**
     * 更新运行记录，仅对 pending/running 状态生效
     */
    int updateIfOpen(ModuleRunPO po);

    /**
     * 根据 ID 查询
     */
    ModuleRunPO selectById(@Param("id") Long id);

    /**
     * 查询策略下某模块最近一次成功的运行
     */
    ModuleRunPO selectLatestComplete(@Param("strategyId") Long strategyId, @Param("moduleId") String moduleId);

    /**
     * 查询策略的运行历史，按创建时间降序
     */
    List<ModuleRunPO> selectByStrategyId(@Param("strategyId") Long strategyId,
                                         @Param("moduleId") String moduleId,
                                         @Param("limit") Integer limit);
}
