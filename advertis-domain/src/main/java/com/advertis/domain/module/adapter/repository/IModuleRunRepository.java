package com.advertis.domain.module.adapter.repository;

import com.advertis.domain.module.model.entity.ModuleRunEntity;

import java.util.List;

/**
 * 模块运行记录仓储接口
 */
public interface IModuleRunRepository {

    /**
     * 保存运行记录
     */
    ModuleRunEntity save(ModuleRunEntity entity);

    /**
     * 根据 ID 查询
     */
    ModuleRunEntity findById(Long id);

    /**
     * 查询策略下某模块最近一次成功的运行，不存在时返回 null
     */
    ModuleRunEntity findLatestComplete(Long strategyId, String moduleId);

    /**
     * 查询策略的运行历史，最新的在前；moduleId 为 null 时不过滤
     */
    List<ModuleRunEntity> findByStrategyId(Long strategyId, String moduleId, int limit);

    /**
     * 更新运行记录，仅对未进入终态的记录生效
     *
     * @return 是否更新成功
     */
    boolean update(ModuleRunEntity entity);
}
