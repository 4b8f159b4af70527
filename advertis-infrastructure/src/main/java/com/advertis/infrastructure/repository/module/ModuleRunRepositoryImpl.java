package com.advertis.infrastructure.repository.module;

import com.advertis.domain.module.adapter.repository.IModuleRunRepository;
import com.advertis.domain.module.model.entity.ModuleRunEntity;
import com.advertis.infrastructure.dao.ModuleRunDao;
import com.advertis.infrastructure.dao.po.ModuleRunPO;
import com.advertis.infrastructure.util.JsonCodec;
import com.advertis.types.enums.ModuleRunStatusEnum;
import com.advertis.types.enums.ModuleTriggerEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 模块运行记录仓储实现类。
 * <p>
 * 输入快照与输出数据以 JSONB 存储；更新语句带状态条件，终态记录不会被改写。
 * </p>
 */
@Slf4j
@Repository
public class ModuleRunRepositoryImpl implements IModuleRunRepository {

    private final ModuleRunDao moduleRunDao;
    private final JsonCodec jsonCodec;

    public ModuleRunRepositoryImpl(ModuleRunDao moduleRunDao, JsonCodec jsonCodec) {
        this.moduleRunDao = moduleRunDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public ModuleRunEntity save(ModuleRunEntity entity) {
        entity.validate();
        ModuleRunPO po = toPO(entity);
        moduleRunDao.insert(po);
        return toEntity(po);
    }

    @Override
    public ModuleRunEntity findById(Long id) {
        ModuleRunPO po = moduleRunDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public ModuleRunEntity findLatestComplete(Long strategyId, String moduleId) {
        ModuleRunPO po = moduleRunDao.selectLatestComplete(strategyId, moduleId);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<ModuleRunEntity> findByStrategyId(Long strategyId, String moduleId, int limit) {
        return moduleRunDao.selectByStrategyId(strategyId, moduleId, limit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public boolean update(ModuleRunEntity entity) {
        entity.validate();
        int affected = moduleRunDao.updateIfOpen(toPO(entity));
        if (affected == 0) {
            log.warn("Module run update skipped, record missing or already final. runId: {}", entity.getId());
        }
        return affected > 0;
    }

    /**
     * PO 转换为 Entity
     */
    private ModuleRunEntity toEntity(ModuleRunPO po) {
        ModuleRunEntity entity = new ModuleRunEntity();
        entity.setId(po.getId());
        entity.setModuleId(po.getModuleId());
        entity.setStrategyId(po.getStrategyId());
        entity.setUserId(po.getUserId());
        entity.setStatus(ModuleRunStatusEnum.fromCode(po.getStatus()));
        entity.setTriggeredBy(ModuleTriggerEnum.fromCode(po.getTriggeredBy()));
        entity.setInputSnapshot(jsonCodec.readMap(po.getInputSnapshot()));
        entity.setOutputData(jsonCodec.readMap(po.getOutputData()));
        entity.setErrorMessage(po.getErrorMessage());
        entity.setDurationMs(po.getDurationMs());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    /**
     * Entity 转换为 PO
     */
    private ModuleRunPO toPO(ModuleRunEntity entity) {
        return ModuleRunPO.builder()
                .id(entity.getId())
                .moduleId(entity.getModuleId())
                .strategyId(entity.getStrategyId())
                .userId(entity.getUserId())
                .status(entity.getStatus() != null ? entity.getStatus().getCode() : null)
                .triggeredBy(entity.getTriggeredBy() != null ? entity.getTriggeredBy().getCode() : null)
                .inputSnapshot(jsonCodec.writeValue(entity.getInputSnapshot()))
                .outputData(jsonCodec.writeValue(entity.getOutputData()))
                .errorMessage(entity.getErrorMessage())
                .durationMs(entity.getDurationMs())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
