package com.advertis.infrastructure.repository.strategy;

import com.advertis.domain.strategy.adapter.repository.ISlotRepository;
import com.advertis.domain.strategy.model.entity.SlotEntity;
import com.advertis.infrastructure.dao.SlotDao;
import com.advertis.infrastructure.dao.po.SlotPO;
import com.advertis.infrastructure.util.JsonCodec;
import com.advertis.types.enums.ResponseCode;
import com.advertis.types.enums.SlotStatusEnum;
import com.advertis.types.enums.SlotTypeEnum;
import com.advertis.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 槽位仓储实现类。
 * <p>
 * 内容以 JSONB 存储；更新带乐观锁，版本不符时抛出 CONFLICT。
 * </p>
 */
@Slf4j
@Repository
public class SlotRepositoryImpl implements ISlotRepository {

    private final SlotDao slotDao;
    private final JsonCodec jsonCodec;

    public SlotRepositoryImpl(SlotDao slotDao, JsonCodec jsonCodec) {
        this.slotDao = slotDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public SlotEntity save(SlotEntity entity) {
        entity.validate();
        SlotPO po = toPO(entity);
        slotDao.insert(po);
        return toEntity(po);
    }

    @Override
    public SlotEntity findById(Long id) {
        SlotPO po = slotDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<SlotEntity> findByStrategyId(Long strategyId) {
        return slotDao.selectByStrategyId(strategyId).stream()
                .map(this::toEntity)
                .sorted(Comparator.comparing(slot -> slot.getType().ordinal()))
                .collect(Collectors.toList());
    }

    @Override
    public SlotEntity findByStrategyIdAndType(Long strategyId, SlotTypeEnum type) {
        SlotPO po = slotDao.selectByStrategyIdAndType(strategyId, type.getCode());
        return po != null ? toEntity(po) : null;
    }

    @Override
    public SlotEntity update(SlotEntity entity) {
        entity.validate();
        Integer oldVersion = entity.getVersion();
        if (oldVersion == null) {
            throw new IllegalStateException("Version cannot be null for slot update: " + entity.getId());
        }
        SlotPO po = toPO(entity);
        int affected = slotDao.updateWithVersion(po);
        if (affected == 0) {
            throw new AppException(ResponseCode.CONFLICT.getCode(), "Optimistic lock failed for slot: " + entity.getId());
        }
        entity.setVersion(oldVersion + 1);
        return toEntity(toPO(entity));
    }

    /**
     * PO 转换为 Entity
     */
    private SlotEntity toEntity(SlotPO po) {
        SlotEntity entity = new SlotEntity();
        entity.setId(po.getId());
        entity.setStrategyId(po.getStrategyId());
        entity.setType(SlotTypeEnum.fromCode(po.getType()));
        entity.setStatus(SlotStatusEnum.fromCode(po.getStatus()));
        entity.setContent(jsonCodec.readTree(po.getContent()));
        entity.setVersion(po.getVersion());
        entity.setErrorMessage(po.getErrorMessage());
        entity.setGeneratedAt(po.getGeneratedAt());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    /**
     * Entity 转换为 PO
     */
    private SlotPO toPO(SlotEntity entity) {
        return SlotPO.builder()
                .id(entity.getId())
                .strategyId(entity.getStrategyId())
                .type(entity.getType() != null ? entity.getType().getCode() : null)
                .status(entity.getStatus() != null ? entity.getStatus().getCode() : null)
                .content(jsonCodec.writeValue(entity.getContent()))
                .version(entity.getVersion())
                .errorMessage(entity.getErrorMessage())
                .generatedAt(entity.getGeneratedAt())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
