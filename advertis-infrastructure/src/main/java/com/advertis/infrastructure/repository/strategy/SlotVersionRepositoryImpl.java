package com.advertis.infrastructure.repository.strategy;

import com.advertis.domain.strategy.adapter.repository.ISlotVersionRepository;
import com.advertis.domain.strategy.model.entity.SlotVersionEntity;
import com.advertis.infrastructure.dao.SlotVersionDao;
import com.advertis.infrastructure.dao.po.SlotVersionPO;
import com.advertis.infrastructure.util.JsonCodec;
import com.advertis.types.enums.SlotVersionSourceEnum;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 槽位历史版本仓储实现类（只增不改）。
 */
@Repository
public class SlotVersionRepositoryImpl implements ISlotVersionRepository {

    private final SlotVersionDao slotVersionDao;
    private final JsonCodec jsonCodec;

    public SlotVersionRepositoryImpl(SlotVersionDao slotVersionDao, JsonCodec jsonCodec) {
        this.slotVersionDao = slotVersionDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public SlotVersionEntity save(SlotVersionEntity entity) {
        SlotVersionPO po = toPO(entity);
        slotVersionDao.insert(po);
        return toEntity(po);
    }

    @Override
    public SlotVersionEntity findById(Long id) {
        SlotVersionPO po = slotVersionDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<SlotVersionEntity> findBySlotId(Long slotId) {
        return slotVersionDao.selectBySlotId(slotId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private SlotVersionEntity toEntity(SlotVersionPO po) {
        SlotVersionEntity entity = new SlotVersionEntity();
        entity.setId(po.getId());
        entity.setSlotId(po.getSlotId());
        entity.setVersion(po.getVersion());
        entity.setContent(jsonCodec.readTree(po.getContent()));
        entity.setSource(SlotVersionSourceEnum.fromCode(po.getSource()));
        entity.setCreatedBy(po.getCreatedBy());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private SlotVersionPO toPO(SlotVersionEntity entity) {
        return SlotVersionPO.builder()
                .id(entity.getId())
                .slotId(entity.getSlotId())
                .version(entity.getVersion())
                .content(jsonCodec.writeValue(entity.getContent()))
                .source(entity.getSource() != null ? entity.getSource().getCode() : null)
                .createdBy(entity.getCreatedBy())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
