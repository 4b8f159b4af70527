package com.advertis.infrastructure.repository.strategy;

import com.advertis.domain.strategy.adapter.repository.IStrategyRepository;
import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.advertis.infrastructure.dao.StrategyDao;
import com.advertis.infrastructure.dao.po.StrategyPO;
import com.advertis.infrastructure.util.JsonCodec;
import com.advertis.types.enums.StrategyStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 策略仓储实现类。
 * <p>
 * 阶段更新采用比较并写入：只有库中阶段仍为调用方读到的阶段时才生效。
 * 问卷答案以 JSONB 存储。
 * </p>
 */
@Slf4j
@Repository
public class StrategyRepositoryImpl implements IStrategyRepository {

    private final StrategyDao strategyDao;
    private final JsonCodec jsonCodec;

    public StrategyRepositoryImpl(StrategyDao strategyDao, JsonCodec jsonCodec) {
        this.strategyDao = strategyDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public StrategyEntity save(StrategyEntity entity) {
        entity.validate();
        StrategyPO po = toPO(entity);
        strategyDao.insert(po);
        return toEntity(po);
    }

    @Override
    public StrategyEntity findById(Long id) {
        StrategyPO po = strategyDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public boolean updatePhase(Long id, String expectedPhase, String targetPhase, StrategyStatusEnum status) {
        int affected = strategyDao.updatePhaseIfMatch(id, expectedPhase, targetPhase, status.getCode());
        if (affected == 0) {
            log.warn("Phase compare-and-set missed. strategyId: {}, expectedPhase: {}, targetPhase: {}",
                    id, expectedPhase, targetPhase);
        }
        return affected > 0;
    }

    @Override
    public boolean updateAnswers(Long id, Map<String, String> answers) {
        return strategyDao.updateAnswers(id, jsonCodec.writeValue(answers == null ? Map.of() : answers)) > 0;
    }

    /**
     * PO 转换为 Entity
     */
    private StrategyEntity toEntity(StrategyPO po) {
        StrategyEntity entity = new StrategyEntity();
        entity.setId(po.getId());
        entity.setUserId(po.getUserId());
        entity.setName(po.getName());
        entity.setDescription(po.getDescription());
        entity.setSector(po.getSector());
        entity.setPhase(po.getPhase());
        entity.setStatus(StrategyStatusEnum.fromCode(po.getStatus()));
        Map<String, String> answers = jsonCodec.readStringMap(po.getAnswers());
        entity.setAnswers(answers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(answers));
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    /**
     * Entity 转换为 PO
     */
    private StrategyPO toPO(StrategyEntity entity) {
        return StrategyPO.builder()
                .id(entity.getId())
                .userId(entity.getUserId())
                .name(entity.getName())
                .description(entity.getDescription())
                .sector(entity.getSector())
                .phase(entity.getPhase())
                .status(entity.getStatus() != null ? entity.getStatus().getCode() : null)
                .answers(jsonCodec.writeValue(entity.getAnswers() == null ? Map.of() : entity.getAnswers()))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
