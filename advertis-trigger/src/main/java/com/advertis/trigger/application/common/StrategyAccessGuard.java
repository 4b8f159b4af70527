package com.advertis.trigger.application.common;

import com.advertis.domain.strategy.adapter.repository.ISlotRepository;
import com.advertis.domain.strategy.adapter.repository.IStrategyRepository;
import com.advertis.domain.strategy.model.entity.SlotEntity;
import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.advertis.types.enums.ResponseCode;
import com.advertis.types.enums.SlotTypeEnum;
import com.advertis.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * 策略归属校验：策略不存在与不属于调用方统一报告为资源不存在。
 */
@Component
public class StrategyAccessGuard {

    private final IStrategyRepository strategyRepository;
    private final ISlotRepository slotRepository;

    public StrategyAccessGuard(IStrategyRepository strategyRepository, ISlotRepository slotRepository) {
        this.strategyRepository = strategyRepository;
        this.slotRepository = slotRepository;
    }

    public StrategyEntity requireOwned(Long strategyId, String userId) {
        if (StringUtils.isBlank(userId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "userId 不能为空");
        }
        if (strategyId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "strategyId 不能为空");
        }
        StrategyEntity strategy = strategyRepository.findById(strategyId);
        if (strategy == null || !strategy.isOwnedBy(userId)) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "策略不存在或无权访问");
        }
        return strategy;
    }

    public SlotEntity requireSlot(Long strategyId, SlotTypeEnum type) {
        SlotEntity slot = slotRepository.findByStrategyIdAndType(strategyId, type);
        if (slot == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "槽位不存在: " + type.getCode());
        }
        return slot;
    }

    public static SlotTypeEnum parseSlotType(String code) {
        if (StringUtils.isBlank(code)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "槽位类型不能为空");
        }
        try {
            return SlotTypeEnum.fromCode(code);
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "未知的槽位类型: " + code, ex);
        }
    }
}
