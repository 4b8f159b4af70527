package com.advertis.domain.strategy.service;

import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.advertis.types.enums.PhaseEnum;
import com.advertis.types.enums.ResponseCode;
import com.advertis.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 阶段迁移领域服务：校验前进、回退与指定阶段前置条件，并在实体上执行迁移。
 * <p>
 * 前进时目标必须在当前阶段之后，中间跨过的阶段必须全部可跳过；回退时目标必须在当前阶段之前，
 * 回退只移动阶段指针，不删除任何槽位内容。
 * </p>
 */
@Service
public class PhaseTransitionDomainService {

    /**
     * 解析策略当前阶段，历史编码已映射；未知编码视为非法迁移。
     */
    public PhaseEnum resolveCurrent(StrategyEntity strategy) {
        PhaseEnum current = strategy.resolvePhase();
        if (current == null) {
            throw rejection("当前阶段未知：" + strategy.getPhase());
        }
        return current;
    }

    public void validateAdvance(PhaseEnum current, PhaseEnum target) {
        if (target.ordinal() <= current.ordinal()) {
            throw rejection("无法从阶段 " + current.getCode() + " 前进到 " + target.getCode() + "：目标阶段必须在当前阶段之后");
        }
        for (PhaseEnum skipped : phasesBetween(current, target)) {
            if (!skipped.isSkippable()) {
                throw rejection("无法直接跳到阶段 " + target.getCode() + "，请先完成阶段 " + skipped.getCode());
            }
        }
    }

    public void validateRevert(PhaseEnum current, PhaseEnum target) {
        if (target.ordinal() >= current.ordinal()) {
            throw rejection("无法回退到阶段 " + target.getCode() + "：策略已处于阶段 " + current.getCode() + " 或更早");
        }
    }

    /**
     * 组合操作要求策略恰好处于指定阶段。
     */
    public void requirePhase(PhaseEnum current, PhaseEnum expected) {
        if (current != expected) {
            throw rejection("策略必须处于阶段 " + expected.getCode() + "，当前阶段为 " + current.getCode());
        }
    }

    /**
     * 严格位于 from 与 to 之间的阶段。
     */
    public List<PhaseEnum> phasesBetween(PhaseEnum from, PhaseEnum to) {
        List<PhaseEnum> between = new ArrayList<>();
        for (PhaseEnum phase : PhaseEnum.values()) {
            if (phase.ordinal() > from.ordinal() && phase.ordinal() < to.ordinal()) {
                between.add(phase);
            }
        }
        return between;
    }

    /**
     * 校验并在实体上执行前进。
     *
     * @return 迁移前的阶段
     */
    public PhaseEnum advance(StrategyEntity strategy, PhaseEnum target) {
        PhaseEnum current = resolveCurrent(strategy);
        validateAdvance(current, target);
        strategy.advanceTo(target);
        return current;
    }

    /**
     * 校验并在实体上执行回退。
     *
     * @return 迁移前的阶段
     */
    public PhaseEnum revert(StrategyEntity strategy, PhaseEnum target) {
        PhaseEnum current = resolveCurrent(strategy);
        validateRevert(current, target);
        strategy.revertTo(target);
        return current;
    }

    private AppException rejection(String message) {
        return new AppException(ResponseCode.INVALID_TRANSITION.getCode(), message);
    }
}
