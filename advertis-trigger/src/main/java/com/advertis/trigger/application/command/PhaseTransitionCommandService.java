package com.advertis.trigger.application.command;

import com.advertis.api.dto.AuditReviewRequestDTO;
import com.advertis.api.dto.FicheReviewRequestDTO;
import com.advertis.api.dto.PhaseTransitionResponseDTO;
import com.advertis.domain.content.model.valobj.SlotValidationResult;
import com.advertis.domain.content.service.SlotContentParser;
import com.advertis.domain.strategy.adapter.repository.ISlotRepository;
import com.advertis.domain.strategy.adapter.repository.ISlotVersionRepository;
import com.advertis.domain.strategy.adapter.repository.IStrategyRepository;
import com.advertis.domain.strategy.model.entity.SlotEntity;
import com.advertis.domain.strategy.model.entity.SlotVersionEntity;
import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.advertis.domain.strategy.service.PhaseTransitionDomainService;
import com.advertis.trigger.application.common.StrategyAccessGuard;
import com.advertis.types.common.Constants;
import com.advertis.types.enums.PhaseEnum;
import com.advertis.types.enums.ResponseCode;
import com.advertis.types.enums.SlotStatusEnum;
import com.advertis.types.enums.SlotTypeEnum;
import com.advertis.types.enums.SlotVersionSourceEnum;
import com.advertis.types.exception.AppException;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.function.Supplier;

/**
 * 阶段迁移写用例：前进、回退，以及 fiche / audit 两个审阅阶段的组合确认。
 * <p>
 * 阶段写入以读取时的存储编码做比较并更新，并发迁移中落败的一方返回 CONFLICT，不做任何修改。
 * 组合操作的内容写入与阶段迁移处于同一事务。
 * </p>
 */
@Slf4j
@Service
public class PhaseTransitionCommandService {

    private static final String METRIC_TRANSITION_TOTAL = "advertis.phase.transition.total";

    private final IStrategyRepository strategyRepository;
    private final ISlotRepository slotRepository;
    private final ISlotVersionRepository slotVersionRepository;
    private final PhaseTransitionDomainService phaseTransitionDomainService;
    private final SlotContentParser slotContentParser;
    private final StrategyAccessGuard strategyAccessGuard;

    public PhaseTransitionCommandService(IStrategyRepository strategyRepository,
                                         ISlotRepository slotRepository,
                                         ISlotVersionRepository slotVersionRepository,
                                         PhaseTransitionDomainService phaseTransitionDomainService,
                                         SlotContentParser slotContentParser,
                                         StrategyAccessGuard strategyAccessGuard) {
        this.strategyRepository = strategyRepository;
        this.slotRepository = slotRepository;
        this.slotVersionRepository = slotVersionRepository;
        this.phaseTransitionDomainService = phaseTransitionDomainService;
        this.slotContentParser = slotContentParser;
        this.strategyAccessGuard = strategyAccessGuard;
    }

    @Transactional(rollbackFor = Exception.class)
    public PhaseTransitionResponseDTO advance(Long strategyId, String userId, String targetPhase) {
        return recorded("advance", () -> {
            StrategyEntity strategy = strategyAccessGuard.requireOwned(strategyId, userId);
            PhaseEnum target = parseTarget(targetPhase);
            String storedPhase = strategy.getPhase();
            PhaseEnum from = phaseTransitionDomainService.advance(strategy, target);
            persistPhase(strategy, storedPhase);
            log.info("Strategy phase advanced. strategyId: {}, from: {}, to: {}", strategyId, from.getCode(), target.getCode());
            return toResponse(strategy, from);
        });
    }

    @Transactional(rollbackFor = Exception.class)
    public PhaseTransitionResponseDTO revert(Long strategyId, String userId, String targetPhase) {
        return recorded("revert", () -> {
            StrategyEntity strategy = strategyAccessGuard.requireOwned(strategyId, userId);
            PhaseEnum target = parseTarget(targetPhase);
            String storedPhase = strategy.getPhase();
            PhaseEnum from = phaseTransitionDomainService.revert(strategy, target);
            persistPhase(strategy, storedPhase);
            log.info("Strategy phase reverted. strategyId: {}, from: {}, to: {}", strategyId, from.getCode(), target.getCode());
            return toResponse(strategy, from);
        });
    }

    /**
     * 保存问卷答案并从 fiche-review 前进到 audit-r。
     */
    @Transactional(rollbackFor = Exception.class)
    public PhaseTransitionResponseDTO validateFicheReview(Long strategyId, String userId, FicheReviewRequestDTO request) {
        return recorded("validate-fiche-review", () -> {
            StrategyEntity strategy = strategyAccessGuard.requireOwned(strategyId, userId);
            String storedPhase = strategy.getPhase();
            phaseTransitionDomainService.requirePhase(phaseTransitionDomainService.resolveCurrent(strategy), PhaseEnum.FICHE_REVIEW);

            Map<String, String> answers = request == null ? null : request.getAnswers();
            if (answers == null) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "answers 不能为空");
            }
            for (String key : answers.keySet()) {
                if (!Constants.isKnownAnswerKey(key)) {
                    throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "未知的问卷答案键: " + key);
                }
            }
            strategy.replaceAnswers(answers);
            strategyRepository.updateAnswers(strategyId, strategy.getAnswers());

            PhaseEnum from = phaseTransitionDomainService.advance(strategy, PhaseEnum.AUDIT_R);
            persistPhase(strategy, storedPhase);
            log.info("Fiche review validated. strategyId: {}, answers: {}", strategyId, answers.size());
            return toResponse(strategy, from);
        });
    }

    /**
     * 保存审阅后的 R、T 槽位内容并从 audit-review 前进到 implementation。
     */
    @Transactional(rollbackFor = Exception.class)
    public PhaseTransitionResponseDTO validateAuditReview(Long strategyId, String userId, AuditReviewRequestDTO request) {
        return recorded("validate-audit-review", () -> {
            StrategyEntity strategy = strategyAccessGuard.requireOwned(strategyId, userId);
            String storedPhase = strategy.getPhase();
            phaseTransitionDomainService.requirePhase(phaseTransitionDomainService.resolveCurrent(strategy), PhaseEnum.AUDIT_REVIEW);

            JsonNode riskContent = request == null ? null : request.getRiskContent();
            JsonNode trackContent = request == null ? null : request.getTrackContent();
            requireObject(riskContent, "riskContent");
            requireObject(trackContent, "trackContent");

            writeReviewed(strategyId, SlotTypeEnum.R, riskContent, userId);
            writeReviewed(strategyId, SlotTypeEnum.T, trackContent, userId);

            PhaseEnum from = phaseTransitionDomainService.advance(strategy, PhaseEnum.IMPLEMENTATION);
            persistPhase(strategy, storedPhase);
            log.info("Audit review validated. strategyId: {}", strategyId);
            return toResponse(strategy, from);
        });
    }

    private void writeReviewed(Long strategyId, SlotTypeEnum type, JsonNode content, String userId) {
        SlotEntity slot = strategyAccessGuard.requireSlot(strategyId, type);
        SlotValidationResult validation = slotContentParser.validateForSave(type, content);
        if (!validation.valid()) {
            log.warn("Reviewed slot content failed validation, saving anyway. strategyId: {}, slot: {}, errors: {}",
                    strategyId, type.getCode(), validation.errors());
        }
        if (slot.hasContent()) {
            slotVersionRepository.save(SlotVersionEntity.snapshotOf(slot, SlotVersionSourceEnum.REVIEW, userId));
        }
        slot.writeContent(content.deepCopy(), SlotStatusEnum.COMPLETE);
        slotRepository.update(slot);
    }

    private void persistPhase(StrategyEntity strategy, String expectedPhase) {
        boolean updated = strategyRepository.updatePhase(strategy.getId(), expectedPhase, strategy.getPhase(), strategy.getStatus());
        if (!updated) {
            throw new AppException(ResponseCode.CONFLICT.getCode(), "策略阶段已被并发修改，请刷新后重试");
        }
    }

    private PhaseEnum parseTarget(String targetPhase) {
        if (StringUtils.isBlank(targetPhase)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "targetPhase 不能为空");
        }
        try {
            return PhaseEnum.fromCode(targetPhase.trim());
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "未知的阶段: " + targetPhase, ex);
        }
    }

    private void requireObject(JsonNode content, String field) {
        if (content == null || !content.isObject()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), field + " 必须为 JSON 对象");
        }
    }

    private PhaseTransitionResponseDTO toResponse(StrategyEntity strategy, PhaseEnum from) {
        PhaseTransitionResponseDTO dto = new PhaseTransitionResponseDTO();
        dto.setStrategyId(strategy.getId());
        dto.setFromPhase(from.getCode());
        dto.setToPhase(strategy.getPhase());
        dto.setStatus(strategy.getStatus() == null ? null : strategy.getStatus().getCode());
        return dto;
    }

    private PhaseTransitionResponseDTO recorded(String kind, Supplier<PhaseTransitionResponseDTO> action) {
        try {
            PhaseTransitionResponseDTO response = action.get();
            increment(kind, "success");
            return response;
        } catch (AppException ex) {
            increment(kind, "rejected_" + ex.getCode());
            throw ex;
        }
    }

    private void increment(String kind, String outcome) {
        Counter.builder(METRIC_TRANSITION_TOTAL)
                .tag("kind", kind)
                .tag("outcome", outcome)
                .register(Metrics.globalRegistry)
                .increment();
    }
}
