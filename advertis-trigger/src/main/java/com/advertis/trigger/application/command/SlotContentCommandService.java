package com.advertis.trigger.application.command;

import com.advertis.api.dto.SlotContentDTO;
import com.advertis.api.dto.SlotSaveRequestDTO;
import com.advertis.api.dto.SlotSaveResponseDTO;
import com.advertis.domain.content.model.valobj.ParseResult;
import com.advertis.domain.content.model.valobj.SlotDocument;
import com.advertis.domain.content.model.valobj.SlotValidationResult;
import com.advertis.domain.content.service.SlotContentParser;
import com.advertis.domain.content.service.SlotSchemaRegistry;
import com.advertis.domain.strategy.adapter.repository.ISlotRepository;
import com.advertis.domain.strategy.adapter.repository.ISlotVersionRepository;
import com.advertis.domain.strategy.model.entity.SlotEntity;
import com.advertis.domain.strategy.model.entity.SlotVersionEntity;
import com.advertis.trigger.application.common.StrategyAccessGuard;
import com.advertis.trigger.application.common.StrategyViewAssembler;
import com.advertis.types.enums.ResponseCode;
import com.advertis.types.enums.SlotStatusEnum;
import com.advertis.types.enums.SlotTypeEnum;
import com.advertis.types.enums.SlotVersionSourceEnum;
import com.advertis.types.exception.AppException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;

/**
 * 槽位内容写用例：手动保存、生成结果写入与历史版本恢复。
 * <p>
 * 每次覆盖前先把当前内容写入版本快照。保存时的校验只产生警告，不阻止写入。
 * 自动触发模块不在此处执行，由调用方在事务提交后另行分发。
 * </p>
 */
@Slf4j
@Service
public class SlotContentCommandService {

    private final ISlotRepository slotRepository;
    private final ISlotVersionRepository slotVersionRepository;
    private final SlotContentParser slotContentParser;
    private final SlotSchemaRegistry slotSchemaRegistry;
    private final StrategyAccessGuard strategyAccessGuard;
    private final StrategyViewAssembler strategyViewAssembler;

    public SlotContentCommandService(ISlotRepository slotRepository,
                                     ISlotVersionRepository slotVersionRepository,
                                     SlotContentParser slotContentParser,
                                     SlotSchemaRegistry slotSchemaRegistry,
                                     StrategyAccessGuard strategyAccessGuard,
                                     StrategyViewAssembler strategyViewAssembler) {
        this.slotRepository = slotRepository;
        this.slotVersionRepository = slotVersionRepository;
        this.slotContentParser = slotContentParser;
        this.slotSchemaRegistry = slotSchemaRegistry;
        this.strategyAccessGuard = strategyAccessGuard;
        this.strategyViewAssembler = strategyViewAssembler;
    }

    @Transactional(rollbackFor = Exception.class)
    public SlotSaveResponseDTO save(Long strategyId, String userId, String slotType, SlotSaveRequestDTO request) {
        strategyAccessGuard.requireOwned(strategyId, userId);
        SlotTypeEnum type = StrategyAccessGuard.parseSlotType(slotType);
        JsonNode content = request == null ? null : request.getContent();
        if (content == null || content.isNull() || content.isMissingNode()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "content 不能为空");
        }
        SlotStatusEnum status = parseStatus(request.getStatus());
        SlotEntity slot = strategyAccessGuard.requireSlot(strategyId, type);

        SlotValidationResult validation = slotContentParser.validateForSave(type, content);
        if (!validation.valid()) {
            log.warn("Slot content saved with validation warnings. strategyId: {}, slot: {}, warnings: {}",
                    strategyId, type.getCode(), validation.errors());
        }

        snapshot(slot, SlotVersionSourceEnum.MANUAL_EDIT, userId);
        slot.writeContent(content.deepCopy(), status);
        SlotEntity updated = slotRepository.update(slot);

        SlotSaveResponseDTO dto = new SlotSaveResponseDTO();
        dto.setSlotId(updated.getId());
        dto.setType(type.getCode());
        dto.setVersion(updated.getVersion());
        dto.setStatus(updated.getStatus().getCode());
        dto.setValid(validation.valid());
        dto.setWarnings(new ArrayList<>(validation.errors()));
        dto.setAutoTriggeredRunIds(new ArrayList<>());
        return dto;
    }

    /**
     * 写入文本生成服务返回的原始文本；解析不完全成功时诊断信息记入 errorMessage。
     */
    @Transactional(rollbackFor = Exception.class)
    public SlotContentDTO ingestGenerated(Long strategyId, String userId, String slotType, String text) {
        strategyAccessGuard.requireOwned(strategyId, userId);
        SlotTypeEnum type = StrategyAccessGuard.parseSlotType(slotType);
        if (StringUtils.isBlank(text)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "text 不能为空");
        }
        SlotEntity slot = strategyAccessGuard.requireSlot(strategyId, type);

        ParseResult<SlotDocument> parsed = slotContentParser.parseGenerated(type, text);
        String diagnostics = parsed.success() ? null : StringUtils.abbreviate(String.join("; ", parsed.errors()), 2000);
        if (!parsed.success()) {
            log.warn("Generated slot content was repaired. strategyId: {}, slot: {}, errors: {}",
                    strategyId, type.getCode(), parsed.errors().size());
        }

        snapshot(slot, SlotVersionSourceEnum.GENERATION, userId);
        slot.markGenerated(slotSchemaRegistry.toTree(parsed.data()), diagnostics);
        return strategyViewAssembler.toSlotContentDTO(slotRepository.update(slot));
    }

    /**
     * 恢复历史版本：先快照当前内容，再写入所选版本的内容，状态保持不变。
     */
    @Transactional(rollbackFor = Exception.class)
    public SlotContentDTO restore(Long strategyId, String userId, String slotType, Long versionId) {
        strategyAccessGuard.requireOwned(strategyId, userId);
        SlotTypeEnum type = StrategyAccessGuard.parseSlotType(slotType);
        SlotEntity slot = strategyAccessGuard.requireSlot(strategyId, type);

        SlotVersionEntity version = versionId == null ? null : slotVersionRepository.findById(versionId);
        if (version == null || !slot.getId().equals(version.getSlotId())) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "版本不存在: " + versionId);
        }

        snapshot(slot, SlotVersionSourceEnum.RESTORE, userId);
        slot.writeContent(version.getContent() == null ? null : version.getContent().deepCopy(), null);
        SlotEntity updated = slotRepository.update(slot);
        log.info("Slot version restored. strategyId: {}, slot: {}, fromVersion: {}, newVersion: {}",
                strategyId, type.getCode(), version.getVersion(), updated.getVersion());
        return strategyViewAssembler.toSlotContentDTO(updated);
    }

    private void snapshot(SlotEntity slot, SlotVersionSourceEnum source, String userId) {
        if (!slot.hasContent()) {
            return;
        }
        slotVersionRepository.save(SlotVersionEntity.snapshotOf(slot, source, userId));
    }

    private SlotStatusEnum parseStatus(String status) {
        if (StringUtils.isBlank(status)) {
            return null;
        }
        try {
            return SlotStatusEnum.fromCode(status.trim());
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "未知的槽位状态: " + status, ex);
        }
    }
}
