package com.advertis.trigger.application.common;

import com.advertis.api.dto.ModuleRunDTO;
import com.advertis.api.dto.ModuleSummaryDTO;
import com.advertis.api.dto.PhaseDTO;
import com.advertis.api.dto.SlotContentDTO;
import com.advertis.api.dto.SlotVersionDTO;
import com.advertis.api.dto.StrategyDetailDTO;
import com.advertis.domain.content.model.valobj.ParseResult;
import com.advertis.domain.content.model.valobj.SlotDocument;
import com.advertis.domain.content.service.SlotContentParser;
import com.advertis.domain.content.service.SlotSchemaRegistry;
import com.advertis.domain.module.model.entity.ModuleRunEntity;
import com.advertis.domain.module.model.valobj.ModuleDescriptor;
import com.advertis.domain.module.model.valobj.ModuleInputSource;
import com.advertis.domain.module.model.valobj.ModuleOutputTarget;
import com.advertis.domain.strategy.model.entity.SlotEntity;
import com.advertis.domain.strategy.model.entity.SlotVersionEntity;
import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.advertis.types.enums.PhaseEnum;
import com.advertis.types.enums.SlotTypeEnum;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 策略视图组装器：统一实体到 DTO 的映射，槽位内容一律经 parseStored 解析后输出。
 */
@Component
public class StrategyViewAssembler {

    private final SlotContentParser slotContentParser;
    private final SlotSchemaRegistry slotSchemaRegistry;

    public StrategyViewAssembler(SlotContentParser slotContentParser, SlotSchemaRegistry slotSchemaRegistry) {
        this.slotContentParser = slotContentParser;
        this.slotSchemaRegistry = slotSchemaRegistry;
    }

    public StrategyDetailDTO toStrategyDetailDTO(StrategyEntity strategy, List<SlotEntity> slots) {
        if (strategy == null) {
            return null;
        }
        StrategyDetailDTO dto = new StrategyDetailDTO();
        dto.setStrategyId(strategy.getId());
        dto.setUserId(strategy.getUserId());
        dto.setName(strategy.getName());
        dto.setDescription(strategy.getDescription());
        dto.setSector(strategy.getSector());
        dto.setPhase(strategy.getPhase());
        dto.setStatus(strategy.getStatus() == null ? null : strategy.getStatus().getCode());
        dto.setAnswers(strategy.getAnswers() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(strategy.getAnswers()));
        dto.setSlots(slots == null ? List.of() : slots.stream().map(this::toSlotContentDTO).collect(Collectors.toList()));
        dto.setCreatedAt(strategy.getCreatedAt());
        dto.setUpdatedAt(strategy.getUpdatedAt());
        return dto;
    }

    public SlotContentDTO toSlotContentDTO(SlotEntity slot) {
        if (slot == null) {
            return null;
        }
        ParseResult<SlotDocument> parsed = slotContentParser.parseStored(slot.getType(), slot.getContent());
        SlotContentDTO dto = new SlotContentDTO();
        dto.setSlotId(slot.getId());
        dto.setType(slot.getType().getCode());
        dto.setTitle(slot.getType().getTitle());
        dto.setStatus(slot.getStatus() == null ? null : slot.getStatus().getCode());
        dto.setVersion(slot.getVersion());
        dto.setContent(slotSchemaRegistry.toTree(parsed.data()));
        dto.setParseSuccess(parsed.success());
        dto.setParseErrors(parsed.errors());
        dto.setErrorMessage(slot.getErrorMessage());
        dto.setGeneratedAt(slot.getGeneratedAt());
        dto.setUpdatedAt(slot.getUpdatedAt());
        return dto;
    }

    /**
     * 版本快照按原样输出，不做解析。
     */
    public SlotVersionDTO toSlotVersionDTO(SlotVersionEntity version) {
        SlotVersionDTO dto = new SlotVersionDTO();
        dto.setVersionId(version.getId());
        dto.setSlotId(version.getSlotId());
        dto.setVersion(version.getVersion());
        dto.setContent(version.getContent());
        dto.setSource(version.getSource() == null ? null : version.getSource().getCode());
        dto.setCreatedBy(version.getCreatedBy());
        dto.setCreatedAt(version.getCreatedAt());
        return dto;
    }

    public ModuleRunDTO toModuleRunDTO(ModuleRunEntity run) {
        if (run == null) {
            return null;
        }
        ModuleRunDTO dto = new ModuleRunDTO();
        dto.setRunId(run.getId());
        dto.setModuleId(run.getModuleId());
        dto.setStrategyId(run.getStrategyId());
        dto.setUserId(run.getUserId());
        dto.setStatus(run.getStatus() == null ? null : run.getStatus().getCode());
        dto.setTriggeredBy(run.getTriggeredBy() == null ? null : run.getTriggeredBy().getCode());
        dto.setInputSnapshot(run.getInputSnapshot());
        dto.setOutputData(run.getOutputData());
        dto.setErrorMessage(run.getErrorMessage());
        dto.setDurationMs(run.getDurationMs());
        dto.setCreatedAt(run.getCreatedAt());
        dto.setUpdatedAt(run.getUpdatedAt());
        return dto;
    }

    public ModuleSummaryDTO toModuleSummaryDTO(ModuleDescriptor descriptor) {
        ModuleSummaryDTO dto = new ModuleSummaryDTO();
        dto.setId(descriptor.id());
        dto.setName(descriptor.name());
        dto.setDescription(descriptor.description());
        dto.setCategory(descriptor.category().getCode());
        dto.setAutoTrigger(descriptor.autoTrigger());
        dto.setInputs(descriptor.inputs().stream().map(ModuleInputSource::label).collect(Collectors.toList()));
        dto.setOutputs(descriptor.outputs().stream().map(this::toOutputTargetDTO).collect(Collectors.toList()));
        return dto;
    }

    public PhaseDTO toPhaseDTO(PhaseEnum phase) {
        PhaseDTO dto = new PhaseDTO();
        dto.setCode(phase.getCode());
        dto.setTitle(phase.getTitle());
        dto.setOrder(phase.ordinal());
        dto.setSkippable(phase.isSkippable());
        dto.setSlotTypes(phase.getSlotTypes().stream().map(SlotTypeEnum::getCode).collect(Collectors.toList()));
        return dto;
    }

    private ModuleSummaryDTO.OutputTargetDTO toOutputTargetDTO(ModuleOutputTarget target) {
        ModuleSummaryDTO.OutputTargetDTO dto = new ModuleSummaryDTO.OutputTargetDTO();
        dto.setSlotType(target.slotType().getCode());
        dto.setPath(target.path());
        dto.setMergeStrategy(target.mergeStrategy().getCode());
        return dto;
    }
}
