package com.advertis.domain.module.service;

import com.advertis.domain.content.model.valobj.ParseResult;
import com.advertis.domain.content.model.valobj.SlotDocument;
import com.advertis.domain.content.model.valobj.SlotValidationResult;
import com.advertis.domain.content.service.SlotContentParser;
import com.advertis.domain.content.service.SlotSchemaRegistry;
import com.advertis.domain.module.model.valobj.ModuleDescriptor;
import com.advertis.domain.module.model.valobj.ModuleOutputTarget;
import com.advertis.domain.strategy.adapter.repository.ISlotRepository;
import com.advertis.domain.strategy.model.entity.SlotEntity;
import com.advertis.types.enums.ResponseCode;
import com.advertis.types.enums.SlotTypeEnum;
import com.advertis.types.exception.AppException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模块输出写回：按目标槽位分组，对每个槽位做一次读取-合并-校验-写入。
 * <p>
 * 写入使用槽位版本号做乐观锁，版本冲突时整个读改写流程重试，最多 maxWriteAttempts 次。
 * 合并后的文档会按槽位 schema 重新校验：默认只记录警告并照常写入，strictRevalidation 开启时拒绝写入。
 * </p>
 */
@Slf4j
@Service
public class ModuleOutputApplier {

    private final ISlotRepository slotRepository;
    private final SlotContentParser contentParser;
    private final SlotSchemaRegistry schemaRegistry;
    private final ObjectMapper objectMapper;
    private final boolean strictRevalidation;
    private final int maxWriteAttempts;

    public ModuleOutputApplier(ISlotRepository slotRepository,
                               SlotContentParser contentParser,
                               SlotSchemaRegistry schemaRegistry,
                               ObjectMapper objectMapper,
                               @Value("${advertis.module.output.strict-revalidation:false}") boolean strictRevalidation,
                               @Value("${advertis.module.output.max-write-attempts:3}") int maxWriteAttempts) {
        this.slotRepository = slotRepository;
        this.contentParser = contentParser;
        this.schemaRegistry = schemaRegistry;
        this.objectMapper = objectMapper;
        this.strictRevalidation = strictRevalidation;
        this.maxWriteAttempts = Math.max(maxWriteAttempts, 1);
    }

    /**
     * @return 实际写入的槽位数
     */
    public int apply(ModuleDescriptor descriptor, Long strategyId, Map<String, Object> output) {
        if (descriptor.isReadOnly() || output == null) {
            return 0;
        }
        Map<SlotTypeEnum, List<ModuleOutputTarget>> bySlot = new LinkedHashMap<>();
        for (ModuleOutputTarget target : descriptor.outputs()) {
            bySlot.computeIfAbsent(target.slotType(), k -> new ArrayList<>()).add(target);
        }

        int written = 0;
        for (Map.Entry<SlotTypeEnum, List<ModuleOutputTarget>> entry : bySlot.entrySet()) {
            if (applyWithRetry(descriptor.id(), strategyId, entry.getKey(), entry.getValue(), output)) {
                written++;
            }
        }
        return written;
    }

    private boolean applyWithRetry(String moduleId, Long strategyId, SlotTypeEnum slotType,
                                   List<ModuleOutputTarget> targets, Map<String, Object> output) {
        for (int attempt = 1; ; attempt++) {
            try {
                return applyToSlot(moduleId, strategyId, slotType, targets, output);
            } catch (AppException ex) {
                if (!ResponseCode.CONFLICT.getCode().equals(ex.getCode()) || attempt >= maxWriteAttempts) {
                    throw ex;
                }
                log.warn("Slot write conflict, retrying. moduleId: {}, strategyId: {}, slot: {}, attempt: {}",
                        moduleId, strategyId, slotType.getCode(), attempt);
            }
        }
    }

    private boolean applyToSlot(String moduleId, Long strategyId, SlotTypeEnum slotType,
                                List<ModuleOutputTarget> targets, Map<String, Object> output) {
        SlotEntity slot = slotRepository.findByStrategyIdAndType(strategyId, slotType);
        if (slot == null) {
            log.warn("Target slot not found, skipping. moduleId: {}, strategyId: {}, slot: {}",
                    moduleId, strategyId, slotType.getCode());
            return false;
        }

        ParseResult<SlotDocument> current = contentParser.parseStored(slotType, slot.getContent());
        ObjectNode updated = schemaRegistry.toTree(current.data());

        boolean touched = false;
        for (ModuleOutputTarget target : targets) {
            Object incoming = output.get(target.incomingKey());
            if (incoming == null) {
                incoming = output.get(target.path());
            }
            if (incoming == null) {
                continue;
            }
            JsonNode existing = SlotMergeStrategies.get(updated, target.path());
            JsonNode merged = SlotMergeStrategies.apply(existing, objectMapper.valueToTree(incoming), target.mergeStrategy());
            SlotMergeStrategies.set(updated, target.path(), merged);
            touched = true;
        }
        if (!touched) {
            log.info("No output value for slot, write skipped. moduleId: {}, strategyId: {}, slot: {}",
                    moduleId, strategyId, slotType.getCode());
            return false;
        }

        SlotValidationResult validation = schemaRegistry.validate(slotType, updated);
        if (!validation.valid()) {
            if (strictRevalidation) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(),
                        "Slot " + slotType.getCode() + " failed validation after module update: "
                                + String.join("; ", validation.errors()));
            }
            log.warn("Slot validation warnings after module update. moduleId: {}, strategyId: {}, slot: {}, issues: {}",
                    moduleId, strategyId, slotType.getCode(), validation.errors());
        }

        slot.writeContent(updated, null);
        slotRepository.update(slot);
        log.info("Module output applied. moduleId: {}, strategyId: {}, slot: {}, targets: {}",
                moduleId, strategyId, slotType.getCode(), targets.size());
        return true;
    }
}
