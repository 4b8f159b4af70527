package com.advertis.test.domain;

import com.advertis.domain.content.service.SlotContentParser;
import com.advertis.domain.content.service.SlotSchemaRegistry;
import com.advertis.domain.module.model.valobj.ModuleDescriptor;
import com.advertis.domain.module.model.valobj.ModuleOutputTarget;
import com.advertis.domain.module.service.ModuleOutputApplier;
import com.advertis.domain.strategy.model.entity.SlotEntity;
import com.advertis.test.support.InMemorySlotRepository;
import com.advertis.types.enums.MergeStrategyEnum;
import com.advertis.types.enums.ModuleCategoryEnum;
import com.advertis.types.enums.ResponseCode;
import com.advertis.types.enums.SlotTypeEnum;
import com.advertis.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ModuleOutputApplierTest {

    private static final Long STRATEGY_ID = 1L;

    private static final ModuleDescriptor SCORE_WRITER = ModuleDescriptor.builder()
            .id("score-writer")
            .category(ModuleCategoryEnum.COMPUTE)
            .outputs(List.of(ModuleOutputTarget.of(SlotTypeEnum.S, "scoreCoherence", MergeStrategyEnum.REPLACE)))
            .build();

    private ObjectMapper objectMapper;
    private SlotSchemaRegistry schemaRegistry;
    private SlotContentParser contentParser;
    private ConflictingSlotRepository slotRepository;
    private Long slotId;

    @BeforeEach
    public void setUp() {
        this.objectMapper = new ObjectMapper();
        this.schemaRegistry = new SlotSchemaRegistry(objectMapper, Validation.buildDefaultValidatorFactory().getValidator());
        this.contentParser = new SlotContentParser(schemaRegistry, objectMapper);
        this.slotRepository = new ConflictingSlotRepository();
        this.slotId = slotRepository.save(SlotEntity.empty(STRATEGY_ID, SlotTypeEnum.S)).getId();
        slotRepository.save(SlotEntity.empty(STRATEGY_ID, SlotTypeEnum.I));
    }

    @Test
    public void shouldRetryReadModifyWriteAfterVersionConflict() {
        slotRepository.conflictsToInject = 2;

        int written = applier(false).apply(SCORE_WRITER, STRATEGY_ID, Map.of("scoreCoherence", 55));

        assertEquals(1, written);
        SlotEntity slot = slotRepository.findById(slotId);
        assertEquals(55, slot.getContent().get("scoreCoherence").asInt());
        assertEquals(4, slot.getVersion());
    }

    @Test
    public void shouldGiveUpAfterMaxWriteAttempts() {
        slotRepository.conflictsToInject = 5;

        AppException ex = assertThrows(AppException.class,
                () -> applier(false).apply(SCORE_WRITER, STRATEGY_ID, Map.of("scoreCoherence", 55)));

        assertEquals(ResponseCode.CONFLICT.getCode(), ex.getCode());
        assertEquals(3, slotRepository.conflictsInjected);
        assertNull(slotRepository.findById(slotId).getContent());
    }

    @Test
    public void shouldWriteInvalidMergeWithWarningByDefault() {
        int written = applier(false).apply(SCORE_WRITER, STRATEGY_ID, Map.of("scoreCoherence", 150));

        assertEquals(1, written);
        assertEquals(150, slotRepository.findById(slotId).getContent().get("scoreCoherence").asInt());
    }

    @Test
    public void shouldRejectInvalidMergeWhenStrict() {
        AppException ex = assertThrows(AppException.class,
                () -> applier(true).apply(SCORE_WRITER, STRATEGY_ID, Map.of("scoreCoherence", 150)));

        assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
        assertNull(slotRepository.findById(slotId).getContent());
        assertEquals(1, slotRepository.findById(slotId).getVersion());
    }

    @Test
    public void shouldSkipSlotWithoutOutputValue() {
        int written = applier(false).apply(SCORE_WRITER, STRATEGY_ID, Map.of("unrelated", "x"));

        assertEquals(0, written);
        assertEquals(1, slotRepository.findById(slotId).getVersion());
    }

    @Test
    public void shouldSkipMissingSlotAndReadOnlyModule() {
        assertEquals(0, applier(false).apply(SCORE_WRITER, 99L, Map.of("scoreCoherence", 10)));

        ModuleDescriptor readOnly = ModuleDescriptor.builder().id("reader").category(ModuleCategoryEnum.COMPUTE).build();
        assertEquals(0, applier(false).apply(readOnly, STRATEGY_ID, Map.of("scoreCoherence", 10)));
    }

    @Test
    public void shouldFallBackToFullPathKey() {
        ModuleDescriptor descriptor = ModuleDescriptor.builder()
                .id("risk-writer")
                .category(ModuleCategoryEnum.DEDUCE)
                .outputs(List.of(ModuleOutputTarget.of(SlotTypeEnum.I, "riskSynthesis.riskScore", MergeStrategyEnum.REPLACE)))
                .build();

        int written = applier(false).apply(descriptor, STRATEGY_ID, Map.of("riskSynthesis.riskScore", 12));

        assertEquals(1, written);
        SlotEntity implementation = slotRepository.findByStrategyIdAndType(STRATEGY_ID, SlotTypeEnum.I);
        assertEquals(12, implementation.getContent().at("/riskSynthesis/riskScore").asInt());
    }

    private ModuleOutputApplier applier(boolean strict) {
        return new ModuleOutputApplier(slotRepository, contentParser, schemaRegistry, objectMapper, strict, 3);
    }

    /**
     * 在写入前模拟另一请求先行提交，使本次写入的版本号失效。
     */
    private static class ConflictingSlotRepository extends InMemorySlotRepository {

        private int conflictsToInject;
        private int conflictsInjected;

        @Override
        public SlotEntity update(SlotEntity entity) {
            if (conflictsInjected < conflictsToInject) {
                conflictsInjected++;
                bumpVersion(entity.getId());
            }
            return super.update(entity);
        }
    }
}
