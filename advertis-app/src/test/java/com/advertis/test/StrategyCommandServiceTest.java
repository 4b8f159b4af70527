package com.advertis.test;

import com.advertis.api.dto.StrategyCreateRequestDTO;
import com.advertis.api.dto.StrategyDetailDTO;
import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.advertis.test.support.PipelineFixture;
import com.advertis.trigger.application.command.StrategyCommandService;
import com.advertis.types.enums.ResponseCode;
import com.advertis.types.enums.SlotTypeEnum;
import com.advertis.types.exception.AppException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StrategyCommandServiceTest {

    private PipelineFixture fixture;
    private StrategyCommandService service;

    @BeforeEach
    public void setUp() {
        this.fixture = new PipelineFixture();
        this.service = fixture.strategyCommandService();
    }

    @Test
    public void shouldCreateDraftWithEightEmptySlots() {
        StrategyCreateRequestDTO request = new StrategyCreateRequestDTO();
        request.setName("  Maison Lumen ");
        request.setSector("retail");
        request.setAnswers(Map.of("A1", "Bougies", "D4", "Premium accessible"));

        StrategyDetailDTO detail = service.create(PipelineFixture.OWNER, request);

        assertNotNull(detail.getStrategyId());
        assertEquals("Maison Lumen", detail.getName());
        assertEquals("fiche", detail.getPhase());
        assertEquals("draft", detail.getStatus());
        assertEquals(8, detail.getSlots().size());
        assertEquals(SlotTypeEnum.A.getCode(), detail.getSlots().get(0).getType());
        assertTrue(detail.getSlots().stream().allMatch(slot -> "pending".equals(slot.getStatus())));
        assertEquals(8, fixture.slotRepository.findByStrategyId(detail.getStrategyId()).size());

        StrategyEntity stored = fixture.strategyRepository.findById(detail.getStrategyId());
        assertEquals(PipelineFixture.OWNER, stored.getUserId());
        assertEquals("Premium accessible", stored.getAnswers().get("D4"));
    }

    @Test
    public void shouldRejectUnknownAnswerKey() {
        StrategyCreateRequestDTO request = new StrategyCreateRequestDTO();
        request.setName("Maison Lumen");
        request.setAnswers(Map.of("Z9", "?"));

        AppException ex = assertThrows(AppException.class, () -> service.create(PipelineFixture.OWNER, request));

        assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
        assertNull(fixture.strategyRepository.findById(1L));
    }

    @Test
    public void shouldRejectBlankNameOrCaller() {
        StrategyCreateRequestDTO request = new StrategyCreateRequestDTO();
        request.setName(" ");

        assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(),
                assertThrows(AppException.class, () -> service.create(PipelineFixture.OWNER, request)).getCode());

        request.setName("Maison Lumen");
        assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(),
                assertThrows(AppException.class, () -> service.create(" ", request)).getCode());
    }
}
