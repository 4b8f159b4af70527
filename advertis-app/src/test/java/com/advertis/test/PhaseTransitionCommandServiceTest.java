package com.advertis.test;

import com.advertis.api.dto.AuditReviewRequestDTO;
import com.advertis.api.dto.FicheReviewRequestDTO;
import com.advertis.api.dto.PhaseTransitionResponseDTO;
import com.advertis.domain.strategy.model.entity.SlotEntity;
import com.advertis.domain.strategy.model.entity.SlotVersionEntity;
import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.advertis.test.support.InMemoryStrategyRepository;
import com.advertis.test.support.PipelineFixture;
import com.advertis.trigger.application.command.PhaseTransitionCommandService;
import com.advertis.trigger.application.common.StrategyAccessGuard;
import com.advertis.types.enums.ResponseCode;
import com.advertis.types.enums.SlotTypeEnum;
import com.advertis.types.enums.SlotVersionSourceEnum;
import com.advertis.types.enums.StrategyStatusEnum;
import com.advertis.types.exception.AppException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PhaseTransitionCommandServiceTest {

    private PipelineFixture fixture;
    private PhaseTransitionCommandService service;

    @BeforeEach
    public void setUp() {
        this.fixture = new PipelineFixture();
        this.service = fixture.phaseTransitionCommandService();
    }

    @Test
    public void shouldAdvanceAndRevert() {
        StrategyEntity strategy = fixture.givenStrategy("fiche");

        PhaseTransitionResponseDTO advanced = service.advance(strategy.getId(), PipelineFixture.OWNER, "fiche-review");

        assertEquals("fiche", advanced.getFromPhase());
        assertEquals("fiche-review", advanced.getToPhase());
        assertEquals("generating", advanced.getStatus());
        assertEquals("fiche-review", fixture.strategyRepository.findById(strategy.getId()).getPhase());

        PhaseTransitionResponseDTO reverted = service.revert(strategy.getId(), PipelineFixture.OWNER, "fiche");

        assertEquals("fiche-review", reverted.getFromPhase());
        assertEquals("fiche", fixture.strategyRepository.findById(strategy.getId()).getPhase());
    }

    @Test
    public void shouldKeepLaterPhaseSlotsUntouchedOnRevert() {
        StrategyEntity strategy = fixture.givenStrategy("implementation");
        fixture.givenSlotContent(strategy.getId(), SlotTypeEnum.R,
                "{\"riskScore\":58,\"globalSwot\":{\"threats\":[\"Hausse de la cire\"]}}");
        fixture.givenSlotContent(strategy.getId(), SlotTypeEnum.T,
                "{\"brandMarketFitScore\":61,\"strategicRecommendations\":[\"Ouvrir un atelier\"]}");
        fixture.givenSlotContent(strategy.getId(), SlotTypeEnum.I, "{\"coherenceScore\":74}");
        Map<SlotTypeEnum, SlotEntity> before = new LinkedHashMap<>();
        for (SlotTypeEnum type : List.of(SlotTypeEnum.R, SlotTypeEnum.T, SlotTypeEnum.I)) {
            SlotEntity slot = fixture.slot(strategy.getId(), type);
            SlotEntity copy = new SlotEntity();
            copy.setContent(slot.getContent().deepCopy());
            copy.setVersion(slot.getVersion());
            copy.setStatus(slot.getStatus());
            before.put(type, copy);
        }
        int updatesBefore = fixture.slotRepository.getUpdateCount();

        PhaseTransitionResponseDTO response = service.revert(strategy.getId(), PipelineFixture.OWNER, "fiche");

        assertEquals("implementation", response.getFromPhase());
        assertEquals("fiche", fixture.strategyRepository.findById(strategy.getId()).getPhase());
        assertEquals(updatesBefore, fixture.slotRepository.getUpdateCount());
        before.forEach((type, expected) -> {
            SlotEntity actual = fixture.slot(strategy.getId(), type);
            assertEquals(expected.getContent(), actual.getContent());
            assertEquals(expected.getVersion(), actual.getVersion());
            assertEquals(expected.getStatus(), actual.getStatus());
            assertTrue(fixture.slotVersionRepository.findBySlotId(actual.getId()).isEmpty());
        });
    }

    @Test
    public void shouldRejectUnknownOrIllegalTarget() {
        StrategyEntity strategy = fixture.givenStrategy("fiche");

        assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), assertThrows(AppException.class,
                () -> service.advance(strategy.getId(), PipelineFixture.OWNER, "brief")).getCode());
        assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), assertThrows(AppException.class,
                () -> service.advance(strategy.getId(), PipelineFixture.OWNER, " ")).getCode());
        assertEquals(ResponseCode.INVALID_TRANSITION.getCode(), assertThrows(AppException.class,
                () -> service.advance(strategy.getId(), PipelineFixture.OWNER, "audit-r")).getCode());
        assertEquals("fiche", fixture.strategyRepository.findById(strategy.getId()).getPhase());
    }

    @Test
    public void shouldAdvanceFromLegacyAuditCode() {
        StrategyEntity strategy = fixture.givenStrategy("audit");

        PhaseTransitionResponseDTO response = service.advance(strategy.getId(), PipelineFixture.OWNER, "audit-t");

        assertEquals("audit-r", response.getFromPhase());
        assertEquals("audit-t", fixture.strategyRepository.findById(strategy.getId()).getPhase());
    }

    @Test
    public void shouldRejectConcurrentPhaseChange() {
        RacingStrategyRepository racingRepository = new RacingStrategyRepository("audit-t");
        StrategyEntity strategy = StrategyEntity.draft(PipelineFixture.OWNER, "Maison Lumen", null, null, Map.of());
        strategy.setPhase("audit-r");
        racingRepository.save(strategy);
        PhaseTransitionCommandService racingService = new PhaseTransitionCommandService(racingRepository,
                fixture.slotRepository, fixture.slotVersionRepository, fixture.phaseTransitionDomainService,
                fixture.contentParser, new StrategyAccessGuard(racingRepository, fixture.slotRepository));

        AppException ex = assertThrows(AppException.class,
                () -> racingService.advance(strategy.getId(), PipelineFixture.OWNER, "market-study"));

        assertEquals(ResponseCode.CONFLICT.getCode(), ex.getCode());
        assertEquals("audit-t", racingRepository.findById(strategy.getId()).getPhase());
    }

    @Test
    public void shouldSaveAnswersAndAdvanceOnFicheReview() {
        StrategyEntity strategy = fixture.givenStrategy("fiche-review", Map.of("A1", "Ancienne reponse"));
        Map<String, String> answers = new LinkedHashMap<>();
        answers.put("A1", "Bougies artisanales");
        answers.put("D4", "Premium accessible");
        FicheReviewRequestDTO request = new FicheReviewRequestDTO();
        request.setAnswers(answers);

        PhaseTransitionResponseDTO response = service.validateFicheReview(strategy.getId(), PipelineFixture.OWNER, request);

        assertEquals("audit-r", response.getToPhase());
        StrategyEntity stored = fixture.strategyRepository.findById(strategy.getId());
        assertEquals("audit-r", stored.getPhase());
        assertEquals(StrategyStatusEnum.GENERATING, stored.getStatus());
        assertEquals(answers, stored.getAnswers());
    }

    @Test
    public void shouldRejectFicheReviewOutsideItsPhaseOrWithUnknownKey() {
        StrategyEntity early = fixture.givenStrategy("fiche");
        FicheReviewRequestDTO request = new FicheReviewRequestDTO();
        request.setAnswers(Map.of("A1", "Bougies"));

        assertEquals(ResponseCode.INVALID_TRANSITION.getCode(), assertThrows(AppException.class,
                () -> service.validateFicheReview(early.getId(), PipelineFixture.OWNER, request)).getCode());

        StrategyEntity reviewing = fixture.givenStrategy("fiche-review");
        request.setAnswers(Map.of("Z9", "?"));

        assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), assertThrows(AppException.class,
                () -> service.validateFicheReview(reviewing.getId(), PipelineFixture.OWNER, request)).getCode());
        assertEquals("fiche-review", fixture.strategyRepository.findById(reviewing.getId()).getPhase());
    }

    @Test
    public void shouldWriteReviewedAuditsAndAdvanceToImplementation() {
        StrategyEntity strategy = fixture.givenStrategy("audit-review");
        fixture.givenSlotContent(strategy.getId(), SlotTypeEnum.R, "{\"riskScore\":60}");
        AuditReviewRequestDTO request = new AuditReviewRequestDTO();
        request.setRiskContent(fixture.json("{\"riskScore\":45,\"summary\":\"Revu\"}"));
        request.setTrackContent(fixture.json("{\"brandMarketFitScore\":70}"));

        PhaseTransitionResponseDTO response = service.validateAuditReview(strategy.getId(), PipelineFixture.OWNER, request);

        assertEquals("audit-review", response.getFromPhase());
        assertEquals("implementation", response.getToPhase());

        SlotEntity risk = fixture.slot(strategy.getId(), SlotTypeEnum.R);
        SlotEntity track = fixture.slot(strategy.getId(), SlotTypeEnum.T);
        assertEquals(45, risk.getContent().get("riskScore").asInt());
        assertEquals(70, track.getContent().get("brandMarketFitScore").asInt());

        List<SlotVersionEntity> riskVersions = fixture.slotVersionRepository.findBySlotId(risk.getId());
        assertEquals(1, riskVersions.size());
        assertEquals(SlotVersionSourceEnum.REVIEW, riskVersions.get(0).getSource());
        assertEquals(60, riskVersions.get(0).getContent().get("riskScore").asInt());
        assertTrue(fixture.slotVersionRepository.findBySlotId(track.getId()).isEmpty());
    }

    @Test
    public void shouldRejectAuditReviewWithoutObjectContent() {
        StrategyEntity strategy = fixture.givenStrategy("audit-review");
        AuditReviewRequestDTO request = new AuditReviewRequestDTO();
        request.setRiskContent(fixture.json("[]"));
        request.setTrackContent(fixture.json("{}"));

        AppException ex = assertThrows(AppException.class,
                () -> service.validateAuditReview(strategy.getId(), PipelineFixture.OWNER, request));

        assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
        assertEquals("audit-review", fixture.strategyRepository.findById(strategy.getId()).getPhase());
    }

    /**
     * 在比较写入前把存储阶段改掉，模拟另一个请求先完成了迁移。
     */
    private static class RacingStrategyRepository extends InMemoryStrategyRepository {

        private final String concurrentPhase;

        private RacingStrategyRepository(String concurrentPhase) {
            this.concurrentPhase = concurrentPhase;
        }

        @Override
        public boolean updatePhase(Long id, String expectedPhase, String targetPhase, StrategyStatusEnum status) {
            forcePhase(id, concurrentPhase);
            return super.updatePhase(id, expectedPhase, targetPhase, status);
        }
    }
}
