package com.advertis.test;

import com.advertis.domain.module.handler.impl.DataQualityScorerModule;
import com.advertis.domain.module.model.entity.ModuleRunEntity;
import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.advertis.test.support.PipelineFixture;
import com.advertis.trigger.http.GlobalApiExceptionHandler;
import com.advertis.trigger.http.SlotController;
import com.advertis.types.common.Constants;
import com.advertis.types.enums.SlotTypeEnum;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class SlotControllerTest {

    private PipelineFixture fixture;
    private MockMvc mockMvc;
    private StrategyEntity strategy;

    @BeforeEach
    public void setUp() {
        this.fixture = new PipelineFixture();
        SlotController controller = new SlotController(fixture.slotQueryService(),
                fixture.slotContentCommandService(), fixture.moduleCommandService());
        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
        this.strategy = fixture.givenStrategy("fiche");
    }

    @Test
    public void shouldSaveSlotAndDispatchAutoTriggeredModules() throws Exception {
        mockMvc.perform(put("/api/strategies/{id}/slots/{type}", strategy.getId(), "A")
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":{\"identite\":{\"archetype\":\"Le Sage bienveillant\"}},\"status\":\"complete\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.type").value("A"))
                .andExpect(jsonPath("$.data.valid").value(true))
                .andExpect(jsonPath("$.data.version").value(2))
                .andExpect(jsonPath("$.data.autoTriggeredRunIds.length()").value(1));

        List<ModuleRunEntity> runs = fixture.moduleRunRepository.findAll();
        assertEquals(1, runs.size());
        assertEquals(DataQualityScorerModule.MODULE_ID, runs.get(0).getModuleId());
        Object input = runs.get(0).getInputSnapshot().get("slot_A");
        assertTrue(String.valueOf(input).contains("Le Sage bienveillant"));
    }

    @Test
    public void shouldSaveSlotWithoutConsumersWithoutRuns() throws Exception {
        mockMvc.perform(put("/api/strategies/{id}/slots/{type}", strategy.getId(), "S")
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":{\"scoreCoherence\":140}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.valid").value(false))
                .andExpect(jsonPath("$.data.warnings.length()").value(1))
                .andExpect(jsonPath("$.data.autoTriggeredRunIds.length()").value(0));
    }

    @Test
    public void shouldReadSlotWithRepairedContent() throws Exception {
        fixture.givenSlotContent(strategy.getId(), SlotTypeEnum.R, "{\"riskScore\":150}");

        mockMvc.perform(get("/api/strategies/{id}/slots/{type}", strategy.getId(), "R")
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.title").value("Risk"))
                .andExpect(jsonPath("$.data.content.riskScore").value(50))
                .andExpect(jsonPath("$.data.parseSuccess").value(false));
    }

    @Test
    public void shouldIngestGeneratedTextAndRestoreVersion() throws Exception {
        fixture.givenSlotContent(strategy.getId(), SlotTypeEnum.E, "{\"principesCommunautaires\":{\"principes\":[\"Atelier du jeudi\"]}}");

        mockMvc.perform(post("/api/strategies/{id}/slots/{type}/generated", strategy.getId(), "E")
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"```json\\n{\\\"principesCommunautaires\\\":{\\\"principes\\\":[\\\"Soiree lecture\\\"]}}\\n```\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.status").value("complete"))
                .andExpect(jsonPath("$.data.content.principesCommunautaires.principes[0]").value("Soiree lecture"));

        mockMvc.perform(get("/api/strategies/{id}/slots/{type}/versions", strategy.getId(), "E")
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].source").value("generation"))
                .andExpect(jsonPath("$.data[0].content.principesCommunautaires.principes[0]").value("Atelier du jeudi"));

        Long versionId = fixture.slotVersionRepository
                .findBySlotId(fixture.slot(strategy.getId(), SlotTypeEnum.E).getId()).get(0).getId();

        mockMvc.perform(post("/api/strategies/{id}/slots/{type}/versions/{versionId}/restore",
                        strategy.getId(), "E", versionId)
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.content.principesCommunautaires.principes[0]").value("Atelier du jeudi"));
    }

    @Test
    public void shouldRejectUnknownSlotType() throws Exception {
        mockMvc.perform(get("/api/strategies/{id}/slots/{type}", strategy.getId(), "Q")
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0002"));
    }
}
