package com.advertis.test;

import com.advertis.domain.module.handler.impl.AuditSynthesisModule;
import com.advertis.domain.module.handler.impl.DataQualityScorerModule;
import com.advertis.domain.module.model.valobj.ModuleExecutionResult;
import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.advertis.test.support.PipelineFixture;
import com.advertis.trigger.http.GlobalApiExceptionHandler;
import com.advertis.trigger.http.ModuleController;
import com.advertis.types.common.Constants;
import com.advertis.types.enums.ModuleTriggerEnum;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ModuleControllerTest {

    private PipelineFixture fixture;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.fixture = new PipelineFixture();
        ModuleController controller = new ModuleController(fixture.moduleCommandService(),
                fixture.moduleQueryService());
        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldListModuleCatalog() throws Exception {
        mockMvc.perform(get("/api/modules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.length()").value(4));

        mockMvc.perform(get("/api/modules").param("slotType", "I"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].id").value(AuditSynthesisModule.MODULE_ID))
                .andExpect(jsonPath("$.data[0].inputs[0]").value("slot_R"))
                .andExpect(jsonPath("$.data[0].outputs[2].mergeStrategy").value("append"));

        mockMvc.perform(get("/api/modules").param("category", "compute"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2));
    }

    @Test
    public void shouldExecuteModule() throws Exception {
        StrategyEntity strategy = fixture.givenStrategy("fiche");

        mockMvc.perform(post("/api/modules/{moduleId}/execute", DataQualityScorerModule.MODULE_ID)
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"strategyId\":" + strategy.getId() + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.success").value(true))
                .andExpect(jsonPath("$.data.runId").isNumber());
    }

    @Test
    public void shouldReturnFailureWithResultBody() throws Exception {
        StrategyEntity strategy = fixture.givenStrategy("fiche");

        mockMvc.perform(post("/api/modules/{moduleId}/execute", "no-such-module")
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"strategyId\":" + strategy.getId() + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0001"))
                .andExpect(jsonPath("$.info").isNotEmpty())
                .andExpect(jsonPath("$.data.success").value(false));
    }

    @Test
    public void shouldListAndReadRuns() throws Exception {
        StrategyEntity strategy = fixture.givenStrategy("fiche");
        ModuleExecutionResult first = fixture.moduleExecutor.execute(DataQualityScorerModule.MODULE_ID,
                strategy.getId(), PipelineFixture.OWNER, ModuleTriggerEnum.AUTO);
        ModuleExecutionResult second = fixture.moduleExecutor.execute(DataQualityScorerModule.MODULE_ID,
                strategy.getId(), PipelineFixture.OWNER, ModuleTriggerEnum.MANUAL);

        mockMvc.perform(get("/api/strategies/{id}/module-runs", strategy.getId())
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER)
                        .param("moduleId", DataQualityScorerModule.MODULE_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].runId").value(second.runId()))
                .andExpect(jsonPath("$.data[0].triggeredBy").value("manual"));

        mockMvc.perform(get("/api/module-runs/{runId}", first.runId())
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("complete"))
                .andExpect(jsonPath("$.data.outputData.globalScore").value(0));

        mockMvc.perform(get("/api/module-runs/{runId}", first.runId())
                        .header(Constants.USER_ID_HEADER, "u-intruder"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0003"));
    }

    @Test
    public void shouldRejectLimitOutOfRange() throws Exception {
        StrategyEntity strategy = fixture.givenStrategy("fiche");

        mockMvc.perform(get("/api/strategies/{id}/module-runs", strategy.getId())
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER)
                        .param("limit", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0002"));
    }
}
