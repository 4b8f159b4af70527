package com.advertis.test;

import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.advertis.test.support.PipelineFixture;
import com.advertis.trigger.http.GlobalApiExceptionHandler;
import com.advertis.trigger.http.PhaseController;
import com.advertis.types.common.Constants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class PhaseControllerTest {

    private PipelineFixture fixture;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.fixture = new PipelineFixture();
        PhaseController controller = new PhaseController(fixture.phaseTransitionCommandService(),
                fixture.strategyQueryService());
        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldListPhasesInOrder() throws Exception {
        mockMvc.perform(get("/api/phases"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.length()").value(9))
                .andExpect(jsonPath("$.data[0].code").value("fiche"))
                .andExpect(jsonPath("$.data[3].code").value("market-study"))
                .andExpect(jsonPath("$.data[3].skippable").value(true))
                .andExpect(jsonPath("$.data[8].code").value("complete"));
    }

    @Test
    public void shouldAdvancePhase() throws Exception {
        StrategyEntity strategy = fixture.givenStrategy("audit-r");

        mockMvc.perform(post("/api/strategies/{id}/phase/advance", strategy.getId())
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetPhase\":\"audit-t\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.fromPhase").value("audit-r"))
                .andExpect(jsonPath("$.data.toPhase").value("audit-t"));

        assertEquals("audit-t", fixture.strategyRepository.findById(strategy.getId()).getPhase());
    }

    @Test
    public void shouldReportInvalidTransition() throws Exception {
        StrategyEntity strategy = fixture.givenStrategy("fiche");

        mockMvc.perform(post("/api/strategies/{id}/phase/advance", strategy.getId())
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetPhase\":\"cockpit\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0004"));

        mockMvc.perform(post("/api/strategies/{id}/phase/revert", strategy.getId())
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetPhase\":\"audit-r\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0004"));
    }

    @Test
    public void shouldValidateAuditReview() throws Exception {
        StrategyEntity strategy = fixture.givenStrategy("audit-review");

        mockMvc.perform(post("/api/strategies/{id}/phase/validate-audit-review", strategy.getId())
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"riskContent\":{\"riskScore\":30},\"trackContent\":{\"brandMarketFitScore\":65}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.toPhase").value("implementation"));
    }

    @Test
    public void shouldValidateFicheReview() throws Exception {
        StrategyEntity strategy = fixture.givenStrategy("fiche-review");

        mockMvc.perform(post("/api/strategies/{id}/phase/validate-fiche-review", strategy.getId())
                        .header(Constants.USER_ID_HEADER, PipelineFixture.OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answers\":{\"A1\":\"Bougies\",\"E2\":\"Ateliers mensuels\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.toPhase").value("audit-r"));

        assertEquals("Ateliers mensuels",
                fixture.strategyRepository.findById(strategy.getId()).getAnswers().get("E2"));
    }
}
