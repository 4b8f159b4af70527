package com.advertis.test.domain;

import com.advertis.domain.module.handler.impl.CoherenceScorerModule;
import com.advertis.domain.module.handler.impl.DataQualityScorerModule;
import com.advertis.domain.module.model.entity.ModuleRunEntity;
import com.advertis.domain.module.model.valobj.ModuleContext;
import com.advertis.domain.module.model.valobj.ModuleExecutionResult;
import com.advertis.domain.module.model.valobj.ModuleResult;
import com.advertis.domain.strategy.model.entity.StrategyEntity;
import com.advertis.test.support.PipelineFixture;
import com.advertis.types.enums.ModuleTriggerEnum;
import com.advertis.types.enums.SlotTypeEnum;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DataQualityScorerModuleTest {

    private static final String HALF_FILLED_AUTHENTICITE = "{"
            + "\"identite\":{\"archetype\":\"Le Sage bienveillant\",\"citationFondatrice\":\"La lumiere se partage\","
            + "\"noyauIdentitaire\":\"Eclairer les rituels du soir\"},"
            + "\"herosJourney\":{\"acte1Origines\":\"Un atelier familial a Lyon\","
            + "\"acte2Appel\":\"Refuser la bougie industrielle\",\"acte3Epreuves\":\"Trois ans sans salaire\"},"
            + "\"ikigai\":{\"aimer\":\"Le travail de la cire naturelle\",\"competence\":\"Maitrise des parfums\","
            + "\"besoinMonde\":\"TBD\",\"remuneration\":\"tbd\"}}";

    private PipelineFixture fixture;

    @BeforeEach
    public void setUp() {
        this.fixture = new PipelineFixture();
    }

    @Test
    public void shouldScoreHalfFilledPillarWithPlaceholderPenalty() {
        StrategyEntity strategy = fixture.givenStrategy("fiche");
        fixture.givenSlotContent(strategy.getId(), SlotTypeEnum.A, HALF_FILLED_AUTHENTICITE);
        int updatesBefore = fixture.slotRepository.getUpdateCount();

        ModuleExecutionResult result = fixture.moduleExecutor.execute(DataQualityScorerModule.MODULE_ID,
                strategy.getId(), PipelineFixture.OWNER, ModuleTriggerEnum.AUTO);

        assertTrue(result.success(), result.error());
        assertEquals(updatesBefore, fixture.slotRepository.getUpdateCount());

        ModuleRunEntity run = fixture.moduleRunRepository.findById(result.runId());
        Map<String, Object> output = run.getOutputData();
        assertEquals(10, ((Number) output.get("globalScore")).intValue());

        Map<?, ?> perPillar = (Map<?, ?>) output.get("perPillar");
        Map<?, ?> authenticite = (Map<?, ?>) perPillar.get("A");
        assertEquals(40, ((Number) authenticite.get("score")).intValue());
        assertEquals(16, ((Number) authenticite.get("totalFields")).intValue());
        assertEquals(8, ((Number) authenticite.get("filledFields")).intValue());
        for (String pillar : List.of("D", "V", "E")) {
            assertEquals(0, ((Number) ((Map<?, ?>) perPillar.get(pillar)).get("score")).intValue());
        }

        List<?> topGaps = (List<?>) output.get("topGaps");
        assertEquals(20, topGaps.size());
        assertEquals(Map.of("pillarType", "A", "field", "Transformation", "issue", "Non renseigne"), topGaps.get(0));
        assertEquals(Map.of("pillarType", "A", "field", "Ikigai : Besoin du monde", "issue", "Placeholder detecte"),
                topGaps.get(2));
    }

    @Test
    public void shouldFlagPlaceholdersAndShortText() {
        DataQualityScorerModule module = new DataQualityScorerModule(fixture.objectMapper);
        Map<String, Object> inputs = Map.of("slot_A", fixture.json("{\"identite\":{"
                + "\"archetype\":\"Lorem ipsum dolor sit amet\",\"citationFondatrice\":\"...\",\"noyauIdentitaire\":\"Court\"},"
                + "\"valeurs\":[{\"valeur\":\"Audace\"}]}"));

        ModuleResult result = module.execute(new ModuleContext(1L, PipelineFixture.OWNER, inputs));

        assertTrue(result.success());
        Map<?, ?> authenticite = (Map<?, ?>) ((Map<?, ?>) result.data().get("perPillar")).get("A");
        assertEquals(0, ((Number) authenticite.get("score")).intValue());
        assertEquals(2, ((Number) authenticite.get("filledFields")).intValue());
        List<?> emptyFields = (List<?>) authenticite.get("emptyFields");
        assertTrue(emptyFields.contains("Archetype"));
        assertTrue(emptyFields.contains("Citation fondatrice"));
        List<?> issues = (List<?>) authenticite.get("qualityIssues");
        assertTrue(issues.contains(Map.of("field", "Noyau identitaire", "issue", "too_short", "severity", "medium")));
        assertTrue(issues.contains(Map.of("field", "Valeurs", "issue", "too_short", "severity", "low")));
        assertTrue(issues.contains(Map.of("field", "Archetype", "issue", "placeholder", "severity", "high")));
    }

    @Test
    public void shouldFeedLatestScoreIntoCoherenceScorer() {
        StrategyEntity strategy = fixture.givenStrategy("cockpit");
        fixture.givenSlotContent(strategy.getId(), SlotTypeEnum.I, "{\"coherenceScore\":80}");

        ModuleExecutionResult withoutQuality = fixture.moduleExecutor.execute(CoherenceScorerModule.MODULE_ID,
                strategy.getId(), PipelineFixture.OWNER, ModuleTriggerEnum.MANUAL);
        assertTrue(withoutQuality.success(), withoutQuality.error());
        assertEquals(40, fixture.slot(strategy.getId(), SlotTypeEnum.S).getContent().get("scoreCoherence").asInt());

        fixture.givenSlotContent(strategy.getId(), SlotTypeEnum.A, HALF_FILLED_AUTHENTICITE);
        fixture.moduleExecutor.execute(DataQualityScorerModule.MODULE_ID, strategy.getId(), PipelineFixture.OWNER,
                ModuleTriggerEnum.AUTO);
        ModuleExecutionResult withQuality = fixture.moduleExecutor.execute(CoherenceScorerModule.MODULE_ID,
                strategy.getId(), PipelineFixture.OWNER, ModuleTriggerEnum.MANUAL);

        assertTrue(withQuality.success(), withQuality.error());
        assertEquals(45, fixture.slot(strategy.getId(), SlotTypeEnum.S).getContent().get("scoreCoherence").asInt());
    }
}
