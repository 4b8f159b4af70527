package com.advertis.domain.module.handler.impl;

import com.advertis.domain.module.handler.AbstractModuleHandler;
import com.advertis.domain.module.model.valobj.ModuleContext;
import com.advertis.domain.module.model.valobj.ModuleDescriptor;
import com.advertis.domain.module.model.valobj.ModuleInputSource;
import com.advertis.types.enums.ModuleCategoryEnum;
import com.advertis.types.enums.SlotTypeEnum;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 数据质量评分：按字段检查 A/D/V/E 四个槽位的完整度，输出总分、分槽位明细与主要缺口。
 * <p>
 * 只读模块，不写回任何槽位。
 * </p>
 */
@Component
public class DataQualityScorerModule extends AbstractModuleHandler<DataQualityScorerModule.Input, DataQualityScorerModule.Output> {

    public static final String MODULE_ID = "data-quality-scorer";

    static final int MIN_TEXT_LENGTH = 10;
    static final int MAX_TOP_GAPS = 20;
    static final int TOO_SHORT_PENALTY = 2;
    static final int PLACEHOLDER_PENALTY = 5;

    private static final List<Pattern> PLACEHOLDER_PATTERNS = List.of(
            Pattern.compile("lorem ipsum", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^todo$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^tbd$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^à définir$", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
            Pattern.compile("^a definir$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\.{3,}$"),
            Pattern.compile("^-+$"),
            Pattern.compile("^n/a$", Pattern.CASE_INSENSITIVE)
    );

    private static final Map<SlotTypeEnum, List<FieldDef>> SLOT_FIELDS = buildFieldDefinitions();

    private static final ModuleDescriptor DESCRIPTOR = ModuleDescriptor.builder()
            .id(MODULE_ID)
            .name("Score de Qualite des Donnees")
            .description("Calcule un score de qualite/completude par champ pour chaque pilier A-D-V-E")
            .category(ModuleCategoryEnum.COMPUTE)
            .inputs(List.of(
                    ModuleInputSource.slot(SlotTypeEnum.A),
                    ModuleInputSource.slot(SlotTypeEnum.D),
                    ModuleInputSource.slot(SlotTypeEnum.V),
                    ModuleInputSource.slot(SlotTypeEnum.E)))
            .outputs(List.of())
            .autoTrigger(true)
            .inputSchema(Input.class)
            .outputSchema(Output.class)
            .build();

    public DataQualityScorerModule(ObjectMapper objectMapper) {
        super(objectMapper, Input.class);
    }

    @Override
    public ModuleDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    protected Output compute(Input input, ModuleContext context) {
        Map<String, SlotQuality> perSlot = new LinkedHashMap<>();
        List<Gap> topGaps = new ArrayList<>();

        for (Map.Entry<SlotTypeEnum, List<FieldDef>> entry : SLOT_FIELDS.entrySet()) {
            SlotTypeEnum slotType = entry.getKey();
            JsonNode document = input.documentOf(slotType);

            int filled = 0;
            List<String> emptyFields = new ArrayList<>();
            List<QualityIssue> issues = new ArrayList<>();
            for (FieldDef field : entry.getValue()) {
                JsonNode value = document == null ? null : document.at(field.pointer());
                if (assess(field, value, issues)) {
                    filled++;
                } else {
                    emptyFields.add(field.label());
                }
            }

            int total = entry.getValue().size();
            long tooShort = issues.stream().filter(i -> QualityIssue.TOO_SHORT.equals(i.getIssue())).count();
            long placeholders = issues.stream().filter(i -> QualityIssue.PLACEHOLDER.equals(i.getIssue())).count();
            int rawScore = (int) Math.round(total > 0 ? filled * 100.0 / total : 0);
            int penalty = (int) (tooShort * TOO_SHORT_PENALTY + placeholders * PLACEHOLDER_PENALTY);
            int score = Math.max(0, rawScore - penalty);

            perSlot.put(slotType.getCode(), new SlotQuality(score, total, filled, emptyFields, issues));

            for (QualityIssue issue : issues) {
                if (QualityIssue.HIGH.equals(issue.getSeverity())) {
                    String label = QualityIssue.EMPTY.equals(issue.getIssue()) ? "Non renseigne" : "Placeholder detecte";
                    topGaps.add(new Gap(slotType.getCode(), issue.getField(), label));
                }
            }
        }

        int globalScore = (int) Math.round(perSlot.values().stream()
                .mapToInt(SlotQuality::getScore)
                .average()
                .orElse(0));

        Output output = new Output();
        output.setGlobalScore(globalScore);
        output.setPerPillar(perSlot);
        output.setTopGaps(new ArrayList<>(topGaps.subList(0, Math.min(MAX_TOP_GAPS, topGaps.size()))));
        return output;
    }

    /**
     * @return 字段是否计为已填写
     */
    static boolean assess(FieldDef field, JsonNode value, List<QualityIssue> issues) {
        if (field.array()) {
            if (value == null || !value.isArray() || value.isEmpty()) {
                issues.add(new QualityIssue(field.label(), QualityIssue.EMPTY, QualityIssue.HIGH));
                return false;
            }
            if (value.size() < field.minLength()) {
                issues.add(new QualityIssue(field.label(), QualityIssue.TOO_SHORT, QualityIssue.LOW));
            }
            return true;
        }

        if (value == null || value.isMissingNode() || value.isNull()
                || (value.isTextual() && value.asText().trim().isEmpty())) {
            issues.add(new QualityIssue(field.label(), QualityIssue.EMPTY, QualityIssue.HIGH));
            return false;
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (isPlaceholder(text)) {
                issues.add(new QualityIssue(field.label(), QualityIssue.PLACEHOLDER, QualityIssue.HIGH));
                return false;
            }
            if (text.length() < MIN_TEXT_LENGTH) {
                issues.add(new QualityIssue(field.label(), QualityIssue.TOO_SHORT, QualityIssue.MEDIUM));
            }
        }
        return true;
    }

    static boolean isPlaceholder(String trimmed) {
        return PLACEHOLDER_PATTERNS.stream().anyMatch(p -> p.matcher(trimmed).find());
    }

    private static Map<SlotTypeEnum, List<FieldDef>> buildFieldDefinitions() {
        Map<SlotTypeEnum, List<FieldDef>> fields = new LinkedHashMap<>();
        fields.put(SlotTypeEnum.A, List.of(
                FieldDef.text("identite.archetype", "Archetype"),
                FieldDef.text("identite.citationFondatrice", "Citation fondatrice"),
                FieldDef.text("identite.noyauIdentitaire", "Noyau identitaire"),
                FieldDef.text("herosJourney.acte1Origines", "Origines"),
                FieldDef.text("herosJourney.acte2Appel", "Appel"),
                FieldDef.text("herosJourney.acte3Epreuves", "Epreuves"),
                FieldDef.text("herosJourney.acte4Transformation", "Transformation"),
                FieldDef.text("herosJourney.acte5Revelation", "Revelation"),
                FieldDef.text("ikigai.aimer", "Ikigai : Aimer"),
                FieldDef.text("ikigai.competence", "Ikigai : Competence"),
                FieldDef.text("ikigai.besoinMonde", "Ikigai : Besoin du monde"),
                FieldDef.text("ikigai.remuneration", "Ikigai : Remuneration"),
                FieldDef.list("valeurs", "Valeurs", 3),
                FieldDef.list("hierarchieCommunautaire", "Hierarchie communautaire", 2),
                FieldDef.text("timelineNarrative.origines", "Timeline : Origines"),
                FieldDef.text("timelineNarrative.futur", "Timeline : Futur")));
        fields.put(SlotTypeEnum.D, List.of(
                FieldDef.list("personas", "Personas", 2),
                FieldDef.list("paysageConcurrentiel.concurrents", "Concurrents", 2),
                FieldDef.list("paysageConcurrentiel.avantagesCompetitifs", "Avantages competitifs", 1),
                FieldDef.text("promessesDeMarque.promesseMaitre", "Promesse maitre"),
                FieldDef.text("positionnement", "Positionnement"),
                FieldDef.text("tonDeVoix.personnalite", "Personnalite de voix"),
                FieldDef.list("tonDeVoix.onDit", "On dit", 3),
                FieldDef.list("tonDeVoix.onNeditPas", "On ne dit pas", 2),
                FieldDef.text("identiteVisuelle.directionArtistique", "Direction artistique"),
                FieldDef.list("identiteVisuelle.paletteCouleurs", "Palette couleurs", 3),
                FieldDef.text("identiteVisuelle.mood", "Mood"),
                FieldDef.list("assetsLinguistiques.mantras", "Mantras", 2),
                FieldDef.list("assetsLinguistiques.vocabulaireProprietaire", "Vocabulaire proprietaire", 3)));
        fields.put(SlotTypeEnum.V, List.of(
                FieldDef.list("productLadder", "Product Ladder", 2),
                FieldDef.list("valeurMarque.tangible", "Valeur tangible", 1),
                FieldDef.list("valeurMarque.intangible", "Valeur intangible", 1),
                FieldDef.list("valeurClient.fonctionnels", "Benefices fonctionnels", 1),
                FieldDef.list("valeurClient.emotionnels", "Benefices emotionnels", 1),
                FieldDef.list("valeurClient.sociaux", "Benefices sociaux", 1),
                FieldDef.text("coutMarque.capex", "CAPEX"),
                FieldDef.text("coutMarque.opex", "OPEX"),
                FieldDef.list("coutClient.frictions", "Frictions client", 1),
                FieldDef.text("unitEconomics.cac", "CAC"),
                FieldDef.text("unitEconomics.ltv", "LTV"),
                FieldDef.text("unitEconomics.ratio", "Ratio LTV/CAC"),
                FieldDef.text("unitEconomics.pointMort", "Point mort"),
                FieldDef.text("unitEconomics.marges", "Marges")));
        fields.put(SlotTypeEnum.E, List.of(
                FieldDef.list("touchpoints", "Touchpoints", 3),
                FieldDef.list("rituels", "Rituels", 2),
                FieldDef.list("principesCommunautaires.principes", "Principes communautaires", 1),
                FieldDef.list("principesCommunautaires.tabous", "Tabous", 1),
                FieldDef.list("gamification", "Gamification", 2),
                FieldDef.text("aarrr.acquisition", "AARRR : Acquisition"),
                FieldDef.text("aarrr.activation", "AARRR : Activation"),
                FieldDef.text("aarrr.retention", "AARRR : Retention"),
                FieldDef.text("aarrr.revenue", "AARRR : Revenue"),
                FieldDef.text("aarrr.referral", "AARRR : Referral"),
                FieldDef.list("kpis", "KPIs", 3)));
        return fields;
    }

    /**
     * 被检查的字段：点分路径、展示名、是否数组、数组期望的最小长度。
     */
    record FieldDef(String path, String label, boolean array, int minLength) {

        static FieldDef text(String path, String label) {
            return new FieldDef(path, label, false, 0);
        }

        static FieldDef list(String path, String label, int minLength) {
            return new FieldDef(path, label, true, minLength);
        }

        String pointer() {
            return "/" + path.replace('.', '/');
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Input {

        @JsonProperty("slot_A")
        private JsonNode slotA;

        @JsonProperty("slot_D")
        private JsonNode slotD;

        @JsonProperty("slot_V")
        private JsonNode slotV;

        @JsonProperty("slot_E")
        private JsonNode slotE;

        JsonNode documentOf(SlotTypeEnum type) {
            switch (type) {
                case A:
                    return slotA;
                case D:
                    return slotD;
                case V:
                    return slotV;
                case E:
                    return slotE;
                default:
                    return null;
            }
        }
    }

    @Data
    public static class Output {

        @Min(0)
        @Max(100)
        private int globalScore;

        @NotNull
        @Valid
        private Map<String, SlotQuality> perPillar = new LinkedHashMap<>();

        @NotNull
        private List<Gap> topGaps = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SlotQuality {

        @Min(0)
        @Max(100)
        private int score;

        private int totalFields;

        private int filledFields;

        private List<String> emptyFields = new ArrayList<>();

        private List<QualityIssue> qualityIssues = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class QualityIssue {

        static final String EMPTY = "empty";
        static final String TOO_SHORT = "too_short";
        static final String PLACEHOLDER = "placeholder";
        static final String LOW = "low";
        static final String MEDIUM = "medium";
        static final String HIGH = "high";

        private String field;

        private String issue;

        private String severity;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Gap {

        private String pillarType;

        private String field;

        private String issue;
    }
}
