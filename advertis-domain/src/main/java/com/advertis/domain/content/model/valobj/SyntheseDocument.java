package com.advertis.domain.content.model.valobj;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 槽位 S（Synthèse）：执行摘要、战略愿景、支柱一致性与优先建议。
 */
@Data
public class SyntheseDocument implements SlotDocument {

    private String syntheseExecutive = "";
    private String visionStrategique = "";
    private List<CoherencePilier> coherencePiliers = new ArrayList<>();
    private List<String> facteursClesSucces = new ArrayList<>();
    private List<Recommandation> recommandationsPrioritaires = new ArrayList<>();

    @Min(0)
    @Max(100)
    private int scoreCoherence;

    @Override
    public void repair() {
        if (scoreCoherence < 0 || scoreCoherence > 100) {
            scoreCoherence = 0;
        }
    }

    @Data
    public static class CoherencePilier {
        private String pilier = "";
        private String contribution = "";
        private String articulation = "";
    }

    @Data
    public static class Recommandation {
        private String action = "";
        private int priorite;
        private String impact = "";
        private String delai = "";
    }
}
