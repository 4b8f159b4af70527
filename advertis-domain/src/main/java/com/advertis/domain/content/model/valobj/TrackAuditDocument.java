package com.advertis.domain.content.model.valobj;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 槽位 T（Track Audit）：三角验证、假设验证、市场现实、TAM/SAM/SOM 与竞品基准。
 */
@Data
public class TrackAuditDocument implements SlotDocument {

    public static final int DEFAULT_FIT_SCORE = 50;

    private Triangulation triangulation = new Triangulation();
    private List<Hypothesis> hypothesisValidation = new ArrayList<>();
    private MarketReality marketReality = new MarketReality();
    private TamSamSom tamSamSom = new TamSamSom();
    private List<Benchmark> competitiveBenchmark = new ArrayList<>();

    @Min(0)
    @Max(100)
    private int brandMarketFitScore = DEFAULT_FIT_SCORE;

    private String brandMarketFitJustification = "";
    private List<String> strategicRecommendations = new ArrayList<>();
    private String summary = "";

    @Override
    public void repair() {
        if (brandMarketFitScore < 0 || brandMarketFitScore > 100) {
            brandMarketFitScore = DEFAULT_FIT_SCORE;
        }
    }

    public enum HypothesisStatus {
        @JsonProperty("validated")
        VALIDATED,
        @JsonProperty("invalidated")
        INVALIDATED,
        @JsonEnumDefaultValue
        @JsonProperty("to_test")
        TO_TEST
    }

    @Data
    public static class Triangulation {
        private String internalData = "";
        private String marketData = "";
        private String customerData = "";
        private String synthesis = "";
    }

    @Data
    public static class Hypothesis {
        private String variableId = "";
        private String hypothesis = "";
        private HypothesisStatus status = HypothesisStatus.TO_TEST;
        private String evidence = "";
    }

    @Data
    public static class MarketReality {
        private List<String> macroTrends = new ArrayList<>();
        private List<String> weakSignals = new ArrayList<>();
        private List<String> emergingPatterns = new ArrayList<>();
    }

    @Data
    public static class TamSamSom {
        private MarketSize tam = new MarketSize();
        private MarketSize sam = new MarketSize();
        private MarketSize som = new MarketSize();
        private String methodology = "";
    }

    @Data
    public static class MarketSize {
        private String value = "";
        private String description = "";
    }

    @Data
    public static class Benchmark {
        private String competitor = "";
        private List<String> strengths = new ArrayList<>();
        private List<String> weaknesses = new ArrayList<>();
        private String marketShare = "";
    }
}
