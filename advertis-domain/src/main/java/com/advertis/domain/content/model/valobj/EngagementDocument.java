package com.advertis.domain.content.model.valobj;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 槽位 E（Engagement）：触点、仪式、社群原则、游戏化、AARRR 漏斗与 KPI。
 */
@Data
public class EngagementDocument implements SlotDocument {

    private List<Touchpoint> touchpoints = new ArrayList<>();
    private List<Rituel> rituels = new ArrayList<>();
    private PrincipesCommunautaires principesCommunautaires = new PrincipesCommunautaires();
    private List<Palier> gamification = new ArrayList<>();
    private Aarrr aarrr = new Aarrr();
    private List<Kpi> kpis = new ArrayList<>();

    public enum TouchpointType {
        @JsonProperty("physique")
        PHYSIQUE,
        @JsonEnumDefaultValue
        @JsonProperty("digital")
        DIGITAL,
        @JsonProperty("humain")
        HUMAIN
    }

    public enum RituelType {
        @JsonEnumDefaultValue
        @JsonProperty("always-on")
        ALWAYS_ON,
        @JsonProperty("cyclique")
        CYCLIQUE
    }

    @Data
    public static class Touchpoint {
        private String canal = "";
        private TouchpointType type = TouchpointType.DIGITAL;
        private String role = "";
        private int priorite;
    }

    @Data
    public static class Rituel {
        private String nom = "";
        private RituelType type = RituelType.ALWAYS_ON;
        private String frequence = "";
        private String description = "";
    }

    @Data
    public static class PrincipesCommunautaires {
        private List<String> principes = new ArrayList<>();
        private List<String> tabous = new ArrayList<>();
    }

    @Data
    public static class Palier {
        private int niveau;
        private String nom = "";
        private String condition = "";
        private String recompense = "";
    }

    @Data
    public static class Aarrr {
        private String acquisition = "";
        private String activation = "";
        private String retention = "";
        private String revenue = "";
        private String referral = "";
    }

    @Data
    public static class Kpi {
        private String variable = "";
        private String nom = "";
        private String cible = "";
        private String frequence = "";
    }
}
