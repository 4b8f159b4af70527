package com.advertis.domain.content.model.valobj;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 槽位 V（Valeur）：产品阶梯、品牌/客户价值与成本、单位经济。
 */
@Data
public class ValeurDocument implements SlotDocument {

    private List<ProductTier> productLadder = new ArrayList<>();
    private ValeurMarque valeurMarque = new ValeurMarque();
    private ValeurClient valeurClient = new ValeurClient();
    private CoutMarque coutMarque = new CoutMarque();
    private CoutClient coutClient = new CoutClient();
    private UnitEconomics unitEconomics = new UnitEconomics();

    @Data
    public static class ProductTier {
        private String tier = "";
        private String prix = "";
        private String description = "";
        private String cible = "";
    }

    @Data
    public static class ValeurMarque {
        private List<String> tangible = new ArrayList<>();
        private List<String> intangible = new ArrayList<>();
    }

    @Data
    public static class ValeurClient {
        private List<String> fonctionnels = new ArrayList<>();
        private List<String> emotionnels = new ArrayList<>();
        private List<String> sociaux = new ArrayList<>();
    }

    @Data
    public static class CoutMarque {
        private String capex = "";
        private String opex = "";
        private List<String> coutsCaches = new ArrayList<>();
    }

    @Data
    public static class CoutClient {
        private List<Friction> frictions = new ArrayList<>();
    }

    @Data
    public static class Friction {
        private String friction = "";
        private String solution = "";
    }

    @Data
    public static class UnitEconomics {
        private String cac = "";
        private String ltv = "";
        private String ratio = "";
        private String pointMort = "";
        private String marges = "";
        private String notes = "";
    }
}
