package com.advertis.domain.content.model.valobj;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 槽位 A（Authenticité）：品牌身份、英雄之旅、Ikigai、价值观与社群层级。
 */
@Data
public class AuthenticiteDocument implements SlotDocument {

    private Identite identite = new Identite();
    private HerosJourney herosJourney = new HerosJourney();
    private Ikigai ikigai = new Ikigai();
    private List<Valeur> valeurs = new ArrayList<>();
    private List<NiveauCommunautaire> hierarchieCommunautaire = new ArrayList<>();
    private TimelineNarrative timelineNarrative = new TimelineNarrative();

    @Data
    public static class Identite {
        private String archetype = "";
        private String citationFondatrice = "";
        private String noyauIdentitaire = "";
    }

    @Data
    public static class HerosJourney {
        private String acte1Origines = "";
        private String acte2Appel = "";
        private String acte3Epreuves = "";
        private String acte4Transformation = "";
        private String acte5Revelation = "";
    }

    @Data
    public static class Ikigai {
        private String aimer = "";
        private String competence = "";
        private String besoinMonde = "";
        private String remuneration = "";
    }

    @Data
    public static class Valeur {
        private String valeur = "";
        private int rang;
        private String justification = "";
    }

    @Data
    public static class NiveauCommunautaire {
        private int niveau;
        private String nom = "";
        private String description = "";
        private String privileges = "";
    }

    @Data
    public static class TimelineNarrative {
        private String origines = "";
        private String croissance = "";
        private String pivot = "";
        private String futur = "";
    }
}
