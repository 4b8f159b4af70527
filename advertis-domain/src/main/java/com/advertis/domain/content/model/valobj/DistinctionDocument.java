package com.advertis.domain.content.model.valobj;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 槽位 D（Distinction）：画像、竞争格局、品牌承诺、定位、语调与视觉识别。
 */
@Data
public class DistinctionDocument implements SlotDocument {

    private List<Persona> personas = new ArrayList<>();
    private PaysageConcurrentiel paysageConcurrentiel = new PaysageConcurrentiel();
    private PromessesDeMarque promessesDeMarque = new PromessesDeMarque();
    private String positionnement = "";
    private TonDeVoix tonDeVoix = new TonDeVoix();
    private IdentiteVisuelle identiteVisuelle = new IdentiteVisuelle();
    private AssetsLinguistiques assetsLinguistiques = new AssetsLinguistiques();

    @Data
    public static class Persona {
        private String nom = "";
        private String demographie = "";
        private String psychographie = "";
        private String motivations = "";
        private String freins = "";
        private int priorite;
    }

    @Data
    public static class PaysageConcurrentiel {
        private List<Concurrent> concurrents = new ArrayList<>();
        private List<String> avantagesCompetitifs = new ArrayList<>();
    }

    @Data
    public static class Concurrent {
        private String nom = "";
        private String forces = "";
        private String faiblesses = "";
        private String partDeMarche = "";
    }

    @Data
    public static class PromessesDeMarque {
        private String promesseMaitre = "";
        private List<String> sousPromesses = new ArrayList<>();
    }

    @Data
    public static class TonDeVoix {
        private String personnalite = "";
        private List<String> onDit = new ArrayList<>();
        private List<String> onNeditPas = new ArrayList<>();
    }

    @Data
    public static class IdentiteVisuelle {
        private String directionArtistique = "";
        private List<String> paletteCouleurs = new ArrayList<>();
        private String mood = "";
    }

    @Data
    public static class AssetsLinguistiques {
        private List<String> mantras = new ArrayList<>();
        private List<String> vocabulaireProprietaire = new ArrayList<>();
    }
}
