package com.advertis.domain.content.model.valobj;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 槽位 I（Implementation）：驾驶舱所需的结构化战略数据。
 * <p>
 * 前八个分区始终存在；campaigns 之后的增强分区可选，缺省为 null 且序列化时省略。
 * coherenceScore 取值 0-100，越界回退为 0。
 * </p>
 */
@Data
public class ImplementationDocument implements SlotDocument {

    private BrandIdentity brandIdentity = new BrandIdentity();
    private Positioning positioning = new Positioning();
    private ValueArchitecture valueArchitecture = new ValueArchitecture();
    private EngagementStrategy engagementStrategy = new EngagementStrategy();
    private RiskSynthesis riskSynthesis = new RiskSynthesis();
    private MarketValidation marketValidation = new MarketValidation();
    private StrategicRoadmap strategicRoadmap = new StrategicRoadmap();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Campaigns campaigns;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private BudgetAllocation budgetAllocation;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private TeamStructure teamStructure;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private LaunchPlan launchPlan;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private OperationalPlaybook operationalPlaybook;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private BrandPlatform brandPlatform;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private CopyStrategy copyStrategy;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private BigIdea bigIdea;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private ActivationDispositif activationDispositif;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Governance governance;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<Workstream> workstreams;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private BrandArchitecture brandArchitecture;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private GuidingPrinciples guidingPrinciples;

    @Min(0)
    @Max(100)
    private int coherenceScore;

    private String executiveSummary = "";

    @Override
    public void repair() {
        if (coherenceScore < 0 || coherenceScore > 100) {
            coherenceScore = 0;
        }
    }

    public enum CampaignType {
        @JsonEnumDefaultValue
        @JsonProperty("lancement")
        LANCEMENT,
        @JsonProperty("recurrence")
        RECURRENCE,
        @JsonProperty("evenement")
        EVENEMENT,
        @JsonProperty("activation")
        ACTIVATION
    }

    // ---- 核心分区 ----

    @Data
    public static class BrandIdentity {
        private String archetype = "";
        private String purpose = "";
        private String vision = "";
        private List<String> values = new ArrayList<>();
        private String narrative = "";
    }

    @Data
    public static class Positioning {
        private String statement = "";
        private List<String> differentiators = new ArrayList<>();
        private String toneOfVoice = "";
        private List<PersonaSummary> personas = new ArrayList<>();
        private List<CompetitorPosition> competitors = new ArrayList<>();
    }

    @Data
    public static class PersonaSummary {
        private String name = "";
        private String description = "";
        private int priority;
    }

    @Data
    public static class CompetitorPosition {
        private String name = "";
        private String position = "";
    }

    @Data
    public static class ValueArchitecture {
        private List<LadderStep> productLadder = new ArrayList<>();
        private String valueProposition = "";
        private Economics unitEconomics = new Economics();
    }

    @Data
    public static class LadderStep {
        private String tier = "";
        private String price = "";
        private String description = "";
    }

    @Data
    public static class Economics {
        private String cac = "";
        private String ltv = "";
        private String ratio = "";
        private String notes = "";
    }

    @Data
    public static class EngagementStrategy {
        private List<ChannelPriority> touchpoints = new ArrayList<>();
        private List<Ritual> rituals = new ArrayList<>();
        private Funnel aarrr = new Funnel();
        private List<KpiTarget> kpis = new ArrayList<>();
    }

    @Data
    public static class ChannelPriority {
        private String channel = "";
        private String role = "";
        private int priority;
    }

    @Data
    public static class Ritual {
        private String name = "";
        private String frequency = "";
        private String description = "";
    }

    @Data
    public static class Funnel {
        private String acquisition = "";
        private String activation = "";
        private String retention = "";
        private String revenue = "";
        private String referral = "";
    }

    @Data
    public static class KpiTarget {
        private String name = "";
        private String target = "";
        private String frequency = "";
    }

    @Data
    public static class RiskSynthesis {
        private int riskScore;
        private SwotQuadrants globalSwot = new SwotQuadrants();
        private List<TopRisk> topRisks = new ArrayList<>();
    }

    @Data
    public static class TopRisk {
        private String risk = "";
        private String impact = "";
        private String mitigation = "";
    }

    @Data
    public static class MarketValidation {
        private int brandMarketFitScore;
        private String tam = "";
        private String sam = "";
        private String som = "";
        private List<String> trends = new ArrayList<>();
        private List<String> recommendations = new ArrayList<>();
    }

    @Data
    public static class StrategicRoadmap {
        private List<SprintAction> sprint90Days = new ArrayList<>();
        private List<String> year1Priorities = new ArrayList<>();
        private String year3Vision = "";
    }

    @Data
    public static class SprintAction {
        private String action = "";
        private String owner = "";
        private String kpi = "";
    }

    // ---- 可选增强分区 ----

    @Data
    public static class Campaigns {
        private List<CalendarEntry> annualCalendar = new ArrayList<>();
        private List<CampaignTemplate> templates = new ArrayList<>();
        private ActivationPlan activationPlan = new ActivationPlan();
    }

    @Data
    public static class CalendarEntry {
        private String mois = "";
        private String campagne = "";
        private String objectif = "";
        private List<String> canaux = new ArrayList<>();
        private String budget = "";
        private String kpiCible = "";
    }

    @Data
    public static class CampaignTemplate {
        private String nom = "";
        private CampaignType type = CampaignType.LANCEMENT;
        private String description = "";
        private String duree = "";
        private List<String> canauxPrincipaux = new ArrayList<>();
        private List<String> messagesCles = new ArrayList<>();
    }

    @Data
    public static class ActivationPlan {
        private String phase1Teasing = "";
        private String phase2Lancement = "";
        private String phase3Amplification = "";
        private String phase4Fidelisation = "";
    }

    @Data
    public static class BudgetAllocation {
        private String enveloppeGlobale = "";
        private List<BudgetLine> parPoste = new ArrayList<>();
        private List<BudgetPhase> parPhase = new ArrayList<>();
        private RoiProjections roiProjections = new RoiProjections();
    }

    @Data
    public static class BudgetLine {
        private String poste = "";
        private String montant = "";
        private double pourcentage;
        private String justification = "";
    }

    @Data
    public static class BudgetPhase {
        private String phase = "";
        private String montant = "";
        private String focus = "";
    }

    @Data
    public static class RoiProjections {
        private String mois6 = "";
        private String mois12 = "";
        private String mois24 = "";
        private String hypotheses = "";
    }

    @Data
    public static class TeamStructure {
        private List<TeamMember> equipeActuelle = new ArrayList<>();
        private List<Recrutement> recrutements = new ArrayList<>();
        private List<Partenaire> partenairesExternes = new ArrayList<>();
    }

    @Data
    public static class TeamMember {
        private String role = "";
        private String profil = "";
        private String allocation = "";
    }

    @Data
    public static class Recrutement {
        private String role = "";
        private String profil = "";
        private String echeance = "";
        private int priorite;
    }

    @Data
    public static class Partenaire {
        private String type = "";
        private String mission = "";
        private String budget = "";
        private String duree = "";
    }

    @Data
    public static class LaunchPlan {
        private List<LaunchPhase> phases = new ArrayList<>();
        private List<Milestone> milestones = new ArrayList<>();
    }

    @Data
    public static class LaunchPhase {
        private String nom = "";
        private String debut = "";
        private String fin = "";
        private List<String> objectifs = new ArrayList<>();
        private List<String> livrables = new ArrayList<>();
        private String goNoGo = "";
    }

    @Data
    public static class Milestone {
        private String date = "";
        private String jalon = "";
        private String responsable = "";
        private String critereSucces = "";
    }

    @Data
    public static class OperationalPlaybook {
        private List<String> rythmeQuotidien = new ArrayList<>();
        private List<String> rythmeHebdomadaire = new ArrayList<>();
        private List<String> rythmeMensuel = new ArrayList<>();
        private List<Escalation> escalation = new ArrayList<>();
        private List<Tool> outilsStack = new ArrayList<>();
    }

    @Data
    public static class Escalation {
        private String scenario = "";
        private String action = "";
        private String responsable = "";
    }

    @Data
    public static class Tool {
        private String outil = "";
        private String usage = "";
        private String cout = "";
    }

    @Data
    public static class BrandPlatform {
        private String purpose = "";
        private String vision = "";
        private String mission = "";
        private List<String> values = new ArrayList<>();
        private String personality = "";
        private String territory = "";
        private String tagline = "";
    }

    @Data
    public static class CopyStrategy {
        private String promise = "";
        private List<String> rtb = new ArrayList<>();
        private String consumerBenefit = "";
        private String tone = "";
        private String constraint = "";
    }

    @Data
    public static class BigIdea {
        private String concept = "";
        private String mechanism = "";
        private String insightLink = "";
        private List<Declinaison> declinaisons = new ArrayList<>();
    }

    @Data
    public static class Declinaison {
        private String support = "";
        private String description = "";
    }

    /**
     * owned / earned / paid / shared 四轴激活。
     */
    @Data
    public static class ActivationDispositif {
        private List<ChannelBudget> owned = new ArrayList<>();
        private List<ChannelBudget> earned = new ArrayList<>();
        private List<ChannelBudget> paid = new ArrayList<>();
        private List<ChannelBudget> shared = new ArrayList<>();
        private String parcoursConso = "";
    }

    @Data
    public static class ChannelBudget {
        private String canal = "";
        private String role = "";
        private String budget = "";
    }

    @Data
    public static class Governance {
        private Committee comiteStrategique = new Committee();
        private Committee comitePilotage = new Committee();
        private Committee pointsOperationnels = new Committee();
        private String processValidation = "";
        private List<Deadline> delaisStandards = new ArrayList<>();
    }

    @Data
    public static class Committee {
        private String frequence = "";
        private List<String> participants = new ArrayList<>();
        private String objectif = "";
    }

    @Data
    public static class Deadline {
        private String livrable = "";
        private String delai = "";
    }

    @Data
    public static class Workstream {
        private String name = "";
        private String objectif = "";
        private List<String> livrables = new ArrayList<>();
        private String frequence = "";
        private List<String> kpis = new ArrayList<>();
    }

    @Data
    public static class BrandArchitecture {
        private String model = "";
        private List<BrandNode> hierarchy = new ArrayList<>();
        private String coexistenceRules = "";
    }

    @Data
    public static class BrandNode {
        private String brand = "";
        private String level = "";
        private String role = "";
    }

    @Data
    public static class GuidingPrinciples {
        private List<String> dos = new ArrayList<>();
        private List<String> donts = new ArrayList<>();
        private List<String> communicationPrinciples = new ArrayList<>();
        private List<String> coherenceCriteria = new ArrayList<>();
    }
}
