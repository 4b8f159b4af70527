package com.advertis.domain.strategy.model.entity;

import com.advertis.types.enums.PhaseEnum;
import com.advertis.types.enums.StrategyStatusEnum;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 策略领域实体（被策略化的品牌）。
 */
@Data
public class StrategyEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 所属用户 ID
     */
    private String userId;

    /**
     * 品牌名称
     */
    private String name;

    /**
     * 描述
     */
    private String description;

    /**
     * 行业
     */
    private String sector;

    /**
     * 当前阶段编码（原样存储，可能是历史编码）
     */
    private String phase;

    /**
     * 状态
     */
    private StrategyStatusEnum status;

    /**
     * 问卷答案（稀疏的键值对）
     */
    private Map<String, String> answers;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    /**
     * 创建处于 fiche 阶段的草稿策略。
     */
    public static StrategyEntity draft(String userId, String name, String description, String sector,
                                       Map<String, String> answers) {
        StrategyEntity entity = new StrategyEntity();
        entity.setUserId(userId);
        entity.setName(name);
        entity.setDescription(description);
        entity.setSector(sector);
        entity.setPhase(PhaseEnum.FICHE.getCode());
        entity.setStatus(StrategyStatusEnum.DRAFT);
        entity.setAnswers(answers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(answers));
        LocalDateTime now = LocalDateTime.now();
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    /**
     * 验证策略是否有效
     */
    public void validate() {
        if (StringUtils.isBlank(userId)) {
            throw new IllegalStateException("User ID cannot be empty");
        }
        if (StringUtils.isBlank(name)) {
            throw new IllegalStateException("Strategy name cannot be empty");
        }
        if (StringUtils.isBlank(phase)) {
            throw new IllegalStateException("Phase cannot be empty");
        }
    }

    public boolean isOwnedBy(String candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }

    /**
     * 解析当前阶段（历史编码已映射），未知编码返回 null。
     */
    public PhaseEnum resolvePhase() {
        try {
            return PhaseEnum.fromCode(phase);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    /**
     * 阶段指针前移：目标为终态时状态置为 complete，否则为 generating。
     */
    public void advanceTo(PhaseEnum target) {
        this.phase = target.getCode();
        this.status = target.isTerminal() ? StrategyStatusEnum.COMPLETE : StrategyStatusEnum.GENERATING;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 阶段指针回退，不触碰任何槽位内容。
     */
    public void revertTo(PhaseEnum target) {
        this.phase = target.getCode();
        this.status = StrategyStatusEnum.GENERATING;
        this.updatedAt = LocalDateTime.now();
    }

    public void replaceAnswers(Map<String, String> newAnswers) {
        this.answers = newAnswers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(newAnswers);
        this.updatedAt = LocalDateTime.now();
    }

    public String answerOf(String key) {
        if (answers == null) {
            return "";
        }
        return StringUtils.defaultString(answers.get(key));
    }

    /**
     * 以字段名为键导出实体元数据，供模块输入按字段投影。
     */
    public Map<String, Object> toFieldMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put("userId", userId);
        fields.put("name", name);
        fields.put("description", description);
        fields.put("sector", sector);
        fields.put("phase", phase);
        fields.put("status", status == null ? null : status.getCode());
        return fields;
    }
}
