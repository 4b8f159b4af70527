package com.advertis.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 槽位保存结果 DTO。
 * <p>
 * 校验问题仅作为警告返回，不阻止保存。
 * </p>
 */
@Data
public class SlotSaveResponseDTO {

    private Long slotId;
    private String type;
    private Integer version;
    private String status;
    private Boolean valid;
    private List<String> warnings;
    private List<Long> autoTriggeredRunIds;
}
