package com.advertis.domain.content.model.valobj;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * SWOT 四象限。
 */
@Data
public class SwotQuadrants {

    private List<String> strengths = new ArrayList<>();
    private List<String> weaknesses = new ArrayList<>();
    private List<String> opportunities = new ArrayList<>();
    private List<String> threats = new ArrayList<>();
}
