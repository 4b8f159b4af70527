package com.advertis.api.dto;

import lombok.Data;

/**
 * 生成文本写入请求 DTO，text 为文本生成服务返回的原始输出。
 */
@Data
public class GeneratedContentRequestDTO {

    private String text;
}
