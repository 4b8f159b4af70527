package com.advertis.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有 API 响应的响应码和对应描述信息。
 * </p>
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 资源不存在或不属于当前用户 */
    NOT_FOUND("0003", "资源不存在"),

    /** 阶段迁移不合法 */
    INVALID_TRANSITION("0004", "阶段迁移不合法"),

    /** 并发修改冲突 */
    CONFLICT("0005", "并发修改冲突");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
