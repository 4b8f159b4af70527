package com.advertis.domain.content.model.valobj;

import com.advertis.types.enums.SlotTypeEnum;
import com.fasterxml.jackson.core.JsonPointer;
import lombok.Getter;

/**
 * 宽松转换仍无法映射到槽位文档时抛出。
 * <p>
 * pointer 指向无法映射的节点；为空指针时表示问题不在某个具体字段上。
 * </p>
 */
@Getter
public class SlotCoercionException extends RuntimeException {

    private static final long serialVersionUID = -2675309147724066115L;

    private final SlotTypeEnum slotType;

    private final transient JsonPointer pointer;

    public SlotCoercionException(SlotTypeEnum slotType, JsonPointer pointer, String message, Throwable cause) {
        super(message, cause);
        this.slotType = slotType;
        this.pointer = pointer == null ? JsonPointer.empty() : pointer;
    }
}
