package com.advertis.domain.content.model.valobj;

/**
 * 槽位结构化文档标记接口。
 * <p>
 * 每个实现类的所有字段都带有默认值，因此空输入 {} 也能得到结构完整的文档骨架。
 * </p>
 */
public interface SlotDocument {

    /**
     * 将越界的受限数值重置为各自的回退值。宽松转换之后调用。
     */
    default void repair() {
    }
}
