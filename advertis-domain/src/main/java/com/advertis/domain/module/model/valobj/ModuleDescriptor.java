package com.advertis.domain.module.model.valobj;

import com.advertis.types.enums.ModuleCategoryEnum;
import lombok.Builder;

import java.util.List;

/**
 * 模块描述符（不可变）。
 * <p>
 * outputs 为空表示只读模块，运行结果只落在运行记录中。
 * inputSchema / outputSchema 为 Jackson 可绑定的类，字段约束使用 Bean Validation 注解。
 * </p>
 */
@Builder
public record ModuleDescriptor(String id,
                               String name,
                               String description,
                               ModuleCategoryEnum category,
                               List<ModuleInputSource> inputs,
                               List<ModuleOutputTarget> outputs,
                               boolean autoTrigger,
                               Class<?> inputSchema,
                               Class<?> outputSchema) {

    public ModuleDescriptor {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    public boolean isReadOnly() {
        return outputs.isEmpty();
    }
}
