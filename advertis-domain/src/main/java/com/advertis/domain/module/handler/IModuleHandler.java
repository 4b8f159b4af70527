package com.advertis.domain.module.handler;

import com.advertis.domain.module.model.valobj.ModuleContext;
import com.advertis.domain.module.model.valobj.ModuleDescriptor;
import com.advertis.domain.module.model.valobj.ModuleResult;

/**
 * 可插拔的策略模块。实现类注册为 Spring Bean 后由模块注册表统一发现。
 */
public interface IModuleHandler {

    ModuleDescriptor descriptor();

    /**
     * 执行模块计算。实现不应访问持久层，输入全部来自 context。
     */
    ModuleResult execute(ModuleContext context);
}
