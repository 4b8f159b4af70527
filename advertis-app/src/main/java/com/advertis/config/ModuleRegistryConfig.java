package com.advertis.config;

import com.advertis.domain.content.service.SlotSchemaRegistry;
import com.advertis.domain.module.handler.IModuleHandler;
import com.advertis.domain.module.service.ModuleRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * 模块注册表装配：容器中的全部 IModuleHandler 在启动时注册，描述符不合法则启动失败。
 */
@Slf4j
@Configuration
public class ModuleRegistryConfig {

    @Bean
    public ModuleRegistry moduleRegistry(SlotSchemaRegistry slotSchemaRegistry, List<IModuleHandler> handlers) {
        ModuleRegistry registry = new ModuleRegistry(slotSchemaRegistry, handlers);
        log.info("Module registry ready. modules: {}", registry.getAll().size());
        return registry;
    }
}
