package com.advertis.test;

import com.advertis.trigger.http.ModuleController;
import com.advertis.trigger.http.PhaseController;
import com.advertis.trigger.http.SlotController;
import com.advertis.trigger.http.StrategyController;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.util.List;

public class ControllerArchitectureTest {

    private static final List<Class<?>> CONTROLLERS = List.of(
            StrategyController.class,
            PhaseController.class,
            SlotController.class,
            ModuleController.class
    );

    @Test
    public void controllersShouldOnlyDependOnApplicationServices() {
        for (Class<?> controller : CONTROLLERS) {
            for (Field field : controller.getDeclaredFields()) {
                String typeName = field.getType().getName();
                Assertions.assertTrue(
                        typeName.startsWith("com.advertis.trigger.application."),
                        () -> "Controller should depend on application services only: " + controller.getSimpleName() + " -> " + typeName
                );
            }
        }
    }
}
