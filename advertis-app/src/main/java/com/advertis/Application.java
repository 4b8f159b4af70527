package com.advertis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ADVERTIS 策略流水线应用启动类。
 * <p>
 * 位于顶层包路径，扫描 trigger、domain、infrastructure 各模块中的组件。
 * </p>
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
