package com.supportdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 客服工单分诊服务启动类。
 * <p>
 * 位于顶层包路径，确保能扫描到 domain / infrastructure / trigger 各模块中的组件与 Mapper。
 * </p>
 *
 * @author supportdesk
 * @since 2025-03-02
 */
@SpringBootApplication
@EnableScheduling
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
