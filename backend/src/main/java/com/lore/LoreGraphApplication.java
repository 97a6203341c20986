package com.lore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.neo4j.Neo4jAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 设定集图谱检索服务主应用类
 *
 * Neo4j 驱动由 graph.neo4j.enabled 控制，不使用 Spring Boot 的自动配置
 */
@SpringBootApplication(exclude = Neo4jAutoConfiguration.class)
@EnableScheduling
public class LoreGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoreGraphApplication.class, args);
    }
}
