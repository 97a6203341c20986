package com.lore.agentic.config;

import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Neo4j 图数据库配置
 */
@Configuration
@ConditionalOnProperty(name = "graph.neo4j.enabled", havingValue = "true", matchIfMissing = false)
public class Neo4jConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(Neo4jConfiguration.class);

    @Value("${graph.neo4j.uri:bolt://localhost:7687}")
    private String uri;

    @Value("${graph.neo4j.username:neo4j}")
    private String username;

    @Value("${graph.neo4j.password:}")
    private String password;

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver() {
        logger.info("🔌 正在连接Neo4j图数据库: {}", uri);

        Driver driver = GraphDatabase.driver(uri, AuthTokens.basic(username, password));
        try (Session session = driver.session()) {
            session.run("RETURN 1").consume();
        } catch (RuntimeException e) {
            logger.error("❌ Neo4j连接失败: {}", e.getMessage());
            logger.error("   请检查：1) Neo4j服务是否启动 2) 端口7687是否开放 3) 用户名密码是否正确");
            driver.close();
            throw new IllegalStateException("Neo4j连接失败", e);
        }

        logger.info("✅ Neo4j图数据库连接成功");
        return driver;
    }
}
