package com.lore.config;

import com.lore.service.ner.Gazetteer;
import com.lore.service.ner.GazetteerLoader;
import com.lore.service.ner.HttpInflectionAdapter;
import com.lore.service.ner.InflectionAdapter;
import com.lore.service.ner.PassThroughInflectionAdapter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * 实体识别相关配置：词典、词形变化服务
 */
@Configuration
public class EntityConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(EntityConfiguration.class);

    @Value("${entity.gazetteer.path:}")
    private String gazetteerPath;

    @Value("${inflection.service-url:}")
    private String inflectionServiceUrl;

    @Value("${inflection.timeout-ms:3000}")
    private int inflectionTimeoutMs;

    /**
     * 启动时加载一次，之后只读共享
     */
    @Bean
    public Gazetteer gazetteer(ResourceLoader resourceLoader) {
        return new GazetteerLoader(resourceLoader).load(gazetteerPath);
    }

    @Bean
    public InflectionAdapter inflectionAdapter() {
        if (StringUtils.isBlank(inflectionServiceUrl)) {
            logger.info("未配置词形变化服务，直接使用规范名");
            return new PassThroughInflectionAdapter();
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(inflectionTimeoutMs);
        requestFactory.setReadTimeout(inflectionTimeoutMs);
        logger.info("✅ 词形变化服务: {}", inflectionServiceUrl);
        return new HttpInflectionAdapter(new RestTemplate(requestFactory), inflectionServiceUrl.trim());
    }
}
