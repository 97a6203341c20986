package com.lore.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * 大模型接口配置（OpenAI 兼容协议）
 */
@Configuration
public class LlmClientConfig {

    @Value("${llm.base-url:https://api.openai.com}")
    private String baseUrl;

    @Value("${llm.chat-path:/v1/chat/completions}")
    private String chatPath;

    @Value("${llm.api-key:}")
    private String apiKey;

    @Value("${llm.model:gpt-4o-mini}")
    private String model;

    @Value("${llm.temperature:0.12}")
    private double temperature;

    @Value("${llm.connect-timeout-ms:15000}")
    private int connectTimeoutMs;

    @Value("${llm.read-timeout-ms:120000}")
    private int readTimeoutMs;

    @Bean
    public RestTemplate llmRestTemplate() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(requestFactory);
    }

    public String getChatUrl() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + chatPath;
    }

    public String getApiKey() { return apiKey; }
    public String getModel() { return model; }
    public double getTemperature() { return temperature; }
}
