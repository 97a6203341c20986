package com.lore.service.ner;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * 调用外部形态学服务进行词形变化
 *
 * 请求: POST {word, canonical}，响应: {"result": "..."}。任何失败都回退到规范名。
 */
public class HttpInflectionAdapter implements InflectionAdapter {

    private static final Logger logger = LoggerFactory.getLogger(HttpInflectionAdapter.class);

    private final RestTemplate restTemplate;
    private final String serviceUrl;

    public HttpInflectionAdapter(RestTemplate restTemplate, String serviceUrl) {
        this.restTemplate = restTemplate;
        this.serviceUrl = serviceUrl;
    }

    @Override
    public String inflect(String sourceWord, String canonicalForm) {
        Map<String, String> body = new HashMap<>();
        body.put("word", sourceWord);
        body.put("canonical", canonicalForm);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            JsonNode response = restTemplate.postForObject(serviceUrl, new HttpEntity<>(body, headers), JsonNode.class);
            if (response != null && response.hasNonNull("result")) {
                String result = response.get("result").asText();
                if (!result.isEmpty()) {
                    return result;
                }
            }
        } catch (RestClientException e) {
            logger.warn("词形变化服务调用失败，使用规范名: {} -> {} ({})", sourceWord, canonicalForm, e.getMessage());
        }
        return canonicalForm;
    }
}
