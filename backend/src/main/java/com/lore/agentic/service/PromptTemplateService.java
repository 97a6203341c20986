package com.lore.agentic.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 提示词模板服务
 *
 * 模板位于 classpath:prompts/，占位符写作 {{name}}，未提供的占位符原样保留。
 */
@Service
public class PromptTemplateService {

    private static final Logger logger = LoggerFactory.getLogger(PromptTemplateService.class);
    private static final String CLASSPATH_PREFIX = "classpath:prompts/";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_]+)\\s*}}");

    private final ResourceLoader resourceLoader;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    @Autowired
    public PromptTemplateService(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public String loadTemplate(String fileName) {
        return cache.computeIfAbsent(fileName, this::readTemplateInternal);
    }

    public String render(String fileName, Map<String, String> variables) {
        String template = loadTemplate(fileName);
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuffer out = new StringBuffer(template.length() + 256);
        while (matcher.find()) {
            String value = variables.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group(0)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String readTemplateInternal(String fileName) {
        Resource resource = resourceLoader.getResource(CLASSPATH_PREFIX + fileName);
        if (!resource.exists()) {
            throw new IllegalArgumentException("无法加载提示词模板: " + fileName);
        }
        try (InputStream in = resource.getInputStream()) {
            String content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            logger.debug("提示词模板已加载: {} ({} 字符)", fileName, content.length());
            return content;
        } catch (IOException e) {
            throw new IllegalStateException("读取提示词模板失败: " + fileName, e);
        }
    }
}
