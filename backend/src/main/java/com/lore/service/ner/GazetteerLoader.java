package com.lore.service.ner;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * 词典加载
 *
 * 文件格式：UTF-8，每行一个规范名，忽略空行和 # 开头的注释行。
 * 优先读取配置的文件路径，未配置时读取 classpath 下的 gazetteer.txt。
 */
public class GazetteerLoader {

    private static final Logger logger = LoggerFactory.getLogger(GazetteerLoader.class);

    static final String DEFAULT_CLASSPATH_LOCATION = "classpath:gazetteer.txt";

    private final ResourceLoader resourceLoader;

    public GazetteerLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public Gazetteer load(String path) {
        if (StringUtils.isNotBlank(path)) {
            Path file = Paths.get(path.trim());
            if (!Files.isRegularFile(file)) {
                throw new IllegalStateException("词典文件不存在: " + file.toAbsolutePath());
            }
            try (InputStream in = Files.newInputStream(file)) {
                Gazetteer gazetteer = Gazetteer.of(readNames(in));
                logger.info("📚 词典已加载: {} ({} 条)", file, gazetteer.size());
                return gazetteer;
            } catch (IOException e) {
                throw new UncheckedIOException("读取词典失败: " + file, e);
            }
        }

        Resource resource = resourceLoader.getResource(DEFAULT_CLASSPATH_LOCATION);
        if (!resource.exists()) {
            logger.warn("⚠️ 未配置词典且 classpath 中没有 gazetteer.txt，使用空词典");
            return Gazetteer.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            Gazetteer gazetteer = Gazetteer.of(readNames(in));
            logger.info("📚 词典已加载: {} ({} 条)", DEFAULT_CLASSPATH_LOCATION, gazetteer.size());
            return gazetteer;
        } catch (IOException e) {
            throw new UncheckedIOException("读取词典失败: " + DEFAULT_CLASSPATH_LOCATION, e);
        }
    }

    static List<String> readNames(InputStream in) throws IOException {
        List<String> names = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                names.add(trimmed);
            }
        }
        return names;
    }
}
