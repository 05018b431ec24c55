package org.example.diary.config;

import org.example.diary.service.DiaryDelivery;
import org.example.diary.service.FileDiaryDelivery;
import org.example.diary.service.PromptAssembler;
import org.example.diary.service.PromptTemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

@Configuration
public class DiaryConfig {

    private static final Logger log = LoggerFactory.getLogger(DiaryConfig.class);
    static final String DEFAULT_TEMPLATE_LOCATION = "classpath:prompts/diary-prompt.txt";

    @Value("${diary.prompt.template-path:}")
    private String templatePath;

    @Value("${diary.prompt.max-body-chars:5000}")
    private int maxBodyChars;

    @Value("${diary.delivery.output-dir:diaries}")
    private String outputDir;

    @Bean
    public PromptAssembler promptAssembler(ResourceLoader resourceLoader) {
        String location = templatePath == null || templatePath.isBlank()
                ? DEFAULT_TEMPLATE_LOCATION
                : "file:" + templatePath;
        log.info("Loading prompt template from {}", location);
        return new PromptAssembler(loadTemplate(resourceLoader.getResource(location)), maxBodyChars);
    }

    @Bean
    public DiaryDelivery diaryDelivery() {
        return new FileDiaryDelivery(Path.of(outputDir));
    }

    static String loadTemplate(Resource resource) {
        if (!resource.exists()) {
            throw new PromptTemplateException("Prompt template not found: " + resource.getDescription());
        }
        try (InputStream is = resource.getInputStream()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PromptTemplateException("Failed to read prompt template " + resource.getDescription(), e);
        }
    }
}
