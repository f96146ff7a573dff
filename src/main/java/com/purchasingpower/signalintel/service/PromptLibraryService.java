package com.purchasingpower.signalintel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.signalintel.model.prompt.PromptTemplate;
import com.purchasingpower.signalintel.model.prompt.RenderedPrompt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt Library Service
 *
 * Loads prompts from YAML files and renders them with variables.
 *
 * Usage:
 * RenderedPrompt prompt = promptLibrary.render("query-planner", Map.of(
 *     "description", "Series B fintechs hiring a CFO"
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:prompts/*.yaml");

            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(resource.getInputStream(), PromptTemplate.class);
                templates.put(template.getName(), template);
                log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            }

            log.info("Loaded {} prompt templates", templates.size());

        } catch (Exception e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    /**
     * Render system and user prompt of a template with the same variables.
     */
    public RenderedPrompt render(String templateName, Map<String, Object> variables) {
        PromptTemplate template = getTemplate(templateName);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }

        String system = template.getSystemPrompt() == null || template.getSystemPrompt().isBlank()
                ? null
                : renderText(templateName + ".system", template.getSystemPrompt(), variables).trim();
        String user = renderText(templateName + ".user", template.getUserPrompt(), variables).trim();

        return new RenderedPrompt(templateName, system, user, template.getTemperature(), template.isJsonMode());
    }

    /**
     * Get template metadata (for logging, debugging)
     */
    public PromptTemplate getTemplate(String name) {
        return templates.get(name);
    }

    private String renderText(String cacheKey, String text, Map<String, Object> variables) {
        Mustache mustache = mustacheFactory.compile(new StringReader(text), cacheKey);
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }
}
