package com.linlay.calendarassistant.agent;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.calendarassistant.config.AssistantResourceProperties;
import com.linlay.calendarassistant.service.LlmService;
import com.linlay.calendarassistant.tool.CalendarToolName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Memoizes the assistant configuration for the life of the process.
 * <p>
 * The in-flight load is what gets cached, so callers arriving during a cold start share one
 * read. A failed load clears the slot before failing its waiters, and the next call reads again.
 */
@Component
public class AssistantConfigurationCache {

    static final String INSTRUCTION_FILE = "instruction.txt";
    static final String FUNCTIONS_DIR = "functions/";

    private static final Logger log = LoggerFactory.getLogger(AssistantConfigurationCache.class);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ResourceLoader resourceLoader;
    private final AssistantResourceProperties properties;
    private final ObjectMapper objectMapper;
    private final AtomicReference<CompletableFuture<AssistantConfiguration>> slot = new AtomicReference<>();

    public AssistantConfigurationCache(
            ResourceLoader resourceLoader,
            AssistantResourceProperties properties,
            ObjectMapper objectMapper
    ) {
        this.resourceLoader = resourceLoader;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Mono<AssistantConfiguration> load() {
        // a cancelled subscriber must not cancel the load shared with other callers
        return Mono.defer(() -> Mono.fromFuture(inFlight(), true));
    }

    private CompletableFuture<AssistantConfiguration> inFlight() {
        while (true) {
            CompletableFuture<AssistantConfiguration> existing = slot.get();
            if (existing != null) {
                return existing;
            }
            CompletableFuture<AssistantConfiguration> created = new CompletableFuture<>();
            if (slot.compareAndSet(null, created)) {
                start(created);
                return created;
            }
        }
    }

    private void start(CompletableFuture<AssistantConfiguration> future) {
        Mono.fromCallable(this::readConfiguration)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        configuration -> {
                            log.info("Loaded assistant configuration with {} tools", configuration.tools().size());
                            future.complete(configuration);
                        },
                        ex -> {
                            log.warn("Failed to load assistant configuration from {}", properties.getLocation(), ex);
                            slot.compareAndSet(future, null);
                            future.completeExceptionally(ex);
                        }
                );
    }

    AssistantConfiguration readConfiguration() throws IOException {
        String base = normalizeLocation(properties.getLocation());
        String instructions = readText(base + INSTRUCTION_FILE);
        List<LlmService.LlmFunctionTool> tools = new ArrayList<>();
        for (CalendarToolName toolName : CalendarToolName.values()) {
            tools.add(readFunction(base + FUNCTIONS_DIR + toolName.wireName() + ".json"));
        }
        return new AssistantConfiguration(instructions, tools);
    }

    private LlmService.LlmFunctionTool readFunction(String location) throws IOException {
        JsonNode node = objectMapper.readTree(readText(location));
        if (node == null || !node.isObject() || !StringUtils.hasText(node.path("name").asText(null))) {
            throw new IOException("Tool schema without a name: " + location);
        }
        Map<String, Object> parameters = node.has("parameters")
                ? objectMapper.convertValue(node.get("parameters"), MAP_TYPE)
                : Map.of("type", "object");
        Boolean strict = node.has("strict") ? node.get("strict").asBoolean() : null;
        return new LlmService.LlmFunctionTool(
                node.get("name").asText(),
                node.path("description").asText(""),
                parameters,
                strict
        );
    }

    private String readText(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new FileNotFoundException("Assistant resource not found: " + location);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return StreamUtils.copyToString(inputStream, StandardCharsets.UTF_8);
        }
    }

    private String normalizeLocation(String location) {
        String base = StringUtils.hasText(location) ? location.trim() : "classpath:assistant/";
        return base.endsWith("/") ? base : base + "/";
    }
}
