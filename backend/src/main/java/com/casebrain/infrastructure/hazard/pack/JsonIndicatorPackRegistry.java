package com.casebrain.infrastructure.hazard.pack;

import com.casebrain.domain.housing.exception.InvalidIndicatorPackException;
import com.casebrain.domain.housing.model.IndicatorPack;
import com.casebrain.domain.housing.repository.IndicatorPackRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Practice-area lexicons loaded from JSON resources at startup.
 *
 * File shape:
 * <pre>
 * {
 *   "practiceArea": "housing_disrepair",
 *   "housingHazardModel": {
 *     "dampMouldFactors": [...], "vulnerableOccupantFactors": [...],
 *     "symptomKeywords": [...], "delayPatterns": [...]
 *   }
 * }
 * </pre>
 * A file without a hazard model registers nothing. A malformed hazard model fails startup.
 */
@Slf4j
@Component
public class JsonIndicatorPackRegistry implements IndicatorPackRegistry {

    static final String HOUSING_DISREPAIR = "housing_disrepair";

    private static final String HAZARD_MODEL = "housingHazardModel";

    private final Map<String, IndicatorPack> packs;

    @Autowired
    public JsonIndicatorPackRegistry(ObjectMapper objectMapper,
                                     @Value("${hazard.packs.location:classpath*:packs/*.json}") String location) {
        this(loadAll(objectMapper, new PathMatchingResourcePatternResolver(), location));
    }

    JsonIndicatorPackRegistry(Map<String, IndicatorPack> packs) {
        this.packs = Collections.unmodifiableMap(new LinkedHashMap<>(packs));
        log.info("[PackRegistry] Registered hazard packs: {}", this.packs.keySet());
    }

    @Override
    public Optional<IndicatorPack> findByPracticeArea(String practiceArea) {
        if (practiceArea == null || practiceArea.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(packs.get(normalize(practiceArea)));
    }

    @Override
    public Set<String> practiceAreas() {
        return packs.keySet();
    }

    /**
     * Lower-case, every character outside [a-z_] becomes "_".
     * Exact key first, then any housing/disrepair variant maps to housing_disrepair.
     */
    String normalize(String practiceArea) {
        String key = canonical(practiceArea);
        if (packs.containsKey(key)) {
            return key;
        }
        if (key.contains("housing") || key.contains("disrepair")) {
            return HOUSING_DISREPAIR;
        }
        return key;
    }

    private static String canonical(String practiceArea) {
        return practiceArea.strip().toLowerCase(Locale.ROOT).replaceAll("[^a-z_]", "_");
    }

    static Map<String, IndicatorPack> loadAll(ObjectMapper objectMapper, ResourcePatternResolver resolver,
                                             String location) {
        Resource[] resources;
        try {
            resources = resolver.getResources(location);
        } catch (IOException e) {
            throw new InvalidIndicatorPackException("Failed to list indicator packs at " + location, e);
        }

        Map<String, IndicatorPack> loaded = new LinkedHashMap<>();
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                JsonNode root = objectMapper.readTree(in);
                String practiceArea = root.path("practiceArea").asText("");
                if (practiceArea.isBlank()) {
                    throw new InvalidIndicatorPackException(
                            "Indicator pack " + resource.getFilename() + " has no practiceArea");
                }
                JsonNode model = root.get(HAZARD_MODEL);
                if (model == null || model.isNull()) {
                    log.debug("[PackRegistry] {} has no hazard model, skipped", resource.getFilename());
                    continue;
                }
                loaded.put(canonical(practiceArea), parsePack(model, resource.getFilename()));
            } catch (IOException e) {
                throw new InvalidIndicatorPackException(
                        "Failed to read indicator pack " + resource.getFilename(), e);
            }
        }
        return loaded;
    }

    static IndicatorPack parsePack(JsonNode model, String source) {
        if (!model.isObject()) {
            throw new InvalidIndicatorPackException(source + ": " + HAZARD_MODEL + " must be an object");
        }
        return new IndicatorPack(
                phrases(model, "dampMouldFactors", source),
                phrases(model, "vulnerableOccupantFactors", source),
                phrases(model, "symptomKeywords", source),
                phrases(model, "delayPatterns", source));
    }

    private static List<String> phrases(JsonNode model, String field, String source) {
        JsonNode node = model.get(field);
        if (node == null || !node.isArray()) {
            throw new InvalidIndicatorPackException(
                    String.format("%s: %s.%s must be an array of strings", source, HAZARD_MODEL, field));
        }
        List<String> phrases = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new InvalidIndicatorPackException(
                        String.format("%s: %s.%s contains a non-string entry: %s", source, HAZARD_MODEL, field, element));
            }
            phrases.add(element.asText());
        }
        return phrases;
    }
}
