package com.fleetrun.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fleetrun.core.model.Feature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Reads already-parsed features from a JSON or YAML file.
 *
 * <p>The document may be a list of features, an object with a {@code features}
 * list, or a single feature object.
 */
@Component
public class FeatureLoader {

    private static final Logger log = LoggerFactory.getLogger(FeatureLoader.class);

    private static final TypeReference<List<Feature>> FEATURE_LIST = new TypeReference<>() {};

    private final ObjectMapper json;
    private final ObjectMapper yaml;

    public FeatureLoader(ObjectMapper objectMapper) {
        this.json = objectMapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.yaml = new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public List<Feature> load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new FeatureLoadException("Features file not found: " + path);
        }
        ObjectMapper mapper = isYaml(path) ? yaml : json;
        try {
            JsonNode root = mapper.readTree(path.toFile());
            JsonNode features;
            if (root == null || root.isMissingNode() || root.isNull()) {
                throw new FeatureLoadException("Features file is empty: " + path);
            } else if (root.isArray()) {
                features = root;
            } else if (root.has("features")) {
                features = root.get("features");
            } else if (root.has("scenarios")) {
                features = mapper.createArrayNode().add(root);
            } else {
                throw new FeatureLoadException("No features found in " + path);
            }
            List<Feature> loaded = mapper.convertValue(features, FEATURE_LIST);
            log.info("Loaded {} features from {}", loaded.size(), path);
            return loaded;
        } catch (IOException | IllegalArgumentException e) {
            throw new FeatureLoadException("Cannot parse features file " + path + ": " + e.getMessage(), e);
        }
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
