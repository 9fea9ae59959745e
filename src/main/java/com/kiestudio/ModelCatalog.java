package com.kiestudio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Read-only list of available models, loaded from {@code models.json} and checked once at load.
 */
public class ModelCatalog {
    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);
    public static final String RESOURCE = "/models.json";

    private final List<ModelSchema> models;

    public ModelCatalog(List<ModelSchema> models) {
        this.models = List.copyOf(models);
    }

    public static ModelCatalog loadDefault() {
        try (InputStream in = ModelCatalog.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Model catalog not found on classpath: " + RESOURCE);
            }
            ModelCatalog catalog = parse(in);
            log.info("Loaded {} models in {} categories", catalog.models.size(), catalog.categories().size());
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read model catalog", e);
        }
    }

    public static ModelCatalog parse(InputStream in) throws IOException {
        JsonNode root = new ObjectMapper().readTree(in);
        List<ModelSchema> models = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (JsonNode node : root.path("models")) {
            ModelSchema schema = parseModel(node);
            if (!ids.add(schema.id)) {
                throw invalid(schema.id, "duplicate model id");
            }
            models.add(schema);
        }
        return new ModelCatalog(models);
    }

    private static ModelSchema parseModel(JsonNode node) {
        String id = node.path("id").asText();
        if (id.isBlank()) {
            throw invalid("?", "model without id");
        }
        List<ParamSpec> params = new ArrayList<>();
        Set<String> names = new HashSet<>();
        int imageParams = 0;
        for (JsonNode p : node.path("params")) {
            ParamSpec spec = parseParam(id, p);
            if (!names.add(spec.name)) {
                throw invalid(id, "duplicate parameter " + spec.name);
            }
            if (spec.kind() == ParamSpec.Kind.IMAGES) {
                imageParams++;
            }
            params.add(spec);
        }
        if (imageParams > 1) {
            throw invalid(id, "more than one image parameter");
        }

        String watermarkParam = node.hasNonNull("watermarkParam") ? node.get("watermarkParam").asText() : null;
        if (watermarkParam != null && params.stream()
                .noneMatch(p -> p.name.equals(watermarkParam) && p.kind() == ParamSpec.Kind.FLAG)) {
            throw invalid(id, "watermark parameter " + watermarkParam + " is not a declared flag");
        }
        Messenger.MediaKind output = "video".equalsIgnoreCase(node.path("output").asText())
                ? Messenger.MediaKind.VIDEO
                : Messenger.MediaKind.IMAGE;

        return new ModelSchema(
                id,
                node.path("name").asText(id),
                node.path("description").asText(),
                node.path("category").asText(),
                node.path("emoji").asText(),
                node.path("pricing").asText(),
                output,
                watermarkParam,
                params
        );
    }

    private static ParamSpec parseParam(String modelId, JsonNode p) {
        String name = p.path("name").asText();
        if (name.isBlank()) {
            throw invalid(modelId, "parameter without name");
        }
        String description = p.path("description").asText();
        boolean required = p.path("required").asBoolean(false);
        String kind = p.path("kind").asText();
        return switch (kind) {
            case "text" -> new ParamSpec.Text(name, description, required, p.path("maxLength").asInt(0));
            case "choice" -> {
                List<String> values = new ArrayList<>();
                p.path("values").forEach(v -> values.add(v.asText()));
                if (values.isEmpty()) {
                    throw invalid(modelId, "choice parameter " + name + " has no values");
                }
                String def = p.hasNonNull("default") ? p.get("default").asText() : null;
                if (def != null && !values.contains(def)) {
                    throw invalid(modelId, "default of " + name + " is not one of its values");
                }
                yield new ParamSpec.Choice(name, description, required, values, def);
            }
            case "flag" -> new ParamSpec.Flag(name, description, required, p.path("default").asBoolean(false));
            case "images" -> new ParamSpec.ImageList(name, description, required);
            default -> throw invalid(modelId, "unknown kind '" + kind + "' for parameter " + name);
        };
    }

    private static IllegalStateException invalid(String modelId, String reason) {
        return new IllegalStateException("Invalid model catalog entry " + modelId + ": " + reason);
    }

    public List<ModelSchema> all() {
        return models;
    }

    public Optional<ModelSchema> find(String modelId) {
        return models.stream().filter(m -> m.id.equals(modelId)).findFirst();
    }

    public List<String> categories() {
        return models.stream()
                .map(m -> m.category)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    public List<ModelSchema> byCategory(String category) {
        return models.stream()
                .filter(m -> m.category.equals(category))
                .collect(Collectors.toList());
    }
}
