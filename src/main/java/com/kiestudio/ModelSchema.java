package com.kiestudio;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class ModelSchema {
    public static final String PROMPT = "prompt";

    public final String id;
    public final String name;
    public final String description;
    public final String category;
    public final String emoji;
    public final String pricingText;
    public final Messenger.MediaKind output;
    /** Flag parameter that selects between clean and watermarked results, or null. */
    public final String watermarkParam;
    public final List<ParamSpec> params;

    public ModelSchema(String id,
                       String name,
                       String description,
                       String category,
                       String emoji,
                       String pricingText,
                       Messenger.MediaKind output,
                       String watermarkParam,
                       List<ParamSpec> params) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.category = category;
        this.emoji = emoji;
        this.pricingText = pricingText;
        this.output = output;
        this.watermarkParam = watermarkParam;
        this.params = List.copyOf(params);
    }

    public Optional<ParamSpec> param(String paramName) {
        return params.stream().filter(p -> p.name.equals(paramName)).findFirst();
    }

    public Optional<ParamSpec.Text> prompt() {
        return param(PROMPT)
                .filter(p -> p instanceof ParamSpec.Text)
                .map(p -> (ParamSpec.Text) p);
    }

    public Optional<ParamSpec.ImageList> imageParam() {
        return params.stream()
                .filter(p -> p instanceof ParamSpec.ImageList)
                .map(p -> (ParamSpec.ImageList) p)
                .findFirst();
    }

    public List<String> requiredNames() {
        return params.stream()
                .filter(p -> p.required)
                .map(p -> p.name)
                .collect(Collectors.toList());
    }

    public Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        for (ParamSpec p : params) {
            if (p.defaultValue() != null) {
                defaults.put(p.name, p.defaultValue());
            }
        }
        return defaults;
    }

    public String title() {
        return emoji + " " + name;
    }
}
