package com.kiestudio;

import java.util.List;
import java.util.Locale;

/**
 * One model parameter. The set of variants is closed: free text, a fixed choice, a yes/no flag
 * or a list of uploaded images.
 */
public abstract class ParamSpec {
    public enum Kind {
        TEXT,
        CHOICE,
        FLAG,
        IMAGES
    }

    public final String name;
    public final String description;
    public final boolean required;

    private ParamSpec(String name, String description, boolean required) {
        this.name = name;
        this.description = description;
        this.required = required;
    }

    public abstract Kind kind();

    /** Schema default, or null when the parameter has none. */
    public abstract Object defaultValue();

    public static final class Text extends ParamSpec {
        public final int maxLength;

        public Text(String name, String description, boolean required, int maxLength) {
            super(name, description, required);
            this.maxLength = maxLength;
        }

        @Override
        public Kind kind() {
            return Kind.TEXT;
        }

        @Override
        public Object defaultValue() {
            return null;
        }

        public boolean accepts(String value) {
            return value != null && !value.isBlank() && (maxLength <= 0 || value.length() <= maxLength);
        }
    }

    public static final class Choice extends ParamSpec {
        public final List<String> values;
        private final String defaultValue;

        public Choice(String name, String description, boolean required, List<String> values, String defaultValue) {
            super(name, description, required);
            this.values = List.copyOf(values);
            this.defaultValue = defaultValue;
        }

        @Override
        public Kind kind() {
            return Kind.CHOICE;
        }

        @Override
        public Object defaultValue() {
            return defaultValue;
        }

        public boolean accepts(String value) {
            return values.contains(value);
        }
    }

    public static final class Flag extends ParamSpec {
        private final boolean defaultValue;

        public Flag(String name, String description, boolean required, boolean defaultValue) {
            super(name, description, required);
            this.defaultValue = defaultValue;
        }

        @Override
        public Kind kind() {
            return Kind.FLAG;
        }

        @Override
        public Object defaultValue() {
            return defaultValue;
        }

        /** Unknown literals fall back to the default. */
        public boolean parse(String raw) {
            if (raw == null) {
                return defaultValue;
            }
            return switch (raw.trim().toLowerCase(Locale.ROOT)) {
                case "true", "yes", "да", "1" -> true;
                case "false", "no", "нет", "0" -> false;
                default -> defaultValue;
            };
        }
    }

    public static final class ImageList extends ParamSpec {
        public static final int MAX_IMAGES = 8;

        public ImageList(String name, String description, boolean required) {
            super(name, description, required);
        }

        @Override
        public Kind kind() {
            return Kind.IMAGES;
        }

        @Override
        public Object defaultValue() {
            return null;
        }
    }
}
