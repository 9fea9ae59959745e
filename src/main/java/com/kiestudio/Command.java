package com.kiestudio;

import java.util.Objects;
import java.util.Optional;

/**
 * Typed form of inline-button callback data. The wire form is {@code type[:arg[:value]]}; decoding happens once,
 * at the transport boundary.
 */
public final class Command {
    public enum Type {
        SHOW_MODELS("show_models", 0),
        CATEGORY("category", 1),
        SELECT_MODEL("select_model", 1),
        SET_PARAM("set_param", 2),
        ADD_IMAGE("add_image", 0),
        IMAGE_DONE("image_done", 0),
        SKIP_IMAGE("skip_image", 0),
        CANCEL("cancel", 0),
        CONFIRM_GENERATE("confirm_generate", 0),
        GENERATE_AGAIN("generate_again", 0),
        CHECK_BALANCE("check_balance", 0),
        TOPUP_BALANCE("topup_balance", 0),
        TOPUP_AMOUNT("topup_amount", 1),
        TOPUP_CUSTOM("topup_custom", 0),
        BACK_TO_MENU("back_to_menu", 0),
        HELP_MENU("help_menu", 0),
        ADMIN_TEST_OCR("admin_test_ocr", 0),
        ADMIN_USER_MODE("admin_user_mode", 0);

        final String wire;
        final int arity;

        Type(String wire, int arity) {
            this.wire = wire;
            this.arity = arity;
        }

        static Optional<Type> fromWire(String wire) {
            for (Type t : values()) {
                if (t.wire.equals(wire)) {
                    return Optional.of(t);
                }
            }
            return Optional.empty();
        }
    }

    public final Type type;
    public final String arg;
    public final String value;

    private Command(Type type, String arg, String value) {
        this.type = type;
        this.arg = arg;
        this.value = value;
    }

    public static Command of(Type type) {
        if (type.arity != 0) {
            throw new IllegalArgumentException(type + " needs arguments");
        }
        return new Command(type, null, null);
    }

    public static Command category(String name) {
        return new Command(Type.CATEGORY, name, null);
    }

    public static Command selectModel(String modelId) {
        return new Command(Type.SELECT_MODEL, modelId, null);
    }

    public static Command setParam(String name, String value) {
        return new Command(Type.SET_PARAM, name, value);
    }

    public static Command topUpAmount(int amount) {
        return new Command(Type.TOPUP_AMOUNT, String.valueOf(amount), null);
    }

    public String encode() {
        return switch (type.arity) {
            case 0 -> type.wire;
            case 1 -> type.wire + ":" + arg;
            default -> type.wire + ":" + arg + ":" + value;
        };
    }

    /**
     * Empty for anything outside the grammar, including known types with missing arguments.
     * Values may contain ':' themselves (aspect ratios), so only the first two separators split.
     */
    public static Optional<Command> decode(String data) {
        if (data == null || data.isBlank()) {
            return Optional.empty();
        }
        String[] parts = data.split(":", 3);
        Optional<Type> type = Type.fromWire(parts[0]);
        if (type.isEmpty()) {
            return Optional.empty();
        }
        Type t = type.get();
        switch (t.arity) {
            case 0:
                return parts.length == 1 ? Optional.of(new Command(t, null, null)) : Optional.empty();
            case 1: {
                if (parts.length < 2) {
                    return Optional.empty();
                }
                String arg = data.substring(t.wire.length() + 1);
                return arg.isEmpty() ? Optional.empty() : Optional.of(new Command(t, arg, null));
            }
            default:
                if (parts.length < 3 || parts[1].isEmpty() || parts[2].isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(new Command(t, parts[1], parts[2]));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Command)) {
            return false;
        }
        Command other = (Command) o;
        return type == other.type && Objects.equals(arg, other.arg) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, arg, value);
    }

    @Override
    public String toString() {
        return encode();
    }
}
