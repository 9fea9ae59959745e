package com.kiestudio;

import java.util.ArrayList;
import java.util.List;

final class Keyboards {
    static final int[] TOP_UP_PRESETS = {100, 500, 1000, 2000, 5000};

    private Keyboards() {
    }

    static Messenger.Button button(String text, Command command) {
        return new Messenger.Button(text, command);
    }

    static Messenger.Button button(String text, Command.Type type) {
        return new Messenger.Button(text, Command.of(type));
    }

    static List<List<Messenger.Button>> mainMenu(boolean primaryAdmin, boolean userMode) {
        List<List<Messenger.Button>> rows = new ArrayList<>();
        rows.add(List.of(button("🎨 Выбрать модель", Command.Type.SHOW_MODELS)));
        rows.add(List.of(button("💰 Баланс", Command.Type.CHECK_BALANCE),
                button("💳 Пополнить", Command.Type.TOPUP_BALANCE)));
        rows.add(List.of(button("ℹ️ Помощь", Command.Type.HELP_MENU)));
        if (primaryAdmin) {
            rows.add(List.of(button("🔍 Тест OCR", Command.Type.ADMIN_TEST_OCR),
                    button(userMode ? "👑 Режим админа" : "👤 Режим пользователя", Command.Type.ADMIN_USER_MODE)));
        }
        return rows;
    }

    static List<List<Messenger.Button>> backToMenu() {
        return List.of(List.of(button("◀️ Назад в меню", Command.Type.BACK_TO_MENU)));
    }

    static List<List<Messenger.Button>> cancelOnly() {
        return List.of(List.of(button("❌ Отмена", Command.Type.CANCEL)));
    }

    static List<List<Messenger.Button>> categories(List<String> categories) {
        List<List<Messenger.Button>> rows = new ArrayList<>();
        for (String category : categories) {
            rows.add(List.of(button(category, Command.category(category))));
        }
        rows.add(List.of(button("◀️ Назад в меню", Command.Type.BACK_TO_MENU)));
        return rows;
    }

    static List<List<Messenger.Button>> models(List<ModelSchema> models) {
        List<List<Messenger.Button>> rows = new ArrayList<>();
        for (ModelSchema model : models) {
            rows.add(List.of(button(model.title(), Command.selectModel(model.id))));
        }
        rows.add(List.of(button("◀️ К категориям", Command.Type.SHOW_MODELS)));
        return rows;
    }

    static List<List<Messenger.Button>> choices(ParamSpec.Choice choice) {
        List<List<Messenger.Button>> rows = new ArrayList<>();
        List<Messenger.Button> row = new ArrayList<>();
        for (String value : choice.values) {
            String label = value.equals(choice.defaultValue()) ? "✅ " + value : value;
            row.add(button(label, Command.setParam(choice.name, value)));
            if (row.size() == 3) {
                rows.add(row);
                row = new ArrayList<>();
            }
        }
        if (!row.isEmpty()) {
            rows.add(row);
        }
        rows.add(List.of(button("❌ Отмена", Command.Type.CANCEL)));
        return rows;
    }

    static List<List<Messenger.Button>> yesNo(ParamSpec.Flag flag) {
        return List.of(
                List.of(button("✅ Да", Command.setParam(flag.name, "true")),
                        button("❌ Нет", Command.setParam(flag.name, "false"))),
                List.of(button("❌ Отмена", Command.Type.CANCEL))
        );
    }

    static List<List<Messenger.Button>> imageOffer(boolean skippable) {
        List<List<Messenger.Button>> rows = new ArrayList<>();
        rows.add(List.of(button("📷 Добавить изображение", Command.Type.ADD_IMAGE)));
        if (skippable) {
            rows.add(List.of(button("⏭ Пропустить", Command.Type.SKIP_IMAGE)));
        }
        rows.add(List.of(button("❌ Отмена", Command.Type.CANCEL)));
        return rows;
    }

    static List<List<Messenger.Button>> imageMore() {
        return List.of(
                List.of(button("📷 Добавить ещё", Command.Type.ADD_IMAGE),
                        button("✅ Готово", Command.Type.IMAGE_DONE)),
                List.of(button("❌ Отмена", Command.Type.CANCEL))
        );
    }

    static List<List<Messenger.Button>> confirm() {
        return List.of(
                List.of(button("🚀 Сгенерировать", Command.Type.CONFIRM_GENERATE)),
                List.of(button("❌ Отмена", Command.Type.CANCEL))
        );
    }

    static List<List<Messenger.Button>> afterResult() {
        return List.of(
                List.of(button("🔄 Сгенерировать ещё", Command.Type.GENERATE_AGAIN)),
                List.of(button("◀️ В меню", Command.Type.BACK_TO_MENU))
        );
    }

    static List<List<Messenger.Button>> topUpOffer() {
        return List.of(
                List.of(button("💳 Пополнить баланс", Command.Type.TOPUP_BALANCE)),
                List.of(button("◀️ Назад в меню", Command.Type.BACK_TO_MENU))
        );
    }

    static List<List<Messenger.Button>> topUpAmounts() {
        List<List<Messenger.Button>> rows = new ArrayList<>();
        List<Messenger.Button> row = new ArrayList<>();
        for (int amount : TOP_UP_PRESETS) {
            row.add(button(amount + " ₽", Command.topUpAmount(amount)));
            if (row.size() == 3) {
                rows.add(row);
                row = new ArrayList<>();
            }
        }
        if (!row.isEmpty()) {
            rows.add(row);
        }
        rows.add(List.of(button("✏️ Своя сумма", Command.Type.TOPUP_CUSTOM)));
        rows.add(List.of(button("❌ Отмена", Command.Type.CANCEL)));
        return rows;
    }

    static List<List<Messenger.Button>> balance(boolean canTopUp) {
        if (!canTopUp) {
            return backToMenu();
        }
        return topUpOffer();
    }
}
