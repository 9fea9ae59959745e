package com.kiestudio;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-user progress through the generation form or the top-up flow. Only touched under the user's lock
 * in {@link SessionStore}.
 */
public class Session {
    public enum State {
        SELECTING_MODEL,
        INPUTTING_PARAMS,
        CONFIRMING_GENERATION,
        SELECTING_AMOUNT,
        WAITING_PAYMENT_SCREENSHOT,
        ADMIN_TEST_OCR
    }

    /** What the next free-text or photo message is expected to be. */
    public enum Waiting {
        NOTHING,
        PARAM,
        IMAGE_CHOICE,
        IMAGE,
        CUSTOM_AMOUNT,
        SCREENSHOT
    }

    public final long userId;
    public State state;
    public ModelSchema model;
    public final Map<String, Object> params = new LinkedHashMap<>();
    public List<String> required = new ArrayList<>();
    public String currentParam;
    public Waiting waitingFor = Waiting.NOTHING;
    public final List<String> pendingImages = new ArrayList<>();
    public boolean imageStepDone;
    public BigDecimal topUpAmount;
    public String taskId;
    public int pollAttempts;

    public Session(long userId, State state) {
        this.userId = userId;
        this.state = state;
    }

    public static Session forModel(long userId, ModelSchema model) {
        Session session = new Session(userId, State.INPUTTING_PARAMS);
        session.model = model;
        session.required = new ArrayList<>(model.requiredNames());
        return session;
    }

    public boolean isGenerating() {
        return taskId != null;
    }

    /** Snapshot kept after a successful generation for "generate again". Collected values are not part of it. */
    public static final class SavedGeneration {
        public final String modelId;
        public final ModelSchema model;
        public final List<String> required;

        public SavedGeneration(ModelSchema model, List<String> required) {
            this.modelId = model.id;
            this.model = model;
            this.required = List.copyOf(required);
        }

        public Session reseed(long userId) {
            Session session = new Session(userId, State.INPUTTING_PARAMS);
            session.model = model;
            session.required = new ArrayList<>(required);
            return session;
        }
    }
}
