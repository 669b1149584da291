package com.ainnovators.viewer.backend.service;

import com.ainnovators.viewer.backend.model.ContextSchema;
import com.ainnovators.viewer.backend.model.ExperimentContext;
import com.ainnovators.viewer.backend.model.Stage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Reconciles the two generations of the context schema into one canonical shape.
 *
 * <p>Older pipeline runs stored stage results as flat fields on {@code state} ({@code idea},
 * {@code research_final}, {@code prototype}, {@code pitch}, ...). Newer runs group them under
 * {@code state.stage_outputs.<stage>}. {@link #normalize(JsonNode)} backfills the structured
 * section from the flat fields so every consumer reads {@code stage_outputs} only.
 *
 * <p>Rules:
 * <ul>
 *   <li>an existing {@code stage_outputs.<stage>} entry is never touched, even when flat fields
 *       disagree with it;</li>
 *   <li>an entry is synthesized only when the stage's flat indicator field ({@code idea},
 *       {@code prototype}, {@code pitch}) is present and not null;</li>
 *   <li>a document without a {@code state} object is returned as is.</li>
 * </ul>
 * The input is never mutated, and normalizing a normalized document changes nothing.
 */
@Component
public class ContextNormalizer {

    static final String STATE = "state";
    static final String STAGE_OUTPUTS = "stage_outputs";

    private static final List<String> LEGACY_INDICATORS = List.of("idea", "prototype", "pitch");

    private final JsonDocumentReader documentReader;

    public ContextNormalizer(JsonDocumentReader documentReader) {
        this.documentReader = documentReader;
    }

    /**
     * Return a normalized copy of {@code rawContext}.
     */
    public JsonNode normalize(JsonNode rawContext) {
        if (rawContext == null || !rawContext.isObject() || !rawContext.path(STATE).isObject()) {
            return rawContext;
        }

        ObjectNode context = rawContext.deepCopy();
        ObjectNode state = (ObjectNode) context.get(STATE);

        JsonNode existing = state.get(STAGE_OUTPUTS);
        ObjectNode stageOutputs;
        if (existing == null || existing.isNull()) {
            stageOutputs = state.putObject(STAGE_OUTPUTS);
        } else if (existing.isObject()) {
            stageOutputs = (ObjectNode) existing;
        } else {
            // Unexpected shape; leave it for the raw view rather than replace it
            return context;
        }

        for (Stage stage : Stage.values()) {
            if (isPresent(stageOutputs.get(stage.getKey()))) {
                continue;
            }
            ObjectNode backfilled = backfill(stage, state);
            if (backfilled != null) {
                stageOutputs.set(stage.getKey(), backfilled);
            }
        }
        return context;
    }

    /**
     * Normalize and bind to the typed model. Empty when the document has a shape the model cannot
     * hold; callers then serve the normalized tree as is.
     */
    public Optional<ExperimentContext> toContext(JsonNode rawContext, String origin) {
        if (detectSchema(rawContext) == ContextSchema.UNRECOGNIZED) {
            return Optional.empty();
        }
        return documentReader.tryBind(normalize(rawContext), ExperimentContext.class, origin);
    }

    /**
     * Classify which schema generation a raw document was written in.
     */
    public ContextSchema detectSchema(JsonNode rawContext) {
        if (rawContext == null || !rawContext.path(STATE).isObject()) {
            return ContextSchema.UNRECOGNIZED;
        }
        JsonNode state = rawContext.get(STATE);

        JsonNode stageOutputs = state.path(STAGE_OUTPUTS);
        if (isPresent(stageOutputs) && !stageOutputs.isObject()) {
            return ContextSchema.UNRECOGNIZED;
        }

        boolean structured = false;
        if (stageOutputs.isObject()) {
            for (Stage stage : Stage.values()) {
                structured |= isPresent(stageOutputs.get(stage.getKey()));
            }
        }

        boolean legacy = false;
        for (String indicator : LEGACY_INDICATORS) {
            legacy |= isPresent(state.get(indicator));
        }

        if (structured && legacy) {
            return ContextSchema.MIXED;
        }
        if (legacy) {
            return ContextSchema.LEGACY;
        }
        return structured ? ContextSchema.STRUCTURED : ContextSchema.EMPTY;
    }

    private ObjectNode backfill(Stage stage, ObjectNode state) {
        return switch (stage) {
            case IDEA_DEVELOPMENT -> backfillIdeaDevelopment(state);
            case PROTOTYPING -> backfillPrototyping(state);
            case PITCH -> backfillPitch(state);
        };
    }

    private ObjectNode backfillIdeaDevelopment(ObjectNode state) {
        if (!isPresent(state.get("idea"))) {
            return null;
        }
        ObjectNode output = state.objectNode();
        copy(state, "idea", output, "idea");
        copy(state, "research", output, "research");
        // Refined validation wins over the first-pass research
        if (!copy(state, "research_final", output, "final_validation")) {
            copy(state, "research", output, "final_validation");
        }
        copy(state, "legal_insights", output, "legal_insights");
        copy(state, "refinement_feedback", output, "refinement_feedback");
        return output;
    }

    private ObjectNode backfillPrototyping(ObjectNode state) {
        if (!isPresent(state.get("prototype"))) {
            return null;
        }
        ObjectNode output = state.objectNode();
        copy(state, "architecture", output, "architecture");
        copy(state, "design", output, "design");
        copy(state, "final_designs", output, "final_designs");
        copy(state, "prototype", output, "prototype");
        return output;
    }

    private ObjectNode backfillPitch(ObjectNode state) {
        if (!isPresent(state.get("pitch"))) {
            return null;
        }
        ObjectNode output = state.objectNode();
        copy(state, "marketing_strategies", output, "marketing_strategies");
        copy(state, "pitch", output, "pitch_deck");
        return output;
    }

    private static boolean copy(ObjectNode from, String sourceField, ObjectNode to, String targetField) {
        JsonNode value = from.get(sourceField);
        if (!isPresent(value)) {
            return false;
        }
        to.set(targetField, value.deepCopy());
        return true;
    }

    private static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode();
    }
}
