package com.project.provenance.core;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Trusted AI model metadata, keyed by model id. Models are never removed.
 */
public class ModelRegistry {

    private final Map<String, AiModel> models = new ConcurrentHashMap<>();

    /**
     * Stage registration of a new model. Only the registry owner may register,
     * and the confidence level must be within [{@value Scores#MIN_CONFIDENCE}, 100].
     */
    void register(LedgerTransaction tx, String modelId, String name, String version, int confidenceLevel) {
        InputValidator.validateModelId(modelId);
        InputValidator.validateModelName(name);
        InputValidator.validateModelVersion(version);

        if (!tx.callerIsRegistryOwner()) {
            throw new ProvenanceException(ProvenanceError.NOT_AUTHORIZED,
                    String.format("%s is not the registry owner", tx.caller()));
        }
        if (models.containsKey(modelId)) {
            throw new ProvenanceException(ProvenanceError.ALREADY_REGISTERED,
                    String.format("model '%s' is already registered", modelId));
        }
        if (!Scores.isValidConfidence(confidenceLevel)) {
            throw new ProvenanceException(ProvenanceError.INVALID_AUTHENTICITY_SCORE,
                    String.format("confidence level must be in [%d, %d]: got %d",
                            Scores.MIN_CONFIDENCE, Scores.MAX_SCORE, confidenceLevel));
        }

        tx.stageModel(new AiModel(modelId, name, version, tx.caller(), confidenceLevel, true));
    }

    public Optional<AiModel> find(String modelId) {
        if (modelId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(models.get(modelId));
    }

    /**
     * True iff the model exists and is active. Never throws.
     */
    public boolean isActiveModel(String modelId) {
        return find(modelId).map(AiModel::active).orElse(false);
    }

    boolean insert(AiModel model) {
        return models.putIfAbsent(model.modelId(), model) == null;
    }
}
