package com.meridian.service;

import com.meridian.config.MeridianProperties;
import com.meridian.model.ModelSpec;
import com.meridian.model.TaskCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registered provider/model pairs with pricing (USD per 1M tokens) and static quality ratings.
 */
@Slf4j
@Component
public class ModelCatalog {

    private static final List<ModelSpec> DEFAULT_MODELS = List.of(
            spec("openai", "gpt-4o", 5.00, 15.00, 0.92),
            spec("openai", "gpt-4o-mini", 0.15, 0.60, 0.78),
            spec("openai", "gpt-4-turbo", 10.00, 30.00, 0.90),
            spec("openai", "gpt-3.5-turbo", 0.50, 1.50, 0.60),
            spec("anthropic", "claude-3-opus", 15.00, 75.00, 0.95),
            spec("anthropic", "claude-3-sonnet", 3.00, 15.00, 0.82),
            spec("anthropic", "claude-3-haiku", 0.25, 1.25, 0.70),
            spec("anthropic", "claude-3-5-sonnet", 3.00, 15.00, 0.93)
    );

    private final ConcurrentMap<String, ModelSpec> models = new ConcurrentHashMap<>();

    @Autowired
    public ModelCatalog(MeridianProperties properties) {
        this(properties.getModels().isEmpty()
                ? DEFAULT_MODELS
                : properties.getModels().stream().map(ModelCatalog::fromConfig).toList());
    }

    public ModelCatalog(Collection<ModelSpec> specs) {
        specs.forEach(this::register);
        log.info("Model catalog initialized with {} models", models.size());
    }

    public void register(ModelSpec spec) {
        models.put(spec.key(), spec);
    }

    public Optional<ModelSpec> find(String provider, String model) {
        return Optional.ofNullable(models.get(provider + ":" + model));
    }

    /**
     * Models registered for a category, ordered by provider/model key.
     */
    public List<ModelSpec> modelsFor(TaskCategory category) {
        return models.values().stream()
                .filter(spec -> spec.supports(category))
                .sorted(Comparator.comparing(ModelSpec::key))
                .toList();
    }

    public List<ModelSpec> all() {
        return models.values().stream()
                .sorted(Comparator.comparing(ModelSpec::key))
                .toList();
    }

    private static ModelSpec spec(String provider, String model, double input, double output, double quality) {
        return ModelSpec.builder()
                .provider(provider)
                .model(model)
                .inputPricePerMillion(input)
                .outputPricePerMillion(output)
                .quality(quality)
                .categoryQuality(Map.of())
                .taskCategories(Set.of())
                .build();
    }

    private static ModelSpec fromConfig(MeridianProperties.ModelConfig config) {
        Map<TaskCategory, Double> categoryQuality = new EnumMap<>(TaskCategory.class);
        config.getCategoryQuality().forEach((id, quality) -> categoryQuality.put(TaskCategory.fromId(id), quality));

        Set<TaskCategory> categories = EnumSet.noneOf(TaskCategory.class);
        config.getTaskCategories().forEach(id -> categories.add(TaskCategory.fromId(id)));

        return ModelSpec.builder()
                .provider(config.getProvider())
                .model(config.getModel())
                .inputPricePerMillion(config.getInputPricePerMillion())
                .outputPricePerMillion(config.getOutputPricePerMillion())
                .quality(config.getQuality())
                .categoryQuality(categoryQuality)
                .taskCategories(categories)
                .build();
    }
}
