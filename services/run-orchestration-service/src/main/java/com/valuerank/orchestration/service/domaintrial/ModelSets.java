package com.valuerank.orchestration.service.domaintrial;

import com.valuerank.orchestration.domain.RunConfig;
import com.valuerank.orchestration.domain.RunEntity;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

final class ModelSets {

    private ModelSets() {
    }

    static List<String> normalize(Collection<String> models) {
        if (models == null) {
            return List.of();
        }
        return models.stream()
            .filter(Objects::nonNull)
            .map(m -> m.trim().toLowerCase(Locale.ROOT))
            .filter(m -> !m.isEmpty())
            .distinct()
            .sorted()
            .toList();
    }

    static boolean isEquivalent(RunEntity run, List<String> normalizedModels, Double temperature) {
        RunConfig config = run.getConfig();
        if (config == null) {
            return false;
        }
        return sameTemperature(config.temperature(), temperature)
            && normalize(config.models()).equals(normalizedModels);
    }

    private static boolean sameTemperature(Double left, Double right) {
        if (left == null || right == null) {
            return left == null && right == null;
        }
        return Double.compare(left, right) == 0;
    }
}
