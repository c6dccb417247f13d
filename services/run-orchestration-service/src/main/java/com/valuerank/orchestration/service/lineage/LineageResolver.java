package com.valuerank.orchestration.service.lineage;

import com.valuerank.orchestration.domain.DefinitionNode;
import com.valuerank.orchestration.repository.DefinitionRepository;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class LineageResolver {

    static final Comparator<DefinitionNode> RECENCY = Comparator
        .comparingInt(DefinitionNode::getVersion)
        .thenComparing(DefinitionNode::getUpdatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(DefinitionNode::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(DefinitionNode::getId);

    private final DefinitionRepository definitionRepository;

    public LineageResolver(DefinitionRepository definitionRepository) {
        this.definitionRepository = definitionRepository;
    }

    public String rootOf(DefinitionNode definition, Map<String, ? extends DefinitionNode> knownById) {
        DefinitionNode current = definition;
        Set<String> visited = new HashSet<>();
        visited.add(current.getId());
        while (current.getParentId() != null) {
            DefinitionNode parent = knownById.get(current.getParentId());
            if (parent == null || visited.contains(parent.getId())) {
                break;
            }
            visited.add(parent.getId());
            current = parent;
        }
        return current.getId();
    }

    public Map<String, DefinitionNode> hydrateAncestors(Collection<? extends DefinitionNode> definitions) {
        Map<String, DefinitionNode> knownById = new LinkedHashMap<>();
        for (DefinitionNode definition : definitions) {
            knownById.put(definition.getId(), definition);
        }

        Set<String> requested = new HashSet<>();
        Set<String> missing = missingParents(definitions, knownById);
        while (!missing.isEmpty()) {
            requested.addAll(missing);
            Set<String> next = new LinkedHashSet<>();
            for (DefinitionNode parent : definitionRepository.findAllById(missing)) {
                if (knownById.containsKey(parent.getId())) {
                    continue;
                }
                knownById.put(parent.getId(), parent);
                String grandParentId = parent.getParentId();
                if (grandParentId != null && !knownById.containsKey(grandParentId) && !requested.contains(grandParentId)) {
                    next.add(grandParentId);
                }
            }
            missing = next;
        }
        return knownById;
    }

    public <T extends DefinitionNode> List<T> latestPerLineage(Collection<T> definitions) {
        return latestPerLineage(definitions, hydrateAncestors(definitions));
    }

    public <T extends DefinitionNode> List<T> latestPerLineage(
        Collection<T> definitions,
        Map<String, ? extends DefinitionNode> knownById
    ) {
        Map<String, T> latestByRoot = new LinkedHashMap<>();
        for (T definition : definitions) {
            String rootId = rootOf(definition, knownById);
            T existing = latestByRoot.get(rootId);
            if (existing == null || RECENCY.compare(definition, existing) > 0) {
                latestByRoot.put(rootId, definition);
            }
        }
        return new ArrayList<>(latestByRoot.values());
    }

    private Set<String> missingParents(Collection<? extends DefinitionNode> definitions, Map<String, DefinitionNode> knownById) {
        Set<String> missing = new LinkedHashSet<>();
        for (DefinitionNode definition : definitions) {
            String parentId = definition.getParentId();
            if (parentId != null && !knownById.containsKey(parentId)) {
                missing.add(parentId);
            }
        }
        return missing;
    }
}
