package com.valuerank.orchestration.service.lineage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.valuerank.orchestration.domain.DefinitionEntity;
import com.valuerank.orchestration.domain.DefinitionNode;
import com.valuerank.orchestration.repository.DefinitionRepository;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LineageResolverTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Mock
    private DefinitionRepository definitionRepository;

    private LineageResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new LineageResolver(definitionRepository);
    }

    @Test
    void shouldPickHighestVersionPerLineage() {
        DefinitionEntity root = definition("root", null, 1, T0);
        DefinitionEntity child = definition("child", root.getId(), 2, T0);
        DefinitionEntity grandChild = definition("grandchild", child.getId(), 3, T0);
        DefinitionEntity other = definition("other", null, 1, T0);

        List<DefinitionEntity> latest = resolver.latestPerLineage(List.of(root, child, grandChild, other));

        assertThat(latest).containsExactly(grandChild, other);
        verify(definitionRepository, never()).findAllById(anyIterable());
    }

    @Test
    void shouldLoadMissingAncestorsSoSiblingsShareALineage() {
        DefinitionEntity root = definition("root", null, 1, T0);
        DefinitionEntity middle = definition("middle", root.getId(), 2, T0);
        DefinitionEntity deep = definition("deep", middle.getId(), 3, T0);
        DefinitionEntity sibling = definition("sibling", root.getId(), 2, T0);
        when(definitionRepository.findAllById(Set.of(middle.getId(), root.getId()))).thenReturn(List.of(middle, root));

        List<DefinitionEntity> latest = resolver.latestPerLineage(List.of(deep, sibling));

        assertThat(latest).containsExactly(deep);
    }

    @Test
    void shouldHydrateAncestorsRoundByRound() {
        DefinitionEntity root = definition("root", null, 1, T0);
        DefinitionEntity middle = definition("middle", root.getId(), 2, T0);
        DefinitionEntity leaf = definition("leaf", middle.getId(), 3, T0);
        when(definitionRepository.findAllById(Set.of(middle.getId()))).thenReturn(List.of(middle));
        when(definitionRepository.findAllById(Set.of(root.getId()))).thenReturn(List.of(root));

        Map<String, DefinitionNode> known = resolver.hydrateAncestors(List.of(leaf));

        assertThat(known).containsOnlyKeys(leaf.getId(), middle.getId(), root.getId());
        assertThat(resolver.rootOf(leaf, known)).isEqualTo(root.getId());
    }

    @Test
    void shouldTreatUnknownParentAsLineageRoot() {
        DefinitionEntity orphan = definition("orphan", "deleted-parent", 4, T0);
        when(definitionRepository.findAllById(Set.of("deleted-parent"))).thenReturn(List.of());

        List<DefinitionEntity> latest = resolver.latestPerLineage(List.of(orphan));

        assertThat(latest).containsExactly(orphan);
        assertThat(resolver.rootOf(orphan, Map.of())).isEqualTo(orphan.getId());
    }

    @Test
    void shouldStopWalkingOnParentCycle() {
        Node a = new Node("a", "b", 1);
        Node b = new Node("b", "a", 2);
        Map<String, DefinitionNode> known = Map.of("a", a, "b", b);

        assertThat(resolver.rootOf(a, known)).isEqualTo("b");
        assertThat(resolver.latestPerLineage(List.of(a, b), known)).hasSize(2);
    }

    @Test
    void shouldBreakVersionTiesByUpdateThenCreationTime() {
        DefinitionEntity root = definition("root", null, 2, T0);
        DefinitionEntity edited = definition("edited", root.getId(), 2, T0);
        edited.setUpdatedAt(T0.plusSeconds(60));
        DefinitionEntity newer = definition("newer", root.getId(), 2, T0);
        newer.setUpdatedAt(T0.plusSeconds(60));
        newer.setCreatedAt(T0.plusSeconds(1));

        assertThat(resolver.latestPerLineage(List.of(root, edited))).containsExactly(edited);
        assertThat(resolver.latestPerLineage(List.of(newer, edited, root))).containsExactly(newer);
    }

    @Test
    void shouldPreferHigherVersionOverNewerTimestamps() {
        DefinitionEntity a = definition("a", null, 1, T0);
        DefinitionEntity b = definition("b", a.getId(), 3, T0);
        DefinitionEntity c = definition("c", b.getId(), 2, T0.plusSeconds(3_600));

        assertThat(resolver.latestPerLineage(List.of(a, b, c))).containsExactly(b);
        assertThat(resolver.latestPerLineage(List.of(c, b, a))).containsExactly(b);
    }

    @Test
    void shouldBeOrderIndependent() {
        DefinitionEntity root = definition("root", null, 1, T0);
        DefinitionEntity v2 = definition("v2", root.getId(), 2, T0);

        assertThat(resolver.latestPerLineage(List.of(v2, root))).containsExactly(v2);
        assertThat(resolver.latestPerLineage(List.of(root, v2))).containsExactly(v2);
    }

    private record Node(String getId, String getParentId, int getVersion) implements DefinitionNode {

        @Override
        public Instant getCreatedAt() {
            return T0;
        }

        @Override
        public Instant getUpdatedAt() {
            return T0;
        }
    }

    private static DefinitionEntity definition(String name, String parentId, int version, Instant at) {
        DefinitionEntity definition = DefinitionEntity.create(name, parentId, "domain-1", version, null);
        definition.setCreatedAt(at);
        definition.setUpdatedAt(at);
        return definition;
    }
}
