package com.retosca.engine.dependency;

import com.retosca.engine.model.ReferenceEdge;
import com.retosca.engine.model.RelationshipKind;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DependencyFilterTest {

    private static ReferenceEdge edge(String property, String target, String targetType) {
        return ReferenceEdge.builder()
                .sourceAddress("aws_instance.web")
                .propertyName(property)
                .targetAddress(target)
                .targetType(targetType)
                .relationshipKind(RelationshipKind.DEPENDS_ON)
                .build();
    }

    private final List<ReferenceEdge> raw = List.of(
            edge("subnet_id", "aws_subnet.a", "aws_subnet"),
            edge("ebs_block_device", "aws_ebs_volume.data", "aws_ebs_volume"),
            edge("ingress", "aws_security_group.other", "aws_security_group"));

    @Test
    void testNoneKeepsEverything() {
        assertThat(DependencyFilter.apply(raw, DependencyFilterSpec.none())).containsExactlyElementsOf(raw);
    }

    @Test
    void testExcludesByTargetTypeAndProperty() {
        DependencyFilterSpec spec = DependencyFilterSpec.builder()
                .excludeTargetType("aws_ebs_volume")
                .excludeProperty("ingress")
                .build();

        assertThat(DependencyFilter.apply(raw, spec))
                .extracting(ReferenceEdge::getTargetAddress)
                .containsExactly("aws_subnet.a");
    }

    @Test
    void testSyntheticEdgesAreAppendedAndMarked() {
        DependencyFilterSpec spec = DependencyFilterSpec.builder()
                .syntheticEdge(edge(ReferenceEdge.DEPENDENCY, "aws_route_table.private", "aws_route_table"))
                .build();

        List<ReferenceEdge> result = DependencyFilter.apply(raw, spec);

        assertThat(result).hasSize(4);
        assertThat(result.get(3).getTargetAddress()).isEqualTo("aws_route_table.private");
        assertThat(result.get(3).isSynthetic()).isTrue();
        assertThat(result.subList(0, 3)).noneMatch(ReferenceEdge::isSynthetic);
    }

    @Test
    void testSyntheticEdgeToCoveredTargetIsDropped() {
        DependencyFilterSpec spec = DependencyFilterSpec.builder()
                .syntheticEdge(edge(ReferenceEdge.DEPENDENCY, "aws_subnet.a", "aws_subnet"))
                .build();

        List<ReferenceEdge> result = DependencyFilter.apply(raw, spec);

        assertThat(result).hasSize(3).noneMatch(ReferenceEdge::isSynthetic);
    }

    @Test
    void testExcludedTargetCanStillBeAddedSynthetically() {
        DependencyFilterSpec spec = DependencyFilterSpec.builder()
                .excludeTargetType("aws_subnet")
                .syntheticEdge(edge(ReferenceEdge.DEPENDENCY, "aws_subnet.a", "aws_subnet"))
                .build();

        assertThat(DependencyFilter.apply(raw, spec))
                .filteredOn(e -> e.getTargetAddress().equals("aws_subnet.a"))
                .singleElement()
                .satisfies(e -> assertThat(e.isSynthetic()).isTrue());
    }
}
