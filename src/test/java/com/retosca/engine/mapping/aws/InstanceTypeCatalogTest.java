package com.retosca.engine.mapping.aws;

import com.retosca.engine.model.ReferenceEdge;
import com.retosca.engine.model.RelationshipKind;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class InstanceTypeCatalogTest {

    @Test
    void testKnownTypes() {
        assertThat(InstanceTypeCatalog.lookup("t3.large")).hasValueSatisfying(spec -> {
            assertThat(spec.getVcpu()).isEqualTo(2);
            assertThat(spec.memSize()).isEqualTo("8 GB");
        });
        assertThat(InstanceTypeCatalog.lookup("t2.nano").orElseThrow().memSize()).isEqualTo("512 MB");
    }

    @Test
    void testUnknownTypeIsEmpty() {
        assertThat(InstanceTypeCatalog.lookup("x9.huge")).isEmpty();
        assertThat(InstanceTypeCatalog.lookup(null)).isEmpty();
        assertThat(InstanceTypeCatalog.DEFAULT.memSize()).isEqualTo("1 GB");
    }

    @Test
    void testInferOsFromAmi() {
        assertThat(AwsInstanceMapper.inferOs("ami-amzn2-arm64-gp2"))
                .containsEntry("distribution", "amazon")
                .containsEntry("architecture", "arm64");
        assertThat(AwsInstanceMapper.inferOs("ami-windows-2022")).containsEntry("type", "windows");
        assertThat(AwsInstanceMapper.inferOs("ami-0abcdef")).isEqualTo(Map.of("architecture", "x86_64"));
        assertThat(AwsInstanceMapper.inferOs(null)).isEmpty();
    }

    @Test
    void testRequirementNames() {
        ReferenceEdge edge = ReferenceEdge.builder()
                .sourceAddress("aws_instance.web")
                .propertyName("subnet_id")
                .targetAddress("aws_subnet.a")
                .targetType("aws_subnet")
                .relationshipKind(RelationshipKind.DEPENDS_ON)
                .build();

        assertThat(AbstractAwsResourceMapper.requirementName(edge)).isEqualTo("subnet_id");
        assertThat(AbstractAwsResourceMapper.requirementName(edge.toBuilder().synthetic(true).build()))
                .isEqualTo("dependency");
        assertThat(AbstractAwsResourceMapper.requirementName(edge.toBuilder().propertyName("depends_on").build()))
                .isEqualTo("dependency");
    }
}
