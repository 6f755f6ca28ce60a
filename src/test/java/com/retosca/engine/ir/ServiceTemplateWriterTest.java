package com.retosca.engine.ir;

import com.retosca.engine.core.context.DiagnosticKind;
import com.retosca.engine.core.context.MappingDiagnostics;
import com.retosca.engine.model.RelationshipKind;
import com.retosca.engine.model.ResolvedValue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ServiceTemplateWriterTest {

    @TempDir
    Path tempDir;

    private final ServiceTemplateWriter writer = new ServiceTemplateWriter();

    private static ServiceTemplate sampleTemplate(MappingDiagnostics diagnostics) {
        ServiceTemplateBuilder builder = new ServiceTemplateBuilder(diagnostics)
                .withDescription("sample")
                .withMetadata("template_name", "net");
        builder.addInput("vpc_cidr", ParameterDefinition.builder()
                .type("string")
                .defaultValue("10.0.0.0/16")
                .required(false)
                .build());
        builder.addNode("aws_vpc_main", "Network")
                .withProperty("cidr", ResolvedValue.input("vpc_cidr"))
                .withProperty("ignored", null)
                .withMetadata("original_resource_type", "aws_vpc")
                .addCapability("link");
        builder.addNode("aws_instance_web", "Compute")
                .addCapability("host", Map.of("num_cpus", 2))
                .addRequirement("subnet_id", "aws_vpc_main", RelationshipKind.DEPENDS_ON)
                .addRequirement(RequirementAssignment.builder()
                        .name("local_storage")
                        .node("aws_ebs_volume_data")
                        .relationship(RelationshipKind.ATTACHES_TO)
                        .relationshipProperties(Map.of("device", "/dev/sdh"))
                        .build());
        builder.addOutput("ip", TemplateOutput.builder()
                .value(ResolvedValue.attribute("aws_instance_web", "public_address"))
                .build());
        return builder.build();
    }

    @Test
    void testYamlLayout() throws IOException {
        String yaml = writer.toYaml(sampleTemplate(new MappingDiagnostics()));

        JsonNode root = new ObjectMapper(new YAMLFactory()).readTree(yaml);
        assertThat(root.path("tosca_definitions_version").asText()).isEqualTo("tosca_2_0");
        assertThat(root.path("metadata").path("template_name").asText()).isEqualTo("net");

        JsonNode st = root.path("service_template");
        assertThat(st.path("inputs").path("vpc_cidr").path("required").asBoolean(true)).isFalse();
        JsonNode vpc = st.path("node_templates").path("aws_vpc_main");
        assertThat(vpc.path("properties").path("cidr").path("$get_input").asText()).isEqualTo("vpc_cidr");
        assertThat(vpc.path("properties").has("ignored")).isFalse();
        assertThat(vpc.path("capabilities").has("link")).isTrue();

        JsonNode requirements = st.path("node_templates").path("aws_instance_web").path("requirements");
        assertThat(requirements).hasSize(2);
        assertThat(requirements.get(0).path("subnet_id").path("relationship").asText()).isEqualTo("DependsOn");
        assertThat(requirements.get(1).path("local_storage").path("relationship").path("type").asText())
                .isEqualTo("AttachesTo");
        assertThat(st.path("outputs").path("ip").path("value").path("$get_attribute").get(1).asText())
                .isEqualTo("public_address");
    }

    @Test
    void testWriteCreatesParentDirectories() throws IOException {
        Path target = tempDir.resolve("out/nested/template.yaml");

        writer.write(sampleTemplate(new MappingDiagnostics()), target);

        assertThat(Files.readString(target)).startsWith("tosca_definitions_version: tosca_2_0");
    }

    @Test
    void testDuplicateRequirementIsIgnored() {
        NodeTemplate node = new ServiceTemplateBuilder(new MappingDiagnostics()).addNode("a", "Root");

        node.addRequirement("dependency", "b", RelationshipKind.LINKS_TO);
        node.addRequirement("dependency", "b", RelationshipKind.LINKS_TO);

        assertThat(node.getRequirements()).hasSize(1);
        assertThat(node.hasRequirementTo("b")).isTrue();
    }

    @Test
    void testPruneDanglingRequirements() {
        MappingDiagnostics diagnostics = new MappingDiagnostics();
        ServiceTemplateBuilder builder = new ServiceTemplateBuilder(diagnostics);
        builder.addNode("a", "Root")
                .addRequirement("dependency", "b", RelationshipKind.DEPENDS_ON)
                .addRequirement("dependency", "ghost", RelationshipKind.DEPENDS_ON);
        builder.addNode("b", "Root");

        Map<String, List<RequirementAssignment>> removed = builder.pruneDanglingRequirements();

        assertThat(removed).containsOnlyKeys("a");
        assertThat(removed.get("a")).extracting(RequirementAssignment::getNode).containsExactly("ghost");
        assertThat(builder.getNode("a").orElseThrow().getRequirements())
                .extracting(RequirementAssignment::getNode)
                .containsExactly("b");
    }

    @Test
    void testNodeCollisionIsReported() {
        MappingDiagnostics diagnostics = new MappingDiagnostics();
        ServiceTemplateBuilder builder = new ServiceTemplateBuilder(diagnostics);

        builder.addNode("aws_subnet_x_a_b", "Network");
        builder.addNode("aws_subnet_x_a_b", "Network");

        assertThat(builder.getNodes()).hasSize(1);
        assertThat(diagnostics.has(DiagnosticKind.NODE_COLLISION)).isTrue();
    }
}
