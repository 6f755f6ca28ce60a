package com.retosca.engine.integration;

import com.retosca.engine.TestPlans;
import com.retosca.engine.ir.ServiceTemplateWriter;
import com.retosca.engine.mapping.MapperRegistry;
import com.retosca.engine.plan.PlanLoader;
import com.retosca.engine.translate.PlanTranslator;
import com.retosca.engine.translate.TranslationResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the complete plan-to-template process.
 */
class ReverseIntegrationTest {

    @TempDir
    Path tempDir;

    @Test
    void testReverseSampleNetworkPlan() throws IOException {
        Path planFile = tempDir.resolve("plan.json");
        Files.writeString(planFile, TestPlans.read("full-plan.json"));
        Path output = tempDir.resolve("out/network.yaml");

        TranslationResult result = new PlanTranslator(MapperRegistry.defaultRegistry())
                .translate(new PlanLoader().load(planFile));
        new ServiceTemplateWriter().write(result.getTemplate(), output);

        assertThat(result.isSuccess()).isTrue();
        assertThat(Files.exists(output)).isTrue();

        JsonNode root = new ObjectMapper(new YAMLFactory()).readTree(output.toFile());
        assertThat(root.path("tosca_definitions_version").asText()).isEqualTo("tosca_2_0");

        JsonNode serviceTemplate = root.path("service_template");
        assertThat(serviceTemplate.path("inputs").path("subnet_cidrs").path("type").asText()).isEqualTo("map");
        assertThat(serviceTemplate.path("inputs").path("db_password").has("default")).isFalse();

        JsonNode nodes = serviceTemplate.path("node_templates");
        assertThat(nodes.size()).isEqualTo(14);

        // input reference narrowed to a map key
        JsonNode cidr = nodes.path("aws_subnet_public").path("properties").path("cidr").path("$get_input");
        assertThat(cidr.isArray()).isTrue();
        assertThat(cidr.get(0).asText()).isEqualTo("subnet_cidrs");
        assertThat(cidr.get(1).asText()).isEqualTo("public");

        assertThat(nodes.path("aws_subnet_public").path("metadata").path("original_resource_type").asText())
                .isEqualTo("aws_subnet");

        // volume attachment recorded on the instance with its device
        JsonNode instanceRequirements = nodes.path("aws_instance_web").path("requirements");
        JsonNode storage = null;
        for (JsonNode requirement : instanceRequirements) {
            if (requirement.has("local_storage")) {
                storage = requirement.path("local_storage");
            }
        }
        assertThat(storage).isNotNull();
        assertThat(storage.path("node").asText()).isEqualTo("aws_ebs_volume_data");
        assertThat(storage.path("relationship").path("properties").path("device").asText()).isEqualTo("/dev/sdh");

        // outputs: attribute reference, literal, sensitive dropped
        JsonNode outputs = serviceTemplate.path("outputs");
        assertThat(outputs.path("web_public_ip").path("value").path("$get_attribute").get(0).asText())
                .isEqualTo("aws_instance_web");
        assertThat(outputs.path("web_public_ip").path("description").asText())
                .isEqualTo("Public address of the web server");
        assertThat(outputs.path("region").path("value").asText()).isEqualTo("us-east-1");
        assertThat(outputs.has("db_password")).isFalse();
        assertThat(Files.readString(output)).doesNotContain("s3cr3t");
    }

    @Test
    void testTranslationIsDeterministic() {
        PlanTranslator translator = new PlanTranslator(MapperRegistry.defaultRegistry());
        ServiceTemplateWriter writer = new ServiceTemplateWriter();

        String first = writer.toYaml(translator.translate(TestPlans.load("full-plan.json")).getTemplate());
        String second = writer.toYaml(translator.translate(TestPlans.load("full-plan.json")).getTemplate());

        assertThat(second).isEqualTo(first);
    }
}
