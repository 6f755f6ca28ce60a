package com.retosca.engine.resolve;

import com.retosca.engine.TestPlans;
import com.retosca.engine.core.context.DiagnosticKind;
import com.retosca.engine.core.context.MappingDiagnostics;
import com.retosca.engine.ir.ServiceTemplateBuilder;
import com.retosca.engine.model.OutputDefinition;
import com.retosca.engine.model.ResolvedValue;
import com.retosca.engine.plan.ConfigurationIndex;
import com.retosca.engine.plan.PlanDocument;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class OutputMapperTest {

    private MappingDiagnostics diagnostics;
    private ServiceTemplateBuilder builder;
    private OutputMapper mapper;

    @BeforeEach
    void setUp() {
        diagnostics = new MappingDiagnostics();
        builder = new ServiceTemplateBuilder(diagnostics);
        mapper = new OutputMapper(new NodeAddressResolver(), diagnostics);
    }

    @Test
    void testExtractorMergesDeclarationsAndValues() {
        PlanDocument plan = TestPlans.load("full-plan.json");

        Map<String, OutputDefinition> outputs = new OutputExtractor().extract(plan, ConfigurationIndex.of(plan));

        assertThat(outputs.keySet()).containsExactly("web_public_ip", "bucket_name", "db_password", "region");
        assertThat(outputs.get("web_public_ip").getResolvedValue()).isNull();
        assertThat(outputs.get("web_public_ip").getDescription()).isEqualTo("Public address of the web server");
        assertThat(outputs.get("bucket_name").getDefiningReferences())
                .containsExactly("aws_s3_bucket.logs.bucket", "aws_s3_bucket.logs");
        assertThat(outputs.get("db_password").isSensitive()).isTrue();
        assertThat(outputs.get("region").getResolvedValue()).isEqualTo("us-east-1");
    }

    @Test
    void testExtractorReadsStateOnlyOutputs() {
        PlanDocument plan = TestPlans.load("state-only.json");

        Map<String, OutputDefinition> outputs = new OutputExtractor().extract(plan, ConfigurationIndex.of(plan));

        assertThat(outputs).containsOnlyKeys("vpc_id");
        assertThat(outputs.get("vpc_id").getResolvedValue()).isEqualTo("vpc-0a1b");
    }

    @Test
    void testAttributeReferenceBecomesGetAttribute() {
        builder.addNode("aws_instance_web", "Compute");

        Map<String, OutputDefinition> outputs = Map.of("ip", output("ip", null,
                "aws_instance.web.public_ip", "aws_instance.web"));
        int added = mapper.mapOutputs(outputs, builder);

        assertThat(added).isEqualTo(1);
        assertThat(builder.getOutputs().get("ip").getValue())
                .isEqualTo(ResolvedValue.attribute("aws_instance_web", "public_address"));
        assertThat(builder.getOutputs().get("ip").toTemplateMap())
                .containsEntry("value", Map.of("$get_attribute", List.of("aws_instance_web", "public_address")));
    }

    @Test
    void testUnkeyedReferenceUsesFirstInstance() {
        builder.addNode("aws_subnet_private__0", "Network");

        assertThat(mapper.map(output("cidr", null, "aws_subnet.private.cidr_block"), builder))
                .contains(ResolvedValue.attribute("aws_subnet_private__0", "cidr"));
    }

    @Test
    void testSensitiveOutputsAreDropped() {
        OutputDefinition secret = OutputDefinition.builder()
                .name("db_password")
                .sensitive(true)
                .resolvedValue("s3cr3t")
                .definingReference("var.db_password")
                .build();

        int added = mapper.mapOutputs(Map.of("db_password", secret), builder);

        assertThat(added).isZero();
        assertThat(builder.getOutputs()).isEmpty();
        assertThat(diagnostics.getEntries()).isEmpty();
    }

    @Test
    void testFallsBackToLiteralValue() {
        // no node emitted, untranslatable attribute, or several references: literal
        assertThat(mapper.map(output("a", "1.2.3.4", "aws_instance.web.public_ip"), builder))
                .contains(ResolvedValue.literal("1.2.3.4"));
        builder.addNode("aws_instance_web", "Compute");
        assertThat(mapper.map(output("b", "t3.micro", "aws_instance.web.instance_type"), builder))
                .contains(ResolvedValue.literal("t3.micro"));
        assertThat(mapper.map(output("c", "x", "aws_instance.web.public_ip", "aws_vpc.main.id"), builder))
                .contains(ResolvedValue.literal("x"));
    }

    @Test
    void testUnresolvableOutputIsReported() {
        int added = mapper.mapOutputs(Map.of("lost", output("lost", null, "aws_instance.web.public_ip")), builder);

        assertThat(added).isZero();
        assertThat(diagnostics.has(DiagnosticKind.OUTPUT_UNRESOLVED)).isTrue();
    }

    @Test
    void testAttributeTranslationTable() {
        assertThat(AttributeTranslationTable.translate("aws_vpc", "cidr_block")).contains("cidr");
        assertThat(AttributeTranslationTable.translate("aws_lb", "dns_name")).contains("public_address");
        assertThat(AttributeTranslationTable.translate("aws_lb", "arn")).isEmpty();
        assertThat(AttributeTranslationTable.translate("aws_iam_role", "id")).isEmpty();
    }

    private static OutputDefinition output(String name, Object value, String... references) {
        return OutputDefinition.builder()
                .name(name)
                .resolvedValue(value)
                .definingReferences(List.of(references))
                .build();
    }
}
