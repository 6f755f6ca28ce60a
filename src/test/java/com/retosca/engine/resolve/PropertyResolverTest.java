package com.retosca.engine.resolve;

import com.retosca.engine.TestPlans;
import com.retosca.engine.core.context.MappingDiagnostics;
import com.retosca.engine.model.ResolutionContext;
import com.retosca.engine.model.ResolvedValue;
import com.retosca.engine.plan.ConfigurationIndex;
import com.retosca.engine.plan.PlanDocument;
import com.retosca.engine.plan.PlanResource;
import com.retosca.engine.plan.PlanWalker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PropertyResolverTest {

    private PropertyResolver resolver;
    private List<PlanResource> resources;

    @BeforeEach
    void setUp() {
        PlanDocument plan = TestPlans.load("full-plan.json");
        MappingDiagnostics diagnostics = new MappingDiagnostics();
        resources = new PlanWalker().walk(plan, diagnostics);
        ConfigurationIndex configuration = ConfigurationIndex.of(plan);
        VariableBindingTracker tracker = new VariableBindingTracker(configuration, resources,
                new VariableExtractor().extract(plan, configuration, diagnostics), diagnostics);
        resolver = new PropertyResolver(tracker, resources);
    }

    @Test
    void testBoundScalarIsSymbolicForProperties() {
        ResolvedValue value = resolver.resolve("aws_vpc.main", "cidr_block", ResolutionContext.PROPERTY);

        assertThat(value).isEqualTo(ResolvedValue.input("vpc_cidr"));
        assertThat(value.toTemplateValue()).isEqualTo(Map.of("$get_input", "vpc_cidr"));
    }

    @Test
    void testMetadataIsAlwaysConcrete() {
        ResolvedValue value = resolver.resolve("aws_vpc.main", "cidr_block", ResolutionContext.METADATA);

        assertThat(value.isSymbolic()).isFalse();
        assertThat(value.toTemplateValue()).isEqualTo("10.0.0.0/16");
    }

    @Test
    void testMapKeyBindingRendersKeyedInput() {
        ResolvedValue value = resolver.resolve("aws_subnet.public", "cidr_block", ResolutionContext.PROPERTY);

        assertThat(value.toTemplateValue()).isEqualTo(Map.of("$get_input", List.of("subnet_cidrs", "public")));
    }

    @Test
    void testUnboundPropertyIsLiteral() {
        assertThat(resolver.resolve("aws_lb.front", "name", ResolutionContext.PROPERTY))
                .isEqualTo(ResolvedValue.literal("front-lb"));
        assertThat(resolver.resolve("aws_lb.front", "absent", ResolutionContext.PROPERTY))
                .isEqualTo(ResolvedValue.literal(null));
    }

    @Test
    void testUnknownAddressResolvesToNullLiteral() {
        assertThat(resolver.resolve("aws_vpc.absent", "cidr_block", ResolutionContext.PROPERTY))
                .isEqualTo(ResolvedValue.literal(null));
    }

    @Test
    void testResolveAllCoversEveryTopLevelProperty() {
        PlanResource vpc = resources.get(0);

        Map<String, Object> properties = resolver.resolveAll(vpc, ResolutionContext.PROPERTY);
        Map<String, Object> metadata = resolver.resolveAll(vpc, ResolutionContext.METADATA);

        assertThat(properties).containsOnlyKeys(vpc.getValues().keySet())
                .containsEntry("cidr_block", Map.of("$get_input", "vpc_cidr"))
                .containsEntry("instance_tenancy", "default");
        assertThat(metadata).containsEntry("cidr_block", "10.0.0.0/16");
    }
}
