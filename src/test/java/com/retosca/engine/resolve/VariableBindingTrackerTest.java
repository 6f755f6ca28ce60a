package com.retosca.engine.resolve;

import com.retosca.engine.TestPlans;
import com.retosca.engine.core.context.DiagnosticKind;
import com.retosca.engine.core.context.MappingDiagnostics;
import com.retosca.engine.model.VariableBinding;
import com.retosca.engine.plan.ConfigurationIndex;
import com.retosca.engine.plan.PlanDocument;
import com.retosca.engine.plan.PlanResource;
import com.retosca.engine.plan.PlanWalker;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class VariableBindingTrackerTest {

    private static VariableBindingTracker trackerFor(PlanDocument plan, MappingDiagnostics diagnostics) {
        List<PlanResource> resources = new PlanWalker().walk(plan, diagnostics);
        ConfigurationIndex configuration = ConfigurationIndex.of(plan);
        return new VariableBindingTracker(configuration, resources,
                new VariableExtractor().extract(plan, configuration, diagnostics), diagnostics);
    }

    @Test
    void testDirectScalarReference() {
        VariableBindingTracker tracker = trackerFor(TestPlans.load("full-plan.json"), new MappingDiagnostics());

        assertThat(tracker.binding("aws_vpc.main", "cidr_block"))
                .contains(VariableBinding.scalar("aws_vpc.main", "cidr_block", "vpc_cidr"));
        assertThat(tracker.binding("aws_instance.web", "instance_type"))
                .hasValueSatisfying(b -> assertThat(b.getVariableName()).isEqualTo("instance_type"));
    }

    @Test
    void testDirectMapReferenceIsNarrowedToKey() {
        VariableBindingTracker tracker = trackerFor(TestPlans.load("full-plan.json"), new MappingDiagnostics());

        assertThat(tracker.binding("aws_subnet.public", "cidr_block"))
                .contains(VariableBinding.mapKey("aws_subnet.public", "cidr_block", "subnet_cidrs", "public"));
    }

    @Test
    void testMapValueMatchWithoutReference() {
        VariableBindingTracker tracker = trackerFor(TestPlans.load("full-plan.json"), new MappingDiagnostics());

        assertThat(tracker.binding("aws_subnet.private[0]", "cidr_block"))
                .contains(VariableBinding.mapKey("aws_subnet.private[0]", "cidr_block", "subnet_cidrs", "private"));
        assertThat(tracker.binding("aws_subnet.private[1]", "cidr_block")).isEmpty();
    }

    @Test
    void testUnboundPropertiesHaveNoBinding() {
        MappingDiagnostics diagnostics = new MappingDiagnostics();
        VariableBindingTracker tracker = trackerFor(TestPlans.load("full-plan.json"), diagnostics);

        assertThat(tracker.binding("aws_lb.front", "name")).isEmpty();
        assertThat(tracker.binding("aws_vpc.absent", "cidr_block")).isEmpty();
        assertThat(tracker.bindingsFor("aws_s3_bucket.logs")).isEmpty();
        assertThat(diagnostics.has(DiagnosticKind.BINDING_AMBIGUOUS)).isFalse();
    }

    @Test
    void testListPositionMatchesInstanceIndex() {
        String json = """
            {
              "variables": {"subnet_names": {"value": ["sub1", "sub2"]}},
              "planned_values": {"root_module": {"resources": [
                {"address": "aws_subnet.this[0]", "type": "aws_subnet", "name": "this",
                 "values": {"name_hint": "sub1"}},
                {"address": "aws_subnet.this[1]", "type": "aws_subnet", "name": "this",
                 "values": {"name_hint": "sub2"}},
                {"address": "aws_subnet.other[0]", "type": "aws_subnet", "name": "other",
                 "values": {"name_hint": "sub2"}}
              ]}},
              "configuration": {"root_module": {
                "variables": {"subnet_names": {"type": "list(string)"}}
              }}
            }
            """;
        VariableBindingTracker tracker = trackerFor(TestPlans.inline(json), new MappingDiagnostics());

        assertThat(tracker.binding("aws_subnet.this[1]", "name_hint"))
                .contains(VariableBinding.listIndex("aws_subnet.this[1]", "name_hint", "subnet_names", 1));
        assertThat(tracker.binding("aws_subnet.this[0]", "name_hint"))
                .hasValueSatisfying(b -> assertThat(b.getCollectionKey()).isEqualTo(0));
        // same value at a different position is not a match
        assertThat(tracker.binding("aws_subnet.other[0]", "name_hint")).isEmpty();
    }

    @Test
    void testAmbiguousMapMatchUsesFirstDeclaredAndReports() {
        String json = """
            {
              "planned_values": {"root_module": {"resources": [
                {"address": "aws_subnet.a", "type": "aws_subnet", "name": "a",
                 "values": {"cidr_block": "10.0.1.0/24"}}
              ]}},
              "configuration": {"root_module": {
                "variables": {
                  "primary_cidrs": {"type": "map(string)", "default": {"a": "10.0.1.0/24"}},
                  "legacy_cidrs": {"type": "map(string)", "default": {"old": "10.0.1.0/24"}}
                }
              }}
            }
            """;
        MappingDiagnostics diagnostics = new MappingDiagnostics();
        VariableBindingTracker tracker = trackerFor(TestPlans.inline(json), diagnostics);

        assertThat(tracker.binding("aws_subnet.a", "cidr_block"))
                .contains(VariableBinding.mapKey("aws_subnet.a", "cidr_block", "primary_cidrs", "a"));
        assertThat(diagnostics.ofKind(DiagnosticKind.BINDING_AMBIGUOUS))
                .singleElement()
                .satisfies(d -> assertThat(d.getResourceAddress()).isEqualTo("aws_subnet.a"));
    }

    @Test
    void testModuleVariableIsTracedToRootVariable() {
        VariableBindingTracker tracker = trackerFor(TestPlans.load("module-plan.json"), new MappingDiagnostics());

        assertThat(tracker.binding("module.network.aws_vpc.this", "cidr_block"))
                .contains(VariableBinding.scalar("module.network.aws_vpc.this", "cidr_block", "env_cidr"));
    }

    @Test
    void testDataSourcesAreNotTracked() {
        VariableBindingTracker tracker = trackerFor(TestPlans.load("full-plan.json"), new MappingDiagnostics());

        assertThat(tracker.allBindings()).extracting(VariableBinding::getResourceAddress)
                .doesNotContain("data.aws_ami.ubuntu");
    }
}
