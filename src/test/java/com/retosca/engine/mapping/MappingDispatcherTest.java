package com.retosca.engine.mapping;

import com.retosca.engine.TestPlans;
import com.retosca.engine.core.context.Diagnostic;
import com.retosca.engine.core.context.DiagnosticKind;
import com.retosca.engine.core.context.MappingDiagnostics;
import com.retosca.engine.core.context.MappingStats;
import com.retosca.engine.core.context.TranslatorConfig;
import com.retosca.engine.core.exception.MappingOrchestrationException;
import com.retosca.engine.plan.PlanDocument;
import com.retosca.engine.plan.PlanResource;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MappingDispatcherTest {

    private static final String PLAN = """
        {"planned_values": {"root_module": {"resources": [
          {"address": "aws_link.ab", "type": "aws_link", "name": "ab", "values": {"a": "x"}},
          {"address": "aws_thing.a", "type": "aws_thing", "name": "a", "values": {"a": "x"}},
          {"address": "aws_thing.b", "type": "aws_thing", "name": "b", "values": {"a": "x"}},
          {"address": "aws_unknown.z", "type": "aws_unknown", "name": "z", "values": {"a": "x"}},
          {"address": "data.aws_thing.lookup", "mode": "data", "type": "aws_thing", "name": "lookup",
           "values": {"a": "x"}}
        ]}}}
        """;

    /**
     * Records every call into a shared log.
     */
    private static class RecordingMapper implements ResourceMapper {
        private final String type;
        private final ResourceRole role;
        private final List<String> calls;
        private String failOn;
        private String declineOn;

        RecordingMapper(String type, ResourceRole role, List<String> calls) {
            this.type = type;
            this.role = role;
            this.calls = calls;
        }

        @Override
        public String resourceType() {
            return type;
        }

        @Override
        public ResourceRole role() {
            return role;
        }

        @Override
        public boolean canMap(String resourceType, PlanResource resource) {
            return !resource.getAddress().equals(declineOn);
        }

        @Override
        public boolean map(MappingContext context, String address, String resourceType, PlanResource resource) {
            calls.add(address);
            if (address.equals(failOn)) {
                throw new IllegalStateException("boom");
            }
            return true;
        }
    }

    private static MappingStats dispatch(MapperRegistry registry, MappingDiagnostics diagnostics,
                                         TranslatorConfig config) {
        PlanDocument plan = TestPlans.inline(PLAN);
        return new MappingDispatcher(registry).dispatch(TestPlans.context(plan, diagnostics, config));
    }

    @Test
    void testAssociativeMappersRunAfterEveryPrimary() {
        List<String> calls = new ArrayList<>();
        MapperRegistry registry = new MapperRegistry()
                .register(new RecordingMapper("aws_link", ResourceRole.ASSOCIATIVE, calls))
                .register(new RecordingMapper("aws_thing", ResourceRole.PRIMARY, calls));
        MappingDiagnostics diagnostics = new MappingDiagnostics();

        MappingStats stats = dispatch(registry, diagnostics, TranslatorConfig.defaults());

        assertThat(calls).containsExactly("aws_thing.a", "aws_thing.b", "aws_link.ab");
        assertThat(stats.getResourcesDiscovered()).isEqualTo(4);
        assertThat(stats.getPrimaryMapped()).isEqualTo(2);
        assertThat(stats.getAssociativeMapped()).isEqualTo(1);
        assertThat(stats.getUnsupported()).isEqualTo(1);
        assertThat(diagnostics.ofKind(DiagnosticKind.UNSUPPORTED_RESOURCE_TYPE))
                .singleElement()
                .satisfies(d -> assertThat(d.getResourceAddress()).isEqualTo("aws_unknown.z"));
    }

    @Test
    void testFailingMapperDoesNotStopTheRun() {
        List<String> calls = new ArrayList<>();
        RecordingMapper things = new RecordingMapper("aws_thing", ResourceRole.PRIMARY, calls);
        things.failOn = "aws_thing.a";
        MapperRegistry registry = new MapperRegistry()
                .register(things)
                .register(new RecordingMapper("aws_link", ResourceRole.ASSOCIATIVE, calls));
        MappingDiagnostics diagnostics = new MappingDiagnostics();

        MappingStats stats = dispatch(registry, diagnostics, TranslatorConfig.defaults());

        assertThat(calls).containsExactly("aws_thing.a", "aws_thing.b", "aws_link.ab");
        assertThat(stats.getFailed()).isEqualTo(1);
        assertThat(stats.getPrimaryMapped()).isEqualTo(1);
        assertThat(diagnostics.ofKind(DiagnosticKind.MAPPER_FAILURE))
                .singleElement()
                .satisfies(d -> assertThat(d.getMessage()).contains("boom"));
        assertThat(diagnostics.hasErrors()).isTrue();
    }

    @Test
    void testDeclinedResourceIsReported() {
        List<String> calls = new ArrayList<>();
        RecordingMapper things = new RecordingMapper("aws_thing", ResourceRole.PRIMARY, calls);
        things.declineOn = "aws_thing.b";
        MappingDiagnostics diagnostics = new MappingDiagnostics();

        MappingStats stats = dispatch(new MapperRegistry().register(things), diagnostics, TranslatorConfig.defaults());

        assertThat(calls).containsExactly("aws_thing.a");
        assertThat(stats.getDeclined()).isEqualTo(1);
        assertThat(diagnostics.ofKind(DiagnosticKind.CAPABILITY_DECLINED))
                .extracting(Diagnostic::getResourceAddress)
                .containsExactly("aws_thing.b");
    }

    @Test
    void testDataSourcesOnlyWhenEnabled() {
        List<String> calls = new ArrayList<>();
        MapperRegistry registry = new MapperRegistry()
                .register(new RecordingMapper("aws_thing", ResourceRole.PRIMARY, calls));

        MappingStats stats = dispatch(registry, new MappingDiagnostics(),
                TranslatorConfig.builder().includeDataSources(true).build());

        assertThat(calls).contains("data.aws_thing.lookup");
        assertThat(stats.getResourcesDiscovered()).isEqualTo(5);
    }

    @Test
    void testBrokenRoleAbortsDispatch() {
        List<String> calls = new ArrayList<>();
        MapperRegistry registry = new MapperRegistry()
                .register(new RecordingMapper("aws_link", null, calls));

        assertThatThrownBy(() -> dispatch(registry, new MappingDiagnostics(), TranslatorConfig.defaults()))
                .isInstanceOf(MappingOrchestrationException.class)
                .hasMessageContaining("aws_link.ab")
                .satisfies(e -> assertThat(((MappingOrchestrationException) e).getResourceType())
                        .isEqualTo("aws_link"));
        assertThat(calls).isEmpty();
    }
}
