package com.retosca.engine.translate;

import com.retosca.engine.core.context.DiagnosticKind;
import com.retosca.engine.core.context.MappingDiagnostics;
import com.retosca.engine.core.context.MappingStats;
import com.retosca.engine.core.context.TranslatorConfig;
import com.retosca.engine.core.exception.ExtractionFailureException;
import com.retosca.engine.ir.RequirementAssignment;
import com.retosca.engine.ir.ServiceTemplateBuilder;
import com.retosca.engine.mapping.MapperRegistry;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.mapping.MappingDispatcher;
import com.retosca.engine.model.OutputDefinition;
import com.retosca.engine.model.VariableDefinition;
import com.retosca.engine.plan.ConfigurationIndex;
import com.retosca.engine.plan.PlanDocument;
import com.retosca.engine.plan.PlanResource;
import com.retosca.engine.plan.PlanWalker;
import com.retosca.engine.resolve.NodeAddressResolver;
import com.retosca.engine.resolve.OutputExtractor;
import com.retosca.engine.resolve.OutputMapper;
import com.retosca.engine.resolve.PropertyResolver;
import com.retosca.engine.resolve.ReferenceGraphExtractor;
import com.retosca.engine.resolve.VariableBindingTracker;
import com.retosca.engine.resolve.VariableExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Translates a plan document into a service template.
 *
 * Holds only the registry and configuration; every call builds its own diagnostics, builder and
 * mapping context. Steps: variables to inputs, two-phase resource mapping, outputs, then removal
 * of requirements whose target node was never emitted.
 */
public class PlanTranslator {

    private static final Logger log = LoggerFactory.getLogger(PlanTranslator.class);

    private final MapperRegistry registry;
    private final TranslatorConfig config;

    public PlanTranslator(MapperRegistry registry, TranslatorConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
    }

    public PlanTranslator(MapperRegistry registry) {
        this(registry, TranslatorConfig.defaults());
    }

    /**
     * @throws ExtractionFailureException when the plan has neither planned values nor a prior state
     */
    public TranslationResult translate(PlanDocument plan) {
        long start = System.currentTimeMillis();
        if (!plan.hasRootModule()) {
            throw new ExtractionFailureException(
                    "Plan has no planned_values.root_module and no prior_state.values.root_module");
        }

        MapperRegistry runRegistry = registry.snapshot();
        MappingDiagnostics diagnostics = new MappingDiagnostics();
        diagnostics.addAll(runRegistry.getRegistrationDiagnostics());

        List<PlanResource> resources = new PlanWalker().walk(plan, diagnostics);
        log.info("Discovered {} resource(s)", resources.size());

        ConfigurationIndex configuration = ConfigurationIndex.of(plan);
        VariableExtractor variableExtractor = new VariableExtractor();
        Map<String, VariableDefinition> variables = variableExtractor.extract(plan, configuration, diagnostics);

        ReferenceGraphExtractor extractor = new ReferenceGraphExtractor(configuration, resources);
        VariableBindingTracker tracker = new VariableBindingTracker(configuration, resources, variables, diagnostics);
        NodeAddressResolver nodeResolver = new NodeAddressResolver();
        ServiceTemplateBuilder builder = new ServiceTemplateBuilder(diagnostics)
                .withDescription(config.getDescription())
                .withMetadata("template_name", config.getTemplateName())
                .withMetadata("template_author", config.getTemplateAuthor())
                .withMetadata("template_version", config.getTemplateVersion());

        variables.forEach((name, variable) -> builder.addInput(name, variableExtractor.toParameter(variable)));

        MappingContext context = MappingContext.builder()
                .config(config)
                .plan(plan)
                .resources(resources)
                .extractor(extractor)
                .tracker(tracker)
                .resolver(new PropertyResolver(tracker, resources))
                .builder(builder)
                .nodeResolver(nodeResolver)
                .diagnostics(diagnostics)
                .build();

        MappingStats dispatched = new MappingDispatcher(runRegistry).dispatch(context);

        Map<String, OutputDefinition> outputs = new OutputExtractor().extract(plan, configuration);
        int outputsEmitted = new OutputMapper(nodeResolver, diagnostics).mapOutputs(outputs, builder);

        pruneDangling(builder, diagnostics);

        MappingStats stats = dispatched.toBuilder()
                .nodesEmitted(builder.getNodes().size())
                .inputsEmitted(builder.getInputs().size())
                .outputsEmitted(outputsEmitted)
                .translationTimeMillis(System.currentTimeMillis() - start)
                .build();
        log.info("Emitted {} node(s), {} input(s), {} output(s) with {} diagnostic(s)",
                stats.getNodesEmitted(), stats.getInputsEmitted(), stats.getOutputsEmitted(),
                diagnostics.getEntries().size());

        return TranslationResult.builder()
                .template(builder.build())
                .diagnostics(diagnostics)
                .stats(stats)
                .build();
    }

    private static void pruneDangling(ServiceTemplateBuilder builder, MappingDiagnostics diagnostics) {
        Map<String, List<RequirementAssignment>> removed = builder.pruneDanglingRequirements();
        removed.forEach((node, requirements) -> {
            for (RequirementAssignment r : requirements) {
                String message = "Requirement '" + r.getName() + "' of node '" + node
                        + "' targets '" + r.getNode() + "', which was never emitted";
                diagnostics.report(DiagnosticKind.REFERENCE_UNRESOLVED, message);
                log.warn(message);
            }
        });
    }
}
