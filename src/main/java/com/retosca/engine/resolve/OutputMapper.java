package com.retosca.engine.resolve;

import com.retosca.engine.core.context.DiagnosticKind;
import com.retosca.engine.core.context.MappingDiagnostics;
import com.retosca.engine.ir.ServiceTemplateBuilder;
import com.retosca.engine.ir.TemplateOutput;
import com.retosca.engine.model.OutputDefinition;
import com.retosca.engine.model.ResolvedValue;
import com.retosca.engine.plan.ResourceAddress.InstanceKey;
import com.retosca.engine.plan.ResourceAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Translates extracted outputs into template outputs.
 *
 * Sensitive outputs are dropped. An output defined by exactly one {@code resource.attribute}
 * reference becomes a {@code $get_attribute} on the emitted node, provided the attribute has a
 * translation and the node exists. Everything else keeps its literal value.
 */
public class OutputMapper {

    private static final Logger log = LoggerFactory.getLogger(OutputMapper.class);

    private final NodeAddressResolver nodeResolver;
    private final MappingDiagnostics diagnostics;

    public OutputMapper(NodeAddressResolver nodeResolver, MappingDiagnostics diagnostics) {
        this.nodeResolver = Objects.requireNonNull(nodeResolver, "nodeResolver");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Adds the translated outputs to the builder.
     *
     * @return number of outputs added
     */
    public int mapOutputs(Map<String, OutputDefinition> outputs, ServiceTemplateBuilder builder) {
        int added = 0;
        for (OutputDefinition output : outputs.values()) {
            if (output.isSensitive()) {
                log.debug("Skipping sensitive output '{}'", output.getName());
                continue;
            }
            Optional<ResolvedValue> value = map(output, builder);
            if (value.isEmpty()) {
                diagnostics.report(DiagnosticKind.OUTPUT_UNRESOLVED,
                        "Output '" + output.getName() + "' has neither an attribute mapping nor a value");
                log.warn("Output '{}' has neither an attribute mapping nor a value", output.getName());
                continue;
            }
            builder.addOutput(output.getName(), TemplateOutput.builder()
                    .description(output.getDescription())
                    .value(value.get())
                    .build());
            added++;
        }
        return added;
    }

    /**
     * Resolved value of a single non-sensitive output, empty when nothing can be emitted.
     */
    public Optional<ResolvedValue> map(OutputDefinition output, ServiceTemplateBuilder builder) {
        Optional<ResolvedValue> symbolic = attributeReference(output, builder);
        if (symbolic.isPresent()) {
            return symbolic;
        }
        return output.getResolvedValue() == null
                ? Optional.empty()
                : Optional.of(ResolvedValue.literal(output.getResolvedValue()));
    }

    private Optional<ResolvedValue> attributeReference(OutputDefinition output, ServiceTemplateBuilder builder) {
        List<String> refs = ReferenceGraphExtractor.normalize(output.getDefiningReferences());
        if (refs.size() != 1) {
            return Optional.empty();
        }
        ResourceAddress target = ResourceAddress.tryParse(refs.get(0));
        if (target == null || target.getAttribute() == null || target.isData()) {
            return Optional.empty();
        }
        Optional<String> attribute = AttributeTranslationTable.translate(target.getType(), target.getAttribute());
        if (attribute.isEmpty()) {
            return Optional.empty();
        }
        return emittedNode(target.withoutAttribute(), builder)
                .map(node -> ResolvedValue.attribute(node, attribute.get()));
    }

    /**
     * Node of the referenced resource; an unkeyed reference to a counted resource designates index 0.
     */
    private Optional<String> emittedNode(ResourceAddress target, ServiceTemplateBuilder builder) {
        String node = nodeResolver.resolve(target, target.getType());
        if (builder.hasNode(node)) {
            return Optional.of(node);
        }
        if (target.getKey() == null) {
            String first = nodeResolver.resolve(target.withKey(InstanceKey.index(0)), target.getType());
            if (builder.hasNode(first)) {
                return Optional.of(first);
            }
        }
        return Optional.empty();
    }
}
