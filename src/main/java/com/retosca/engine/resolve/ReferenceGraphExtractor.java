package com.retosca.engine.resolve;

import com.retosca.engine.model.ReferenceEdge;
import com.retosca.engine.model.RelationshipKind;
import com.retosca.engine.plan.ConfigurationIndex;
import com.retosca.engine.plan.ExpressionReferences;
import com.retosca.engine.plan.PlanResource;
import com.retosca.engine.plan.ResourceAddress.InstanceKey;
import com.retosca.engine.plan.ResourceAddress.ModuleInstance;
import com.retosca.engine.plan.ResourceAddress;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Finds the resources a given resource refers to.
 *
 * References are read from the configuration expressions first. Only when a resource has no
 * expression-level references at all are its concrete values matched against the identifiers of
 * other resources, which recovers edges from already-applied plans at the cost of precision.
 */
public class ReferenceGraphExtractor {

    private static final Logger log = LoggerFactory.getLogger(ReferenceGraphExtractor.class);

    public static final String DEPENDS_ON_PROPERTY = "depends_on";

    private static final List<String> IGNORED_ROOTS = List.of(
            "var.", "local.", "data.", "count.", "each.", "path.", "self.", "terraform.");

    private static final List<String> ID_PREFIXES = List.of(
            "vpc-", "subnet-", "sg-", "i-", "igw-", "nat-", "rtb-", "vol-", "eipalloc-", "eni-", "arn:");

    private final ConfigurationIndex configuration;
    private final Map<String, PlanResource> resourcesByAddress = new LinkedHashMap<>();
    private final Map<String, List<String>> addressesByConfigAddress = new TreeMap<>();
    private final Map<String, String> addressByIdentifier = new LinkedHashMap<>();

    public ReferenceGraphExtractor(ConfigurationIndex configuration, Collection<PlanResource> resources) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        for (PlanResource resource : resources) {
            resourcesByAddress.put(resource.getAddress(), resource);
            addressesByConfigAddress
                    .computeIfAbsent(resource.getParsedAddress().configAddress(), k -> new ArrayList<>())
                    .add(resource.getAddress());
        }
        addressesByConfigAddress.values().forEach(Collections::sort);
        resourcesByAddress.keySet().stream().sorted().forEach(address -> {
            PlanResource r = resourcesByAddress.get(address);
            for (String attr : List.of("id", "arn")) {
                Object value = r.concreteValue(attr);
                if (value instanceof String s && !s.isBlank()) {
                    addressByIdentifier.putIfAbsent(s, address);
                }
            }
        });
    }

    public Optional<PlanResource> resource(String address) {
        return Optional.ofNullable(resourcesByAddress.get(address));
    }

    /**
     * Raw, unfiltered edges of one resource, de-duplicated by target address.
     */
    public List<ReferenceEdge> extract(String address) {
        PlanResource source = resourcesByAddress.get(address);
        if (source == null) {
            return List.of();
        }
        List<ReferenceEdge> edges = fromConfiguration(source);
        if (edges.isEmpty()) {
            edges = fromConcreteValues(source);
            if (!edges.isEmpty()) {
                log.debug("Recovered {} edge(s) for {} by identifier matching", edges.size(), address);
            }
        }
        return dedupeByTarget(edges);
    }

    private List<ReferenceEdge> fromConfiguration(PlanResource source) {
        ResourceAddress parsed = source.getParsedAddress();
        Optional<JsonNode> config = configuration.resource(parsed.configAddress());
        if (config.isEmpty()) {
            return List.of();
        }
        String modulePath = parsed.moduleConfigPath();
        List<ReferenceEdge> edges = new ArrayList<>();

        JsonNode expressions = config.get().path("expressions");
        Iterator<Map.Entry<String, JsonNode>> fields = expressions.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String property = field.getKey();
            boolean multiValued = source.concreteValue(property) instanceof List;
            for (String ref : normalize(ExpressionReferences.collect(field.getValue()))) {
                for (String target : resolveReference(source, modulePath, ref, multiValued, new HashSet<>())) {
                    addEdge(edges, source, property, target);
                }
            }
        }

        JsonNode dependsOn = config.get().path("depends_on");
        if (dependsOn.isArray()) {
            for (JsonNode dep : dependsOn) {
                for (String target : resolveReference(source, modulePath, dep.asText(), true, new HashSet<>())) {
                    addEdge(edges, source, DEPENDS_ON_PROPERTY, target);
                }
            }
        }
        return edges;
    }

    private List<ReferenceEdge> fromConcreteValues(PlanResource source) {
        List<ReferenceEdge> edges = new ArrayList<>();
        Set<String> properties = new LinkedHashSet<>(source.getValues().keySet());
        properties.addAll(source.getPriorValues().keySet());
        for (String property : properties) {
            if ("id".equals(property) || "arn".equals(property)) {
                continue;
            }
            for (String candidate : identifierCandidates(source.concreteValue(property))) {
                if (!RelationshipRuleTable.isIdentifierProperty(property) && !looksLikeIdentifier(candidate)) {
                    continue;
                }
                String target = addressByIdentifier.get(candidate);
                if (target != null) {
                    addEdge(edges, source, property, target);
                }
            }
        }
        for (String dep : source.getStateDependsOn()) {
            if (resourcesByAddress.containsKey(dep)) {
                addEdge(edges, source, DEPENDS_ON_PROPERTY, dep);
                continue;
            }
            ResourceAddress parsed = ResourceAddress.tryParse(dep);
            if (parsed != null) {
                for (String target : addressesByConfigAddress.getOrDefault(parsed.configAddress(), List.of())) {
                    addEdge(edges, source, DEPENDS_ON_PROPERTY, target);
                }
            }
        }
        return edges;
    }

    /**
     * Resolves one expression reference, relative to {@code modulePath}, to concrete resource
     * addresses. Module output references are followed into the child module.
     */
    private List<String> resolveReference(PlanResource source, String modulePath, String ref,
                                          boolean multiValued, Set<String> visited) {
        if (ref == null || IGNORED_ROOTS.stream().anyMatch(ref::startsWith)) {
            return List.of();
        }
        if (ref.startsWith("module.")) {
            return resolveModuleReference(source, modulePath, ref, multiValued, visited);
        }
        ResourceAddress target = ResourceAddress.tryParse(ref);
        if (target == null || !target.getModules().isEmpty()) {
            return List.of();
        }
        return instancesOf(source, modulePath, target, multiValued);
    }

    private List<String> resolveModuleReference(PlanResource source, String modulePath, String ref,
                                                boolean multiValued, Set<String> visited) {
        List<String> segments = ResourceAddress.splitSegments(ref);
        String childName = stripKey(segments.get(1));
        String childPath = join(modulePath, "module." + childName);
        if (segments.size() < 3) {
            // a whole-module reference, as found in depends_on
            List<String> all = new ArrayList<>();
            addressesByConfigAddress.forEach((configAddress, addresses) -> {
                if (configAddress.startsWith(childPath + ".")) {
                    all.addAll(addresses);
                }
            });
            return all;
        }
        String output = stripKey(segments.get(2));
        if (!visited.add(childPath + "#" + output)) {
            return List.of();
        }
        JsonNode expression = configuration.moduleOutputExpression(childPath, output);
        Set<String> targets = new LinkedHashSet<>();
        for (String inner : normalize(ExpressionReferences.collect(expression))) {
            targets.addAll(resolveReference(source, childPath, inner, multiValued, visited));
        }
        return new ArrayList<>(targets);
    }

    /**
     * Picks the concrete instances a reference designates. Tried in order: the instance with the
     * source's own key, index 0, the unkeyed address, then every instance sorted by address.
     * Multi-valued properties skip straight to every instance.
     */
    private List<String> instancesOf(PlanResource source, String modulePath, ResourceAddress target,
                                     boolean multiValued) {
        String configAddress = join(modulePath, target.localName());
        List<String> candidates = addressesByConfigAddress.getOrDefault(configAddress, List.of());
        if (candidates.isEmpty()) {
            log.debug("Reference {} from {} has no matching resource", configAddress, source.getAddress());
            return List.of();
        }
        ResourceAddress base = target.withoutAttribute()
                .withModules(preferredModules(source.getParsedAddress(), modulePath));

        if (target.getKey() != null) {
            String exact = base.resourceAddress();
            if (candidates.contains(exact)) {
                return List.of(exact);
            }
            return candidates.stream()
                    .filter(c -> target.getKey().equals(ResourceAddress.parse(c).getKey()))
                    .limit(1)
                    .toList();
        }

        List<String> scoped = candidates.stream()
                .filter(c -> ResourceAddress.parse(c).modulePath().equals(base.modulePath()))
                .toList();
        List<String> pool = scoped.isEmpty() ? candidates : scoped;
        if (multiValued) {
            return pool;
        }

        InstanceKey sourceKey = source.getParsedAddress().getKey();
        if (sourceKey != null) {
            String contextual = base.withKey(sourceKey).resourceAddress();
            if (candidates.contains(contextual)) {
                return List.of(contextual);
            }
        }
        String first = base.withKey(InstanceKey.index(0)).resourceAddress();
        if (candidates.contains(first)) {
            return List.of(first);
        }
        String exact = base.resourceAddress();
        if (candidates.contains(exact)) {
            return List.of(exact);
        }
        return pool;
    }

    /**
     * Module instances for a target living at {@code targetModulePath}: the leading modules shared
     * with the source keep the source's instance keys.
     */
    private static List<ModuleInstance> preferredModules(ResourceAddress source, String targetModulePath) {
        List<ModuleInstance> result = new ArrayList<>();
        if (targetModulePath.isEmpty()) {
            return result;
        }
        List<ModuleInstance> sourceModules = source.getModules();
        String[] parts = targetModulePath.split("\\.");
        int depth = 0;
        boolean shared = true;
        for (int i = 1; i < parts.length; i += 2) {
            String name = parts[i];
            shared = shared && depth < sourceModules.size() && sourceModules.get(depth).getName().equals(name);
            result.add(shared ? sourceModules.get(depth) : new ModuleInstance(name, null));
            depth++;
        }
        return result;
    }

    private void addEdge(List<ReferenceEdge> edges, PlanResource source, String property, String target) {
        if (target.equals(source.getAddress())) {
            return;
        }
        PlanResource targetResource = resourcesByAddress.get(target);
        String targetType = targetResource != null
                ? targetResource.getType()
                : ResourceAddress.parse(target).getType();
        RelationshipKind kind = RelationshipRuleTable.classify(property, targetType);
        edges.add(ReferenceEdge.builder()
                .sourceAddress(source.getAddress())
                .propertyName(property)
                .targetAddress(target)
                .targetType(targetType)
                .relationshipKind(kind)
                .build());
        log.debug("Edge {}.{} -> {} ({})", source.getAddress(), property, target, kind.getToscaName());
    }

    /**
     * Drops references that another, more specific reference in the same list already covers,
     * e.g. {@code aws_subnet.a} next to {@code aws_subnet.a[0].id}.
     */
    static List<String> normalize(List<String> refs) {
        List<String> out = new ArrayList<>();
        for (String ref : refs) {
            boolean shadowed = refs.stream()
                    .anyMatch(other -> !other.equals(ref)
                            && (other.startsWith(ref + ".") || other.startsWith(ref + "[")));
            if (!shadowed) {
                out.add(ref);
            }
        }
        return out;
    }

    private static List<ReferenceEdge> dedupeByTarget(List<ReferenceEdge> edges) {
        Map<String, ReferenceEdge> byTarget = new LinkedHashMap<>();
        for (ReferenceEdge edge : edges) {
            byTarget.putIfAbsent(edge.getTargetAddress(), edge);
        }
        return new ArrayList<>(byTarget.values());
    }

    private static List<String> identifierCandidates(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof String s) {
            out.add(s);
        } else if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof String s) {
                    out.add(s);
                }
            }
        }
        return out;
    }

    private static boolean looksLikeIdentifier(String value) {
        return ID_PREFIXES.stream().anyMatch(value::startsWith);
    }

    private static String stripKey(String segment) {
        int open = segment.indexOf('[');
        return open < 0 ? segment : segment.substring(0, open);
    }

    private static String join(String prefix, String local) {
        return prefix == null || prefix.isEmpty() ? local : prefix + "." + local;
    }
}
