package com.retosca.engine.mapping;

import com.retosca.engine.core.context.DiagnosticKind;
import com.retosca.engine.core.context.MappingStats;
import com.retosca.engine.core.exception.MappingOrchestrationException;
import com.retosca.engine.plan.PlanResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs mappers over the discovered resources in two phases.
 *
 * Primary mappers run first, in discovery order. Associative mappers run only once every primary
 * mapper has finished, so the nodes they link are already in the builder. A failure inside one
 * mapper is reported and the run continues; a failure in the dispatch logic itself is raised as
 * {@link MappingOrchestrationException}.
 */
public class MappingDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MappingDispatcher.class);

    private final MapperRegistry registry;

    public MappingDispatcher(MapperRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * @return counts of the dispatch, without node, input or output totals
     */
    public MappingStats dispatch(MappingContext context) {
        Counters counters = new Counters();
        List<Pending> associative = new ArrayList<>();

        for (PlanResource resource : context.getResources()) {
            if (resource.isData() && !context.getConfig().isIncludeDataSources()) {
                log.debug("Skipping data source {}", resource.getAddress());
                continue;
            }
            counters.discovered++;
            Optional<Pending> pending = classify(context, resource, counters);
            if (pending.isEmpty()) {
                continue;
            }
            if (pending.get().role == ResourceRole.ASSOCIATIVE) {
                associative.add(pending.get());
            } else if (invoke(context, pending.get(), counters)) {
                counters.primary++;
            }
        }

        log.debug("Primary phase done; dispatching {} associative resource(s)", associative.size());
        for (Pending pending : associative) {
            if (invoke(context, pending, counters)) {
                counters.associative++;
            }
        }

        return MappingStats.builder()
                .resourcesDiscovered(counters.discovered)
                .primaryMapped(counters.primary)
                .associativeMapped(counters.associative)
                .unsupported(counters.unsupported)
                .declined(counters.declined)
                .failed(counters.failed)
                .build();
    }

    private Optional<Pending> classify(MappingContext context, PlanResource resource, Counters counters) {
        String address = resource.getAddress();
        String type = resource.getType();
        try {
            Optional<ResourceMapper> mapper = registry.lookup(type);
            if (mapper.isEmpty()) {
                counters.unsupported++;
                context.getDiagnostics().report(DiagnosticKind.UNSUPPORTED_RESOURCE_TYPE,
                        "No mapper registered for type '" + type + "'", address, type);
                log.info("No mapper for {} ({}); skipped", address, type);
                return Optional.empty();
            }
            ResourceRole role = Objects.requireNonNull(mapper.get().role(), "role");
            return Optional.of(new Pending(resource, mapper.get(), role));
        } catch (RuntimeException e) {
            throw new MappingOrchestrationException("Dispatch failed", address, type, e);
        }
    }

    private boolean invoke(MappingContext context, Pending pending, Counters counters) {
        PlanResource resource = pending.resource;
        String address = resource.getAddress();
        String type = resource.getType();
        try {
            if (!pending.mapper.canMap(type, resource)) {
                counters.declined++;
                context.getDiagnostics().report(DiagnosticKind.CAPABILITY_DECLINED,
                        pending.mapper.getClass().getSimpleName() + " declined the resource", address, type);
                log.warn("Mapper {} declined {}", pending.mapper.getClass().getSimpleName(), address);
                return false;
            }
            return pending.mapper.map(context, address, type, resource);
        } catch (RuntimeException e) {
            counters.failed++;
            context.getDiagnostics().report(DiagnosticKind.MAPPER_FAILURE,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), address, type);
            log.error("Mapper {} failed on {}", pending.mapper.getClass().getSimpleName(), address, e);
            return false;
        }
    }

    private static final class Pending {
        final PlanResource resource;
        final ResourceMapper mapper;
        final ResourceRole role;

        Pending(PlanResource resource, ResourceMapper mapper, ResourceRole role) {
            this.resource = resource;
            this.mapper = mapper;
            this.role = role;
        }
    }

    private static final class Counters {
        int discovered;
        int primary;
        int associative;
        int unsupported;
        int declined;
        int failed;
    }
}
