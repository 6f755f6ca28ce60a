package com.retosca.engine.mapping;

import com.retosca.engine.core.context.Diagnostic;
import com.retosca.engine.core.context.DiagnosticKind;
import com.retosca.engine.mapping.aws.AwsEbsVolumeMapper;
import com.retosca.engine.mapping.aws.AwsInstanceMapper;
import com.retosca.engine.mapping.aws.AwsInternetGatewayMapper;
import com.retosca.engine.mapping.aws.AwsLbMapper;
import com.retosca.engine.mapping.aws.AwsLbTargetGroupAttachmentMapper;
import com.retosca.engine.mapping.aws.AwsLbTargetGroupMapper;
import com.retosca.engine.mapping.aws.AwsNatGatewayMapper;
import com.retosca.engine.mapping.aws.AwsRouteTableAssociationMapper;
import com.retosca.engine.mapping.aws.AwsRouteTableMapper;
import com.retosca.engine.mapping.aws.AwsS3BucketMapper;
import com.retosca.engine.mapping.aws.AwsSecurityGroupMapper;
import com.retosca.engine.mapping.aws.AwsSubnetMapper;
import com.retosca.engine.mapping.aws.AwsVolumeAttachmentMapper;
import com.retosca.engine.mapping.aws.AwsVpcMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resource type to mapper table. One mapper per type; registering a second one replaces the first
 * and records a {@link DiagnosticKind#REGISTRY_OVERWRITE}.
 */
public final class MapperRegistry {

    private static final Logger log = LoggerFactory.getLogger(MapperRegistry.class);

    private final Map<String, ResourceMapper> mappers = new LinkedHashMap<>();
    private final List<Diagnostic> registrationDiagnostics = new ArrayList<>();

    /**
     * Registry holding every bundled AWS mapper.
     */
    public static MapperRegistry defaultRegistry() {
        return new MapperRegistry()
                .register(new AwsVpcMapper())
                .register(new AwsSubnetMapper())
                .register(new AwsRouteTableMapper())
                .register(new AwsInternetGatewayMapper())
                .register(new AwsNatGatewayMapper())
                .register(new AwsSecurityGroupMapper())
                .register(new AwsInstanceMapper())
                .register(new AwsEbsVolumeMapper())
                .register(new AwsS3BucketMapper())
                .register(new AwsLbMapper())
                .register(new AwsLbTargetGroupMapper())
                .register(new AwsRouteTableAssociationMapper())
                .register(new AwsVolumeAttachmentMapper())
                .register(new AwsLbTargetGroupAttachmentMapper());
    }

    public MapperRegistry register(ResourceMapper mapper) {
        return register(mapper.resourceType(), mapper);
    }

    public MapperRegistry register(String type, ResourceMapper mapper) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(mapper, "mapper");
        ResourceMapper previous = mappers.put(type, mapper);
        if (previous != null && previous != mapper) {
            String message = "Mapper " + mapper.getClass().getSimpleName() + " replaces "
                    + previous.getClass().getSimpleName() + " for type '" + type + "'";
            registrationDiagnostics.add(Diagnostic.builder()
                    .kind(DiagnosticKind.REGISTRY_OVERWRITE)
                    .message(message)
                    .resourceType(type)
                    .build());
            log.warn(message);
        }
        return this;
    }

    public Optional<ResourceMapper> lookup(String type) {
        return Optional.ofNullable(mappers.get(type));
    }

    public boolean supports(String type) {
        return mappers.containsKey(type);
    }

    public Map<String, ResourceMapper> getMappers() {
        return Collections.unmodifiableMap(mappers);
    }

    /**
     * Overwrite diagnostics recorded while the registry was assembled.
     */
    public List<Diagnostic> getRegistrationDiagnostics() {
        return Collections.unmodifiableList(registrationDiagnostics);
    }

    /**
     * Independent copy used for one translation run.
     */
    public MapperRegistry snapshot() {
        MapperRegistry copy = new MapperRegistry();
        copy.mappers.putAll(mappers);
        copy.registrationDiagnostics.addAll(registrationDiagnostics);
        return copy;
    }
}
