package com.retosca.engine.mapping.aws;

import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.mapping.ResourceRole;
import com.retosca.engine.model.ReferenceEdge;
import com.retosca.engine.model.RelationshipKind;
import com.retosca.engine.plan.PlanResource;

import java.util.Optional;

/**
 * {@code aws_route_table_association}: links the associated subnet or gateway to its route table.
 */
public class AwsRouteTableAssociationMapper extends AbstractAwsResourceMapper {

    public AwsRouteTableAssociationMapper() {
        super("aws_route_table_association");
    }

    @Override
    public ResourceRole role() {
        return ResourceRole.ASSOCIATIVE;
    }

    @Override
    public boolean map(MappingContext context, String address, String type, PlanResource resource) {
        Optional<NodeTemplate> routeTable = endpoint(context, resource, "aws_route_table");
        Optional<NodeTemplate> source = endpoint(context, resource, "aws_subnet")
                .or(() -> endpoint(context, resource, "aws_internet_gateway"));
        if (routeTable.isEmpty() || source.isEmpty()) {
            return endpointMissing(context, resource, "Route table or associated subnet/gateway node not found");
        }
        source.get().addRequirement(ReferenceEdge.DEPENDENCY, routeTable.get().getName(), RelationshipKind.LINKS_TO);
        log.debug("Linked {} to route table {}", source.get().getName(), routeTable.get().getName());
        return true;
    }
}
