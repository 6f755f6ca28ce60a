package com.retosca.engine.dependency;

import com.retosca.engine.model.ReferenceEdge;
import com.retosca.engine.model.RelationshipKind;
import com.retosca.engine.plan.PlanResource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Pairs subnets with route tables when no association record links them.
 *
 * Public subnets pair with every public route table. Private subnets pair with the private
 * tables named after their availability zone; only when there is none do they fall back to the
 * first private table without a zone in its name. Candidates are compared in address order.
 */
public final class RouteTableAffinityRules {

    public enum Category {
        PUBLIC, PRIVATE, UNKNOWN
    }

    static final String ROUTE_TABLE_TYPE = "aws_route_table";

    private static final Pattern ZONE_SUFFIX = Pattern.compile("(^|[-_])\\d+[a-z]($|[-_])");

    private static final List<Function<PlanResource, Optional<Category>>> SUBNET_RULES = List.of(
            r -> categoryOf(nameTag(r)),
            r -> categoryOf(r.getAddress()),
            r -> Optional.of(Boolean.TRUE.equals(r.concreteValue("map_public_ip_on_launch"))
                    ? Category.PUBLIC
                    : Category.PRIVATE));

    private static final List<Function<PlanResource, Optional<Category>>> ROUTE_TABLE_RULES = List.of(
            r -> categoryOf(nameTag(r)),
            r -> categoryOf(r.getAddress()));

    private RouteTableAffinityRules() {
    }

    public static Category subnetCategory(PlanResource subnet) {
        return firstMatch(SUBNET_RULES, subnet);
    }

    public static Category routeTableCategory(PlanResource routeTable) {
        return firstMatch(ROUTE_TABLE_RULES, routeTable);
    }

    /**
     * Synthetic {@code dependency} edges from {@code subnet} to the route tables it most likely uses.
     */
    public static List<ReferenceEdge> synthesize(PlanResource subnet, Collection<PlanResource> routeTables) {
        Category category = subnetCategory(subnet);
        List<PlanResource> candidates = routeTables.stream()
                .filter(t -> ROUTE_TABLE_TYPE.equals(t.getType()))
                .filter(t -> sameVpc(subnet, t))
                .filter(t -> sameModule(subnet, t))
                .filter(t -> routeTableCategory(t) == category)
                .sorted(Comparator.comparing(PlanResource::getAddress))
                .toList();

        List<PlanResource> chosen = new ArrayList<>();
        if (category == Category.PUBLIC) {
            chosen.addAll(candidates);
        } else {
            String zone = zoneSuffix(subnet);
            if (zone != null) {
                candidates.stream().filter(t -> matchesZone(tableName(t), zone)).forEach(chosen::add);
            }
            if (chosen.isEmpty()) {
                candidates.stream()
                        .filter(t -> !ZONE_SUFFIX.matcher(tableName(t)).find())
                        .findFirst()
                        .ifPresent(chosen::add);
            }
        }
        return chosen.stream()
                .map(t -> ReferenceEdge.builder()
                        .sourceAddress(subnet.getAddress())
                        .propertyName(ReferenceEdge.DEPENDENCY)
                        .targetAddress(t.getAddress())
                        .targetType(t.getType())
                        .relationshipKind(RelationshipKind.DEPENDS_ON)
                        .synthetic(true)
                        .build())
                .toList();
    }

    /**
     * Zone identifier of a subnet, e.g. {@code 1a} for {@code us-east-1a}.
     */
    static String zoneSuffix(PlanResource subnet) {
        if (!(subnet.concreteValue("availability_zone") instanceof String az) || az.isBlank()) {
            return null;
        }
        int dash = az.lastIndexOf('-');
        return (dash >= 0 ? az.substring(dash + 1) : az).toLowerCase(Locale.ROOT);
    }

    static boolean matchesZone(String tableName, String zone) {
        return tableName.endsWith(zone) || tableName.contains("-" + zone) || tableName.contains("_" + zone);
    }

    private static Category firstMatch(List<Function<PlanResource, Optional<Category>>> rules, PlanResource r) {
        for (Function<PlanResource, Optional<Category>> rule : rules) {
            Optional<Category> category = rule.apply(r);
            if (category.isPresent()) {
                return category.get();
            }
        }
        return Category.UNKNOWN;
    }

    private static Optional<Category> categoryOf(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("private")) {
            return Optional.of(Category.PRIVATE);
        }
        if (lower.contains("public")) {
            return Optional.of(Category.PUBLIC);
        }
        return Optional.empty();
    }

    private static String nameTag(PlanResource r) {
        if (r.concreteValue("tags") instanceof Map<?, ?> tags && tags.get("Name") instanceof String name) {
            return name;
        }
        return null;
    }

    private static String tableName(PlanResource table) {
        String tag = nameTag(table);
        return (tag != null ? tag : table.getParsedAddress().getName()).toLowerCase(Locale.ROOT);
    }

    private static boolean sameVpc(PlanResource subnet, PlanResource table) {
        Object a = subnet.concreteValue("vpc_id");
        Object b = table.concreteValue("vpc_id");
        return a == null || b == null || a.equals(b);
    }

    private static boolean sameModule(PlanResource subnet, PlanResource table) {
        String a = subnet.getParsedAddress().modulePath();
        String b = table.getParsedAddress().modulePath();
        return a.isEmpty() || b.isEmpty() || a.equals(b);
    }
}
