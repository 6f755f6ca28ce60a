package com.retosca.engine.resolve;

import com.retosca.engine.model.RelationshipKind;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Ordered rules that classify a reference edge from its property name and target type.
 *
 * The first matching rule wins; unmatched edges default to {@link RelationshipKind#DEPENDS_ON}.
 * This is a naming heuristic: false positives are tolerated.
 */
public final class RelationshipRuleTable {

    static final Set<String> NETWORK_TYPES = Set.of(
            "aws_vpc", "aws_subnet", "aws_route_table", "aws_internet_gateway",
            "aws_egress_only_internet_gateway", "aws_nat_gateway", "aws_eip", "aws_network_interface",
            "aws_security_group", "aws_db_subnet_group", "aws_elasticache_subnet_group",
            "aws_vpc_endpoint", "aws_network_acl");

    static final Set<String> LOAD_BALANCER_TYPES = Set.of(
            "aws_lb", "aws_alb", "aws_elb", "aws_lb_target_group", "aws_alb_target_group", "aws_lb_listener");

    static final Set<String> LOAD_BALANCER_PROPERTIES = Set.of(
            "load_balancer", "load_balancer_arn", "load_balancers",
            "target_group", "target_group_arn", "target_group_arns");

    static final Set<String> COMPUTE_TYPES = Set.of("aws_instance", "aws_spot_instance_request");

    static final Set<String> COMPUTE_PROPERTIES = Set.of("instance", "instance_id", "instance_ids");

    /**
     * One classification rule.
     */
    public static final class Rule {
        private final String name;
        private final BiPredicate<String, String> matcher;
        private final RelationshipKind kind;

        Rule(String name, BiPredicate<String, String> matcher, RelationshipKind kind) {
            this.name = name;
            this.matcher = matcher;
            this.kind = kind;
        }

        public String getName() {
            return name;
        }

        public RelationshipKind getKind() {
            return kind;
        }

        boolean matches(String propertyName, String targetType) {
            return matcher.test(propertyName, targetType);
        }
    }

    private static final List<Rule> RULES = List.of(
            new Rule("network-identifier",
                    (prop, target) -> isIdentifierProperty(prop) && NETWORK_TYPES.contains(target),
                    RelationshipKind.DEPENDS_ON),
            new Rule("load-balancer",
                    (prop, target) -> LOAD_BALANCER_TYPES.contains(target) || LOAD_BALANCER_PROPERTIES.contains(prop),
                    RelationshipKind.CONNECTS_TO),
            new Rule("compute-host",
                    (prop, target) -> COMPUTE_TYPES.contains(target) || COMPUTE_PROPERTIES.contains(prop),
                    RelationshipKind.HOSTED_ON));

    private RelationshipRuleTable() {
    }

    public static RelationshipKind classify(String propertyName, String targetType) {
        return matchingRule(propertyName, targetType)
                .map(Rule::getKind)
                .orElse(RelationshipKind.DEPENDS_ON);
    }

    public static Optional<Rule> matchingRule(String propertyName, String targetType) {
        String prop = propertyName == null ? "" : propertyName;
        String target = targetType == null ? "" : targetType;
        return RULES.stream().filter(r -> r.matches(prop, target)).findFirst();
    }

    public static List<Rule> rules() {
        return RULES;
    }

    static boolean isIdentifierProperty(String propertyName) {
        return propertyName.endsWith("_id") || propertyName.endsWith("_ids");
    }
}
