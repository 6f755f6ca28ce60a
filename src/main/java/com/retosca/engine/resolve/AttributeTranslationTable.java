package com.retosca.engine.resolve;

import java.util.Map;
import java.util.Optional;

/**
 * Renames Terraform attributes to the attribute names exposed by the emitted node types.
 * Pairs missing from the table are untranslatable.
 */
public final class AttributeTranslationTable {

    private static final Map<String, String> NETWORK = Map.of(
            "cidr_block", "cidr",
            "id", "tosca_id");

    private static final Map<String, Map<String, String>> TABLE = Map.of(
            "aws_instance", Map.of(
                    "public_ip", "public_address",
                    "private_ip", "private_address",
                    "id", "tosca_id",
                    "public_dns", "public_address",
                    "private_dns", "private_address"),
            "aws_vpc", NETWORK,
            "aws_subnet", NETWORK,
            "aws_s3_bucket", Map.of(
                    "bucket", "name",
                    "id", "tosca_id",
                    "arn", "tosca_id"),
            "aws_lb", Map.of("dns_name", "public_address"),
            "aws_ebs_volume", Map.of(
                    "id", "volume_id",
                    "size", "size"));

    private AttributeTranslationTable() {
    }

    public static Optional<String> translate(String resourceType, String attribute) {
        return Optional.ofNullable(TABLE.getOrDefault(resourceType, Map.of()).get(attribute));
    }
}
