package com.retosca.engine.resolve;

import com.retosca.engine.plan.ResourceAddress.InstanceKey;
import com.retosca.engine.plan.ResourceAddress.ModuleInstance;
import com.retosca.engine.plan.ResourceAddress;

/**
 * Derives node identifiers from resource addresses.
 *
 * The identifier is a pure function of {@code (address, type)}:
 * {@code [module_<name>[<key>]_]*[data_]<type>_<name>[<key>]}, restricted to
 * {@code [A-Za-z0-9_]}. A key renders as {@code __<n>} for a count index and {@code __k_<key>}
 * for a string key. Each name segment is sanitized on its own and never keeps a double
 * underscore, so {@code web_1} and {@code web[1]} stay apart. Primary mappers, associative mappers
 * and output mapping all call this independently and must agree, so no state is kept here.
 *
 * Keys that differ only in characters outside the safe set ({@code a-b} and {@code a_b}) map to the
 * same identifier; the template builder reports such collisions.
 */
public final class NodeAddressResolver {

    public String resolve(String address, String type) {
        ResourceAddress parsed = ResourceAddress.tryParse(address);
        if (parsed == null) {
            // not a resource address; keep it recognisable
            return sanitize((type == null ? "" : type + "_") + address);
        }
        return resolve(parsed, type == null ? parsed.getType() : type);
    }

    public String resolve(ResourceAddress address, String type) {
        StringBuilder sb = new StringBuilder();
        for (ModuleInstance module : address.getModules()) {
            sb.append("module_").append(sanitize(module.getName()));
            appendKey(sb, module.getKey());
            sb.append('_');
        }
        if (address.isData()) {
            sb.append("data_");
        }
        sb.append(sanitize(type)).append('_').append(sanitize(address.getName()));
        appendKey(sb, address.getKey());
        return sb.toString();
    }

    private static void appendKey(StringBuilder sb, InstanceKey key) {
        if (key == null) {
            return;
        }
        Integer index = key.asIndex();
        if (index != null) {
            sb.append("__").append(index);
        } else {
            sb.append("__k_").append(sanitize(key.getValue()));
        }
    }

    static String sanitize(String raw) {
        String s = raw.replaceAll("[^A-Za-z0-9_]", "_")
                .replaceAll("_+", "_");
        if (s.startsWith("_")) {
            s = s.substring(1);
        }
        if (s.endsWith("_")) {
            s = s.substring(0, s.length() - 1);
        }
        return s.isEmpty() ? "node" : s;
    }
}
