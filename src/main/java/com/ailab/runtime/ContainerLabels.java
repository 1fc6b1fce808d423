package com.ailab.runtime;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Label keys attached to every managed container, so ownership is recorded as structured
 * metadata rather than inferred from the container name.
 */
public final class ContainerLabels {

    public static final String MANAGED = "ai-lab.managed";
    public static final String ENV_ID = "ai-lab.env-id";
    public static final String OWNER = "ai-lab.owner";
    public static final String TEMPLATE = "ai-lab.template";
    public static final String GPUS = "ai-lab.gpus";

    private ContainerLabels() {}

    public static Map<String, String> of(String envId, String ownerId, String templateId, Set<Integer> gpus) {
        return Map.of(
                MANAGED, "true",
                ENV_ID, envId,
                OWNER, ownerId,
                TEMPLATE, templateId == null ? "" : templateId,
                GPUS, formatGpus(gpus));
    }

    public static String formatGpus(Set<Integer> gpus) {
        return new TreeSet<>(gpus).stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    /** Parses a {@link #GPUS} label value; malformed tokens are skipped. */
    public static Set<Integer> parseGpus(String value) {
        var result = new TreeSet<Integer>();
        if (value == null || value.isBlank()) {
            return result;
        }
        for (String token : value.split(",")) {
            try {
                result.add(Integer.parseInt(token.trim()));
            } catch (NumberFormatException e) {
                // not a device index
            }
        }
        return result;
    }

    public static boolean isManaged(Map<String, String> labels) {
        return "true".equals(labels.get(MANAGED));
    }
}
