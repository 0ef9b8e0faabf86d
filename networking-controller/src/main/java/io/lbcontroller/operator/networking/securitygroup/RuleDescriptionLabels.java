/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.securitygroup;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * The ownership labels of a security group rule are stored in the rule description as a comma separated list of
 * {@code key=value} pairs, for example {@code elbv2.k8s.aws/targetGroupBinding=shared}.
 */
public final class RuleDescriptionLabels {
    private RuleDescriptionLabels() { }

    /**
     * Parses the labels from a description. Parts which are not {@code key=value} pairs are ignored, so free-form
     * descriptions result in no labels.
     *
     * @param description   Rule description, can be null
     *
     * @return  Map with the labels
     */
    public static Map<String, String> parse(String description) {
        Map<String, String> labels = new TreeMap<>();

        if (description == null || description.isBlank()) {
            return labels;
        }

        for (String part : description.split(",")) {
            int separator = part.indexOf('=');

            if (separator > 0) {
                String key = part.substring(0, separator).trim();
                String value = part.substring(separator + 1).trim();

                if (!key.isEmpty() && !key.contains(" ")) {
                    labels.put(key, value);
                }
            }
        }

        return labels;
    }

    /**
     * Formats the labels into a description. Keys are sorted to keep the description stable.
     *
     * @param labels    Labels
     *
     * @return  Description
     */
    public static String format(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return "";
        }

        return new TreeMap<>(labels).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
    }
}
