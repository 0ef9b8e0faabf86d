/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common.model;

import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A predicate on a set of labels with the semantics of a Kubernetes label selector. All requirements have to match for
 * the predicate to match. The predicate without any requirements ({@link #EVERYTHING}) matches any label set.
 *
 * @see <a href="https://kubernetes.io/docs/concepts/overview/working-with-objects/labels/#label-selectors">Label selectors</a>
 */
public class LabelPredicate implements Predicate<Map<String, String>> {
    /**
     * Predicate matching every label set, including the empty one
     */
    public static final LabelPredicate EVERYTHING = new LabelPredicate(List.of());

    private static final Pattern SET_BASED = Pattern.compile("^(\\S+)\\s+(in|notin)\\s*\\((.*)\\)$");
    private static final Pattern KEY = Pattern.compile("([a-z0-9.-]*/)?([a-z0-9A-Z](?:[a-z0-9A-Z_.-]*[a-z0-9A-Z])?)");
    private static final Pattern VALUE = Pattern.compile("([a-z0-9A-Z]([a-z0-9A-Z_.-]*[a-z0-9A-Z])?)?");

    private final List<Requirement> requirements;

    private LabelPredicate(List<Requirement> requirements) {
        this.requirements = List.copyOf(requirements);
    }

    /**
     * Operators supported in the requirements
     */
    public enum Operator {
        /**
         * The label is present and has the given value
         */
        EQUALS,
        /**
         * The label is absent or has a different value
         */
        NOT_EQUALS,
        /**
         * The label is present and its value is one of the values
         */
        IN,
        /**
         * The label is absent or its value is none of the values
         */
        NOT_IN,
        /**
         * The label is present
         */
        EXISTS,
        /**
         * The label is absent
         */
        DOES_NOT_EXIST
    }

    /**
     * Single requirement of the predicate
     *
     * @param key       Label key
     * @param operator  Operator
     * @param values    Values used by the operator (empty for EXISTS and DOES_NOT_EXIST)
     */
    public record Requirement(String key, Operator operator, Set<String> values) {
        /**
         * Constructor
         *
         * @param key       Label key
         * @param operator  Operator
         * @param values    Values used by the operator
         */
        public Requirement {
            Objects.requireNonNull(key);
            Objects.requireNonNull(operator);
            values = values == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(values));
        }

        boolean matches(Map<String, String> labels) {
            String value = labels.get(key);

            return switch (operator) {
                case EQUALS, IN -> value != null && values.contains(value);
                case NOT_EQUALS, NOT_IN -> value == null || !values.contains(value);
                case EXISTS -> labels.containsKey(key);
                case DOES_NOT_EXIST -> !labels.containsKey(key);
            };
        }

        @Override
        public String toString() {
            return switch (operator) {
                case EQUALS -> key + "=" + values.iterator().next();
                case NOT_EQUALS -> key + "!=" + values.iterator().next();
                case IN -> key + " in (" + String.join(",", values) + ")";
                case NOT_IN -> key + " notin (" + String.join(",", values) + ")";
                case EXISTS -> key;
                case DOES_NOT_EXIST -> "!" + key;
            };
        }
    }

    /**
     * Creates a predicate requiring all the given labels to be present with the given values.
     *
     * @param labels    Map with the required labels
     *
     * @return  Label predicate
     */
    public static LabelPredicate fromMap(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return EVERYTHING;
        }

        List<Requirement> requirements = new ArrayList<>(labels.size());
        for (Map.Entry<String, String> label : new TreeMap<>(labels).entrySet()) {
            requirements.add(requirement(label.getKey(), Operator.EQUALS, List.of(label.getValue())));
        }

        return new LabelPredicate(requirements);
    }

    /**
     * Creates a predicate from the Kubernetes LabelSelector structure. A null selector matches everything.
     *
     * @param selector  The Kubernetes label selector
     *
     * @return  Label predicate
     *
     * @throws IllegalArgumentException if the selector uses an unknown operator or invalid keys or values
     */
    public static LabelPredicate fromLabelSelector(LabelSelector selector) throws IllegalArgumentException {
        if (selector == null) {
            return EVERYTHING;
        }

        List<Requirement> requirements = new ArrayList<>(fromMap(selector.getMatchLabels()).requirements);

        if (selector.getMatchExpressions() != null) {
            for (LabelSelectorRequirement expression : selector.getMatchExpressions()) {
                Operator operator = switch (String.valueOf(expression.getOperator())) {
                    case "In" -> Operator.IN;
                    case "NotIn" -> Operator.NOT_IN;
                    case "Exists" -> Operator.EXISTS;
                    case "DoesNotExist" -> Operator.DOES_NOT_EXIST;
                    default -> throw new IllegalArgumentException("Unsupported label selector operator " + expression.getOperator());
                };

                requirements.add(requirement(expression.getKey(), operator, expression.getValues()));
            }
        }

        return new LabelPredicate(requirements);
    }

    /**
     * Parses the label selector string, for example:
     * <pre><code>
     * elbv2.k8s.aws/cluster=my-cluster,tier in (frontend,backend),!legacy
     * </code></pre>
     *
     * A null or blank string results in a predicate matching everything.
     *
     * @param selector  The string to parse
     *
     * @return  The label predicate
     *
     * @throws IllegalArgumentException if the string is not a valid selector
     */
    public static LabelPredicate fromString(String selector) throws IllegalArgumentException {
        if (selector == null || selector.isBlank()) {
            return EVERYTHING;
        }

        List<Requirement> requirements = new ArrayList<>();
        for (String term : splitTerms(selector)) {
            requirements.add(parseTerm(term.trim(), selector));
        }

        return new LabelPredicate(requirements);
    }

    private static List<String> splitTerms(String selector) {
        List<String> terms = new ArrayList<>();
        int depth = 0;
        int start = 0;

        for (int i = 0; i < selector.length(); i++) {
            char c = selector.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                terms.add(selector.substring(start, i));
                start = i + 1;
            }
        }
        terms.add(selector.substring(start));

        if (depth != 0) {
            throw new IllegalArgumentException("Unbalanced parentheses in label selector " + selector);
        }

        return terms;
    }

    private static Requirement parseTerm(String term, String selector) {
        if (term.isEmpty()) {
            throw new IllegalArgumentException("Empty requirement in label selector " + selector);
        }

        Matcher setBased = SET_BASED.matcher(term);
        if (setBased.matches()) {
            List<String> values = new ArrayList<>();
            for (String value : setBased.group(3).split(",")) {
                values.add(value.trim());
            }
            return requirement(setBased.group(1), "in".equals(setBased.group(2)) ? Operator.IN : Operator.NOT_IN, values);
        } else if (term.startsWith("!")) {
            return requirement(term.substring(1).trim(), Operator.DOES_NOT_EXIST, List.of());
        } else if (term.contains("!=")) {
            String[] fields = term.split("!=", 2);
            return requirement(fields[0].trim(), Operator.NOT_EQUALS, List.of(fields[1].trim()));
        } else if (term.contains("==")) {
            String[] fields = term.split("==", 2);
            return requirement(fields[0].trim(), Operator.EQUALS, List.of(fields[1].trim()));
        } else if (term.contains("=")) {
            String[] fields = term.split("=", 2);
            return requirement(fields[0].trim(), Operator.EQUALS, List.of(fields[1].trim()));
        } else {
            return requirement(term, Operator.EXISTS, List.of());
        }
    }

    private static Requirement requirement(String key, Operator operator, List<String> values) {
        checkLabelKey(key);

        if (values != null) {
            for (String value : values) {
                checkLabelValue(value);
            }
        }

        if ((operator == Operator.IN || operator == Operator.NOT_IN) && (values == null || values.isEmpty())) {
            throw new IllegalArgumentException("Operator " + operator + " on label " + key + " requires at least one value");
        }

        return new Requirement(key, operator, values == null ? Set.of() : new LinkedHashSet<>(values));
    }

    private static void checkLabelKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("The label key is missing");
        }

        Matcher keyMatcher = KEY.matcher(key);
        if (!keyMatcher.matches()) {
            throw new IllegalArgumentException("The label key " + key + " is invalid");
        } else if (keyMatcher.group(2).length() > 63) {
            throw new IllegalArgumentException("The label name " + key + " is too long (63 character max)");
        }
    }

    private static void checkLabelValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("The label value is missing");
        } else if (value.length() > 63) {
            throw new IllegalArgumentException("The label value " + value + " is too long (63 character max)");
        } else if (!VALUE.matcher(value).matches()) {
            throw new IllegalArgumentException("The label value " + value + " is invalid");
        }
    }

    /**
     * Checks whether the labels match this predicate. Null labels are handled as an empty label set.
     *
     * @param labels    Labels which should be checked
     *
     * @return  True if the labels match all requirements. False otherwise.
     */
    @Override
    public boolean test(Map<String, String> labels) {
        Map<String, String> actual = labels == null ? Map.of() : labels;

        for (Requirement requirement : requirements) {
            if (!requirement.matches(actual)) {
                return false;
            }
        }

        return true;
    }

    /**
     * Combines this predicate with another one. The result matches only the label sets matched by both.
     *
     * @param other     The other predicate
     *
     * @return  Predicate with the requirements of both predicates
     */
    public LabelPredicate and(LabelPredicate other) {
        if (other.matchesEverything()) {
            return this;
        } else if (matchesEverything()) {
            return other;
        }

        List<Requirement> combined = new ArrayList<>(requirements);
        combined.addAll(other.requirements);

        return new LabelPredicate(combined);
    }

    /**
     * @return  True if this predicate matches any label set
     */
    public boolean matchesEverything() {
        return requirements.isEmpty();
    }

    /**
     * @return  The requirements of this predicate
     */
    public List<Requirement> requirements() {
        return requirements;
    }

    /**
     * @return  The selector in the Kubernetes string syntax. Empty string for a predicate matching everything.
     */
    public String toSelectorString() {
        return requirements.stream().map(Requirement::toString).collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o == null || getClass() != o.getClass()) {
            return false;
        } else {
            return requirements.equals(((LabelPredicate) o).requirements);
        }
    }

    @Override
    public int hashCode() {
        return requirements.hashCode();
    }

    @Override
    public String toString() {
        return "LabelPredicate(" + toSelectorString() + ")";
    }
}
