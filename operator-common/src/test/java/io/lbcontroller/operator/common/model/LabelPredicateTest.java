/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common.model;

import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorBuilder;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class LabelPredicateTest {
    @Test
    public void testEverything() {
        assertThat(LabelPredicate.EVERYTHING.test(null), is(true));
        assertThat(LabelPredicate.EVERYTHING.test(Map.of()), is(true));
        assertThat(LabelPredicate.EVERYTHING.test(Map.of("a", "b")), is(true));
        assertThat(LabelPredicate.EVERYTHING.matchesEverything(), is(true));

        assertThat(LabelPredicate.fromString(null), is(LabelPredicate.EVERYTHING));
        assertThat(LabelPredicate.fromString("  "), is(LabelPredicate.EVERYTHING));
        assertThat(LabelPredicate.fromMap(Map.of()), is(LabelPredicate.EVERYTHING));
        assertThat(LabelPredicate.fromLabelSelector(null), is(LabelPredicate.EVERYTHING));
    }

    @Test
    public void testEquality() {
        LabelPredicate p = LabelPredicate.fromString("owner=lbc");

        assertThat(p.test(Map.of("owner", "lbc")), is(true));
        assertThat(p.test(Map.of("owner", "lbc", "other", "x")), is(true));
        assertThat(p.test(Map.of("owner", "someone-else")), is(false));
        assertThat(p.test(Map.of()), is(false));
        assertThat(p.test(null), is(false));

        assertThat(LabelPredicate.fromString("owner==lbc"), is(p));
    }

    @Test
    public void testInequality() {
        LabelPredicate p = LabelPredicate.fromString("owner!=lbc");

        assertThat(p.test(Map.of("owner", "lbc")), is(false));
        assertThat(p.test(Map.of("owner", "other")), is(true));
        assertThat(p.test(Map.of()), is(true));
    }

    @Test
    public void testSetBased() {
        LabelPredicate in = LabelPredicate.fromString("tier in (frontend, backend)");
        assertThat(in.test(Map.of("tier", "frontend")), is(true));
        assertThat(in.test(Map.of("tier", "backend")), is(true));
        assertThat(in.test(Map.of("tier", "db")), is(false));
        assertThat(in.test(Map.of()), is(false));

        LabelPredicate notIn = LabelPredicate.fromString("tier notin (frontend,backend)");
        assertThat(notIn.test(Map.of("tier", "frontend")), is(false));
        assertThat(notIn.test(Map.of("tier", "db")), is(true));
        assertThat(notIn.test(Map.of()), is(true));
    }

    @Test
    public void testExistence() {
        LabelPredicate exists = LabelPredicate.fromString("elbv2.k8s.aws/targetGroupBinding");
        assertThat(exists.test(Map.of("elbv2.k8s.aws/targetGroupBinding", "shared")), is(true));
        assertThat(exists.test(Map.of("other", "shared")), is(false));

        LabelPredicate missing = LabelPredicate.fromString("!legacy");
        assertThat(missing.test(Map.of("legacy", "true")), is(false));
        assertThat(missing.test(Map.of()), is(true));
    }

    @Test
    public void testMultipleRequirements() {
        LabelPredicate p = LabelPredicate.fromString("elbv2.k8s.aws/cluster=my-cluster,tier in (frontend,backend),!legacy");

        assertThat(p.requirements().size(), is(3));
        assertThat(p.test(Map.of("elbv2.k8s.aws/cluster", "my-cluster", "tier", "frontend")), is(true));
        assertThat(p.test(Map.of("elbv2.k8s.aws/cluster", "my-cluster", "tier", "frontend", "legacy", "")), is(false));
        assertThat(p.test(Map.of("elbv2.k8s.aws/cluster", "other", "tier", "frontend")), is(false));
        assertThat(p.toSelectorString(), is("elbv2.k8s.aws/cluster=my-cluster,tier in (frontend,backend),!legacy"));
    }

    @Test
    public void testFromMap() {
        LabelPredicate p = LabelPredicate.fromMap(Map.of("b", "2", "a", "1"));

        assertThat(p.toSelectorString(), is("a=1,b=2"));
        assertThat(p.test(Map.of("a", "1", "b", "2")), is(true));
        assertThat(p.test(Map.of("a", "1")), is(false));
    }

    @Test
    public void testFromLabelSelector() {
        LabelSelector selector = new LabelSelectorBuilder()
                .withMatchLabels(Map.of("app", "web"))
                .addNewMatchExpression()
                    .withKey("tier")
                    .withOperator("In")
                    .withValues("frontend")
                .endMatchExpression()
                .addNewMatchExpression()
                    .withKey("legacy")
                    .withOperator("DoesNotExist")
                .endMatchExpression()
                .build();

        LabelPredicate p = LabelPredicate.fromLabelSelector(selector);
        assertThat(p.test(Map.of("app", "web", "tier", "frontend")), is(true));
        assertThat(p.test(Map.of("app", "web", "tier", "backend")), is(false));
        assertThat(p.test(Map.of("app", "web", "tier", "frontend", "legacy", "yes")), is(false));
    }

    @Test
    public void testFromLabelSelectorWithUnknownOperator() {
        LabelSelector selector = new LabelSelectorBuilder()
                .addNewMatchExpression()
                    .withKey("tier")
                    .withOperator("Gt")
                    .withValues("1")
                .endMatchExpression()
                .build();

        assertThrows(IllegalArgumentException.class, () -> LabelPredicate.fromLabelSelector(selector));
    }

    @Test
    public void testInvalidSelectors() {
        assertThrows(IllegalArgumentException.class, () -> LabelPredicate.fromString("a=b,,c=d"));
        assertThrows(IllegalArgumentException.class, () -> LabelPredicate.fromString("tier in (a,b"));
        assertThrows(IllegalArgumentException.class, () -> LabelPredicate.fromString("-invalid-=x"));
        assertThrows(IllegalArgumentException.class, () -> LabelPredicate.fromString("key=in valid"));
        assertThrows(IllegalArgumentException.class, () -> LabelPredicate.fromString("key=" + "a".repeat(64)));
    }

    @Test
    public void testAnd() {
        LabelPredicate cluster = LabelPredicate.fromString("elbv2.k8s.aws/cluster=my-cluster");
        LabelPredicate both = cluster.and(LabelPredicate.fromMap(Map.of("service.k8s.aws/name", "frontend")));

        assertThat(both.test(Map.of("elbv2.k8s.aws/cluster", "my-cluster", "service.k8s.aws/name", "frontend")), is(true));
        assertThat(both.test(Map.of("elbv2.k8s.aws/cluster", "my-cluster", "service.k8s.aws/name", "backend")), is(false));
        assertThat(both.test(Map.of("elbv2.k8s.aws/cluster", "my-cluster")), is(false));
        assertThat(both.toSelectorString(), is("elbv2.k8s.aws/cluster=my-cluster,service.k8s.aws/name=frontend"));

        assertThat(cluster.and(LabelPredicate.EVERYTHING), is(cluster));
        assertThat(LabelPredicate.EVERYTHING.and(cluster), is(cluster));
    }
}
