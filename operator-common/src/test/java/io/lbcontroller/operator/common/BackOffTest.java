/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class BackOffTest {
    @Test
    public void testDefaultBackOff() {
        BackOff b = new BackOff();
        assertThat(b.maxAttempts(), is(6));
        assertThat(b.done(), is(false));
        assertThat(b.delayMs(), is(200L));
        assertThat(b.delayMs(), is(400L));
        assertThat(b.delayMs(), is(800L));
        assertThat(b.delayMs(), is(1600L));
        assertThat(b.delayMs(), is(3200L));
        assertThat(b.done(), is(false));
        assertThat(b.delayMs(), is(6400L));
        assertThat(b.attempts(), is(6));
        assertThat(b.done(), is(true));

        assertThrows(MaxAttemptsExceededException.class, b::delayMs);
    }

    @Test
    public void testCustomBackOff() {
        BackOff b = new BackOff(1, 10, 3);
        assertThat(b.delayMs(), is(1L));
        assertThat(b.delayMs(), is(10L));
        assertThat(b.delayMs(), is(100L));

        assertThrows(MaxAttemptsExceededException.class, b::delayMs);
    }

    @Test
    public void testInvalidBackOff() {
        assertThrows(IllegalArgumentException.class, () -> new BackOff(0));
        assertThrows(IllegalArgumentException.class, () -> new BackOff(0, 2, 3));
        assertThrows(IllegalArgumentException.class, () -> new BackOff(100, 0, 3));
    }
}
