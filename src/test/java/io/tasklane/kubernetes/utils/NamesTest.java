package io.tasklane.kubernetes.utils;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.not;

class NamesTest {
    @Test
    void fixedSuffix() {
        assertThat(Names.fixed("abcde").withRandomSuffix("build-pod"), is("build-pod-abcde"));
    }

    @Test
    void truncateLongName() {
        String name = Names.fixed("abcde").withRandomSuffix("a".repeat(100));

        assertThat(name.length(), is(Names.MAX_LENGTH));
        assertThat(name, is("a".repeat(57) + "-abcde"));
    }

    @Test
    void randomSuffix() {
        Names names = Names.random();

        String first = names.withRandomSuffix("run-pod");
        String second = names.withRandomSuffix("run-pod");

        assertThat(first, matchesPattern("run-pod-[bcdfghjklmnpqrstvwxz2456789]{5}"));
        assertThat(first, not(second));
    }
}
