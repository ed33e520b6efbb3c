package com.healthtech.olap.data.star;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SurrogateKeyResolverTest {

    @Test
    void shouldAssignKeysInNaturalKeyOrder() {
        SurrogateKeyResolver<Integer> subject = SurrogateKeyResolver.assign(List.of(40, 10, 30, 20));

        assertEquals(Optional.of(1), subject.keyFor(10));
        assertEquals(Optional.of(2), subject.keyFor(20));
        assertEquals(Optional.of(3), subject.keyFor(30));
        assertEquals(Optional.of(4), subject.keyFor(40));
    }

    @Test
    void shouldCollapseDuplicateNaturalKeys() {
        SurrogateKeyResolver<String> subject = SurrogateKeyResolver.assign(List.of("OUTPATIENT", "INPATIENT", "OUTPATIENT"));

        assertEquals(2, subject.size());
        assertEquals(Optional.of(1), subject.keyFor("INPATIENT"));
        assertEquals(Optional.of(2), subject.keyFor("OUTPATIENT"));
    }

    @Test
    void shouldMapEverySurrogateKeyBackToExactlyOneNaturalKey() {
        SurrogateKeyResolver<Integer> subject = SurrogateKeyResolver.assign(List.of(7, 3, 99, 12, 5));

        Set<Integer> seen = new HashSet<>();
        for (Integer naturalKey : subject.naturalKeys()) {
            int surrogate = subject.keyFor(naturalKey).orElseThrow();
            assertTrue(seen.add(surrogate), "surrogate key " + surrogate + " assigned twice");
            assertEquals(Optional.of(naturalKey), subject.naturalKeyFor(surrogate));
        }
    }

    @Test
    void shouldNotResolveUnknownOrNullKeys() {
        SurrogateKeyResolver<Integer> subject = SurrogateKeyResolver.assign(List.of(1));

        assertTrue(subject.keyFor(2).isEmpty());
        assertTrue(subject.keyFor(null).isEmpty());
        assertTrue(subject.naturalKeyFor(0).isEmpty());
    }

    @Test
    void shouldAssignSameKeysRegardlessOfInputOrder() {
        SurrogateKeyResolver<Integer> first = SurrogateKeyResolver.assign(List.of(3, 1, 2));
        SurrogateKeyResolver<Integer> second = SurrogateKeyResolver.assign(List.of(2, 3, 1));

        for (int naturalKey = 1; naturalKey <= 3; naturalKey++) {
            assertEquals(first.keyFor(naturalKey), second.keyFor(naturalKey));
        }
    }
}
