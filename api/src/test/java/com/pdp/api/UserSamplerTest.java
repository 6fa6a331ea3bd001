package com.pdp.api;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class UserSamplerTest {

    private static final List<String> POPULATION =
            IntStream.range(0, 50).mapToObj(i -> "user" + i).toList();

    @RepeatedTest(5)
    void sampleHasNoDuplicatesAndComesFromPopulation() {
        List<String> s = new UserSampler().sample(POPULATION, 20);
        assertEquals(20, s.size());
        assertEquals(20, new HashSet<>(s).size());
        assertTrue(POPULATION.containsAll(s));
    }

    @Test
    void oversizedRequestIsClampedToWholePopulation() {
        List<String> s = new UserSampler().sample(POPULATION, 500);
        assertEquals(POPULATION.size(), s.size());
        assertEquals(new HashSet<>(POPULATION), new HashSet<>(s));
    }

    @Test
    void seededSamplerIsReproducible() {
        assertEquals(UserSampler.forSeed(5L).sample(POPULATION, 10),
                UserSampler.forSeed(5L).sample(POPULATION, 10));
        assertEquals(new UserSampler(new Random(1)).sample(POPULATION, 10),
                new UserSampler(new Random(1)).sample(POPULATION, 10));
    }

    @Test
    void everyUserCanBeDrawn() {
        UserSampler sampler = new UserSampler(new Random(3));
        HashSet<String> seen = new HashSet<>();
        for (int i = 0; i < 400; i++) {
            seen.addAll(sampler.sample(POPULATION, 2));
        }
        assertEquals(POPULATION.size(), seen.size());
    }

    @Test
    void edgeCases() {
        UserSampler sampler = new UserSampler();
        assertTrue(sampler.sample(List.of(), 3).isEmpty());
        assertTrue(sampler.sample(POPULATION, 0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> sampler.sample(POPULATION, -1));
    }
}
