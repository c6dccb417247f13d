package com.valuerank.orchestration.service.launch;

import java.util.ArrayList;
import java.util.List;

public final class ScenarioSampler {

    private static final long MODULUS = 2_147_483_647L;
    private static final long MULTIPLIER = 16_807L;

    private ScenarioSampler() {
    }

    public static int targetCount(int scenarioCount, int samplePercentage) {
        if (samplePercentage >= 100) {
            return scenarioCount;
        }
        return (int) Math.max(1, Math.round(scenarioCount * samplePercentage / 100.0));
    }

    public static List<String> sample(List<String> scenarioIds, int samplePercentage, long seed) {
        List<String> shuffled = new ArrayList<>(scenarioIds);
        shuffled.sort(null);
        if (samplePercentage >= 100) {
            return shuffled;
        }

        Lcg random = new Lcg(seed);
        for (int i = shuffled.size() - 1; i > 0; i--) {
            int j = (int) Math.floor(random.next() * (i + 1));
            String tmp = shuffled.get(i);
            shuffled.set(i, shuffled.get(j));
            shuffled.set(j, tmp);
        }
        int count = Math.min(shuffled.size(), targetCount(shuffled.size(), samplePercentage));
        return new ArrayList<>(shuffled.subList(0, count));
    }

    public static long seedFor(String definitionId) {
        int hash = 0;
        for (int i = 0; i < definitionId.length(); i++) {
            hash = (hash << 5) - hash + definitionId.charAt(i);
        }
        return Math.abs((long) hash);
    }

    private static final class Lcg {

        private long state;

        Lcg(long seed) {
            this.state = Math.floorMod(seed, MODULUS);
        }

        double next() {
            state = (state * MULTIPLIER) % MODULUS;
            return (double) state / MODULUS;
        }
    }
}
