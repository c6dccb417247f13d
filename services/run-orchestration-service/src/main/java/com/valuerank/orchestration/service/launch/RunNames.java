package com.valuerank.orchestration.service.launch;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

final class RunNames {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("MMM dd", Locale.US);
    private static final String FINAL_SUFFIX = " (Final)";

    private RunNames() {
    }

    static String nameFor(LocalDate day, long runsAlreadyToday, boolean finalTrial) {
        String name = DAY.format(day) + "-" + alphaIndex(runsAlreadyToday);
        return finalTrial ? name + FINAL_SUFFIX : name;
    }

    static String alphaIndex(long zeroBasedIndex) {
        StringBuilder result = new StringBuilder();
        long x = zeroBasedIndex + 1;
        while (x > 0) {
            long remainder = (x - 1) % 26;
            result.insert(0, (char) ('A' + remainder));
            x = (x - 1) / 26;
        }
        return result.toString();
    }
}
