package com.clinicalguard.signal;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import lombok.Value;

/**
 * Red and yellow finding counts per category, in category order. Every
 * category that produced a finding is listed, green-only ones with zero counts.
 */
@Value
public class SignalSummary {
    Map<String, Counts> categories;

    public static SignalSummary of(List<Finding> findings) {
        Map<String, int[]> tally = new TreeMap<>();
        for (Finding finding : findings) {
            int[] counts = tally.computeIfAbsent(finding.getCategory(), k -> new int[2]);
            if (finding.getColor() == SignalColor.RED) {
                counts[0]++;
            } else if (finding.getColor() == SignalColor.YELLOW) {
                counts[1]++;
            }
        }
        Map<String, Counts> categories = new TreeMap<>();
        tally.forEach((category, counts) -> categories.put(category, new Counts(counts[0], counts[1])));
        return new SignalSummary(Collections.unmodifiableMap(categories));
    }

    @Value
    public static class Counts {
        int red;
        int yellow;
    }
}
