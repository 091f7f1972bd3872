package org.hardshell.loader.delegation;

import java.util.ArrayList;
import java.util.List;

/**
 * Delegation strategies keyed by inclusive platform version ranges. Versions outside every range have no
 * strategy.
 */
public final class DelegationStrategies {

    private static final class Range {
        final int min;
        final int max;
        final DelegationStrategy strategy;

        Range(int min, int max, DelegationStrategy strategy) {
            this.min = min;
            this.max = max;
            this.strategy = strategy;
        }
    }

    private final List<Range> ranges = new ArrayList<>();

    public DelegationStrategies register(int minSdk, int maxSdk, DelegationStrategy strategy) {
        if (minSdk > maxSdk) throw new IllegalArgumentException("empty range " + minSdk + ".." + maxSdk);
        for (Range range : ranges) {
            if (minSdk <= range.max && range.min <= maxSdk)
                throw new IllegalArgumentException("range " + minSdk + ".." + maxSdk + " overlaps " + range.min + ".." + range.max);
        }
        ranges.add(new Range(minSdk, maxSdk, strategy));
        return this;
    }

    /**
     * @return the strategy for {@code sdkInt}, or {@code null} for an unknown platform version
     */
    public DelegationStrategy forSdk(int sdkInt) {
        for (Range range : ranges) {
            if (sdkInt >= range.min && sdkInt <= range.max) return range.strategy;
        }
        return null;
    }
}
