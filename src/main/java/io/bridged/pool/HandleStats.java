package io.bridged.pool;

import java.util.List;
import java.util.Map;

public record HandleStats(
        int total,
        int maxHandles,
        Map<String, Integer> perKindCounts,
        List<String> ids,
        long createdTotal,
        long removedTotal,
        long rejectedTotal
) {
    public double saturation() {
        return maxHandles <= 0 ? 0.0d : (double) total / (double) maxHandles;
    }
}
