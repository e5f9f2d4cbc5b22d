package com.questrail.mdoc.harness;

import com.questrail.mdoc.presentment.TerminationStyle;

import java.util.List;
import java.util.Objects;

/**
 * Ordered list of what the harness runs: each entry is run for its number of
 * iterations before the next entry starts.
 */
public record TestPlan(List<Entry> entries)
{
    public TestPlan {
        entries = List.copyOf(entries);
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("Test plan has no entries");
        }
    }

    public static TestPlan of(Entry... entries) {
        return new TestPlan(List.of(entries));
    }

    public int totalIterations() {
        return entries.stream().mapToInt(Entry::iterations).sum();
    }

    public record Entry(HarnessTransport transport, TerminationStyle style, int iterations) {
        public Entry {
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(style, "style");
            if (iterations < 1) {
                throw new IllegalArgumentException("iterations must be at least 1");
            }
        }

        /** Central-client mode without L2CAP. */
        public static Entry of(TerminationStyle style, int iterations) {
            return new Entry(HarnessTransport.BLE_CENTRAL_CLIENT, style, iterations);
        }
    }
}
