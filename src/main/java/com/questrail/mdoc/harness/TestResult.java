package com.questrail.mdoc.harness;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated outcome of a harness run. Timings are in milliseconds.
 */
public record TestResult(
    int numIterationsTotal,
    int numIterationsCompleted,
    int numIterationsSuccessful,
    List<Integer> failedIterations,
    int numHolderTimeouts,
    int numHolderErrors,
    int numReaderTimeouts,
    int numReaderErrors,
    Timing transactionTime,
    Timing scanningTime
) {
    public TestResult {
        failedIterations = List.copyOf(failedIterations);
        Objects.requireNonNull(transactionTime, "transactionTime");
        Objects.requireNonNull(scanningTime, "scanningTime");
    }

    /**
     * Summary statistics; every field is 0 when there are no samples.
     * {@code stdDev} is the population standard deviation.
     */
    public record Timing(double min, double max, double avg, double stdDev) {
        public static final Timing EMPTY = new Timing(0, 0, 0, 0);

        public static Timing of(List<Double> samples) {
            if (samples.isEmpty()) {
                return EMPTY;
            }
            double min = Double.MAX_VALUE;
            double max = -Double.MAX_VALUE;
            double sum = 0;
            for (double s : samples) {
                min = Math.min(min, s);
                max = Math.max(max, s);
                sum += s;
            }
            double mean = sum / samples.size();
            double squares = 0;
            for (double s : samples) {
                squares += (s - mean) * (s - mean);
            }
            return new Timing(min, max, mean, Math.sqrt(squares / samples.size()));
        }
    }

    /**
     * Collects per-iteration outcomes. Not thread-safe; owned by the server loop.
     */
    public static final class Accumulator {
        private final int total;
        private int completed;
        private int successful;
        private final List<Integer> failed = new ArrayList<>();
        private int holderTimeouts;
        private int holderErrors;
        private int readerTimeouts;
        private int readerErrors;
        private final List<Double> transactionMillis = new ArrayList<>();
        private final List<Double> scanningMillis = new ArrayList<>();

        public Accumulator(int total) {
            this.total = total;
        }

        public int total() {
            return total;
        }

        public void holderTimeout() {
            holderTimeouts++;
        }

        public void holderError() {
            holderErrors++;
        }

        public void readerTimeout() {
            readerTimeouts++;
        }

        public void readerError() {
            readerErrors++;
        }

        public void transactionTime(double millis) {
            transactionMillis.add(millis);
        }

        public void scanningTime(double millis) {
            scanningMillis.add(millis);
        }

        public void iterationDone(int iteration, boolean success) {
            completed++;
            if (success) {
                successful++;
            } else {
                failed.add(iteration);
            }
        }

        public TestResult snapshot() {
            return new TestResult(total, completed, successful, failed,
                    holderTimeouts, holderErrors, readerTimeouts, readerErrors,
                    Timing.of(transactionMillis), Timing.of(scanningMillis));
        }
    }
}
