package com.questrail.mdoc.harness;

import com.questrail.mdoc.presentment.TerminationStyle;

import java.util.Objects;

/**
 * Messages of the harness control protocol.
 *
 * <pre>
 * server                           client
 *   plan  -------------------------->
 *   per iteration:
 *   prepare (engagement) ----------->
 *         <------------------------- prepared
 *   start -------------------------->
 *         <------------------------- success | timeout | failed
 *   result ------------------------->
 *   done  -------------------------->
 * </pre>
 */
public sealed interface ControlMessage
{
    record Plan(TestPlan plan) implements ControlMessage {
        public Plan {
            Objects.requireNonNull(plan, "plan");
        }
    }

    record Prepare(int iteration,
                   int totalIterations,
                   HarnessTransport transport,
                   TerminationStyle style,
                   byte[] deviceEngagement) implements ControlMessage {
        public Prepare {
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(style, "style");
            Objects.requireNonNull(deviceEngagement, "deviceEngagement");
        }
    }

    record Prepared(int iteration) implements ControlMessage {}

    record Start(int iteration) implements ControlMessage {}

    /**
     * @param scanningMillis {@code null} when the reader did not scan
     */
    record Success(int iteration, long transactionMillis, Long scanningMillis) implements ControlMessage {}

    record Timeout(int iteration) implements ControlMessage {}

    record Failed(int iteration, String reason) implements ControlMessage {
        public Failed {
            Objects.requireNonNull(reason, "reason");
        }
    }

    record Result(TestResult result) implements ControlMessage {
        public Result {
            Objects.requireNonNull(result, "result");
        }
    }

    enum Done implements ControlMessage {
        INSTANCE
    }
}
