package com.questrail.mdoc.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of the multi-device test harness.
 *
 * @param bindAddress      control socket address of the server; port 0 picks a free port
 * @param messageTimeout   how long a presentment waits for each session message
 * @param iterationTimeout upper bound for one iteration, after which it is cancelled
 * @param transportOptions base transport options; the L2CAP flag is set per plan entry
 */
public record HarnessConfig(
    InetSocketAddress bindAddress,
    Duration messageTimeout,
    Duration iterationTimeout,
    MdocTransportOptions transportOptions
) {
    public HarnessConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(messageTimeout, "messageTimeout");
        Objects.requireNonNull(iterationTimeout, "iterationTimeout");
        Objects.requireNonNull(transportOptions, "transportOptions");
        if (iterationTimeout.compareTo(messageTimeout) < 0) {
            throw new IllegalArgumentException("iterationTimeout shorter than messageTimeout");
        }
    }

    public static HarnessConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress("127.0.0.1", 0);
        private Duration messageTimeout = Duration.ofSeconds(10);
        private Duration iterationTimeout = Duration.ofSeconds(30);
        private MdocTransportOptions transportOptions = MdocTransportOptions.defaults();

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withMessageTimeout(Duration messageTimeout) {
            this.messageTimeout = messageTimeout;
            return this;
        }

        public Builder withIterationTimeout(Duration iterationTimeout) {
            this.iterationTimeout = iterationTimeout;
            return this;
        }

        public Builder withTransportOptions(MdocTransportOptions transportOptions) {
            this.transportOptions = transportOptions;
            return this;
        }

        public HarnessConfig build() {
            return new HarnessConfig(bindAddress, messageTimeout, iterationTimeout, transportOptions);
        }
    }
}
