package com.questrail.timedcallback.config;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Aggregated configuration for the timed callback runtime.
 *
 * @param tickPolicy tick cadence and elapsed-time bound
 * @param randomSeed seed for delay draws; empty for an unseeded source
 * @param useNettyTicks drive ticks from a Netty event executor instead of a
 *                      JDK scheduled executor
 */
public record TimedCallbackConfig(
    TickPolicy tickPolicy,
    OptionalLong randomSeed,
    boolean useNettyTicks
) {
    public TimedCallbackConfig {
        Objects.requireNonNull(tickPolicy, "tickPolicy");
        Objects.requireNonNull(randomSeed, "randomSeed");
    }

    public static TimedCallbackConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TickPolicy tickPolicy = TickPolicy.defaults();
        private OptionalLong randomSeed = OptionalLong.empty();
        private boolean useNettyTicks = false;

        public Builder withTickPolicy(TickPolicy tickPolicy) {
            this.tickPolicy = tickPolicy;
            return this;
        }

        public Builder withRandomSeed(long seed) {
            this.randomSeed = OptionalLong.of(seed);
            return this;
        }

        public Builder withNettyTicks(boolean useNettyTicks) {
            this.useNettyTicks = useNettyTicks;
            return this;
        }

        public TimedCallbackConfig build() {
            return new TimedCallbackConfig(tickPolicy, randomSeed, useNettyTicks);
        }
    }
}
