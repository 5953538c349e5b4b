package io.github.reugn.arbitrary4j;

import java.time.Clock;
import java.util.Objects;

/**
 * Mutable state and settings shared by every value produced within one generator.
 *
 * <p>The context owns the {@link SequenceCounter}, so two generators built with separate
 * contexts draw independent sequences. Handing the same context to several generators
 * makes their values unique across all of them.
 *
 * <p><b>Defaults:</b>
 * <ul>
 *   <li>counter starts at 0, so the first drawn value is 1</li>
 *   <li>{@link Clock#systemDefaultZone()}</li>
 *   <li>e-mail domain {@value #DEFAULT_EMAIL_DOMAIN}</li>
 * </ul>
 */
public final class GenerationContext {

    public static final String DEFAULT_EMAIL_DOMAIN = "example.com";

    private final SequenceCounter counter;
    private final Clock clock;
    private final String emailDomain;

    private GenerationContext(SequenceCounter counter, Clock clock, String emailDomain) {
        this.counter = counter;
        this.clock = clock;
        this.emailDomain = emailDomain;
    }

    public static GenerationContext create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Draws the next unique value.
     */
    public long nextSequence() {
        return counter.next();
    }

    public SequenceCounter counter() {
        return counter;
    }

    public Clock clock() {
        return clock;
    }

    public String emailDomain() {
        return emailDomain;
    }

    public static final class Builder {
        private long counterStart;
        private SequenceCounter counter;
        private Clock clock = Clock.systemDefaultZone();
        private String emailDomain = DEFAULT_EMAIL_DOMAIN;

        private Builder() {
        }

        /**
         * Starts a new counter at the given value. Ignored when {@link #counter(SequenceCounter)} is set.
         */
        public Builder counterStart(long counterStart) {
            this.counterStart = counterStart;
            return this;
        }

        /**
         * Shares an existing counter.
         */
        public Builder counter(SequenceCounter counter) {
            this.counter = Objects.requireNonNull(counter, "counter");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder emailDomain(String emailDomain) {
            Objects.requireNonNull(emailDomain, "emailDomain");
            if (emailDomain.isBlank() || emailDomain.contains("@")) {
                throw new IllegalArgumentException("Invalid e-mail domain: '" + emailDomain + "'");
            }
            this.emailDomain = emailDomain;
            return this;
        }

        public GenerationContext build() {
            SequenceCounter sequence = counter != null ? counter : new SequenceCounter(counterStart);
            return new GenerationContext(sequence, clock, emailDomain);
        }
    }
}
