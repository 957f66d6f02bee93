package com.lsemantica.core.trace;

import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Caller-supplied clock and id factories. Every hook is optional and is only invoked when its
 * output is actually needed; {@link HookResolver} guards against hooks that throw or return
 * unusable values.
 *
 * @param clock             source of timestamps
 * @param runIdFactory      source of run ids
 * @param feedbackIdFactory source of FeedbackTensor ids, may be {@code null}
 */
public record GovernanceHooks(
        Supplier<Instant> clock,
        Supplier<String> runIdFactory,
        Supplier<String> feedbackIdFactory
) {

    public static GovernanceHooks defaults() {
        return new GovernanceHooks(Instant::now, () -> UUID.randomUUID().toString(), null);
    }

    /**
     * System clock and no id factories. Pipeline stages use this so a downstream artifact
     * inherits the upstream run id instead of minting a new one.
     */
    public static GovernanceHooks systemClock() {
        return new GovernanceHooks(Instant::now, null, null);
    }

    public static GovernanceHooks fixed(Instant instant, String runId) {
        return new GovernanceHooks(() -> instant, () -> runId, null);
    }

    public GovernanceHooks withClock(Supplier<Instant> clock) {
        return new GovernanceHooks(clock, runIdFactory, feedbackIdFactory);
    }

    public GovernanceHooks withRunIdFactory(Supplier<String> runIdFactory) {
        return new GovernanceHooks(clock, runIdFactory, feedbackIdFactory);
    }

    public GovernanceHooks withFeedbackIdFactory(Supplier<String> feedbackIdFactory) {
        return new GovernanceHooks(clock, runIdFactory, feedbackIdFactory);
    }
}
