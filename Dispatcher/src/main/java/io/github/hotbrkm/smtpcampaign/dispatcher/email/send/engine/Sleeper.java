package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.engine;

import java.time.Duration;

/**
 * Blocking pause between attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void pause(Duration duration) throws InterruptedException;
}
