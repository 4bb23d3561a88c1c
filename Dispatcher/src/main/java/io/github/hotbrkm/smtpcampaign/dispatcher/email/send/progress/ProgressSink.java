package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.progress;

/**
 * Receives the status events of a running campaign.
 * Called from the dispatching thread; implementations must not block for long.
 */
public interface ProgressSink {

    /**
     * Human-readable status line, e.g. "Sent email to: a@x.com".
     */
    void onInfo(String message);

    /**
     * Successful sends so far divided by the number of recipients, in [0, 1]. Never decreases within a campaign.
     */
    void onProgress(double fraction);

    /**
     * The last recipient has been resolved.
     */
    void onDone();
}
