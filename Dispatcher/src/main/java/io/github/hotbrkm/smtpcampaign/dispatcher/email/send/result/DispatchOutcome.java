package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.result;

/**
 * Terminal result of one recipient. Produced exactly once per recipient.
 */
public sealed interface DispatchOutcome permits DispatchOutcome.Sent, DispatchOutcome.Failed {

    /**
     * @return attempts used, including the last one
     */
    int attempts();

    static DispatchOutcome sent(int attempts) {
        return new Sent(attempts);
    }

    static DispatchOutcome failed(int afterAttempts) {
        return new Failed(afterAttempts);
    }

    record Sent(int attempts) implements DispatchOutcome {
    }

    record Failed(int afterAttempts) implements DispatchOutcome {

        @Override
        public int attempts() {
            return afterAttempts;
        }
    }
}
