package io.github.hotbrkm.smtpcampaign.dispatcher.email.mime;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.domain.EmailAddressUtil;
import lombok.experimental.UtilityClass;

import java.util.concurrent.atomic.AtomicLong;

@UtilityClass
public class MessageIdGenerator {
    private static final AtomicLong INDEX = new AtomicLong(0);
    private static final String FALLBACK_DOMAIN = "localhost";

    /**
     * Creates a Message-ID on the sender's domain.
     */
    public static String next(String senderAddress) {
        long nextIndex = INDEX.updateAndGet(i -> (i + 1) % 10000000L);
        String domain = EmailAddressUtil.extractDomain(senderAddress);
        if (domain.isEmpty()) {
            domain = FALLBACK_DOMAIN;
        }
        return "<" + System.currentTimeMillis() + "." + nextIndex + "@" + domain + ">";
    }
}
