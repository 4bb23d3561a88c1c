package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.progress;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingProgressSink implements ProgressSink {

    @Override
    public void onInfo(String message) {
        log.info(message);
    }

    @Override
    public void onProgress(double fraction) {
        log.info("progress={}%", Math.round(fraction * 100));
    }

    @Override
    public void onDone() {
        log.info("event=campaign_done");
    }
}
