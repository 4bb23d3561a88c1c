package io.github.hotbrkm.smtpcampaign.dispatcher.cli;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.CampaignException;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.mime.AttachmentBlob;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.mime.AttachmentReader;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.entry.CampaignRequest;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.entry.CampaignRunner;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.progress.LoggingProgressSink;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.send.result.RecipientOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * <pre>
 * Runs one campaign from the command line:
 *   --recipients=&lt;csv file&gt; --subject=&lt;text&gt; --body=&lt;html file&gt;
 *   [--attachment=&lt;file&gt; ...] [--sender=&lt;address&gt;]
 * </pre>
 * Exit code: 0 when the campaign completed (even with failed recipients), 1 on a fatal error, 2 on bad arguments.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "email.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CampaignCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private final CampaignRunner campaignRunner;
    private final AttachmentReader attachmentReader;

    private int exitCode = EXIT_OK;

    public CampaignCommandLineRunner(CampaignRunner campaignRunner, AttachmentReader attachmentReader) {
        this.campaignRunner = campaignRunner;
        this.attachmentReader = attachmentReader;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.getOptionNames().isEmpty()) {
            log.info("No campaign options given. Usage: --recipients=<csv> --subject=<text> --body=<html file> "
                    + "[--attachment=<file> ...] [--sender=<address>]");
            return;
        }

        CampaignRequest request;
        try {
            request = toRequest(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid campaign arguments: {}", e.getMessage());
            exitCode = EXIT_USAGE;
            return;
        } catch (IOException e) {
            log.error("Failed to read campaign input: {}", e.toString());
            exitCode = EXIT_FATAL;
            return;
        }

        try {
            List<RecipientOutcome> outcomes = campaignRunner.run(request, new LoggingProgressSink());
            long sent = outcomes.stream().filter(RecipientOutcome::isSent).count();
            log.info("event=campaign_finished, recipients={}, sent={}, failed={}", outcomes.size(), sent, outcomes.size() - sent);
        } catch (CampaignException e) {
            log.error("Campaign aborted: {}", e.getMessage());
            exitCode = EXIT_FATAL;
        } catch (IllegalArgumentException e) {
            log.error("Invalid campaign arguments: {}", e.getMessage());
            exitCode = EXIT_USAGE;
        } catch (IllegalStateException e) {
            log.error("Campaign not started: {}", e.getMessage());
            exitCode = EXIT_FATAL;
        }
    }

    CampaignRequest toRequest(ApplicationArguments args) throws IOException {
        Path recipients = Path.of(required(args, "recipients"));
        String subject = required(args, "subject");
        Path body = Path.of(required(args, "body"));

        List<Path> attachmentPaths = args.containsOption("attachment")
                ? args.getOptionValues("attachment").stream().map(Path::of).toList()
                : List.of();
        List<AttachmentBlob> attachments = attachmentReader.read(attachmentPaths);

        return new CampaignRequest(
                optional(args, "sender"),
                subject,
                Files.readString(body, StandardCharsets.UTF_8),
                new String(Files.readAllBytes(recipients), StandardCharsets.UTF_8),
                attachments);
    }

    private static String required(ApplicationArguments args, String name) {
        String value = optional(args, name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("--" + name + " is required");
        }
        return value;
    }

    private static String optional(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
