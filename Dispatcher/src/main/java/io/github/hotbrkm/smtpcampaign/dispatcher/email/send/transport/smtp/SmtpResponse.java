package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Getter
@Setter
class SmtpResponse {

    // Text of every reply line, the final one included; for EHLO these are the extensions
    private final List<String> lines = new ArrayList<>();
    private int statusCode;
    private String message;
    private String originalMessage;

    public void addLine(String line) {
        this.lines.add(line);
    }

    /**
     * True when a reply line names the keyword, e.g. {@code STARTTLS} or {@code AUTH}.
     */
    public boolean supports(String keyword) {
        return lines.stream()
                .map(SmtpResponse::firstToken)
                .anyMatch(keyword::equalsIgnoreCase);
    }

    /**
     * Mechanisms of the {@code AUTH} extension line, upper-cased. Also accepts the legacy {@code AUTH=} form.
     */
    public List<String> getAuthMechanisms() {
        List<String> mechanisms = new ArrayList<>();
        for (String line : lines) {
            String upper = line.toUpperCase(Locale.ROOT);
            if (upper.startsWith("AUTH ") || upper.startsWith("AUTH=")) {
                Arrays.stream(upper.substring(5).trim().split("\\s+"))
                        .filter(mechanism -> !mechanism.isEmpty() && !mechanisms.contains(mechanism))
                        .forEach(mechanisms::add);
            }
        }
        return mechanisms;
    }

    private static String firstToken(String line) {
        String trimmed = line.trim();
        int end = 0;
        while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end)) && trimmed.charAt(end) != '=') {
            end++;
        }
        return trimmed.substring(0, end);
    }

    @Override
    public String toString() {
        StringBuilder responseBuilder = new StringBuilder();

        for (int i = 0; i < lines.size() - 1; i++) {
            responseBuilder.append(statusCode).append("-").append(lines.get(i)).append("\n");
        }

        responseBuilder.append(statusCode).append(" ").append(message);
        return responseBuilder.toString();
    }
}
