package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp;

import java.util.List;

class SmtpResponseParser {

    public SmtpResponse parseResponse(List<String> lines) {
        SmtpResponse smtpResponse = new SmtpResponse();

        for (String line : lines) {
            // A malformed line only sets the status when no reply code has been read yet
            if (line == null || line.length() < 3 || !hasStatusCode(line)) {
                if (smtpResponse.getStatusCode() <= 0) {
                    setInvalidResponseMessage(line, smtpResponse);
                }
                continue;
            }

            int statusCode = Integer.parseInt(line.substring(0, 3));
            String message = line.length() > 4 ? line.substring(4).trim() : "";

            smtpResponse.addLine(message);
            if (!isMultiLineResponse(line)) {
                smtpResponse.setStatusCode(statusCode);
                smtpResponse.setMessage(message);
                smtpResponse.setOriginalMessage(line);
            }
        }

        if (smtpResponse.getStatusCode() <= 0) {
            setInvalidResponseMessage(lines.isEmpty() ? null : lines.get(lines.size() - 1), smtpResponse);
        }

        return smtpResponse;
    }

    private void setInvalidResponseMessage(String line, SmtpResponse smtpResponse) {
        smtpResponse.setStatusCode(SmtpStatus.INVALID_RESPONSE);
        smtpResponse.setMessage("response message is invalid. [" + line + "]");
        smtpResponse.setOriginalMessage(SmtpStatus.INVALID_RESPONSE + " response message is invalid. [" + line + "]");
    }

    private boolean hasStatusCode(String line) {
        return Character.isDigit(line.charAt(0)) && Character.isDigit(line.charAt(1)) && Character.isDigit(line.charAt(2))
                && (line.length() == 3 || line.charAt(3) == ' ' || line.charAt(3) == '-');
    }

    private boolean isMultiLineResponse(String line) {
        return line.length() > 3 && line.charAt(3) == '-';
    }
}
