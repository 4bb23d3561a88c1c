package io.github.hotbrkm.smtpcampaign.dispatcher.email.send.transport.smtp;

import lombok.Getter;

import java.util.List;

@Getter
public class SmtpCommandResponse {
    private final SmtpCommand command;
    private final SmtpResponse response;

    public SmtpCommandResponse(SmtpCommand command, List<String> response) {
        this.command = command;

        SmtpResponseParser responseParser = new SmtpResponseParser();
        this.response = responseParser.parseResponse(response);
    }

    public boolean isSuccess() {
        return command.getSuccessCode() == response.getStatusCode();
    }

    public String getOriginalMessage() {
        return response.getOriginalMessage();
    }

    public boolean supports(String extension) {
        return response.supports(extension);
    }

    public List<String> getAuthMechanisms() {
        return response.getAuthMechanisms();
    }

    public int getStatusCode() {
        return response.getStatusCode();
    }

    @Override
    public String toString() {
        return "Command: " + command + ", Response: " + response;
    }
}
