package io.github.hotbrkm.smtpcampaign.dispatcher.email.recipient;

import io.github.hotbrkm.smtpcampaign.dispatcher.email.domain.EmailAddressUtil;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.domain.RecipientAddress;
import io.github.hotbrkm.smtpcampaign.dispatcher.email.recipient.CsvTableReader.CsvTable;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns a recipient table into the ordered work list of a campaign.
 * <p>
 * The first header (by column order) containing "email", ignoring case, is the address column.
 * Each row's value is trimmed and validated; invalid rows are skipped with a warning.
 */
@Slf4j
public class RecipientExtractor {

    private static final String EMAIL_COLUMN_TOKEN = "email";

    private final CsvTableReader csvTableReader = new CsvTableReader();

    public RecipientExtraction extract(byte[] content) {
        Objects.requireNonNull(content, "content must not be null");
        return extract(new String(content, StandardCharsets.UTF_8));
    }

    /**
     * @param content table text with a header row
     * @return recipients in row order plus the rejected rows
     * @throws SchemaException when no header names an email column
     */
    public RecipientExtraction extract(String content) {
        Objects.requireNonNull(content, "content must not be null");
        log.debug("Reading recipient table ({} chars)", content.length());

        CsvTable table = csvTableReader.read(content);
        int columnIndex = findEmailColumn(table);
        String columnName = table.header().get(columnIndex);

        List<RecipientAddress> recipients = new ArrayList<>();
        List<RecipientExtraction.RejectedRow> rejectedRows = new ArrayList<>();

        int rowNumber = 0;
        for (List<String> row : table.rows()) {
            rowNumber++;
            String email = table.cell(row, columnIndex).trim();
            if (EmailAddressUtil.isValid(email)) {
                recipients.add(RecipientAddress.of(email));
            } else {
                log.warn("Invalid email found: {} (row {})", email, rowNumber);
                rejectedRows.add(new RecipientExtraction.RejectedRow(rowNumber, email));
            }
        }

        log.debug("Found {} valid emails in column '{}', skipped {}", recipients.size(), columnName, rejectedRows.size());
        return new RecipientExtraction(columnName, recipients, rejectedRows);
    }

    private int findEmailColumn(CsvTable table) {
        if (!table.hasHeader()) {
            throw new SchemaException("No email column found in CSV: the table has no header row");
        }
        List<String> header = table.header();
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).toLowerCase(Locale.ROOT).contains(EMAIL_COLUMN_TOKEN)) {
                return i;
            }
        }
        throw new SchemaException("No email column found in CSV (columns: " + header + ")");
    }
}
