package io.github.hotbrkm.smtpcampaign.dispatcher.email.recipient;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads comma separated text into a header and data rows.
 * <p>
 * Supports double-quoted fields with embedded commas, line breaks and doubled quotes ("").
 * Records end with LF or CRLF. A leading UTF-8 BOM is dropped and fully blank lines are skipped.
 */
class CsvTableReader {

    private static final char SEPARATOR = ',';
    private static final char QUOTE = '"';
    private static final char BOM = '\uFEFF';

    public CsvTable read(String content) {
        List<List<String>> records = parseRecords(stripBom(content));
        if (records.isEmpty()) {
            return new CsvTable(List.of(), List.of());
        }
        List<String> header = records.get(0).stream()
                .map(String::trim)
                .toList();
        return new CsvTable(header, records.subList(1, records.size()));
    }

    private String stripBom(String content) {
        if (content != null && !content.isEmpty() && content.charAt(0) == BOM) {
            return content.substring(1);
        }
        return content == null ? "" : content;
    }

    private List<List<String>> parseRecords(String content) {
        List<List<String>> records = new ArrayList<>();
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean fieldStarted = false;

        int length = content.length();
        for (int i = 0; i < length; i++) {
            char c = content.charAt(i);

            if (quoted) {
                if (c == QUOTE) {
                    if (i + 1 < length && content.charAt(i + 1) == QUOTE) {
                        field.append(QUOTE);
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(c);
                }
                continue;
            }

            switch (c) {
                case QUOTE -> {
                    quoted = true;
                    fieldStarted = true;
                }
                case SEPARATOR -> {
                    fields.add(field.toString());
                    field.setLength(0);
                    fieldStarted = true;
                }
                case '\r' -> {
                    // CR is only meaningful as part of CRLF
                }
                case '\n' -> {
                    endRecord(records, fields, field, fieldStarted);
                    fields = new ArrayList<>();
                    field.setLength(0);
                    fieldStarted = false;
                }
                default -> {
                    field.append(c);
                    fieldStarted = true;
                }
            }
        }
        endRecord(records, fields, field, fieldStarted);
        return records;
    }

    private void endRecord(List<List<String>> records, List<String> fields, StringBuilder field, boolean fieldStarted) {
        if (!fieldStarted && fields.isEmpty()) {
            return;
        }
        fields.add(field.toString());
        if (fields.size() == 1 && fields.get(0).isBlank()) {
            return;
        }
        records.add(List.copyOf(fields));
    }

    /**
     * Parsed table. Data rows keep their original order and may be shorter or longer than the header.
     */
    record CsvTable(List<String> header, List<List<String>> rows) {

        boolean hasHeader() {
            return !header.isEmpty();
        }

        String cell(List<String> row, int columnIndex) {
            return columnIndex < row.size() ? row.get(columnIndex) : "";
        }
    }
}
