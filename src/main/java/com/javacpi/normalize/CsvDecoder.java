package com.javacpi.normalize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes {@code ConvertTo-Csv -NoTypeInformation} output: one header line, then rows of
 * double-quoted, comma-separated fields.
 */
public final class CsvDecoder {

    private static final Logger log = LoggerFactory.getLogger(CsvDecoder.class);

    private CsvDecoder() {}

    /**
     * Maps each data row's fields by position onto {@code columns}. The header line is
     * skipped, not interpreted; blank lines and rows shorter than {@code columns} are dropped.
     */
    public static List<Map<String, String>> decode(String text, List<String> columns) {
        var rows = new ArrayList<Map<String, String>>();
        var lines = text.lines().iterator();
        if (!lines.hasNext()) return rows;
        lines.next();
        while (lines.hasNext()) {
            var line = lines.next();
            if (line.isBlank()) continue;
            var fields = splitLine(line);
            if (fields.size() < columns.size()) {
                log.debug("Skipping CSV row with {} of {} fields: {}", fields.size(), columns.size(), line);
                continue;
            }
            var row = new LinkedHashMap<String, String>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), fields.get(i));
            }
            rows.add(row);
        }
        return rows;
    }

    static List<String> splitLine(String line) {
        var fields = new ArrayList<String>();
        var current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }
}
