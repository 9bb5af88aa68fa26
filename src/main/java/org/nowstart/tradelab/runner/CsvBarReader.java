package org.nowstart.tradelab.runner;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.nowstart.tradelab.data.dto.Bar;
import org.nowstart.tradelab.data.exception.ErrorCode;
import org.nowstart.tradelab.data.exception.TradingException;
import org.springframework.stereotype.Component;

/**
 * Reads daily bars from a CSV file with the header {@value #CSV_HEADER}.
 *
 * <p>Rows are returned in ascending date order; a later row for an already seen date replaces the earlier
 * one. The {@code amount} column may be omitted and then reads as 0.
 */
@Component
public class CsvBarReader {

    static final String CSV_HEADER = "date,open,high,low,close,volume,amount";
    private static final int MIN_COLUMNS = 6;

    public List<Bar> read(Path path) {
        try {
            List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            if (lines.size() < 2) {
                throw new TradingException(ErrorCode.EMPTY_DATA, "CSV has no rows: " + path);
            }

            Map<LocalDate, Bar> byDate = new TreeMap<>();
            for (int i = 1; i < lines.size(); i++) {
                String line = lines.get(i).trim();
                if (line.isEmpty()) {
                    continue;
                }
                String[] parts = line.split(",", -1);
                if (parts.length < MIN_COLUMNS) {
                    continue;
                }
                Bar bar = parse(parts, path, i + 1);
                byDate.put(bar.date(), bar);
            }

            if (byDate.isEmpty()) {
                throw new TradingException(ErrorCode.EMPTY_DATA, "CSV has no rows: " + path);
            }
            return new ArrayList<>(byDate.values());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load CSV: " + path, e);
        }
    }

    private Bar parse(String[] parts, Path path, int lineNumber) {
        try {
            return new Bar(
                    LocalDate.parse(parts[0].trim()),
                    parseDouble(parts[1]),
                    parseDouble(parts[2]),
                    parseDouble(parts[3]),
                    parseDouble(parts[4]),
                    parseDouble(parts[5]),
                    parts.length > MIN_COLUMNS ? parseDouble(parts[6]) : 0.0
            );
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new TradingException(ErrorCode.INVALID_DATA, "Malformed CSV row at " + path + ":" + lineNumber + " (" + e.getMessage() + ")");
        }
    }

    private double parseDouble(String raw) {
        String value = raw.trim();
        return value.isEmpty() ? 0.0 : Double.parseDouble(value);
    }
}
