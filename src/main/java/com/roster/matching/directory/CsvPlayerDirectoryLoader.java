package com.roster.matching.directory;

import com.roster.matching.core.model.PlayerRecord;
import com.roster.matching.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads an {@link InMemoryPlayerDirectory} from a CSV snapshot.
 *
 * <p>Expected format, header first:</p>
 * <pre>
 * player_id,first_name,last_name,club,series,league_id
 * nndz-WkMrK3didjlnUT09,Robert,Smith,Tennaqua,Tennaqua - 19,APTA_CHICAGO
 * "nndz-WlNhd3hMYi9nQT09","Mary Ann","O'Brien","Lake Forest","Lake Forest S2B",NSTF
 * </pre>
 *
 * <p>Fields may be double-quoted; a doubled quote inside a quoted field is a
 * literal quote. Rows with the wrong number of fields or no player id are
 * reported in {@link LoadResult#errors()} and skipped.</p>
 */
public class CsvPlayerDirectoryLoader {
    private static final Logger log = LoggerFactory.getLogger(CsvPlayerDirectoryLoader.class);
    private static final int FIELD_COUNT = 6;

    public LoadResult load(InputStream input) throws IOException {
        return load(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    /**
     * Reads the whole snapshot. I/O failures propagate to the caller.
     */
    public LoadResult load(Reader reader) throws IOException {
        List<PlayerRecord> players = new ArrayList<>();
        List<LoadResult.LoadError> errors = new ArrayList<>();
        long rowsRead = 0;

        try (LogContext ctx = LogContext.forSnapshotLoad("csv");
             BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String header = br.readLine();
            if (header == null) {
                return new LoadResult(new InMemoryPlayerDirectory(List.of()), 0, List.of());
            }

            String line;
            long lineNumber = 1;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                rowsRead++;

                List<String> fields = parseLine(line);
                if (fields.size() != FIELD_COUNT) {
                    errors.add(new LoadResult.LoadError(lineNumber, line,
                            "Expected " + FIELD_COUNT + " fields but found " + fields.size()));
                    log.warn("snapshot.row.skipped line={} reason=fieldCount count={}", lineNumber, fields.size());
                    continue;
                }
                if (fields.get(0).isBlank()) {
                    errors.add(new LoadResult.LoadError(lineNumber, line, "Missing player_id"));
                    log.warn("snapshot.row.skipped line={} reason=missingPlayerId", lineNumber);
                    continue;
                }

                players.add(new PlayerRecord(
                        fields.get(0).trim(),
                        fields.get(1).trim(),
                        fields.get(2).trim(),
                        fields.get(3).trim(),
                        fields.get(4).trim(),
                        fields.get(5).trim()));
            }
        }

        LoadResult result = new LoadResult(new InMemoryPlayerDirectory(players), rowsRead, errors);
        log.info("snapshot.loaded rows={} players={} errors={}", rowsRead, result.playersLoaded(), errors.size());
        return result;
    }

    /**
     * Splits one CSV line, honouring double-quoted fields.
     */
    List<String> parseLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
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
