package com.company.powersense.upstream;

import com.company.powersense.config.PowerSenseProperties;
import com.company.powersense.domain.RawRecord;
import com.company.powersense.exception.HistoryArchiveException;
import com.company.powersense.exception.UpstreamConfigurationException;
import com.company.powersense.ingest.MetricNameRemapper;
import com.company.powersense.ingest.RecordNormalizer;
import com.company.powersense.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Reads the consolidated history archive used to seed an empty store.
 * <p>
 * The archive is a ZIP whose first {@code .xls}/{@code .xlsx} entry is, despite its extension,
 * tab-separated latin-1 text with French column labels.
 */
@Component
@Slf4j
public class HistoryArchiveReader {

    private static final String NATURE_LABEL = "Nature";

    private final RestClient restClient;
    private final PowerSenseProperties.History config;

    public HistoryArchiveReader(@Qualifier("historyRestClient") RestClient restClient,
                                PowerSenseProperties properties) {
        this.restClient = restClient;
        this.config = properties.getHistory();
    }

    public List<RawRecord> download(LocalDate today) {
        String url = config.getUrl();
        if (url == null || url.isBlank()) {
            throw new UpstreamConfigurationException("History archive URL is not configured (powersense.history.url)");
        }

        log.info("Downloading history archive from {}", url);
        byte[] archive = restClient.get().uri(url.trim()).retrieve().body(byte[].class);
        if (archive == null || archive.length == 0) {
            throw new HistoryArchiveException("History archive is empty: " + url);
        }
        return parse(archive, today);
    }

    /**
     * Rows without a nature are dropped, as are rows dated after {@code today - maxAge}.
     */
    public List<RawRecord> parse(byte[] archive, LocalDate today) {
        byte[] table = extractTable(archive);
        LocalDate lastDay = today.minusDays(Math.max(0, config.getMaxAge().toDays()));

        List<RawRecord> records = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                new ByteArrayInputStream(table), StandardCharsets.ISO_8859_1))) {

            String headerLine = reader.readLine();
            if (headerLine == null) {
                throw new HistoryArchiveException("History table has no header line");
            }
            String[] labels = headerLine.split("\t", -1);
            int natureColumn = indexOf(labels, NATURE_LABEL);
            if (natureColumn < 0) {
                throw new HistoryArchiveException("History table has no '" + NATURE_LABEL + "' column");
            }
            String[] columns = new String[labels.length];
            for (int i = 0; i < labels.length; i++) {
                columns[i] = MetricNameRemapper.remap(labels[i]);
            }

            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                String[] cells = line.split("\t", -1);
                if (cell(cells, natureColumn) == null) {
                    skipped++;
                    continue;
                }

                Map<String, Object> fields = new LinkedHashMap<>();
                for (int i = 0; i < columns.length; i++) {
                    fields.put(columns[i], cell(cells, i));
                }

                Optional<Instant> timestamp = addTimestamp(fields);
                if (timestamp.isEmpty()
                        || timestamp.get().atZone(ZoneOffset.UTC).toLocalDate().isAfter(lastDay)) {
                    skipped++;
                    continue;
                }
                records.add(RawRecord.of(fields));
            }
        } catch (IOException e) {
            throw new HistoryArchiveException("Cannot read history table", e);
        }

        log.info("History archive: {} rows kept, {} skipped (last day {})", records.size(), skipped, lastDay);
        return records;
    }

    private byte[] extractTable(byte[] archive) {
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                String name = entry.getName().toLowerCase(Locale.ROOT);
                if (!entry.isDirectory() && (name.endsWith(".xls") || name.endsWith(".xlsx"))) {
                    log.debug("Using history entry {}", entry.getName());
                    return zip.readAllBytes();
                }
            }
        } catch (IOException e) {
            throw new HistoryArchiveException("History archive is not a readable ZIP", e);
        }
        throw new HistoryArchiveException("No XLS/XLSX file found in history archive");
    }

    // date_heure built from date + heure, in UTC
    private static Optional<Instant> addTimestamp(Map<String, Object> fields) {
        Object date = fields.get(RecordNormalizer.FIELD_DATE);
        Object time = fields.get(RecordNormalizer.FIELD_TIME);
        if (date == null || time == null) {
            return Optional.empty();
        }
        Optional<Instant> timestamp = TimeUtils.combineDateAndTime(date.toString(), time.toString());
        timestamp.ifPresent(ts -> fields.put(RecordNormalizer.FIELD_TIMESTAMP, TimeUtils.toIsoSeconds(ts)));
        return timestamp;
    }

    private static int indexOf(String[] labels, String label) {
        for (int i = 0; i < labels.length; i++) {
            if (label.equals(labels[i].strip())) {
                return i;
            }
        }
        return -1;
    }

    private static String cell(String[] cells, int index) {
        if (index >= cells.length) {
            return null;
        }
        String value = cells[index].strip();
        return value.isEmpty() ? null : value;
    }
}
