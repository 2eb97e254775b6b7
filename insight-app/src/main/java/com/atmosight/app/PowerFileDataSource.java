package com.atmosight.app;

import com.atmosight.core.model.RawRecord;
import com.atmosight.core.source.ClimateDataSource;
import com.atmosight.core.source.SeriesKey;
import com.atmosight.core.source.SeriesResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * {@link ClimateDataSource} backed by a POWER response saved on disk.
 *
 * <p>
 * Records dated outside the key's year range are dropped. Records whose
 * year cannot be read are kept so the normalizer reports them.
 * </p>
 */
public class PowerFileDataSource implements ClimateDataSource {

    private static final Logger LOG = LoggerFactory.getLogger(PowerFileDataSource.class);

    private final Path file;
    private final PowerResponseReader reader;

    public PowerFileDataSource(Path file, PowerResponseReader reader) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
    }

    @Override
    public SeriesResponse fetch(SeriesKey key) throws IOException {
        Objects.requireNonNull(key, "key must not be null");
        if (!Files.isRegularFile(file)) {
            throw new IOException("POWER response file not found: " + file.toAbsolutePath());
        }

        SeriesResponse response;
        try (InputStream in = Files.newInputStream(file)) {
            response = reader.read(in, key.getVariable());
        }

        List<RawRecord> inRange = response.getRecords().stream()
                .filter(r -> withinYears(r.getRawDate(), key))
                .toList();
        if (inRange.size() < response.getRecords().size()) {
            LOG.info("Dropped {} record(s) outside {}..{} from {}",
                    response.getRecords().size() - inRange.size(), key.getStartYear(), key.getEndYear(), file);
        }
        return new SeriesResponse(inRange, response.getMissingSentinel());
    }

    private static boolean withinYears(String rawDate, SeriesKey key) {
        if (rawDate == null || rawDate.length() < 4) {
            return true;
        }
        String prefix = rawDate.substring(0, 4);
        if (!prefix.chars().allMatch(Character::isDigit)) {
            return true;
        }
        int year = Integer.parseInt(prefix);
        return year >= key.getStartYear() && year <= key.getEndYear();
    }

    @Override
    public String toString() {
        return "PowerFileDataSource{file=" + file + '}';
    }
}
