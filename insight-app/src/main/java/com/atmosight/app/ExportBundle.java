package com.atmosight.app;

import com.atmosight.core.model.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Downloadable archive of one analysis: the historical values as CSV and
 * the full result as JSON.
 */
public class ExportBundle {

    private static final Logger LOG = LoggerFactory.getLogger(ExportBundle.class);

    public static final String CSV_ENTRY = "historical_data.csv";
    public static final String JSON_ENTRY = "analysis.json";

    private final HistoricalValuesCsv csv;
    private final AnalysisResultCodec codec;

    public ExportBundle(HistoricalValuesCsv csv, AnalysisResultCodec codec) {
        this.csv = Objects.requireNonNull(csv, "csv must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    /** Write the archive to {@code out}; the stream is finished but not closed. */
    public void write(AnalysisResult result, OutputStream out) throws IOException {
        Objects.requireNonNull(result, "result must not be null");
        ZipOutputStream zip = new ZipOutputStream(Objects.requireNonNull(out, "out must not be null"));
        putEntry(zip, CSV_ENTRY, csv.write(result).getBytes(StandardCharsets.UTF_8));
        putEntry(zip, JSON_ENTRY, codec.toBytes(result));
        zip.finish();
    }

    /**
     * Write the archive to {@code file}, creating parent directories.
     *
     * @return {@code file}
     */
    public Path write(AnalysisResult result, Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(file)) {
            write(result, out);
        }
        LOG.info("Wrote export bundle {}", file);
        return file;
    }

    /** @return a file name such as {@code faisalabad_temperature_07-15.zip} */
    public static String fileName(AnalysisResult result) {
        String location = result.getQuery().getLocationName().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_|_$", "");
        String day = result.getQuery().getTargetDay().format(AppConfig.TARGET_DAY_FORMAT);
        return location + "_" + result.getQuery().getVariable().name().toLowerCase(Locale.ROOT)
                + "_" + day + ".zip";
    }

    private static void putEntry(ZipOutputStream zip, String name, byte[] content) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content);
        zip.closeEntry();
    }
}
