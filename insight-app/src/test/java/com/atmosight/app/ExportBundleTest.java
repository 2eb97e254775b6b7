package com.atmosight.app;

import com.atmosight.core.model.AnalysisResult;
import com.atmosight.core.model.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ExportBundle}.
 */
class ExportBundleTest {

    private final AnalysisResultCodec codec = new AnalysisResultCodec();
    private final ExportBundle bundle = new ExportBundle(new HistoricalValuesCsv(), codec);

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should pack the CSV table and the JSON result")
    void shouldWriteBothEntries() throws IOException {
        AnalysisResult result = Fixtures.result(Variable.TEMPERATURE, 30, 31, 29, 32, 30.5);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        bundle.write(result, out);

        Map<String, String> entries = unzip(out.toByteArray());
        assertThat(entries).containsOnlyKeys(ExportBundle.CSV_ENTRY, ExportBundle.JSON_ENTRY);
        assertThat(entries.get(ExportBundle.CSV_ENTRY)).startsWith("year,value,observations,fitted");
        assertThat(codec.fromJson(entries.get(ExportBundle.JSON_ENTRY))).isEqualTo(result);
    }

    @Test
    @DisplayName("Should create missing directories when writing to a file")
    void shouldWriteToFile() throws IOException {
        AnalysisResult result = Fixtures.result(Variable.TEMPERATURE, 30, 31, 29, 32, 30.5);
        Path target = tempDir.resolve("nested/out").resolve(ExportBundle.fileName(result));

        Path written = bundle.write(result, target);

        assertThat(written).exists();
        assertThat(written.getFileName().toString()).isEqualTo("faisalabad_temperature_07-05.zip");
        assertThat(unzip(Files.readAllBytes(written))).hasSize(2);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Map<String, String> unzip(byte[] archive) throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                entries.put(entry.getName(), new String(zip.readAllBytes(), StandardCharsets.UTF_8));
            }
        }
        return entries;
    }
}
