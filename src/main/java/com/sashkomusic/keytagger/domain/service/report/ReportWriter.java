package com.sashkomusic.keytagger.domain.service.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sashkomusic.keytagger.domain.model.ReportFormat;
import com.sashkomusic.keytagger.domain.model.TrackResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

@Slf4j
@Service
public class ReportWriter {

    private static final String REPORT_PREFIX = "music_analysis_";
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectWriter jsonWriter;
    private final ObjectWriter csvWriter;
    private final Clock clock;

    public ReportWriter(Clock clock) {
        this.clock = clock;

        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.jsonWriter = objectMapper.writerFor(ReportRow[].class);

        CsvMapper csvMapper = new CsvMapper();
        csvMapper.registerModule(new JavaTimeModule());
        csvMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        CsvSchema schema = csvMapper.schemaFor(ReportRow.class).withHeader();
        this.csvWriter = csvMapper.writer(schema);
    }

    public Path write(Path folder, List<TrackResult> results, ReportFormat format) {
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
        Path reportFile = folder.resolve(REPORT_PREFIX + timestamp + "." + format.getExtension());
        Path tempFile = folder.resolve(reportFile.getFileName() + ".tmp");

        ReportRow[] rows = results.stream().map(ReportRow::from).toArray(ReportRow[]::new);

        try {
            switch (format) {
                case CSV -> csvWriter.writeValue(tempFile.toFile(), rows);
                case JSON -> jsonWriter.writeValue(tempFile.toFile(), rows);
            }

            Files.move(tempFile, reportFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

            log.info("Results saved to: {}", reportFile);
            return reportFile;

        } catch (IOException e) {
            log.error("Failed to write report: {}", reportFile, e);
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupError) {
                log.warn("Failed to cleanup temp file: {}", tempFile, cleanupError);
            }

            throw new ReportWriteException("Failed to write analysis report " + reportFile, e);
        }
    }

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
