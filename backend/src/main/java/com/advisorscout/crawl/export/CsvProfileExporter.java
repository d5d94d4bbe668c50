package com.advisorscout.crawl.export;

import com.advisorscout.crawl.model.AdvisorProfile;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Component
public class CsvProfileExporter implements ProfileExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvProfileExporter.class);

    @Override
    public void export(List<AdvisorProfile> profiles, Path output) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(AdvisorProfile.COLUMNS.toArray(String[]::new))
            .build();
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, format)) {
                for (AdvisorProfile profile : profiles) {
                    printer.printRecord(profile.toRow());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write profiles to " + output, e);
        }
        log.info("Wrote {} profiles to {}", profiles.size(), output);
    }
}
