package com.licensewatch.obits.reconcile.service;

import com.licensewatch.obits.reconcile.model.Candidate;
import com.licensewatch.obits.reconcile.model.LicenseFile;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class LicenseFileReader {
    private static final Logger log = LoggerFactory.getLogger(LicenseFileReader.class);

    public static final String FIRST_NAME = "First Name";
    public static final String LAST_NAME = "Last Name";

    public LicenseFile read(Path path) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .build();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            List<String> headers = new ArrayList<>(parser.getHeaderNames());
            List<Candidate> candidates = new ArrayList<>();
            int index = 0;
            for (CSVRecord record : parser) {
                Map<String, String> raw = new LinkedHashMap<>();
                for (String header : headers) {
                    raw.put(header, record.isSet(header) ? record.get(header) : "");
                }
                candidates.add(new Candidate(raw.get(FIRST_NAME), raw.get(LAST_NAME), raw, index));
                index++;
            }
            log.info("Read {} rows from {}", candidates.size(), path);
            return new LicenseFile(path.toString(), headers, candidates);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read license file " + path, e);
        }
    }
}
