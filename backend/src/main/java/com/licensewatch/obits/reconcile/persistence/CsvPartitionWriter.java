package com.licensewatch.obits.reconcile.persistence;

import com.licensewatch.obits.reconcile.model.PartitionedRow;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

public class CsvPartitionWriter implements PartitionSink {
    private final CSVPrinter keptPrinter;
    private final CSVPrinter removedPrinter;
    private final List<String> keptHeader;
    private final List<String> removedHeader;

    public CsvPartitionWriter(
        Path keptPath,
        List<String> keptHeader,
        Path removedPath,
        List<String> removedHeader,
        boolean append
    ) {
        this.keptHeader = List.copyOf(keptHeader);
        this.removedHeader = List.copyOf(removedHeader);
        this.keptPrinter = open(keptPath, this.keptHeader, append);
        CSVPrinter removed;
        try {
            removed = open(removedPath, this.removedHeader, append);
        } catch (UncheckedIOException e) {
            closeQuietly(keptPrinter, e);
            throw e;
        }
        this.removedPrinter = removed;
    }

    @Override
    public void writeKept(List<PartitionedRow> rows) {
        write(keptPrinter, keptHeader, rows);
    }

    @Override
    public void writeRemoved(List<PartitionedRow> rows) {
        write(removedPrinter, removedHeader, rows);
    }

    @Override
    public void close() throws IOException {
        try {
            keptPrinter.close(true);
        } finally {
            removedPrinter.close(true);
        }
    }

    private static void write(CSVPrinter printer, List<String> header, List<PartitionedRow> rows) {
        if (rows.isEmpty()) {
            return;
        }
        try {
            for (PartitionedRow row : rows) {
                List<String> values = new ArrayList<>(header.size());
                for (String column : header) {
                    String value = row.values().get(column);
                    values.add(value == null ? "" : value);
                }
                printer.printRecord(values);
            }
            printer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write output rows", e);
        }
    }

    private static CSVPrinter open(Path path, List<String> header, boolean append) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            boolean writeHeader = !append || !Files.exists(path) || Files.size(path) == 0;
            BufferedWriter writer = append
                ? Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)
                : Files.newBufferedWriter(
                    path,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE
                );
            CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT);
            if (writeHeader) {
                printer.printRecord(header);
                printer.flush();
            }
            return printer;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open output file " + path, e);
        }
    }

    private static void closeQuietly(CSVPrinter printer, Exception primary) {
        try {
            printer.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
