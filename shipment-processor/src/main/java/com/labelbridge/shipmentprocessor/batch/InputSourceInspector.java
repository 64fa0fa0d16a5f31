package com.labelbridge.shipmentprocessor.batch;

import com.labelbridge.shipmentprocessor.config.ShipmentProperties;
import com.labelbridge.shipmentprocessor.layout.LayoutColumns;
import com.labelbridge.shipmentprocessor.layout.LayoutDetection;
import com.labelbridge.shipmentprocessor.layout.LayoutDetector;
import com.labelbridge.shipmentprocessor.layout.UnrecognizedLayoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.file.FlatFileParseException;
import org.springframework.batch.item.file.separator.DefaultRecordSeparatorPolicy;
import org.springframework.batch.item.file.separator.RecordSeparatorPolicy;
import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the leading rows of an input file, detects its layout, resolves its columns and counts
 * its data lines. Runs once per job, before the preparation step is partitioned.
 *
 * <p>Partitions are physical line ranges, so every record must fit on one line: a file with a
 * quoted cell spanning several lines is refused with a {@link FlatFileParseException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InputSourceInspector {

    private static final int LEADING_ROWS = 2;

    private final ResourceLoader resourceLoader;
    private final LayoutDetector layoutDetector;
    private final ShipmentProperties properties;

    public InputSource inspect(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalArgumentException("Input file not found: " + location);
        }

        List<String> leadingLines = new ArrayList<>(LEADING_ROWS);
        int totalLines = 0;
        RecordSeparatorPolicy recordSeparator = new DefaultRecordSeparatorPolicy();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                totalLines++;
                if (totalLines <= LEADING_ROWS) {
                    leadingLines.add(line);
                }
                if (!recordSeparator.isEndOfRecord(line)) {
                    throw new FlatFileParseException("Line " + totalLines + " of '" + location
                            + "' continues on the next line (quoted cell with a line break or trailing '\\');"
                            + " remove line breaks from the cells and export again", line, totalLines);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read input file " + location, e);
        }

        DelimitedLineTokenizer tokenizer = tokenizer(properties.getInput().getDelimiter());
        List<List<String>> leadingRows = leadingLines.stream()
                .map(line -> Arrays.asList(tokenizer.tokenize(line).getValues()))
                .toList();

        String fileName = resource.getFilename() != null ? resource.getFilename() : location;
        LayoutDetection detection = layoutDetector.detect(fileName, leadingRows)
                .orElseThrow(() -> new UnrecognizedLayoutException(
                        "Cannot recognize the layout of '" + fileName + "' from its header or file name"));
        if (detection.headerRowIndex() >= leadingRows.size()) {
            throw new UnrecognizedLayoutException("'" + fileName + "' has no header row");
        }

        LayoutColumns columns = LayoutColumns.resolve(detection.kind(), leadingRows.get(detection.headerRowIndex()));
        int firstDataLine = detection.headerRowIndex() + 2;
        int dataLines = Math.max(0, totalLines - firstDataLine + 1);

        InputSource source = new InputSource(location, LayoutDetector.stem(fileName), detection, columns,
                firstDataLine, dataLines);
        log.info("Input '{}': layout={} (by {}), {} data lines from line {}",
                fileName, detection.kind(), detection.matchedBy(), dataLines, firstDataLine);
        return source;
    }

    static DelimitedLineTokenizer tokenizer(String delimiter) {
        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer(delimiter);
        tokenizer.setStrict(false);
        return tokenizer;
    }
}
