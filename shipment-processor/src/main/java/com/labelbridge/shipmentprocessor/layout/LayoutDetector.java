package com.labelbridge.shipmentprocessor.layout;

import com.labelbridge.shipmentprocessor.domain.LayoutKind;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Classifies an input source into a {@link LayoutKind}.
 *
 * <p>The header signature wins over the file name:
 * <ol>
 *   <li>AGENCY: the header sits on the <em>second</em> row and has an {@code Area} or
 *       {@code N° Point serviti} column (the first row is a title banner).</li>
 *   <li>OLD: first-row header with a {@code Layout} column.</li>
 *   <li>NEW: first-row header with a {@code Location negozio} column.</li>
 *   <li>Otherwise the file name tokens {@code OLD}, {@code NEW}, {@code AGENZIE}/{@code AGENCY}.</li>
 * </ol>
 * No I/O happens here; callers pass the leading rows already tokenized.
 */
@Component
public class LayoutDetector {

    private static final Set<String> AGENCY_MARKERS = Set.of("area", "n° point serviti", "n. point serviti");
    private static final String OLD_MARKER = "layout";
    private static final String NEW_MARKER = "location negozio";

    private static final Set<String> AGENCY_TOKENS = Set.of("AGENZIE", "AGENZIA", "AGENCY", "AGENCIES");

    public Optional<LayoutDetection> detect(String fileName, List<List<String>> leadingRows) {
        Set<String> first = leadingRows.isEmpty() ? Set.of() : normalizedCells(leadingRows.get(0));
        Set<String> second = leadingRows.size() > 1 ? normalizedCells(leadingRows.get(1)) : Set.of();

        if (second.stream().anyMatch(AGENCY_MARKERS::contains)) {
            return Optional.of(new LayoutDetection(LayoutKind.AGENCY, 1, "header"));
        }
        if (first.contains(OLD_MARKER)) {
            return Optional.of(new LayoutDetection(LayoutKind.OLD, 0, "header"));
        }
        if (first.contains(NEW_MARKER)) {
            return Optional.of(new LayoutDetection(LayoutKind.NEW, 0, "header"));
        }
        if (first.stream().anyMatch(AGENCY_MARKERS::contains)) {
            return Optional.of(new LayoutDetection(LayoutKind.AGENCY, 0, "header"));
        }
        return detectFromFileName(fileName, first.size() <= 1 && leadingRows.size() > 1 ? 1 : 0);
    }

    private Optional<LayoutDetection> detectFromFileName(String fileName, int agencyHeaderRow) {
        if (fileName == null || fileName.isBlank()) {
            return Optional.empty();
        }
        Set<String> tokens = Arrays.stream(stem(fileName).split("[^\\p{L}\\p{N}]+"))
                .map(t -> t.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());

        if (tokens.stream().anyMatch(AGENCY_TOKENS::contains)) {
            return Optional.of(new LayoutDetection(LayoutKind.AGENCY, agencyHeaderRow, "filename"));
        }
        if (tokens.contains("OLD")) {
            return Optional.of(new LayoutDetection(LayoutKind.OLD, 0, "filename"));
        }
        if (tokens.contains("NEW")) {
            return Optional.of(new LayoutDetection(LayoutKind.NEW, 0, "filename"));
        }
        return Optional.empty();
    }

    public static String stem(String fileName) {
        String name = fileName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static Set<String> normalizedCells(List<String> row) {
        return row.stream()
                .map(LayoutColumns::normalizeHeader)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
    }
}
