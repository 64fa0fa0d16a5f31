package com.labelbridge.shipmentprocessor.layout;

import com.labelbridge.shipmentprocessor.domain.LayoutKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the columns of one header row onto {@link LogicalField}s for a given layout.
 *
 * <p>Each field has a list of accepted header names per layout. A header matches exactly
 * (case-insensitive, whitespace collapsed) first; failing that, the first unused header that
 * contains the name is taken. The ordinal of OLD and AGENCY exports lives in the first,
 * unnamed column.
 */
public final class LayoutColumns {

    private static final Set<LogicalField> REQUIRED =
            Set.of(LogicalField.RECIPIENT, LogicalField.ADDRESS, LogicalField.CITY, LogicalField.POSTAL_CODE);

    private static final Map<LayoutKind, Map<LogicalField, List<String>>> NAMES = new EnumMap<>(LayoutKind.class);

    static {
        Map<LogicalField, List<String>> old = new LinkedHashMap<>();
        old.put(LogicalField.RECIPIENT, List.of("Ragione sociale negozio", "Ragione sociale"));
        old.put(LogicalField.ADDRESS, List.of("Indirizzo"));
        old.put(LogicalField.CITY, List.of("Località", "Localita", "Comune"));
        old.put(LogicalField.POSTAL_CODE, List.of("Cap"));
        old.put(LogicalField.PROVINCE, List.of("Provincia", "Prov"));
        old.put(LogicalField.ORDINAL, List.of("Progressivo"));
        old.put(LogicalField.MOBILE, List.of("Cellulare"));
        old.put(LogicalField.LANDLINE, List.of("Telefono"));
        old.put(LogicalField.EMAIL, List.of("E-Mail", "Email"));
        old.put(LogicalField.INSTRUCTIONS, List.of("Centro comm.le / Indicazioni", "Indicazioni"));
        old.put(LogicalField.REFERENCE, List.of("Bda", "Riferimento"));
        NAMES.put(LayoutKind.OLD, old);

        Map<LogicalField, List<String>> neu = new LinkedHashMap<>();
        neu.put(LogicalField.RECIPIENT, List.of("Ragione sociale"));
        neu.put(LogicalField.ADDRESS, List.of("Indirizzo"));
        neu.put(LogicalField.CITY, List.of("Comune", "Località"));
        neu.put(LogicalField.POSTAL_CODE, List.of("CAP"));
        neu.put(LogicalField.PROVINCE, List.of("Provincia", "Prov"));
        neu.put(LogicalField.ORDINAL, List.of("Progressivo"));
        neu.put(LogicalField.MOBILE, List.of("Cellulare"));
        neu.put(LogicalField.LANDLINE, List.of("Telefono"));
        neu.put(LogicalField.EMAIL, List.of("Mail PEC", "E-Mail", "Email"));
        neu.put(LogicalField.INSTRUCTIONS, List.of("Presso CC", "Indicazioni"));
        neu.put(LogicalField.REFERENCE, List.of("Bda", "Riferimento"));
        NAMES.put(LayoutKind.NEW, neu);

        Map<LogicalField, List<String>> agency = new LinkedHashMap<>();
        agency.put(LogicalField.RECIPIENT, List.of("Ragione sociale"));
        agency.put(LogicalField.ADDRESS, List.of("Indirizzo"));
        agency.put(LogicalField.CITY, List.of("Città", "Citta", "Comune"));
        agency.put(LogicalField.POSTAL_CODE, List.of("CAP"));
        agency.put(LogicalField.PROVINCE, List.of("Provincia", "Prov"));
        agency.put(LogicalField.ORDINAL, List.of("Progressivo"));
        agency.put(LogicalField.MOBILE, List.of("Cellulare"));
        agency.put(LogicalField.EMAIL, List.of("E-mail", "Email"));
        agency.put(LogicalField.INSTRUCTIONS, List.of("Note x consegne", "Note"));
        agency.put(LogicalField.REFERENCE, List.of("Bda", "Riferimento"));
        agency.put(LogicalField.PACKAGE_COUNT, List.of("Colli", "N. colli"));
        agency.put(LogicalField.WEIGHT, List.of("Peso", "Peso kg"));
        NAMES.put(LayoutKind.AGENCY, agency);
    }

    private final LayoutKind kind;
    private final List<String> header;
    private final Map<LogicalField, Integer> indexes;

    private LayoutColumns(LayoutKind kind, List<String> header, Map<LogicalField, Integer> indexes) {
        this.kind = kind;
        this.header = List.copyOf(header);
        this.indexes = Collections.unmodifiableMap(indexes);
    }

    /**
     * @throws UnrecognizedLayoutException when a column required by every layout is missing
     */
    public static LayoutColumns resolve(LayoutKind kind, List<String> header) {
        List<String> normalized = header.stream().map(LayoutColumns::normalizeHeader).toList();
        Map<LogicalField, Integer> indexes = new EnumMap<>(LogicalField.class);
        Set<Integer> used = new HashSet<>();

        // exact matches first so that a partial match never steals a column named precisely
        NAMES.get(kind).forEach((field, names) -> {
            for (String name : names) {
                int idx = normalized.indexOf(normalizeHeader(name));
                if (idx >= 0 && !used.contains(idx)) {
                    indexes.put(field, idx);
                    used.add(idx);
                    return;
                }
            }
        });
        NAMES.get(kind).forEach((field, names) -> {
            if (indexes.containsKey(field)) {
                return;
            }
            for (String name : names) {
                String wanted = normalizeHeader(name);
                for (int i = 0; i < normalized.size(); i++) {
                    if (!used.contains(i) && !normalized.get(i).isEmpty() && normalized.get(i).contains(wanted)) {
                        indexes.put(field, i);
                        used.add(i);
                        return;
                    }
                }
            }
        });

        if (!indexes.containsKey(LogicalField.ORDINAL) && kind != LayoutKind.NEW
                && !normalized.isEmpty() && normalized.get(0).isEmpty() && !used.contains(0)) {
            indexes.put(LogicalField.ORDINAL, 0);
        }

        List<LogicalField> missing = new ArrayList<>();
        for (LogicalField field : LogicalField.values()) {
            if (REQUIRED.contains(field) && !indexes.containsKey(field)) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new UnrecognizedLayoutException(
                    "Layout " + kind + " header is missing required columns " + missing + ": " + header);
        }
        return new LayoutColumns(kind, header, indexes);
    }

    public LayoutKind kind() {
        return kind;
    }

    public boolean has(LogicalField field) {
        return indexes.containsKey(field);
    }

    /** Trimmed cell value for {@code field}, or {@code null} when unmapped, absent or blank. */
    public String value(LogicalField field, String[] cells) {
        Integer idx = indexes.get(field);
        if (idx == null || idx >= cells.length) {
            return null;
        }
        return clean(cells[idx]);
    }

    /** Non-blank cells of columns that are not mapped to a logical field. */
    public Map<String, String> extras(String[] cells) {
        Map<String, String> extras = new LinkedHashMap<>();
        for (int i = 0; i < cells.length && i < header.size(); i++) {
            if (!indexes.containsValue(i)) {
                String value = clean(cells[i]);
                String name = header.get(i) == null || header.get(i).isBlank() ? "column" + i : header.get(i).trim();
                if (value != null) {
                    extras.put(name, value);
                }
            }
        }
        return extras;
    }

    public static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        return header.replace("\uFEFF", "").trim().replaceAll("\\s+", " ").toLowerCase(Locale.ITALIAN);
    }

    private static String clean(String cell) {
        if (cell == null) {
            return null;
        }
        String trimmed = cell.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
