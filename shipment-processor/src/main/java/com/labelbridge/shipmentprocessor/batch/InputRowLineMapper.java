package com.labelbridge.shipmentprocessor.batch;

import com.labelbridge.shipmentprocessor.domain.InputRow;
import com.labelbridge.shipmentprocessor.layout.LayoutColumns;
import com.labelbridge.shipmentprocessor.layout.LogicalField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.file.LineMapper;
import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;

import java.math.BigDecimal;

/**
 * Maps one physical line onto an {@link InputRow} through the run's resolved {@link LayoutColumns}.
 *
 * <p>A line mapper rather than a {@code FieldSetMapper} because the row keeps its physical line
 * number. Manual package count and weight given for the whole run fill in rows that lack their own.
 */
@Slf4j
public class InputRowLineMapper implements LineMapper<InputRow> {

    private final DelimitedLineTokenizer tokenizer;
    private final LayoutColumns columns;
    private final Integer manualPackageCount;
    private final BigDecimal manualWeightKg;

    public InputRowLineMapper(String delimiter, LayoutColumns columns,
                              Integer manualPackageCount, BigDecimal manualWeightKg) {
        this.tokenizer = InputSourceInspector.tokenizer(delimiter);
        this.columns = columns;
        this.manualPackageCount = manualPackageCount;
        this.manualWeightKg = manualWeightKg;
    }

    @Override
    public InputRow mapLine(String line, int lineNumber) {
        String[] cells = tokenizer.tokenize(line).getValues();

        Integer packageCount = parsePackageCount(columns.value(LogicalField.PACKAGE_COUNT, cells), lineNumber);
        BigDecimal weight = parseWeight(columns.value(LogicalField.WEIGHT, cells), lineNumber);

        return InputRow.builder()
                .lineNumber(lineNumber)
                .ordinal(columns.value(LogicalField.ORDINAL, cells))
                .recipientName(columns.value(LogicalField.RECIPIENT, cells))
                .address(columns.value(LogicalField.ADDRESS, cells))
                .city(columns.value(LogicalField.CITY, cells))
                .postalCode(columns.value(LogicalField.POSTAL_CODE, cells))
                .province(columns.value(LogicalField.PROVINCE, cells))
                .landlinePhone(columns.value(LogicalField.LANDLINE, cells))
                .mobilePhone(columns.value(LogicalField.MOBILE, cells))
                .email(columns.value(LogicalField.EMAIL, cells))
                .deliveryInstructions(columns.value(LogicalField.INSTRUCTIONS, cells))
                .reference(columns.value(LogicalField.REFERENCE, cells))
                .packageCount(packageCount != null ? packageCount : manualPackageCount)
                .weightKg(weight != null ? weight : manualWeightKg)
                .extras(columns.extras(cells))
                .build();
    }

    /** {@code "2"} and {@code "2.0"} are both two packages; anything else is treated as absent. */
    static Integer parsePackageCount(String raw, int lineNumber) {
        if (raw == null) {
            return null;
        }
        try {
            return new BigDecimal(raw.replace(',', '.')).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            log.debug("Line {}: unreadable package count '{}'", lineNumber, raw);
            return null;
        }
    }

    /** Accepts both {@code 2.5} and {@code 2,5}. */
    static BigDecimal parseWeight(String raw, int lineNumber) {
        if (raw == null) {
            return null;
        }
        try {
            return new BigDecimal(raw.replace(',', '.'));
        } catch (NumberFormatException e) {
            log.debug("Line {}: unreadable weight '{}'", lineNumber, raw);
            return null;
        }
    }
}
