package com.labelbridge.shipmentprocessor.batch;

import com.labelbridge.shipmentprocessor.domain.InputRow;
import com.labelbridge.shipmentprocessor.domain.LayoutKind;
import com.labelbridge.shipmentprocessor.layout.LayoutColumns;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InputRowLineMapperTest {

    private static final LayoutColumns NEW_COLUMNS = LayoutColumns.resolve(LayoutKind.NEW, List.of(
            "Progressivo", "Location negozio", "Ragione sociale", "Indirizzo", "Comune", "CAP", "Provincia",
            "Cellulare", "Presso CC"));

    private static final LayoutColumns AGENCY_COLUMNS = LayoutColumns.resolve(LayoutKind.AGENCY, List.of(
            "", "Area", "Ragione sociale", "Indirizzo", "Città", "CAP", "Prov", "Colli", "Peso"));

    @Test
    @DisplayName("Quoted cells keep their commas; the physical line number is kept")
    void mapLine_newLayout() {
        InputRowLineMapper mapper = new InputRowLineMapper(",", NEW_COLUMNS, null, null);

        InputRow row = mapper.mapLine(
                "12,Milano Centro,\"Bar Sport, di Rossi\",Via Roma 1,Milano,20121,MI,333 1234567,\"CC Portello, piano 1\"", 14);

        assertThat(row.getLineNumber()).isEqualTo(14);
        assertThat(row.getOrdinal()).isEqualTo("12");
        assertThat(row.getRecipientName()).isEqualTo("Bar Sport, di Rossi");
        assertThat(row.getAddress()).isEqualTo("Via Roma 1");
        assertThat(row.getPostalCode()).isEqualTo("20121");
        assertThat(row.getMobilePhone()).isEqualTo("333 1234567");
        assertThat(row.getDeliveryInstructions()).isEqualTo("CC Portello, piano 1");
        assertThat(row.getExtras()).containsEntry("Location negozio", "Milano Centro");
    }

    @Test
    void mapLine_shortLineLeavesMissingCellsNull() {
        InputRow row = new InputRowLineMapper(",", NEW_COLUMNS, null, null).mapLine("1,,Bar,Via Roma 1", 2);

        assertThat(row.getCity()).isNull();
        assertThat(row.getPostalCode()).isNull();
    }

    @Test
    @DisplayName("AGENCY: row values win over run-wide manual values, which fill the gaps")
    void mapLine_agencyManualFallback() {
        InputRowLineMapper mapper = new InputRowLineMapper(",", AGENCY_COLUMNS, 3, new BigDecimal("7.5"));

        InputRow own = mapper.mapLine("4,Nord,Agenzia Uno,Via Po 2,Torino,10121,TO,2,\"4,5\"", 3);
        InputRow blank = mapper.mapLine("5,Nord,Agenzia Due,Via Po 4,Torino,10121,TO,,", 4);

        assertThat(own.getOrdinal()).isEqualTo("4");
        assertThat(own.getPackageCount()).isEqualTo(2);
        assertThat(own.getWeightKg()).isEqualByComparingTo("4.5");
        assertThat(blank.getPackageCount()).isEqualTo(3);
        assertThat(blank.getWeightKg()).isEqualByComparingTo("7.5");
    }

    @Test
    void parsePackageCount() {
        assertThat(InputRowLineMapper.parsePackageCount("2", 1)).isEqualTo(2);
        assertThat(InputRowLineMapper.parsePackageCount("2.0", 1)).isEqualTo(2);
        assertThat(InputRowLineMapper.parsePackageCount("2,5", 1)).isNull();
        assertThat(InputRowLineMapper.parsePackageCount("due", 1)).isNull();
        assertThat(InputRowLineMapper.parsePackageCount(null, 1)).isNull();
    }

    @Test
    void parseWeight() {
        assertThat(InputRowLineMapper.parseWeight("2,5", 1)).isEqualByComparingTo("2.5");
        assertThat(InputRowLineMapper.parseWeight("kg", 1)).isNull();
    }
}
