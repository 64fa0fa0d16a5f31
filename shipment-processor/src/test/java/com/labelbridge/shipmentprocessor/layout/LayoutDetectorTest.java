package com.labelbridge.shipmentprocessor.layout;

import com.labelbridge.shipmentprocessor.domain.LayoutKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class LayoutDetectorTest {

    private static final List<String> OLD_HEADER = List.of(
            "", "Layout", "Ragione sociale negozio", "Indirizzo", "Località", "Cap", "Provincia", "Telefono", "Cellulare");
    private static final List<String> NEW_HEADER = List.of(
            "Progressivo", "Location negozio", "Ragione sociale", "Indirizzo", "Comune", "CAP", "Provincia", "Cellulare");
    private static final List<String> AGENCY_BANNER = List.of("ELENCO AGENZIE PRIMAVERA 2024", "", "", "");
    private static final List<String> AGENCY_HEADER = List.of(
            "", "Area", "N° Point serviti", "Ragione sociale", "Indirizzo", "Città", "CAP", "Prov", "Colli", "Peso");

    private final LayoutDetector detector = new LayoutDetector();

    @Test
    @DisplayName("OLD: first-row header with a Layout column")
    void detect_oldByHeader() {
        Optional<LayoutDetection> detection = detector.detect("export.csv", List.of(OLD_HEADER, List.of("1", "A")));

        assertThat(detection).contains(new LayoutDetection(LayoutKind.OLD, 0, "header"));
    }

    @Test
    @DisplayName("NEW: first-row header with a Location negozio column")
    void detect_newByHeader() {
        Optional<LayoutDetection> detection = detector.detect("export.csv", List.of(NEW_HEADER));

        assertThat(detection).contains(new LayoutDetection(LayoutKind.NEW, 0, "header"));
    }

    @Test
    @DisplayName("AGENCY: header on the second row under a title banner")
    void detect_agencyOnSecondRow() {
        Optional<LayoutDetection> detection = detector.detect("lista.csv", List.of(AGENCY_BANNER, AGENCY_HEADER));

        assertThat(detection).contains(new LayoutDetection(LayoutKind.AGENCY, 1, "header"));
    }

    @Test
    @DisplayName("Header signature wins over a misleading file name")
    void detect_headerBeatsFileName() {
        Optional<LayoutDetection> detection = detector.detect("Spedizioni_OLD_marzo.csv", List.of(NEW_HEADER));

        assertThat(detection.map(LayoutDetection::kind)).contains(LayoutKind.NEW);
    }

    @Test
    void detect_fallsBackToFileName() {
        List<List<String>> rows = List.of(List.of("Ragione sociale", "Indirizzo", "Comune", "CAP"));

        assertThat(detector.detect("/data/Spedizioni_NEW_aprile.csv", rows))
                .contains(new LayoutDetection(LayoutKind.NEW, 0, "filename"));
        assertThat(detector.detect("punti-OLD.csv", rows).map(LayoutDetection::kind)).contains(LayoutKind.OLD);
        assertThat(detector.detect("Agenzie 2024.csv", rows).map(LayoutDetection::kind)).contains(LayoutKind.AGENCY);
    }

    @Test
    @DisplayName("File-name tokens must be whole words")
    void detect_fileNameTokensAreWholeWords() {
        List<List<String>> rows = List.of(List.of("Ragione sociale", "Indirizzo"));

        assertThat(detector.detect("GOLDEN_list.csv", rows)).isEmpty();
        assertThat(detector.detect("NEWSLETTER.csv", rows)).isEmpty();
    }

    @Test
    void detect_unknown() {
        assertThat(detector.detect("clienti.csv", List.of(List.of("Nome", "Via", "Città")))).isEmpty();
        assertThat(detector.detect(null, List.of())).isEmpty();
    }

    @Test
    void stem_dropsDirectoryAndExtension() {
        assertThat(LayoutDetector.stem("/tmp/in/Spedizioni_NEW.csv")).isEqualTo("Spedizioni_NEW");
        assertThat(LayoutDetector.stem("C:\\export\\agenzie.2024.csv")).isEqualTo("agenzie.2024");
        assertThat(LayoutDetector.stem("noext")).isEqualTo("noext");
    }
}
