package com.labelbridge.shipmentprocessor.domain;

import lombok.Getter;

/**
 * Every way a row can fail before or during upload, with the operator hint shown in the
 * rejected-rows report.
 */
@Getter
public enum FailureKind {

    INVALID_ZIP(FailureCategory.DATA_QUALITY, "Verificare CAP: servono 5 cifre"),
    INVALID_PROVINCE(FailureCategory.DATA_QUALITY, "Verificare sigla provincia (2 lettere)"),
    LOCALITY_MISMATCH(FailureCategory.DATA_QUALITY, "Verificare comune corretto"),
    NOT_FOUND(FailureCategory.DATA_QUALITY, "Verifica ortografia indirizzo"),
    AMBIGUOUS(FailureCategory.DATA_QUALITY, "Indirizzo ambiguo, specificare via e civico"),
    NO_ROUTE(FailureCategory.DATA_QUALITY, "Indirizzo generico, manca via/civico"),
    GENERIC_RURAL_ADDRESS(FailureCategory.DATA_QUALITY, "Verificare indirizzo catastale"),
    STATE_ROAD_WITHOUT_NUMBER(FailureCategory.DATA_QUALITY,
            "Cercare via del centro commerciale o riferimento più specifico"),
    MISSING_HOUSE_NUMBER(FailureCategory.DATA_QUALITY, "Aggiungere numero civico se possibile"),
    MISSING_MANUAL_FIELD(FailureCategory.DATA_QUALITY, "Indicare numero colli e peso"),
    MISSING_RECIPIENT(FailureCategory.DATA_QUALITY, "Indicare ragione sociale destinatario"),
    NO_PHONE(FailureCategory.DATA_QUALITY, "Indicare un numero di telefono"),
    DUPLICATE_REFERENCE(FailureCategory.DATA_QUALITY, "Riferimento Bda ripetuto nel file"),
    PROVIDER_REJECTED(FailureCategory.DATA_QUALITY, "API key non valida o richiesta non valida"),
    PROVIDER_UNAVAILABLE(FailureCategory.PROVIDER_UNAVAILABLE, "Servizio non raggiungibile, riprovare più tardi"),
    CARRIER_REJECTED(FailureCategory.CARRIER_BUSINESS, "Correggere i dati e ricaricare la spedizione");

    private final FailureCategory category;
    private final String suggestion;

    FailureKind(FailureCategory category, String suggestion) {
        this.category = category;
        this.suggestion = suggestion;
    }

    public boolean isTransient() {
        return category == FailureCategory.PROVIDER_UNAVAILABLE;
    }
}
