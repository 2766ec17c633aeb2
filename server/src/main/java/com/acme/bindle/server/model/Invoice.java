package com.acme.bindle.server.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Bindle metadata plus the parcels it references. Validation belongs to the invoice service.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Invoice(
    String bindleVersion,
    boolean yanked,
    BindleSpec bindle,
    Map<String, String> annotations,
    List<Parcel> parcel
) {
    public Invoice {
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
        parcel = parcel == null ? List.of() : List.copyOf(parcel);
    }

    public Invoice(String bindleVersion, BindleSpec bindle, List<Parcel> parcel) {
        this(bindleVersion, false, bindle, Map.of(), parcel);
    }
}
