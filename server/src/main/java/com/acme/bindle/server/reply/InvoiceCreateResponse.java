package com.acme.bindle.server.reply;

import com.acme.bindle.server.model.Invoice;
import com.acme.bindle.server.model.Label;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Reply to invoice creation. Invoices may be accepted before their parcels are uploaded;
 * {@code missing} lists the referenced parcels the server does not have yet.
 *
 * <p>An absent and an empty {@code missing} both mean the invoice is fully satisfied.
 * The absent form is the one written.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = false)
public record InvoiceCreateResponse(
    Invoice invoice,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) List<Label> missing
) {
    public InvoiceCreateResponse {
        Objects.requireNonNull(invoice, "invoice");
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public static InvoiceCreateResponse satisfied(Invoice invoice) {
        return new InvoiceCreateResponse(invoice, List.of());
    }

    public boolean allParcelsPresent() {
        return missing.isEmpty();
    }
}
