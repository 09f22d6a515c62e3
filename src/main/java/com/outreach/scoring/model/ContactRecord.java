package com.outreach.scoring.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single contact to be scored. Read-only input; the engine never mutates it.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Contact record with its identifier and derived attributes")
public class ContactRecord {

    @Schema(description = "Email address, used as identifier", example = "sales@idraulica-rossi.it")
    String email;

    @Schema(description = "Company website domain; defaults to the email domain", example = "idraulica-rossi.it")
    String domain;

    @Schema(description = "Company name", example = "Idraulica Rossi Hydraulic Pump Srl")
    String companyName;

    @Schema(description = "Country of the company", example = "Italy")
    String country;

    @Schema(description = "Region of the company, if known", example = "Central Europe")
    String region;

    @Schema(description = "Free-text company description")
    String description;

    @Schema(description = "Page the address was found on (contact, about, product ...)", example = "contact")
    String source;

    @Schema(description = "Domain age in days, if known", example = "3650")
    Integer domainAgeDays;
}
