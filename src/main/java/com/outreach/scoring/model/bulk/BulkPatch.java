package com.outreach.scoring.model.bulk;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A bulk patch that passed validation: safe identifiers and whitelisted, type-checked fields.
 */
@Value
public class BulkPatch {

    List<String> identifiers;

    Map<PatchField, Object> fields;
}
