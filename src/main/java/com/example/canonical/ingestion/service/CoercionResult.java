package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.FieldError;
import java.util.Optional;

/**
 * Outcome of typing one raw field. A rejected result carries the error and no value; an
 * accepted result may still carry a recovered notice (clamp, soft null) that must be audited.
 */
public record CoercionResult(Object value, boolean coerced, FieldError error, boolean rejected) {

    public static CoercionResult accepted(Object value) {
        return new CoercionResult(value, false, null, false);
    }

    public static CoercionResult coerced(Object value) {
        return new CoercionResult(value, true, null, false);
    }

    public static CoercionResult recovered(Object value, FieldError notice) {
        return new CoercionResult(value, true, notice, false);
    }

    public static CoercionResult rejected(FieldError error) {
        return new CoercionResult(null, false, error, true);
    }

    public Optional<FieldError> notice() {
        return rejected ? Optional.empty() : Optional.ofNullable(error);
    }
}
