package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.ErrorKind;
import com.example.canonical.ingestion.model.FieldError;
import com.example.canonical.ingestion.schema.ColumnSpec;
import com.example.canonical.ingestion.schema.ColumnType;
import com.example.canonical.ingestion.schema.NumericRange;
import com.example.canonical.ingestion.schema.ReferenceData;
import com.example.canonical.ingestion.support.NameNormalizer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Types one raw token against its column spec. Steps run in a fixed order: null tokens,
 * numeric clean-up, type conversion, range clamping, categorical matching. Expected failures
 * come back as rejected results, never as exceptions.
 */
@Slf4j
public class ValueCoercer {

    private static final Set<String> TRUE_TOKENS = Set.of("true", "yes", "1", "t", "y");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "no", "0", "f", "n");
    private static final Pattern PLAIN_INTEGER = Pattern.compile("[+-]?\\d+");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private final ReferenceData reference;
    private final NameNormalizer normalizer;

    public ValueCoercer(ReferenceData reference, NameNormalizer normalizer) {
        this.reference = reference;
        this.normalizer = normalizer;
    }

    public CoercionResult parse(String raw, ColumnSpec spec) {
        if (reference.isNullToken(raw)) {
            if (spec.nullable()) {
                return CoercionResult.accepted(null);
            }
            return CoercionResult.rejected(error(ErrorKind.REQUIRED_VALUE_MISSING, spec, raw,
                    "Non-nullable column %s has null value".formatted(spec.name())));
        }

        String token = raw.strip();
        return switch (spec.type()) {
            case STRING -> spec.isCategorical() ? enforceCategory(token, raw, spec) : CoercionResult.accepted(token);
            case INTEGER, FLOAT -> parseNumeric(token, raw, spec);
            case BOOLEAN -> parseBoolean(token, raw, spec);
        };
    }

    /**
     * Canonical spelling of a player name, present only when it differs from the value by more
     * than letter case.
     */
    public Optional<String> normalizePlayerName(String name, String position) {
        if (normalizer == null || name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalizer.normalizePlayerName(name, position);
        if (normalized.isEmpty() || normalized.equalsIgnoreCase(name.strip())) {
            return Optional.empty();
        }
        return Optional.of(normalized);
    }

    /**
     * Unregistered columns keep their token, trimmed.
     */
    public static String passthrough(String raw) {
        return raw == null ? null : raw.strip();
    }

    private CoercionResult parseNumeric(String token, String raw, ColumnSpec spec) {
        boolean percent = token.endsWith("%");
        String cleaned = token.replace(",", "").replace("$", "").replace("%", "").strip();

        BigDecimal number;
        try {
            number = new BigDecimal(cleaned);
        } catch (NumberFormatException ex) {
            return CoercionResult.rejected(error(ErrorKind.TYPE_COERCION_FAILURE, spec, raw,
                    "Cannot parse %s=%s as %s".formatted(spec.name(), raw, typeName(spec.type()))));
        }

        boolean coerced = false;
        if (percent) {
            number = number.divide(HUNDRED);
            coerced = true;
        }

        if (spec.type() == ColumnType.INTEGER) {
            if (percent || !PLAIN_INTEGER.matcher(cleaned).matches()) {
                coerced = true;
            }
            if (number.compareTo(LONG_MIN) < 0 || number.compareTo(LONG_MAX) > 0) {
                return CoercionResult.rejected(error(ErrorKind.TYPE_COERCION_FAILURE, spec, raw,
                        "Value %s for %s does not fit an integer".formatted(raw, spec.name())));
            }
            long value = number.abs().compareTo(BigDecimal.ONE) < 0
                    ? 0L
                    : number.setScale(0, RoundingMode.DOWN).longValue();
            return clampInteger(value, raw, spec, coerced);
        }

        double value = number.doubleValue();
        if (Double.isInfinite(value)) {
            return CoercionResult.rejected(error(ErrorKind.TYPE_COERCION_FAILURE, spec, raw,
                    "Value %s for %s is out of floating point range".formatted(raw, spec.name())));
        }
        return clampDecimal(value, raw, spec, coerced);
    }

    private CoercionResult clampInteger(long value, String raw, ColumnSpec spec, boolean coerced) {
        NumericRange range = spec.range();
        if (range == null || range.contains(value)) {
            return coerced ? CoercionResult.coerced(value) : CoercionResult.accepted(value);
        }
        long clamped = value < range.low() ? (long) Math.ceil(range.low()) : (long) Math.floor(range.high());
        return clamped(Long.valueOf(clamped), value, raw, spec);
    }

    private CoercionResult clampDecimal(double value, String raw, ColumnSpec spec, boolean coerced) {
        NumericRange range = spec.range();
        if (range == null || range.contains(value)) {
            return coerced ? CoercionResult.coerced(value) : CoercionResult.accepted(value);
        }
        return clamped(range.clamp(value), value, raw, spec);
    }

    private CoercionResult clamped(Object clamped, Object original, String raw, ColumnSpec spec) {
        log.warn("Value {} for {} outside range {}, clamped to {}", original, spec.name(), spec.range(), clamped);
        return CoercionResult.recovered(clamped, error(ErrorKind.RANGE_VIOLATION, spec, raw,
                "Value %s outside range %s, clamped to %s".formatted(original, spec.range(), clamped)));
    }

    private CoercionResult parseBoolean(String token, String raw, ColumnSpec spec) {
        String lower = token.toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(lower)) {
            return CoercionResult.accepted(Boolean.TRUE);
        }
        if (FALSE_TOKENS.contains(lower)) {
            return CoercionResult.accepted(Boolean.FALSE);
        }
        return CoercionResult.rejected(error(ErrorKind.TYPE_COERCION_FAILURE, spec, raw,
                "Cannot parse boolean value %s for %s".formatted(raw, spec.name())));
    }

    private CoercionResult enforceCategory(String token, String raw, ColumnSpec spec) {
        Set<String> allowed = spec.allowedValues();
        if (allowed.contains(token)) {
            return CoercionResult.accepted(token);
        }

        for (String candidate : allowed) {
            if (candidate.equalsIgnoreCase(token)) {
                log.debug("Case-normalised {} to {} for {}", token, candidate, spec.name());
                return CoercionResult.coerced(candidate);
            }
        }

        String alias = spec.aliases().get(token.toUpperCase(Locale.ROOT));
        if (alias != null && allowed.contains(alias)) {
            log.debug("Mapping {} alias {} to {}", spec.name(), token, alias);
            return CoercionResult.coerced(alias);
        }

        if (spec.teamCode() && normalizer != null) {
            String normalized = normalizer.normalizeTeamCode(token);
            if (allowed.contains(normalized)) {
                log.debug("Normalised team {} to {} for {}", token, normalized, spec.name());
                return CoercionResult.coerced(normalized);
            }
        }

        String message = "Value %s for %s not in allowed values".formatted(token, spec.name());
        if (spec.nullable()) {
            log.warn("{}, replaced with null", message);
            return CoercionResult.recovered(null, error(ErrorKind.INVALID_CATEGORICAL_VALUE, spec, raw,
                    message + ", replaced with null"));
        }
        return CoercionResult.rejected(error(ErrorKind.INVALID_CATEGORICAL_VALUE, spec, raw, message));
    }

    private static FieldError error(ErrorKind kind, ColumnSpec spec, String raw, String message) {
        return new FieldError(kind, spec.name(), raw, message);
    }

    private static String typeName(ColumnType type) {
        return type.name().toLowerCase(Locale.ROOT);
    }
}
