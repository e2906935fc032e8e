package io.ucmsdk.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.ucmsdk.core.model.FieldSpec;
import io.ucmsdk.core.model.PrimitiveType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Coercion rules shared by the {@link SignatureVerifier}, the
 * {@link ResponseNormalizer} and the schema parsers (for declared defaults).
 *
 * <ul>
 * <li>string: text, numbers and booleans, trimmed</li>
 * <li>integer: integral numbers or integral text, as {@link Long}</li>
 * <li>decimal: any number or numeric text, as {@link BigDecimal}</li>
 * <li>boolean: {@link Boolean} or {@code true/false/t/f/1/0/yes/no},
 * case-insensitive</li>
 * <li>dateTime: {@link OffsetDateTime}, {@link ZonedDateTime},
 * {@link LocalDateTime} (UTC), {@link Instant} or ISO-8601 text; epoch
 * seconds only where the caller allows them</li>
 * <li>date: {@link LocalDate} or ISO-8601 text</li>
 * <li>enum: exactly one of the declared values</li>
 * </ul>
 *
 * <p>
 * Failures are reported as {@link IllegalArgumentException}; callers map them
 * to the validation or response error for the field at hand.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class ValueCoercion {

    private static final Set<String> TRUE_TOKENS = Set.of("true", "t", "1", "yes");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "f", "0", "no");

    private ValueCoercion() {}

    /**
     * Coerces a scalar to the field's primitive type.
     *
     * @param type              the declared type
     * @param value             a non-null scalar
     * @param allowEpochSeconds whether integral values are accepted for
     *                          {@code dateTime}
     * @return the canonical value
     * @throws IllegalArgumentException if the value does not fit the type
     */
    public static Object coerce(PrimitiveType type, Object value, boolean allowEpochSeconds) {
        return switch (type) {
            case STRING -> toText(value);
            case INTEGER -> toInteger(value);
            case DECIMAL -> toDecimal(value);
            case BOOLEAN -> toBoolean(value);
            case DATE_TIME -> toDateTime(value, allowEpochSeconds);
            case DATE -> toDate(value);
        };
    }

    /**
     * Matches a value against an enum's allowed set.
     *
     * @return the matching declared value, or {@code null} if there is none
     */
    public static String matchEnum(List<String> allowed, Object value) {
        String text;
        if (value instanceof Enum<?> e) {
            text = e.name();
        } else if (value instanceof CharSequence || value instanceof Number) {
            text = value.toString().trim();
        } else {
            return null;
        }
        return allowed.contains(text) ? text : null;
    }

    /**
     * Coerces a field's declared default to its canonical value.
     *
     * @throws IllegalArgumentException if the default does not fit the field
     */
    public static Object coerceDefault(FieldSpec field) {
        String declared = field.defaultValue();
        return switch (field.kind()) {
            case ENUM -> {
                String matched = matchEnum(field.enumValues(), declared);
                if (matched == null) {
                    throw new IllegalArgumentException(
                            "default '" + declared + "' is not one of " + field.enumValues());
                }
                yield matched;
            }
            case PRIMITIVE -> coerce(field.primitiveType(), declared, false);
            case OBJECT -> throw new IllegalArgumentException("object fields cannot declare a default");
        };
    }

    /**
     * Converts a scalar JSON node to the plain Java value coercion works on:
     * text, number or boolean.
     *
     * @throws IllegalArgumentException if the node is a container
     */
    public static Object scalarOf(JsonNode node) {
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isContainerNode()) {
            throw new IllegalArgumentException("expected a single value but got " + describe(node));
        }
        return node.asText();
    }

    /** Short type description for error messages. */
    public static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof JsonNode node) {
            return node.getNodeType().name().toLowerCase(Locale.ROOT);
        }
        if (value instanceof CharSequence) {
            return "text '" + value + "'";
        }
        return value.getClass().getSimpleName() + " " + value;
    }

    static String toText(Object value) {
        if (value instanceof CharSequence text) {
            return text.toString().trim();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        throw new IllegalArgumentException("expected text but got " + describe(value));
    }

    static Long toInteger(Object value) {
        try {
            if (value instanceof Long l) {
                return l;
            }
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            if (value instanceof BigInteger big) {
                return big.longValueExact();
            }
            if (value instanceof BigDecimal decimal) {
                return decimal.longValueExact();
            }
            if (value instanceof Double || value instanceof Float) {
                return new BigDecimal(value.toString()).longValueExact();
            }
            if (value instanceof CharSequence text) {
                return new BigDecimal(text.toString().trim()).longValueExact();
            }
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("expected an integer but got " + describe(value), e);
        }
        throw new IllegalArgumentException("expected an integer but got " + describe(value));
    }

    static BigDecimal toDecimal(Object value) {
        try {
            if (value instanceof BigDecimal decimal) {
                return decimal;
            }
            if (value instanceof BigInteger big) {
                return new BigDecimal(big);
            }
            if (value instanceof Number || value instanceof CharSequence) {
                return new BigDecimal(value.toString().trim());
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("expected a decimal but got " + describe(value), e);
        }
        throw new IllegalArgumentException("expected a decimal but got " + describe(value));
    }

    static Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof CharSequence || value instanceof Number) {
            String token = value.toString().trim().toLowerCase(Locale.ROOT);
            if (TRUE_TOKENS.contains(token)) {
                return Boolean.TRUE;
            }
            if (FALSE_TOKENS.contains(token)) {
                return Boolean.FALSE;
            }
        }
        throw new IllegalArgumentException("expected a boolean but got " + describe(value));
    }

    static OffsetDateTime toDateTime(Object value, boolean allowEpochSeconds) {
        if (value instanceof OffsetDateTime odt) {
            return odt;
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toOffsetDateTime();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.atOffset(ZoneOffset.UTC);
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        if (allowEpochSeconds && (value instanceof Long || value instanceof Integer || value instanceof BigInteger)) {
            return fromEpochSeconds(new BigInteger(value.toString()), value);
        }
        if (value instanceof CharSequence chars) {
            String text = chars.toString().trim();
            if (allowEpochSeconds && !text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
                return fromEpochSeconds(new BigInteger(text), value);
            }
            try {
                TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                        text, ZonedDateTime::from, OffsetDateTime::from, LocalDateTime::from);
                if (parsed instanceof ZonedDateTime zdt) {
                    return zdt.toOffsetDateTime();
                }
                if (parsed instanceof OffsetDateTime odt) {
                    return odt;
                }
                return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("expected an ISO-8601 date-time but got " + describe(value), e);
            }
        }
        throw new IllegalArgumentException("expected a date-time but got " + describe(value));
    }

    private static OffsetDateTime fromEpochSeconds(BigInteger seconds, Object value) {
        try {
            return Instant.ofEpochSecond(seconds.longValueExact()).atOffset(ZoneOffset.UTC);
        } catch (ArithmeticException | DateTimeException e) {
            throw new IllegalArgumentException("epoch seconds out of range: " + describe(value), e);
        }
    }

    static LocalDate toDate(Object value) {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof CharSequence text) {
            try {
                return LocalDate.parse(text.toString().trim());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("expected an ISO-8601 date but got " + describe(value), e);
            }
        }
        throw new IllegalArgumentException("expected a date but got " + describe(value));
    }
}
