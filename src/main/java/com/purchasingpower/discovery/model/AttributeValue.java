package com.purchasingpower.discovery.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Typed value of an entity attribute.
 *
 * <p>Only one of the payload fields is populated, according to {@link #getKind()}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AttributeValue {

    private static final AttributeValue NULL = new AttributeValue(Kind.NULL, null, null, null, null);

    Kind kind;
    String text;
    Double number;
    Boolean flag;
    Instant timestamp;

    public enum Kind {
        STRING, NUMBER, BOOLEAN, TIMESTAMP, NULL
    }

    public static AttributeValue of(String value) {
        return value == null ? NULL : new AttributeValue(Kind.STRING, value, null, null, null);
    }

    public static AttributeValue of(double value) {
        return new AttributeValue(Kind.NUMBER, null, value, null, null);
    }

    public static AttributeValue of(boolean value) {
        return new AttributeValue(Kind.BOOLEAN, null, null, value, null);
    }

    public static AttributeValue of(Instant value) {
        return value == null ? NULL : new AttributeValue(Kind.TIMESTAMP, null, null, null, value);
    }

    public static AttributeValue nullValue() {
        return NULL;
    }

    /**
     * Wraps a loosely typed value (as read from YAML or JSON).
     */
    public static AttributeValue from(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof AttributeValue attributeValue) {
            return attributeValue;
        }
        if (value instanceof Number number) {
            return of(number.doubleValue());
        }
        if (value instanceof Boolean bool) {
            return of(bool.booleanValue());
        }
        if (value instanceof Instant instant) {
            return of(instant);
        }
        return of(value.toString());
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public Optional<Instant> asTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    /**
     * Text form used when the value is a reference to another entity's id.
     * Whole numbers render without a fractional part.
     */
    public String asText() {
        return switch (kind) {
            case STRING -> text;
            case NUMBER -> number == Math.rint(number) && !Double.isInfinite(number)
                    ? String.valueOf(number.longValue())
                    : String.valueOf(number);
            case BOOLEAN -> String.valueOf(flag);
            case TIMESTAMP -> timestamp.toString();
            case NULL -> null;
        };
    }

    @Override
    public String toString() {
        return kind == Kind.NULL ? "null" : asText();
    }
}
