package org.nowstart.tradelab.data.dto;

import org.nowstart.tradelab.data.type.AttributeType;

/**
 * One typed metadata entry attached to a {@link Signal}.
 *
 * <p>Values are limited to numbers, booleans and text so that signals and orders serialize to any
 * tabular or JSON sink without custom converters. Keys are stable machine-readable identifiers such as
 * {@code ma.fast} or {@code reason}.
 *
 * @param key   stable attribute identifier
 * @param type  expected value type
 * @param value attribute value, never null
 */
public record SignalAttribute(
        String key,
        AttributeType type,
        Object value
) {

    public SignalAttribute {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("attribute key is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("attribute type is required");
        }
        if (value == null) {
            throw new IllegalArgumentException("attribute value is required");
        }
        if (!type.supports(value)) {
            throw new IllegalArgumentException("attribute " + key + " must be " + type.typeName());
        }
    }

    public static SignalAttribute number(String key, double value) {
        return new SignalAttribute(key, AttributeType.NUMBER, value);
    }

    public static SignalAttribute bool(String key, boolean value) {
        return new SignalAttribute(key, AttributeType.BOOLEAN, value);
    }

    public static SignalAttribute text(String key, String value) {
        return new SignalAttribute(key, AttributeType.TEXT, value == null ? "" : value);
    }
}
