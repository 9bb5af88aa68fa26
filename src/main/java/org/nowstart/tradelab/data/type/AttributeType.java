package org.nowstart.tradelab.data.type;

/**
 * Value type contract for a signal or order attribute.
 *
 * <p>The closed set keeps attribute payloads serializable as plain scalars.
 */
public enum AttributeType {
    NUMBER(Number.class),
    BOOLEAN(Boolean.class),
    TEXT(String.class);

    private final Class<?> valueType;

    AttributeType(Class<?> valueType) {
        this.valueType = valueType;
    }

    public boolean supports(Object value) {
        return valueType.isInstance(value);
    }

    public String typeName() {
        return valueType.getSimpleName();
    }
}
