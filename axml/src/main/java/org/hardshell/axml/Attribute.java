package org.hardshell.axml;

import java.util.Objects;

/**
 * One attribute of a start element. String-typed values are held by value; pool indices only exist while a
 * document is being read or written.
 */
public final class Attribute {

    private final String namespace;
    private final String name;
    private final int resourceId;
    private final String rawValue;
    private final int type;
    private final int data;
    private final String stringData;

    Attribute(String namespace, String name, int resourceId, String rawValue, int type, int data, String stringData) {
        this.namespace = namespace;
        this.name = Objects.requireNonNull(name, "name");
        this.resourceId = resourceId;
        this.rawValue = rawValue;
        this.type = type;
        this.data = data;
        this.stringData = stringData;
    }

    public static Attribute string(String namespace, String name, int resourceId, String value) {
        Objects.requireNonNull(value, "value");
        return new Attribute(namespace, name, resourceId, value, TypedValue.TYPE_STRING, 0, value);
    }

    public static Attribute bool(String namespace, String name, int resourceId, boolean value) {
        return new Attribute(namespace, name, resourceId, null, TypedValue.TYPE_INT_BOOLEAN, value ? -1 : 0, null);
    }

    public static Attribute integer(String namespace, String name, int resourceId, int value) {
        return new Attribute(namespace, name, resourceId, null, TypedValue.TYPE_INT_DEC, value, null);
    }

    public String namespace() {
        return namespace;
    }

    public String name() {
        return name;
    }

    /**
     * @return the framework resource id of this attribute, or 0 when it has none
     */
    public int resourceId() {
        return resourceId;
    }

    public String rawValue() {
        return rawValue;
    }

    public int type() {
        return type;
    }

    /**
     * Raw typed data. Meaningless for {@link TypedValue#TYPE_STRING}, whose value is {@link #stringValue()}.
     */
    public int data() {
        return data;
    }

    /**
     * @return the string value, falling back to the raw value for non-string types; may be {@code null}
     */
    public String stringValue() {
        return type == TypedValue.TYPE_STRING ? stringData : rawValue;
    }

    public boolean booleanValue() {
        if (type == TypedValue.TYPE_INT_BOOLEAN) return data != 0;
        return "true".equals(stringValue());
    }

    public int intValue(int fallback) {
        if (type >= TypedValue.TYPE_INT_DEC && type <= 0x1f) return data;
        String s = stringValue();
        if (s == null) return fallback;
        try {
            return Integer.decode(s.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    boolean sameSlot(Attribute other) {
        if (resourceId != 0 || other.resourceId != 0) return resourceId == other.resourceId;
        return name.equals(other.name) && Objects.equals(namespace, other.namespace);
    }

    @Override
    public String toString() {
        return (namespace == null ? "" : "{" + namespace + "}") + name + "=" + stringValue();
    }
}
