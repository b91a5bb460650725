package com.hiolang.script.parser;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime value shared by the interpreter and the bytecode runner.
 *
 * Arrays and objects hold their mutable list/map by reference, so copying a
 * Value aliases the same container.
 */
public final class Value {
    public enum Type { INTEGER, FLOAT, TEXT, BOOLEAN, ARRAY, OBJECT, VOID }

    private static final Value VOID = new Value(Type.VOID, null);
    private static final Value TRUE = new Value(Type.BOOLEAN, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOLEAN, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long n) { return new Value(Type.INTEGER, n); }
    public static Value floating(double d) { return new Value(Type.FLOAT, d); }
    public static Value text(String s) { return new Value(Type.TEXT, Objects.requireNonNull(s, "text")); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value array(List<Value> a) { return new Value(Type.ARRAY, Objects.requireNonNull(a, "array")); }
    public static Value object(Map<String, Value> m) { return new Value(Type.OBJECT, Objects.requireNonNull(m, "object")); }
    public static Value voidValue() { return VOID; }

    /** Converts a literal payload from the lexer (Long, Double, String, Boolean) to a Value. */
    public static Value fromLiteral(Object literal) {
        if (literal instanceof Long) return integer((Long) literal);
        if (literal instanceof Double) return floating((Double) literal);
        if (literal instanceof String) return text((String) literal);
        if (literal instanceof Boolean) return bool((Boolean) literal);
        throw new IllegalArgumentException("Unsupported literal: " + literal);
    }

    public Type getType() { return type; }

    public boolean isNumeric() { return type == Type.INTEGER || type == Type.FLOAT; }

    public boolean isVoid() { return type == Type.VOID; }

    public long asInteger() {
        if (type != Type.INTEGER) throw new IllegalStateException("Expected integer, got " + type);
        return (Long) value;
    }

    public double asFloat() {
        if (type != Type.FLOAT) throw new IllegalStateException("Expected float, got " + type);
        return (Double) value;
    }

    /** Integer or Float widened to double. */
    public double asDouble() {
        if (type == Type.INTEGER) return (Long) value;
        if (type == Type.FLOAT) return (Double) value;
        throw new IllegalStateException("Expected number, got " + type);
    }

    public String asText() {
        if (type != Type.TEXT) throw new IllegalStateException("Expected text, got " + type);
        return (String) value;
    }

    public boolean asBool() {
        if (type != Type.BOOLEAN) throw new IllegalStateException("Expected boolean, got " + type);
        return (Boolean) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asArray() {
        if (type != Type.ARRAY) throw new IllegalStateException("Expected array, got " + type);
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asObject() {
        if (type != Type.OBJECT) throw new IllegalStateException("Expected object, got " + type);
        return (Map<String, Value>) value;
    }

    public boolean isTruthy() {
        switch (type) {
            case INTEGER: return asInteger() != 0L;
            case FLOAT: return asFloat() != 0.0;
            case TEXT: return !asText().isEmpty();
            case BOOLEAN: return asBool();
            case ARRAY: return !asArray().isEmpty();
            case OBJECT: return !asObject().isEmpty();
            default: return false;
        }
    }

    /** Name reported by the type() builtin. */
    public String typeName() {
        switch (type) {
            case INTEGER: return "number";
            case FLOAT: return "float";
            case TEXT: return "string";
            case BOOLEAN: return "boolean";
            case ARRAY: return "array";
            case OBJECT: return "object";
            default: return "void";
        }
    }

    /** Display form used by print, string concatenation and the REPL. */
    public String display() {
        switch (type) {
            case INTEGER: return Long.toString(asInteger());
            case FLOAT: return formatFloat(asFloat());
            case TEXT: return asText();
            case BOOLEAN: return Boolean.toString(asBool());
            case ARRAY: {
                StringBuilder sb = new StringBuilder("[");
                Iterator<Value> it = asArray().iterator();
                while (it.hasNext()) {
                    sb.append(it.next().display());
                    if (it.hasNext()) sb.append(", ");
                }
                return sb.append(']').toString();
            }
            case OBJECT: {
                StringBuilder sb = new StringBuilder("{");
                Iterator<Map.Entry<String, Value>> it = asObject().entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<String, Value> e = it.next();
                    sb.append(e.getKey()).append(": ").append(e.getValue().display());
                    if (it.hasNext()) sb.append(", ");
                }
                return sb.append('}').toString();
            }
            default:
                return "void";
        }
    }

    static String formatFloat(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            String s = Long.toString((long) d);
            return (d == 0.0 && 1.0 / d < 0) ? "-" + s : s;
        }
        return Double.toString(d);
    }

    /**
     * Strict structural equality (same variant, equal contents). The language's
     * '==' operator is looser across Integer/Float; see {@link Operators#equal}.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case TEXT: return '"' + asText() + '"';
            case VOID: return "void";
            default: return type.name().toLowerCase() + "(" + display() + ")";
        }
    }
}
