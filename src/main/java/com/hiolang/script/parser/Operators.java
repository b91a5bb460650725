package com.hiolang.script.parser;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Operator, indexing and member semantics. The interpreter and the bytecode
 * runner both go through this class, so their results and error messages agree.
 */
public final class Operators {

    private Operators() {}

    // -------------------------
    // Arithmetic
    // -------------------------

    public static Value add(Value left, Value right, int line) {
        if (left.type == Value.Type.TEXT || right.type == Value.Type.TEXT) {
            return Value.text(left.display() + right.display());
        }
        requireNumbers("+", left, right, line);
        if (bothIntegers(left, right)) return Value.integer(left.asInteger() + right.asInteger());
        return Value.floating(left.asDouble() + right.asDouble());
    }

    public static Value subtract(Value left, Value right, int line) {
        requireNumbers("-", left, right, line);
        if (bothIntegers(left, right)) return Value.integer(left.asInteger() - right.asInteger());
        return Value.floating(left.asDouble() - right.asDouble());
    }

    public static Value multiply(Value left, Value right, int line) {
        requireNumbers("*", left, right, line);
        if (bothIntegers(left, right)) return Value.integer(left.asInteger() * right.asInteger());
        return Value.floating(left.asDouble() * right.asDouble());
    }

    public static Value divide(Value left, Value right, int line) {
        requireNumbers("/", left, right, line);
        requireNonZero(right, line);
        if (bothIntegers(left, right)) return Value.integer(left.asInteger() / right.asInteger());
        return Value.floating(left.asDouble() / right.asDouble());
    }

    public static Value modulo(Value left, Value right, int line) {
        requireNumbers("%", left, right, line);
        requireNonZero(right, line);
        if (bothIntegers(left, right)) return Value.integer(left.asInteger() % right.asInteger());
        return Value.floating(left.asDouble() % right.asDouble());
    }

    public static Value negate(Value operand, int line) {
        switch (operand.type) {
            case INTEGER: return Value.integer(-operand.asInteger());
            case FLOAT: return Value.floating(-operand.asFloat());
            default:
                throw new HioRuntimeException(ErrorKind.TYPE_MISMATCH,
                        "Unary '-' expects a number, got " + operand.typeName(), line);
        }
    }

    public static Value not(Value operand) {
        return Value.bool(!operand.isTruthy());
    }

    // -------------------------
    // Comparison
    // -------------------------

    /** Relational operators {@code < <= > >=}. */
    public static Value compare(String op, Value left, Value right, int line) {
        if (left.isNumeric() && right.isNumeric()) {
            if (bothIntegers(left, right)) {
                return Value.bool(test(op, Long.compare(left.asInteger(), right.asInteger())));
            }
            double a = left.asDouble();
            double b = right.asDouble();
            switch (op) {
                case "<": return Value.bool(a < b);
                case "<=": return Value.bool(a <= b);
                case ">": return Value.bool(a > b);
                default: return Value.bool(a >= b);
            }
        }
        if (left.type == Value.Type.TEXT && right.type == Value.Type.TEXT) {
            return Value.bool(test(op, left.asText().compareTo(right.asText())));
        }
        if (left.type == Value.Type.BOOLEAN && right.type == Value.Type.BOOLEAN) {
            return Value.bool(test(op, Boolean.compare(left.asBool(), right.asBool())));
        }
        throw new HioRuntimeException(ErrorKind.TYPE_MISMATCH,
                "Cannot compare " + left.typeName() + " and " + right.typeName() + " with '" + op + "'", line);
    }

    private static boolean test(String op, int cmp) {
        switch (op) {
            case "<": return cmp < 0;
            case "<=": return cmp <= 0;
            case ">": return cmp > 0;
            case ">=": return cmp >= 0;
            default: throw new IllegalArgumentException("Not a relational operator: " + op);
        }
    }

    /** Language equality: structural, with Integer/Float compared numerically at any depth. */
    public static boolean equal(Value left, Value right) {
        if (left.isNumeric() && right.isNumeric()) {
            if (bothIntegers(left, right)) return left.asInteger() == right.asInteger();
            return left.asDouble() == right.asDouble();
        }
        if (left.type != right.type) return false;
        switch (left.type) {
            case ARRAY: {
                List<Value> a = left.asArray();
                List<Value> b = right.asArray();
                if (a.size() != b.size()) return false;
                for (int i = 0; i < a.size(); i++) {
                    if (!equal(a.get(i), b.get(i))) return false;
                }
                return true;
            }
            case OBJECT: {
                Map<String, Value> a = left.asObject();
                Map<String, Value> b = right.asObject();
                if (a.size() != b.size()) return false;
                Iterator<Map.Entry<String, Value>> it = a.entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<String, Value> e = it.next();
                    Value other = b.get(e.getKey());
                    if (other == null || !equal(e.getValue(), other)) return false;
                }
                return true;
            }
            default:
                return left.equals(right);
        }
    }

    // -------------------------
    // Indexing and members
    // -------------------------

    public static Value index(Value target, Value index, int line) {
        switch (target.type) {
            case ARRAY: {
                List<Value> items = target.asArray();
                int i = arrayIndex(index, items.size(), line);
                return items.get(i);
            }
            case TEXT: {
                String s = target.asText();
                int count = s.codePointCount(0, s.length());
                int i = arrayIndex(index, count, line);
                int start = s.offsetByCodePoints(0, i);
                int end = s.offsetByCodePoints(start, 1);
                return Value.text(s.substring(start, end));
            }
            case OBJECT:
                return objectEntry(target.asObject(), objectKey(index, line), line);
            default:
                throw new HioRuntimeException(ErrorKind.TYPE_MISMATCH,
                        "Cannot index into " + target.typeName(), line);
        }
    }

    public static Value member(Value target, String name, int line) {
        if (target.type != Value.Type.OBJECT) {
            throw new HioRuntimeException(ErrorKind.TYPE_MISMATCH,
                    "Cannot read member '" + name + "' of " + target.typeName(), line);
        }
        return objectEntry(target.asObject(), name, line);
    }

    /** {@code a[i] = v} replaces in range and appends at {@code i == length}. */
    public static void setIndex(Value target, Value index, Value value, int line) {
        switch (target.type) {
            case ARRAY: {
                List<Value> items = target.asArray();
                if (index.type != Value.Type.INTEGER) {
                    throw new HioRuntimeException(ErrorKind.TYPE_MISMATCH,
                            "Array index must be a number, got " + index.typeName(), line);
                }
                long i = index.asInteger();
                if (i == items.size()) {
                    items.add(value);
                } else {
                    items.set(arrayIndex(index, items.size(), line), value);
                }
                return;
            }
            case OBJECT:
                target.asObject().put(objectKey(index, line), value);
                return;
            default:
                throw new HioRuntimeException(ErrorKind.TYPE_MISMATCH,
                        "Cannot assign by index into " + target.typeName(), line);
        }
    }

    public static void setMember(Value target, String name, Value value, int line) {
        if (target.type != Value.Type.OBJECT) {
            throw new HioRuntimeException(ErrorKind.TYPE_MISMATCH,
                    "Cannot set member '" + name + "' of " + target.typeName(), line);
        }
        target.asObject().put(name, value);
    }

    private static int arrayIndex(Value index, int length, int line) {
        if (index.type != Value.Type.INTEGER) {
            throw new HioRuntimeException(ErrorKind.TYPE_MISMATCH,
                    "Array index must be a number, got " + index.typeName(), line);
        }
        long i = index.asInteger();
        if (i < 0 || i >= length) {
            throw new HioRuntimeException(ErrorKind.INDEX_OUT_OF_BOUNDS,
                    "Index " + i + " out of bounds for length " + length, line);
        }
        return (int) i;
    }

    private static String objectKey(Value key, int line) {
        if (key.type != Value.Type.TEXT) {
            throw new HioRuntimeException(ErrorKind.TYPE_MISMATCH,
                    "Object key must be a string, got " + key.typeName(), line);
        }
        return key.asText();
    }

    private static Value objectEntry(Map<String, Value> entries, String key, int line) {
        Value v = entries.get(key);
        if (v == null) {
            throw new HioRuntimeException(ErrorKind.UNDEFINED_KEY, "Undefined key '" + key + "'", line);
        }
        return v;
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static boolean bothIntegers(Value a, Value b) {
        return a.type == Value.Type.INTEGER && b.type == Value.Type.INTEGER;
    }

    private static void requireNumbers(String op, Value left, Value right, int line) {
        if (!left.isNumeric() || !right.isNumeric()) {
            throw new HioRuntimeException(ErrorKind.TYPE_MISMATCH,
                    "Unsupported operand types for '" + op + "': " + left.typeName() + ", " + right.typeName(), line);
        }
    }

    private static void requireNonZero(Value divisor, int line) {
        boolean zero = divisor.type == Value.Type.INTEGER ? divisor.asInteger() == 0L : divisor.asDouble() == 0.0;
        if (zero) {
            throw new HioRuntimeException(ErrorKind.DIVISION_BY_ZERO, "Division by zero", line);
        }
    }
}
