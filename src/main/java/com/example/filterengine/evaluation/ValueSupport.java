package com.example.filterengine.evaluation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Value-type aware helpers shared by the comparator and snapshotting. Rule and
 * model values arrive untyped (JSON / BSON), so everything here works on the
 * handful of shapes those decode into: numbers, strings, booleans, lists, maps.
 */
public final class ValueSupport {

    public enum ValueKind { NULL, NUMBER, STRING, BOOLEAN, LIST, MAP, OTHER }

    private ValueSupport() {}

    public static ValueKind kindOf(Object value) {
        if (value == null) return ValueKind.NULL;
        if (value instanceof Number) return ValueKind.NUMBER;
        if (value instanceof CharSequence || value instanceof Character) return ValueKind.STRING;
        if (value instanceof Boolean) return ValueKind.BOOLEAN;
        if (value instanceof List || value instanceof Object[]) return ValueKind.LIST;
        if (value instanceof Map) return ValueKind.MAP;
        return ValueKind.OTHER;
    }

    public static boolean isScalar(Object value) {
        ValueKind kind = kindOf(value);
        return kind != ValueKind.LIST && kind != ValueKind.MAP;
    }

    /**
     * Deep equality where numbers compare by value ({@code 1 == 1.0}) and never
     * against their string form.
     */
    public static boolean deepEquals(Object a, Object b) {
        ValueKind ka = kindOf(a);
        ValueKind kb = kindOf(b);
        if (ka != kb) {
            return false;
        }
        switch (ka) {
            case NULL:
                return true;
            case NUMBER:
                return !isNaN(a) && !isNaN(b) && compareNumbers((Number) a, (Number) b) == 0;
            case STRING:
                return a.toString().equals(b.toString());
            case LIST: {
                List<?> la = asList(a);
                List<?> lb = asList(b);
                if (la.size() != lb.size()) return false;
                for (int i = 0; i < la.size(); i++) {
                    if (!deepEquals(la.get(i), lb.get(i))) return false;
                }
                return true;
            }
            case MAP: {
                Map<?, ?> ma = (Map<?, ?>) a;
                Map<?, ?> mb = (Map<?, ?>) b;
                if (!ma.keySet().equals(mb.keySet())) return false;
                for (Map.Entry<?, ?> e : ma.entrySet()) {
                    if (!deepEquals(e.getValue(), mb.get(e.getKey()))) return false;
                }
                return true;
            }
            default:
                return Objects.equals(a, b);
        }
    }

    /**
     * NaN has no order and equals nothing, so comparisons treat it as a non-number.
     */
    public static boolean isNaN(Object value) {
        return (value instanceof Double && ((Double) value).isNaN())
                || (value instanceof Float && ((Float) value).isNaN());
    }

    public static boolean containsDeep(List<?> haystack, Object needle) {
        for (Object candidate : haystack) {
            if (deepEquals(candidate, needle)) {
                return true;
            }
        }
        return false;
    }

    public static int compareNumbers(Number a, Number b) {
        BigDecimal da = toBigDecimal(a);
        BigDecimal db = toBigDecimal(b);
        if (da == null || db == null) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return da.compareTo(db);
    }

    /**
     * Exact decimal form of a number, or null for NaN / infinities.
     */
    static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) return (BigDecimal) n;
        if (n instanceof BigInteger) return new BigDecimal((BigInteger) n);
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return BigDecimal.valueOf(n.longValue());
        }
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return null;
        }
        try {
            return new BigDecimal(n.toString());
        } catch (NumberFormatException e) {
            return BigDecimal.valueOf(d);
        }
    }

    public static List<?> asList(Object value) {
        if (value instanceof List) return (List<?>) value;
        if (value instanceof Object[]) return Arrays.asList((Object[]) value);
        throw new IllegalArgumentException("Not a list value: " + value);
    }

    /**
     * Structural copy; nested lists and maps come back unmodifiable.
     */
    public static Object deepCopy(Object value) {
        switch (kindOf(value)) {
            case LIST: {
                List<Object> copy = new ArrayList<>();
                for (Object item : asList(value)) {
                    copy.add(deepCopy(item));
                }
                return Collections.unmodifiableList(copy);
            }
            case MAP: {
                Map<Object, Object> copy = new LinkedHashMap<>();
                for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                    copy.put(e.getKey(), deepCopy(e.getValue()));
                }
                return Collections.unmodifiableMap(copy);
            }
            default:
                return value;
        }
    }

    public static String render(Object value) {
        switch (kindOf(value)) {
            case NULL:
                return "null";
            case STRING:
                return "\"" + value + "\"";
            case LIST: {
                StringJoiner joiner = new StringJoiner(", ", "[", "]");
                for (Object item : asList(value)) {
                    joiner.add(render(item));
                }
                return joiner.toString();
            }
            case MAP: {
                StringJoiner joiner = new StringJoiner(", ", "{", "}");
                for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                    joiner.add(e.getKey() + ": " + render(e.getValue()));
                }
                return joiner.toString();
            }
            default:
                return String.valueOf(value);
        }
    }

    public static String describeKind(Object value) {
        if (isNaN(value)) {
            return "NaN";
        }
        return kindOf(value).name().toLowerCase(Locale.ROOT);
    }
}
