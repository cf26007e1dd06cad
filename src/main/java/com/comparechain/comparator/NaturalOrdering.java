package com.comparechain.comparator;

import com.comparechain.exception.IncomparableValuesException;

import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Natural ordering used when no comparator domain is supplied. It is total: any two values
 * can be ordered.
 * <p>
 * Values of different kinds order by kind:
 * {@code null < number < boolean < other comparable < other object < record < map < sequence < string}.
 * Within a kind:
 * <ul>
 *   <li>Numbers of any type compare by value (1 == 1.0)</li>
 *   <li>Comparable values of the same class use {@code compareTo}</li>
 *   <li>Records of the same class compare component by component in declaration order</li>
 *   <li>Lists, collections and arrays compare lexicographically</li>
 *   <li>Maps compare by size and then by entries in key order</li>
 *   <li>Character sequences compare by their characters</li>
 * </ul>
 * Values of the same kind but different classes order by class name.
 * <p>
 * Records are compared by structure, which is rarely the ordering their type means; callers
 * are warned about it at evaluation time.
 */
public final class NaturalOrdering implements ComparatorDomain {

    public static final NaturalOrdering INSTANCE = new NaturalOrdering();

    private enum Kind {
        NULL, NUMBER, BOOLEAN, COMPARABLE, OBJECT, RECORD, MAP, SEQUENCE, STRING
    }

    private NaturalOrdering() {
    }

    @Override
    public Ordering order(Object left, Object right) {
        return Ordering.of(compare(left, right));
    }

    /**
     * Whether a value is compared by structure rather than by a meaning of its own.
     */
    public static boolean isComposite(Object value) {
        return value instanceof Record;
    }

    private static Kind kindOf(Object value) {
        if (value == null) {
            return Kind.NULL;
        }
        if (value instanceof Number) {
            return Kind.NUMBER;
        }
        if (value instanceof Boolean) {
            return Kind.BOOLEAN;
        }
        if (value instanceof CharSequence) {
            return Kind.STRING;
        }
        if (value instanceof Record) {
            return Kind.RECORD;
        }
        if (value instanceof Map) {
            return Kind.MAP;
        }
        if (value instanceof Collection || value.getClass().isArray()) {
            return Kind.SEQUENCE;
        }
        return value instanceof Comparable ? Kind.COMPARABLE : Kind.OBJECT;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private int compare(Object left, Object right) {
        Kind kind = kindOf(left);
        int byKind = kind.compareTo(kindOf(right));
        if (byKind != 0) {
            return byKind;
        }
        switch (kind) {
            case NULL:
                return 0;
            case NUMBER:
                return compareNumbers((Number) left, (Number) right);
            case BOOLEAN:
                return Boolean.compare((Boolean) left, (Boolean) right);
            case STRING:
                return CharSequence.compare((CharSequence) left, (CharSequence) right);
            case SEQUENCE:
                return compareSequences(toList(left), toList(right));
            case MAP:
                return compareMaps((Map<?, ?>) left, (Map<?, ?>) right);
            default:
                break;
        }
        if (left.getClass() != right.getClass()) {
            return left.getClass().getName().compareTo(right.getClass().getName());
        }
        if (left instanceof Comparable c) {
            return c.compareTo(right);
        }
        if (kind == Kind.RECORD) {
            return compareRecords((Record) left, (Record) right);
        }
        return compareObjects(left, right);
    }

    private int compareNumbers(Number left, Number right) {
        if (!isFinite(left) || !isFinite(right)) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    private boolean isFinite(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return Double.isFinite(number.doubleValue());
        }
        return true;
    }

    private BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal bd) {
            return bd;
        }
        if (number instanceof BigInteger bi) {
            return new BigDecimal(bi);
        }
        if (number instanceof Long || number instanceof Integer
                || number instanceof Short || number instanceof Byte) {
            return BigDecimal.valueOf(number.longValue());
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }

    private int compareRecords(Record left, Record right) {
        for (RecordComponent component : left.getClass().getRecordComponents()) {
            int result = compare(componentValue(component, left), componentValue(component, right));
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    private Object componentValue(RecordComponent component, Record record) {
        try {
            Method accessor = component.getAccessor();
            accessor.setAccessible(true);
            return accessor.invoke(record);
        } catch (ReflectiveOperationException e) {
            throw new IncomparableValuesException("Cannot read component '" + component.getName()
                    + "' of " + record.getClass().getName() + ": " + e.getMessage());
        }
    }

    // Same class, no ordering of its own: equal objects are equal, the rest order by text
    private int compareObjects(Object left, Object right) {
        if (left.equals(right)) {
            return 0;
        }
        int byText = String.valueOf(left).compareTo(String.valueOf(right));
        if (byText != 0) {
            return byText;
        }
        return Integer.compare(System.identityHashCode(left), System.identityHashCode(right));
    }

    private List<Object> toList(Object sequence) {
        if (sequence instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        int length = Array.getLength(sequence);
        List<Object> list = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            list.add(Array.get(sequence, i));
        }
        return list;
    }

    private int compareSequences(List<?> left, List<?> right) {
        Iterator<?> l = left.iterator();
        Iterator<?> r = right.iterator();
        while (l.hasNext() && r.hasNext()) {
            int result = compare(l.next(), r.next());
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private int compareMaps(Map<?, ?> left, Map<?, ?> right) {
        int bySize = Integer.compare(left.size(), right.size());
        if (bySize != 0) {
            return bySize;
        }
        List<Map.Entry<?, ?>> leftEntries = sortedEntries(left);
        List<Map.Entry<?, ?>> rightEntries = sortedEntries(right);
        for (int i = 0; i < leftEntries.size(); i++) {
            Map.Entry<?, ?> l = leftEntries.get(i);
            Map.Entry<?, ?> r = rightEntries.get(i);
            int result = compare(l.getKey(), r.getKey());
            if (result == 0) {
                result = compare(l.getValue(), r.getValue());
            }
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    private List<Map.Entry<?, ?>> sortedEntries(Map<?, ?> map) {
        List<Map.Entry<?, ?>> entries = new ArrayList<>(map.entrySet());
        entries.sort((a, b) -> compare(a.getKey(), b.getKey()));
        return entries;
    }

    static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }
}
