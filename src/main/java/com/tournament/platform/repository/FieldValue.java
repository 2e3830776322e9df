package com.tournament.platform.repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Field transforms resolved by the store at write time.
 */
public abstract class FieldValue {
    
    FieldValue() {
    }
    
    public static FieldValue increment(Number delta) {
        return new Increment(delta);
    }
    
    public static FieldValue arrayAppend(Object... elements) {
        return new ArrayAppend(Arrays.asList(elements));
    }
    
    public static FieldValue serverTimestamp() {
        return ServerTimestamp.INSTANCE;
    }
    
    /**
     * Computes the new field value from the stored one.
     */
    public abstract Object apply(Object current, Instant now);
    
    static final class Increment extends FieldValue {
        private final Number delta;
        
        Increment(Number delta) {
            this.delta = delta;
        }
        
        @Override
        public Object apply(Object current, Instant now) {
            Number base = current instanceof Number ? (Number) current : 0;
            if (isIntegral(base) && isIntegral(delta)) {
                long sum = base.longValue() + delta.longValue();
                if (sum >= Integer.MIN_VALUE && sum <= Integer.MAX_VALUE) {
                    return (int) sum;
                }
                return sum;
            }
            return base.doubleValue() + delta.doubleValue();
        }
        
        private static boolean isIntegral(Number number) {
            return number instanceof Integer || number instanceof Long
                || number instanceof Short || number instanceof Byte;
        }
    }
    
    static final class ArrayAppend extends FieldValue {
        private final List<Object> elements;
        
        ArrayAppend(List<Object> elements) {
            this.elements = elements;
        }
        
        @Override
        public Object apply(Object current, Instant now) {
            List<Object> result = new ArrayList<>();
            if (current instanceof List<?>) {
                result.addAll((List<?>) current);
            }
            for (Object element : elements) {
                result.add(Documents.deepCopy(element));
            }
            return result;
        }
    }
    
    static final class ServerTimestamp extends FieldValue {
        static final ServerTimestamp INSTANCE = new ServerTimestamp();
        
        @Override
        public Object apply(Object current, Instant now) {
            return now.toString();
        }
    }
}
