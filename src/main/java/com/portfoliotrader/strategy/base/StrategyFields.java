package com.portfoliotrader.strategy.base;

import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.core.convert.ConversionService;
import org.springframework.core.convert.support.DefaultConversionService;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

/**
 * Reflection access to the {@link StrategyParameter} and {@link StrategyVariable} fields of a
 * strategy class. Field lists are resolved once per class.
 */
final class StrategyFields {

    private static final ConversionService CONVERSION_SERVICE = DefaultConversionService.getSharedInstance();

    private static final Map<Class<?>, Map<String, Field>> PARAMETERS = new ConcurrentHashMap<>();
    private static final Map<Class<?>, Map<String, Field>> VARIABLES = new ConcurrentHashMap<>();

    private StrategyFields() {}

    static Map<String, Field> parameters(Class<?> type) {
        return PARAMETERS.computeIfAbsent(type, t -> scan(t, StrategyParameter.class));
    }

    static Map<String, Field> variables(Class<?> type) {
        return VARIABLES.computeIfAbsent(type, t -> scan(t, StrategyVariable.class));
    }

    static Map<String, Object> read(Map<String, Field> fields, Object target) {
        Map<String, Object> values = new LinkedHashMap<>();
        fields.forEach((name, field) -> values.put(name, ReflectionUtils.getField(field, target)));
        return values;
    }

    /**
     * Writes {@code value} to the field, converting it to the field's type first
     * (e.g. a persisted {@code Integer} into a {@code double} parameter).
     *
     * @throws org.springframework.core.convert.ConversionException if the value cannot be converted
     */
    static void write(Field field, Object target, Object value) {
        Class<?> type = ClassUtils.resolvePrimitiveIfNecessary(field.getType());
        ReflectionUtils.setField(field, target, CONVERSION_SERVICE.convert(value, type));
    }

    static <T> T convert(Object value, Class<T> type) {
        return CONVERSION_SERVICE.convert(value, type);
    }

    private static Map<String, Field> scan(Class<?> type, Class<? extends Annotation> marker) {
        // superclass fields first so shared declarations keep a stable leading position
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.add(0, c);
        }
        Map<String, Field> fields = new LinkedHashMap<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                if (field.isAnnotationPresent(marker)) {
                    ReflectionUtils.makeAccessible(field);
                    fields.put(field.getName(), field);
                }
            }
        }
        return fields;
    }
}
