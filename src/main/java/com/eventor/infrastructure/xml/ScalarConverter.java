package com.eventor.infrastructure.xml;

import com.eventor.domain.mapping.Coded;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;

/**
 * Converts element text and attribute values to the scalar type of a field.
 */
final class ScalarConverter {

    private ScalarConverter() {
    }

    static boolean supports(Class<?> type) {
        return type == String.class
            || type == int.class || type == Integer.class
            || type == long.class || type == Long.class
            || type == double.class || type == Double.class
            || type == boolean.class || type == Boolean.class
            || type == LocalDate.class
            || type == LocalTime.class
            || type.isEnum();
    }

    static Object convert(String raw, Class<?> type, String path) throws XmlDecodingException {
        if (type == String.class) {
            return raw;
        }
        String text = raw.trim();
        try {
            if (type == int.class || type == Integer.class) {
                return Integer.valueOf(text);
            }
            if (type == long.class || type == Long.class) {
                return Long.valueOf(text);
            }
            if (type == double.class || type == Double.class) {
                return Double.valueOf(text);
            }
            if (type == boolean.class || type == Boolean.class) {
                return parseBoolean(text);
            }
            if (type == LocalDate.class) {
                return LocalDate.parse(text);
            }
            if (type == LocalTime.class) {
                return LocalTime.parse(text);
            }
            if (type.isEnum()) {
                return parseEnum(text, type);
            }
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new XmlDecodingException(
                "Cannot convert '" + raw + "' to " + type.getSimpleName(), path, e);
        }
        throw new IllegalStateException("Unsupported scalar type " + type.getName());
    }

    private static Boolean parseBoolean(String text) {
        if ("true".equalsIgnoreCase(text)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(text)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Not a boolean: " + text);
    }

    /**
     * Matches the constant name first, then the numeric code ({@link Coded}) or ordinal.
     */
    private static Object parseEnum(String text, Class<?> type) {
        Object[] constants = type.getEnumConstants();
        for (Object constant : constants) {
            if (((Enum<?>) constant).name().equalsIgnoreCase(text)) {
                return constant;
            }
        }
        int number = Integer.parseInt(text);
        if (Coded.class.isAssignableFrom(type)) {
            for (Object constant : constants) {
                if (((Coded) constant).code() == number) {
                    return constant;
                }
            }
        } else if (number >= 0 && number < constants.length) {
            return constants[number];
        }
        throw new IllegalArgumentException("No " + type.getSimpleName() + " for " + text);
    }
}
