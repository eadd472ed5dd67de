package org.relay.http.extract;

import org.relay.http.extract.PathShape.ScalarParser;
import org.relay.http.extract.PathShape.ScalarShape;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Built-in scalar shapes.
 * <p>
 * Parsing is strict: no surrounding whitespace, no type suffixes, {@code true}/{@code false}
 * only for booleans and the canonical 8-4-4-4-12 form for UUIDs.
 */
public final class Scalars {
    private static final Pattern UUID_FORMAT =
            Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    public static final ScalarShape<String> STRING = of("String", value -> value);
    public static final ScalarShape<Character> CHAR = of("Character", Scalars::parseChar);
    public static final ScalarShape<Boolean> BOOLEAN = of("Boolean", Scalars::parseBoolean);
    public static final ScalarShape<Byte> BYTE = of("Byte", value -> Byte.valueOf(strictInteger(value)));
    public static final ScalarShape<Short> SHORT = of("Short", value -> Short.valueOf(strictInteger(value)));
    public static final ScalarShape<Integer> INTEGER = of("Integer", value -> Integer.valueOf(strictInteger(value)));
    public static final ScalarShape<Long> LONG = of("Long", value -> Long.valueOf(strictInteger(value)));
    public static final ScalarShape<Float> FLOAT = of("Float", value -> Float.valueOf(strictFloating(value)));
    public static final ScalarShape<Double> DOUBLE = of("Double", value -> Double.valueOf(strictFloating(value)));
    public static final ScalarShape<BigInteger> BIG_INTEGER = of("BigInteger", value -> new BigInteger(strictInteger(value)));
    public static final ScalarShape<BigDecimal> BIG_DECIMAL = of("BigDecimal", value -> new BigDecimal(strictDecimal(value)));
    public static final ScalarShape<java.util.UUID> UUID = of("UUID", Scalars::parseUuid);

    private Scalars() {}

    /**
     * Custom scalar. The parser may throw any exception to report a parse error for
     * {@code typeName}, or {@link PathDeserializationException#custom(String)} to report its own message.
     */
    public static <T> ScalarShape<T> of(String typeName, ScalarParser<T> parser) {
        return new ScalarShape<>(typeName, parser);
    }

    /**
     * Enum constant matched by exact name.
     */
    public static <E extends Enum<E>> ScalarShape<E> enumOf(Class<E> type) {
        var constants = type.getEnumConstants();

        return of(type.getSimpleName(), value -> {
            for (var constant : constants) {
                if (constant.name().equals(value)) {
                    return constant;
                }
            }
            throw PathDeserializationException.custom("unknown variant `" + value + "`, " + expectedVariants(constants));
        });
    }

    private static String expectedVariants(Enum<?>[] constants) {
        var names = Arrays.stream(constants)
                          .map(constant -> "`" + constant.name() + "`")
                          .collect(Collectors.toList());

        return switch (names.size()) {
            case 0 -> "there are no variants";
            case 1 -> "expected " + names.get(0);
            case 2 -> "expected " + names.get(0) + " or " + names.get(1);
            default -> "expected one of " + String.join(", ", names);
        };
    }

    private static Character parseChar(String value) {
        if (value.length() != 1) {
            throw new IllegalArgumentException("Expected a single character");
        }
        return value.charAt(0);
    }

    private static Boolean parseBoolean(String value) {
        return switch (value) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException("Expected true or false");
        };
    }

    private static java.util.UUID parseUuid(String value) {
        if (!UUID_FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Malformed UUID");
        }
        return java.util.UUID.fromString(value);
    }

    // JDK number parsing accepts any Unicode decimal digit
    private static String strictInteger(String value) {
        return requireChars(value, "+-");
    }

    private static String strictDecimal(String value) {
        return requireChars(value, "+-.eE");
    }

    private static String strictFloating(String value) {
        if (value.isEmpty()) {
            throw new NumberFormatException("Empty value");
        }

        var first = value.charAt(0);
        var last = value.charAt(value.length() - 1);

        // Double.parseDouble trims control characters and accepts type suffixes
        if (first <= ' ' || last <= ' ' || "dDfF".indexOf(last) >= 0 || !isAscii(value)) {
            throw new NumberFormatException("Malformed number");
        }
        return value;
    }

    private static boolean isAscii(String value) {
        return value.chars().allMatch(c -> c < 0x80);
    }

    private static String requireChars(String value, String allowedNonDigits) {
        if (value.isEmpty()) {
            throw new NumberFormatException("Empty value");
        }
        for (var i = 0; i < value.length(); i++) {
            var c = value.charAt(i);

            if ((c < '0' || c > '9') && allowedNonDigits.indexOf(c) < 0) {
                throw new NumberFormatException("Malformed number");
            }
        }
        return value;
    }
}
