package org.relay.http.extract;

/**
 * The kinds of errors that can happen while extracting path captures.
 * <p>
 * Obtained from {@link PathRejection#kind()}, useful for building more precise error messages.
 * Every kind renders to fixed text via {@link #message()} and is classified as either a client
 * error (malformed URL) or a server error (route and target type do not fit together).
 */
public sealed interface ErrorKind {
    String WRONG_NUMBER_HINT = ". Note that multiple parameters must be extracted with a tuple "
                               + "`Path<(_, _)>` or a struct `Path<YourParams>`";

    /**
     * Rendered error text.
     */
    String message();

    /**
     * Whether the error was caused by the request rather than by the server's route declarations.
     */
    boolean isClientError();

    /**
     * The URL contained the wrong number of parameters.
     *
     * @param got      number of captures in the URL
     * @param expected number of captures the target type needs
     */
    record WrongNumberOfParameters(int got, int expected) implements ErrorKind {
        @Override
        public String message() {
            var text = "Wrong number of path arguments for `Path`. Expected " + expected + " but got " + got;
            return expected == 1 ? text + WRONG_NUMBER_HINT : text;
        }

        @Override
        public boolean isClientError() {
            return false;
        }
    }

    /**
     * Failed to parse the value of a named capture. Used for types with named fields and for maps.
     */
    record ParseErrorAtKey(String key, String value, String expectedType) implements ErrorKind {
        @Override
        public String message() {
            return "Cannot parse `" + key + "` with value `" + quote(value) + "` to a `" + expectedType + "`";
        }

        @Override
        public boolean isClientError() {
            return true;
        }
    }

    /**
     * Failed to parse the value at a position. Used for tuples and lists.
     */
    record ParseErrorAtIndex(int index, String value, String expectedType) implements ErrorKind {
        @Override
        public String message() {
            return "Cannot parse value at index " + index + " with value `" + quote(value) + "` to a `"
                   + expectedType + "`";
        }

        @Override
        public boolean isClientError() {
            return true;
        }
    }

    /**
     * Failed to parse a single value extracted directly into a scalar type.
     */
    record ParseError(String value, String expectedType) implements ErrorKind {
        @Override
        public String message() {
            return "Cannot parse `" + quote(value) + "` to a `" + expectedType + "`";
        }

        @Override
        public boolean isClientError() {
            return true;
        }
    }

    /**
     * A capture which, once percent-decoded, is not valid UTF-8.
     */
    record InvalidUtf8InPathParam(String key) implements ErrorKind {
        @Override
        public String message() {
            return "Invalid UTF-8 in `" + key + "`";
        }

        @Override
        public boolean isClientError() {
            return true;
        }
    }

    /**
     * Target type nests aggregates the deserializer cannot fill, such as a map inside a map.
     * This is a programmer error.
     */
    record UnsupportedType(String name) implements ErrorKind {
        @Override
        public String message() {
            return "Unsupported type `" + name + "`";
        }

        @Override
        public boolean isClientError() {
            return false;
        }
    }

    /**
     * Any other error, e.g. raised by custom validation while parsing a value.
     */
    record Message(String text) implements ErrorKind {
        @Override
        public String message() {
            return text;
        }

        @Override
        public boolean isClientError() {
            return true;
        }
    }

    /**
     * Quote value the way it is shown in error texts: double-quoted with escapes.
     */
    static String quote(String value) {
        var sb = new StringBuilder(value.length() + 2).append('"');

        value.codePoints().forEach(cp -> {
            switch (cp) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case 0 -> sb.append("\\0");
                default -> {
                    if (Character.isISOControl(cp)) {
                        sb.append("\\u{").append(Integer.toHexString(cp)).append('}');
                    } else {
                        sb.appendCodePoint(cp);
                    }
                }
            }
        });
        return sb.append('"').toString();
    }
}
