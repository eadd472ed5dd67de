package org.relay.http.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorKindTest {

    @Test
    void wrong_number_of_parameters_adds_hint_for_single_expected() {
        var kind = new ErrorKind.WrongNumberOfParameters(2, 1);

        assertThat(kind.message()).isEqualTo(
                "Wrong number of path arguments for `Path`. Expected 1 but got 2. Note that multiple parameters "
                + "must be extracted with a tuple `Path<(_, _)>` or a struct `Path<YourParams>`");
    }

    @Test
    void wrong_number_of_parameters_without_hint_for_multiple_expected() {
        var kind = new ErrorKind.WrongNumberOfParameters(1, 2);

        assertThat(kind.message()).isEqualTo("Wrong number of path arguments for `Path`. Expected 2 but got 1");
    }

    @Test
    void parse_errors_render_quoted_value() {
        assertThat(new ErrorKind.ParseErrorAtKey("id", "abc", "Integer").message())
                .isEqualTo("Cannot parse `id` with value `\"abc\"` to a `Integer`");
        assertThat(new ErrorKind.ParseErrorAtIndex(1, "abc", "Long").message())
                .isEqualTo("Cannot parse value at index 1 with value `\"abc\"` to a `Long`");
        assertThat(new ErrorKind.ParseError("abc", "Integer").message())
                .isEqualTo("Cannot parse `\"abc\"` to a `Integer`");
    }

    @Test
    void other_kinds_render_fixed_text() {
        assertThat(new ErrorKind.InvalidUtf8InPathParam("name").message()).isEqualTo("Invalid UTF-8 in `name`");
        assertThat(new ErrorKind.UnsupportedType("Map<String, Map<String, Integer>>").message())
                .isEqualTo("Unsupported type `Map<String, Map<String, Integer>>`");
        assertThat(new ErrorKind.Message("custom text").message()).isEqualTo("custom text");
    }

    @Test
    void quote_escapes_quotes_backslashes_and_controls() {
        assertThat(ErrorKind.quote("a\"b\\c")).isEqualTo("\"a\\\"b\\\\c\"");
        assertThat(ErrorKind.quote("x\ny\tz\r\0")).isEqualTo("\"x\\ny\\tz\\r\\0\"");
        assertThat(ErrorKind.quote("\u0001")).isEqualTo("\"\\u{1}\"");
        assertThat(ErrorKind.quote("héllo")).isEqualTo("\"héllo\"");
    }

    @Test
    void classification_splits_client_and_server_errors() {
        assertThat(new ErrorKind.Message("x").isClientError()).isTrue();
        assertThat(new ErrorKind.InvalidUtf8InPathParam("k").isClientError()).isTrue();
        assertThat(new ErrorKind.ParseError("v", "T").isClientError()).isTrue();
        assertThat(new ErrorKind.ParseErrorAtIndex(0, "v", "T").isClientError()).isTrue();
        assertThat(new ErrorKind.ParseErrorAtKey("k", "v", "T").isClientError()).isTrue();
        assertThat(new ErrorKind.WrongNumberOfParameters(0, 1).isClientError()).isFalse();
        assertThat(new ErrorKind.UnsupportedType("T").isClientError()).isFalse();
    }
}
