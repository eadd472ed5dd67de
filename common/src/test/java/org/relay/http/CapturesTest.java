package org.relay.http;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapturesTest {

    @Test
    void entries_preserve_insertion_order() {
        var captures = Captures.empty()
                               .insert("team_id", "2")
                               .insert("user_id", "1");

        assertThat(captures.entries()).containsExactly(new Captures.Capture("team_id", "2"),
                                                       new Captures.Capture("user_id", "1"));
    }

    @Test
    void insert_with_existing_key_replaces_value_in_place() {
        var captures = Captures.of("a", "1", "b", "2")
                               .insert("a", "3");

        assertThat(captures.entries()).containsExactly(new Captures.Capture("a", "3"),
                                                       new Captures.Capture("b", "2"));
    }

    @Test
    void merge_of_empty_store_leaves_captures_unchanged() {
        var captures = Captures.of("user_id", "7", "team_id", "9");
        var before = captures.entries();

        captures.merge(Captures.empty());

        assertThat(captures.entries()).isEqualTo(before);
    }

    @Test
    void merge_of_disjoint_stores_yields_union() {
        var outer = Captures.of("user_id", "7");
        var inner = Captures.of("team_id", "9");

        outer.merge(inner);

        assertThat(outer.size()).isEqualTo(2);
        assertThat(outer.get("user_id")).hasValue("7");
        assertThat(outer.get("team_id")).hasValue("9");
        assertThat(outer.entries()).extracting(Captures.Capture::key)
                                   .containsExactly("user_id", "team_id");
    }

    @Test
    void merge_lets_incoming_value_win_on_collision() {
        var outer = Captures.of("id", "outer", "name", "x");

        outer.merge(Captures.of("id", "inner"));

        assertThat(outer.entries()).containsExactly(new Captures.Capture("id", "inner"),
                                                    new Captures.Capture("name", "x"));
    }

    @Test
    void entries_snapshot_is_read_only() {
        var entries = Captures.of("id", "1").entries();

        assertThatThrownBy(() -> entries.add(new Captures.Capture("x", "y")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void of_list_builds_store_in_order() {
        var captures = Captures.of(List.of(new Captures.Capture("b", "2"), new Captures.Capture("a", "1")));

        assertThat(captures.asMap().keySet()).containsExactly("b", "a");
        assertThat(captures.containsKey("a")).isTrue();
        assertThat(captures.isEmpty()).isFalse();
    }

    @Test
    void null_values_are_rejected() {
        assertThatThrownBy(() -> Captures.empty().insert("id", null))
                .isInstanceOf(NullPointerException.class);
    }
}
