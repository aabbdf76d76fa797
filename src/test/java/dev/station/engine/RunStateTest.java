package dev.station.engine;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunStateTest {

    @Test
    void startsEmpty() {
        var state = RunState.fresh("run-1");

        assertThat(state.runId()).isEqualTo("run-1");
        assertThat(state.keys()).isEmpty();
        assertThat(state.get("Foo")).isEmpty();
    }

    @Test
    void setValuesAreReadBack() {
        var state = RunState.fresh("run-1");

        state.set("Foo", "Bar");
        state.set("Baz", 42);

        assertThat(state.get("Foo")).contains("Bar");
        assertThat(state.require("Baz", Integer.class)).isEqualTo(42);
        assertThat(state.keys()).containsExactly("Foo", "Baz");
    }

    @Test
    void overwritingAKeyKeepsLatestValue() {
        var state = RunState.fresh("run-1");

        state.set("Baz", 41);
        state.set("Baz", 42);

        assertThat(state.get("Baz")).contains(42);
        assertThat(state.keys()).hasSize(1);
    }

    @Test
    void settingNullRemovesKey() {
        var state = RunState.fresh("run-1");
        state.set("Foo", "Bar");

        state.set("Foo", null);

        assertThat(state.contains("Foo")).isFalse();
    }

    @Test
    void requireFailsForMissingKey() {
        var state = RunState.fresh("run-1");

        assertThatThrownBy(() -> state.require("Foo", String.class))
            .isInstanceOf(NoSuchElementException.class)
            .hasMessageContaining("Foo");
    }

    @Test
    void requireFailsForWrongType() {
        var state = RunState.fresh("run-1");
        state.set("Baz", 42);

        assertThatThrownBy(() -> state.require("Baz", String.class))
            .isInstanceOf(ClassCastException.class);
    }

    @Test
    void snapshotIsDetachedFromLaterWrites() {
        var state = RunState.fresh("run-1");
        state.set("Foo", "Bar");

        var snapshot = state.snapshot();
        state.set("Baz", 42);

        assertThat(snapshot).containsOnlyKeys("Foo");
    }
}
