package dev.station.secret;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompositeSecretStoreTest {

    @Test
    void firstStoreDeclaringNameWins() {
        var overrides = new MapSecretStore(Map.of("FOO", "override"));
        var keystore = new MapSecretStore(Map.of("FOO", "stored", "BAR", "stored-bar"));

        var store = new CompositeSecretStore(List.of(overrides, keystore));

        assertThat(store.get("FOO")).isEqualTo("override");
        assertThat(store.get("BAR")).isEqualTo("stored-bar");
    }

    @Test
    void missingEverywhereIsNotFound() {
        var store = new CompositeSecretStore(List.of(SecretStore.empty(), SecretStore.empty()));

        assertThatThrownBy(() -> store.get("FOO")).isInstanceOf(SecretNotFoundException.class);
    }

    @Test
    void unavailableStoreIsNotSkipped() {
        SecretStore broken = name -> {
            throw new SecretStoreUnavailableException("keystore offline", null);
        };
        var store = new CompositeSecretStore(List.of(SecretStore.empty(), broken, new MapSecretStore(Map.of("FOO", "x"))));

        assertThatThrownBy(() -> store.get("FOO")).isInstanceOf(SecretStoreUnavailableException.class);
    }
}
