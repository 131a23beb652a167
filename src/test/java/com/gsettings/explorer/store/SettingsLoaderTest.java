package com.gsettings.explorer.store;

import com.gsettings.explorer.model.KeyMetadata;
import com.gsettings.explorer.model.KeyTree;
import com.gsettings.explorer.value.ScalarValue;
import com.gsettings.explorer.value.text.ValueTextParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SettingsLoaderTest {

    private final SettingsLoader loader = new SettingsLoader();

    @Test
    void testBrokenKeysAreReportedAndOthersStillLoad() {
        InMemorySchemaSource schemas = new InMemorySchemaSource()
                .register(key("org.example.a", "numbers", "ai").defaultValue(ValueTextParser.parse("ai", "[1, 2]")).build())
                .register(key("org.example.a", "broken-type", "a{vs}").build())
                .register(key("org.example.b", "wrong-value", "ai").build())
                .register(key("org.example.b", "empty", "s").build())
                .register(key("org.example.b", "flag", "b").build());
        InMemorySettingsStore store = new InMemorySettingsStore(schemas);
        store.preload("org.example.a", "broken-type", null, ScalarValue.ofInt32(1));
        store.preload("org.example.b", "wrong-value", null, ScalarValue.ofString("x"));
        store.preload("org.example.b", "flag", null, ScalarValue.ofBoolean(true));

        LoadResult result = loader.load(schemas, store, null);

        assertThat(result.getTrees())
                .extracting(t -> t.getMetadata().toString())
                .containsExactly("org.example.a.numbers", "org.example.b.flag");
        assertThat(result.getKeysWithoutValue()).extracting(KeyMetadata::getKeyName).containsExactly("empty");
        assertThat(result.getDiagnostics().hasFailures()).isTrue();
        assertThat(result.getDiagnostics().getFailedKeys())
                .containsOnlyKeys("org.example.a.broken-type", "org.example.b.wrong-value");
        assertThat(result.getDiagnostics().getFailedKeys().get("org.example.a.broken-type"))
                .contains("Malformed type signature");
    }

    @Test
    void testRelocationPathIsUsedForReads() {
        InMemorySchemaSource schemas = new InMemorySchemaSource()
                .register(key("org.example.profile", "name", "s").build());
        InMemorySettingsStore store = new InMemorySettingsStore(schemas);
        store.write("org.example.profile", "name", "/profiles/a/", ScalarValue.ofString("A"));

        LoadResult atA = loader.load(schemas, store, "/profiles/a/");
        LoadResult atB = loader.load(schemas, store, "/profiles/b/");

        KeyTree tree = atA.find("org.example.profile", "name").orElseThrow();
        assertThat(tree.nodeAt(List.of()).getDisplayValue()).isEqualTo("A");
        assertThat(atB.getTrees()).isEmpty();
        assertThat(atB.getKeysWithoutValue()).hasSize(1);
        assertThat(atB.getDiagnostics().hasFailures()).isFalse();
    }

    private static KeyMetadata.KeyMetadataBuilder key(String schemaId, String keyName, String type) {
        return KeyMetadata.builder().schemaId(schemaId).keyName(keyName).type(type);
    }
}
