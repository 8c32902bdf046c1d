package dev.uimigrator.mapping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.uimigrator.model.XamlNamespaces;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonMappingLoaderTest {

    private final JsonMappingLoader loader = new JsonMappingLoader();

    @Test
    void parsesAllSectionsAndIgnoresUnknownFields() {
        MappingDatabase database = loader.parse("""
                {
                  "version": "2.1",
                  "generatedBy": "hand",
                  "types": [
                    {"sourceType": "System.Windows.Controls.Label", "targetType": "Avalonia.Controls.Label",
                     "targetNamespace": "https://github.com/avaloniaui"}
                  ],
                  "properties": [
                    {"sourceName": "Visibility", "targetName": "IsVisible",
                     "valueConversions": {"Visible": "True", "Collapsed": "False"}},
                    {"sourceName": "SnapsToDevicePixels", "targetName": ""}
                  ],
                  "namespaces": [
                    {"sourceNamespace": "http://schemas.microsoft.com/winfx/2006/xaml/presentation",
                     "targetNamespace": "https://github.com/avaloniaui"}
                  ]
                }
                """);

        assertThat(database.version()).isEqualTo("2.1");
        assertThat(database.types()).singleElement().satisfies(type -> {
            assertThat(type.targetSimpleName()).isEqualTo("Label");
            assertThat(type.requiresManualReview()).isFalse();
            assertThat(type.notes()).isEmpty();
        });
        assertThat(database.properties()).hasSize(2);
        assertThat(database.properties().get(0).convertValue("Collapsed")).contains("False");
        assertThat(database.properties().get(1).isRemoval()).isTrue();
        assertThat(database.namespaces()).singleElement()
                .satisfies(namespace -> assertThat(namespace.targetNamespace()).isEqualTo(XamlNamespaces.AVALONIA));
    }

    @Test
    void missingSectionsBecomeEmpty() {
        MappingDatabase database = loader.parse("{\"version\": \"1\"}");

        assertThat(database.types()).isEmpty();
        assertThat(database.properties()).isEmpty();
        assertThat(database.namespaces()).isEmpty();
    }

    @Test
    void bundledDefaultsCoverThePresentationNamespace() {
        MappingDatabase database = loader.loadDefaults();

        assertThat(database.namespaces()).extracting(NamespaceMapping::sourceNamespace)
                .contains(XamlNamespaces.WPF_PRESENTATION);
        assertThat(database.types()).extracting(TypeMapping::sourceType).contains("System.Windows.Controls.GroupBox");
        assertThat(database.properties()).extracting(PropertyMapping::sourceName).contains("ToolTip");
    }

    @Test
    void loadsFromFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("mappings.json");
        Files.writeString(file, "{\"types\": [{\"sourceType\": \"A.B\", \"targetType\": \"C.D\"}]}");

        assertThat(loader.load(file).types()).extracting(TypeMapping::targetType).containsExactly("C.D");
    }

    @Test
    void invalidContentIsAMappingLoadException(@TempDir Path tempDir) {
        assertThatThrownBy(() -> loader.parse("{ not json")).isInstanceOf(MappingLoadException.class);
        assertThatThrownBy(() -> loader.parse("{\"types\": [{\"sourceType\": \"\", \"targetType\": \"X\"}]}"))
                .isInstanceOf(MappingLoadException.class);
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.json")))
                .isInstanceOf(MappingLoadException.class)
                .hasMessageContaining("absent.json");
    }
}
