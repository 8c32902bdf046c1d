package dev.uimigrator.mapping;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryMappingSourceTest {

    private final MappingSource source = new InMemoryMappingSource(new MappingDatabase("1",
            List.of(new TypeMapping("System.Windows.Controls.Calendar", "Avalonia.Controls.Calendar", "avalonia"),
                    new TypeMapping("Toolkit.Calendar", "Avalonia.Controls.CalendarDatePicker", "avalonia")),
            List.of(new PropertyMapping("Header", "Content"),
                    new PropertyMapping("Header", "Title", "Window", Map.of(), false, "")),
            List.of(new NamespaceMapping("old", "new", ""))));

    @Test
    void typesAreIndexedBySimpleAndQualifiedNameIgnoringCase() {
        assertThat(source.typesNamed("calendar")).extracting(TypeMapping::targetType)
                .containsExactly("Avalonia.Controls.Calendar", "Avalonia.Controls.CalendarDatePicker");
        assertThat(source.findTypeByQualifiedName("TOOLKIT.Calendar")).map(TypeMapping::targetSimpleName)
                .contains("CalendarDatePicker");
        assertThat(source.typesNamed(null)).isEmpty();
    }

    @Test
    void scopedPropertyMappingWinsOverUnscoped() {
        assertThat(source.findProperty("Header", "Window")).map(PropertyMapping::targetName).contains("Title");
        assertThat(source.findProperty("Header", "Expander")).map(PropertyMapping::targetName).contains("Content");
        assertThat(source.findProperty("Header", null)).map(PropertyMapping::targetName).contains("Content");
        assertThat(source.findProperty("Footer", "Window")).isEmpty();
    }

    @Test
    void namespacesMatchExactly() {
        assertThat(source.findNamespace("old")).map(NamespaceMapping::targetNamespace).contains("new");
        assertThat(source.findNamespace("OLD")).isEmpty();
        assertThat(MappingSource.empty().findNamespace("old")).isEmpty();
    }
}
