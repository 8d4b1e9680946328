package com.flowgraph.catalog;

import com.flowgraph.document.model.Role;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryPluginCatalogTest {

    @Test
    void fromResource_groupsDescriptorsByRole() {
        CategorizedPluginDescriptors plugins = InMemoryPluginCatalog.fromResource("test-catalog.json").listPlugins();

        assertEquals(5, plugins.size());
        assertEquals(1, plugins.forRole(Role.SOURCES).size());
        assertEquals("RSSSource", plugins.forRole(Role.SOURCES).get(0).getPluginName());
        assertEquals(Role.GENERATORS, plugins.find("DailySummaryGenerator").orElseThrow().getRole());
        assertTrue(plugins.find(Role.AI, "RSSSource").isEmpty());
    }

    @Test
    void fromResource_readsConfigSchemaInOrderWithNames() {
        PluginDescriptor rss = InMemoryPluginCatalog.fromResource("test-catalog.json")
                .listPlugins().find("RSSSource").orElseThrow();

        List<ParameterDef> schema = rss.getConfigParameters();
        assertEquals("url", schema.get(0).getName());
        assertTrue(schema.get(0).isRequired());
        assertEquals("maxItems", schema.get(1).getName());
        assertEquals("number", schema.get(1).getType());
    }

    @Test
    void register_rejectsDuplicateNameInSameRole() {
        InMemoryPluginCatalog catalog = new InMemoryPluginCatalog();
        catalog.register(PluginDescriptor.of("RSSSource", Role.SOURCES, List.of(), List.of()));

        assertThrows(IllegalArgumentException.class,
                () -> catalog.register(PluginDescriptor.of("RSSSource", Role.SOURCES, List.of(), List.of())));
        catalog.register(PluginDescriptor.of("RSSSource", Role.ENRICHERS, List.of(), List.of()));
        assertEquals(2, catalog.listPlugins().size());
    }

    @Test
    void register_rejectsMissingRole() {
        InMemoryPluginCatalog catalog = new InMemoryPluginCatalog();
        assertThrows(IllegalArgumentException.class,
                () -> catalog.register(PluginDescriptor.of("X", null, List.of(), List.of())));
    }

    @Test
    void listPlugins_isSnapshot() {
        InMemoryPluginCatalog catalog = new InMemoryPluginCatalog();
        CategorizedPluginDescriptors before = catalog.listPlugins();
        catalog.register(PluginDescriptor.of("RSSSource", Role.SOURCES, List.of(), List.of()));

        assertEquals(0, before.size());
        assertEquals(1, catalog.listPlugins().size());
    }

    @Test
    void fromJson_invalidThrowsUnchecked() {
        assertThrows(UncheckedIOException.class, () -> InMemoryPluginCatalog.fromJson("{"));
    }
}
