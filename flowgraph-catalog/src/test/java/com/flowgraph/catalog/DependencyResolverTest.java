package com.flowgraph.catalog;

import com.flowgraph.document.model.ConfigDocument;
import com.flowgraph.document.model.Role;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyResolverTest {

    private final DependencyResolver resolver = new DependencyResolver();
    private final CategorizedPluginDescriptors plugins =
            InMemoryPluginCatalog.fromResource("test-catalog.json").listPlugins();

    @Test
    void requirements_detectsProviderAndStorageByTypeOrName() {
        assertEquals(new DependencyRequirements(true, true),
                resolver.requirements(plugins.find("DailySummaryGenerator").orElseThrow()));
        assertEquals(new DependencyRequirements(true, false),
                resolver.requirements(plugins.find("AiTopicsEnricher").orElseThrow()));
        assertEquals(DependencyRequirements.NONE, resolver.requirements(plugins.find("RSSSource").orElseThrow()));

        PluginDescriptor byName = PluginDescriptor.of("X", Role.SOURCES, List.of(),
                List.of(ParameterDef.of("storage", "object", false)));
        assertTrue(resolver.requirements(byName).needsStorage());
    }

    @Test
    void plan_createsDefaultsWhenDocumentHasNone() {
        DependencyPlan plan = resolver.plan(ConfigDocument.empty("d"),
                plugins.find("DailySummaryGenerator").orElseThrow());

        assertEquals("OpenAIProvider", plan.getProviderToAdd().getName());
        assertEquals("gpt-4o-mini", plan.getProviderToAdd().getParams().get("model"));
        assertEquals("SQLiteStorage", plan.getStorageToAdd().getName());
        assertEquals(Map.of("provider", "OpenAIProvider", "storage", "SQLiteStorage"), plan.dependencyParams());
    }

    @Test
    void plan_reusesFirstExistingEntries() {
        ConfigDocument doc = ConfigDocument.builder("d")
                .add(Role.AI, "gpt", Map.of())
                .add(Role.AI, "claude", Map.of())
                .add(Role.STORAGE, "db", Map.of())
                .build();

        DependencyPlan plan = resolver.plan(doc, plugins.find("DailySummaryGenerator").orElseThrow());

        assertNull(plan.getProviderToAdd());
        assertNull(plan.getStorageToAdd());
        assertEquals("gpt", plan.getProviderName());
        assertEquals("db", plan.getStorageName());
    }

    @Test
    void plan_withoutRequirementsIsEmpty() {
        DependencyPlan plan = resolver.plan(ConfigDocument.empty("d"), plugins.find("RSSSource").orElseThrow());

        assertTrue(plan.dependencyParams().isEmpty());
        assertFalse(plan.getRequirements().needsProvider());
        assertNull(plan.getProviderToAdd());
    }

    @Test
    void plan_topLevelRolesHaveNoDependencies() {
        PluginDescriptor vectorStore = PluginDescriptor.of("VectorStorage", Role.STORAGE, List.of(),
                List.of(ParameterDef.of("provider", "AIProvider", true)));

        assertEquals(DependencyRequirements.NONE, resolver.requirements(vectorStore));
        DependencyPlan plan = resolver.plan(ConfigDocument.empty("d"), vectorStore);
        assertNull(plan.getProviderToAdd());
        assertTrue(plan.dependencyParams().isEmpty());
    }
}
