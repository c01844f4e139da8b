package com.gridplanner.core.config;

import com.gridplanner.core.model.CategoryStyle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CategoryCatalogTest {

    @Test
    @DisplayName("built-in catalog holds the eight planner categories")
    void defaults() {
        CategoryCatalog catalog = CategoryCatalog.defaults();
        assertEquals(8, catalog.all().size());
        assertEquals("#50E3C2", catalog.lookup("RESEARCH").color());
        assertEquals(6, catalog.lookup("RESEARCH").weight());
        assertTrue(catalog.lookup("MILESTONE").milestone());
    }

    @Test
    @DisplayName("lookup ignores case and surrounding whitespace")
    void caseInsensitive() {
        CategoryCatalog catalog = CategoryCatalog.defaults();
        assertEquals("#D0021B", catalog.lookup(" dissertation ").color());
        assertTrue(catalog.contains("Laser"));
    }

    @Test
    @DisplayName("unknown and null categories resolve to neutral gray")
    void unknownCategory() {
        CategoryCatalog catalog = CategoryCatalog.defaults();
        CategoryStyle unknown = catalog.lookup("GARDENING");
        assertEquals(CategoryCatalog.DEFAULT_COLOR, unknown.color());
        assertEquals(CategoryCatalog.NEUTRAL_WEIGHT, unknown.weight());
        assertFalse(unknown.milestone());
        assertEquals(CategoryCatalog.DEFAULT_COLOR, catalog.lookup(null).color());
        assertFalse(catalog.contains("GARDENING"));
    }

    @Test
    @DisplayName("custom catalog normalizes keys")
    void customCatalog() {
        CategoryCatalog catalog = CategoryCatalog.of(List.of(new CategoryStyle("fieldwork", "Field Work", "#112233", 8, false)));
        assertEquals("FIELDWORK", catalog.lookup("FieldWork").name());
        assertEquals(8, catalog.lookup("fieldwork").weight());
        assertThrows(UnsupportedOperationException.class, () -> catalog.all().clear());
    }
}
