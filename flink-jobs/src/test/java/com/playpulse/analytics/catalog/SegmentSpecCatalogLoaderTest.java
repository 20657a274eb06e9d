package com.playpulse.analytics.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import com.playpulse.analytics.model.SegmentSpec;
import com.playpulse.analytics.util.JsonSupport;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SegmentSpecCatalogLoaderTest {

    @Test
    void loadDefaultCatalogResolvesKnownAndUnknownProjects() {
        SegmentSpecCatalog catalog = SegmentSpecCatalogLoader.loadDefault();

        List<SegmentSpec> demo = catalog.specsFor("demo-platformer");
        assertEquals(2, demo.size());
        assertEquals("menu", demo.get(0).name);
        assertEquals(0.35, demo.get(0).rangeHigh);
        assertEquals("level_1", demo.get(1).name);

        List<SegmentSpec> fallback = catalog.specsFor("unknown-project");
        assertEquals(3, fallback.size());
        assertEquals("tutorial", fallback.get(0).name);
        assertEquals(fallback.size(), catalog.specsFor(null).size());
    }

    @Test
    void specsForReturnsIndependentCopies() {
        SegmentSpecCatalog catalog = SegmentSpecCatalogLoader.loadDefault();

        catalog.specsFor("demo-platformer").clear();

        assertEquals(2, catalog.specsFor("demo-platformer").size());
    }

    @Test
    void invalidCatalogNamesOffendingField() throws Exception {
        JsonNode root = JsonSupport.MAPPER.readTree("{\"catalog_version\":\"x\",\"projects\":[{\"project_id\":\"p\","
                + "\"segments\":[{\"name\":\"a\",\"target_dimension\":\"calm\",\"acceptable_range\":[0.8,0.1],"
                + "\"expected_duration_sec\":5}]}]}");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> SegmentSpecCatalogLoader.parseCatalog(root));

        assertTrue(ex.getMessage().contains("projects[0].segments[0].acceptable_range"));
    }

    @Test
    void missingClasspathResourceYieldsNull() {
        assertNull(SegmentSpecCatalogLoader.loadFromClasspath("reference/does-not-exist.json"));
    }
}
