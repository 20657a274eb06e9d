package com.playpulse.analytics.catalog;

import com.fasterxml.jackson.databind.JsonNode;

import com.playpulse.analytics.model.SegmentSpec;
import com.playpulse.analytics.parse.JsonNodeUtils;
import com.playpulse.analytics.parse.SegmentSpecParser;
import com.playpulse.analytics.parse.TelemetryValidationException;
import com.playpulse.analytics.util.JsonSupport;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the segment spec catalog from classpath or filesystem.
 *
 * Lookup order:
 * 1) JVM property `playpulse.segment.catalog.path`
 * 2) classpath resource `reference/segment_specs.v1.json`
 * 3) repository fallback `configs/reference/segment_specs.v1.json`
 */
public final class SegmentSpecCatalogLoader {
    public static final String CATALOG_PROPERTY = "playpulse.segment.catalog.path";
    public static final String DEFAULT_CLASSPATH_RESOURCE = "reference/segment_specs.v1.json";
    public static final Path DEFAULT_REPO_PATH = Path.of("configs/reference/segment_specs.v1.json");

    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(SegmentSpecCatalogLoader.class);

    private SegmentSpecCatalogLoader() {}

    public static SegmentSpecCatalog loadDefault() {
        String overridePath = System.getProperty(CATALOG_PROPERTY);
        if (overridePath != null && !overridePath.isBlank()) {
            return loadFromFile(Path.of(overridePath));
        }

        SegmentSpecCatalog fromClasspath = loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
        if (fromClasspath != null) {
            return fromClasspath;
        }

        return loadFromFile(DEFAULT_REPO_PATH);
    }

    static SegmentSpecCatalog loadFromClasspath(String resourcePath) {
        try (InputStream in = SegmentSpecCatalogLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                return null;
            }
            SegmentSpecCatalog catalog = parseCatalog(JsonSupport.MAPPER.readTree(in));
            LOG.info("Loaded segment spec catalog version={} projects={} from classpath:{}",
                    catalog.version(), catalog.projectCount(), resourcePath);
            return catalog;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load segment spec catalog from classpath: " + resourcePath, ex);
        }
    }

    static SegmentSpecCatalog loadFromFile(Path path) {
        if (!Files.exists(path)) {
            throw new IllegalStateException("Segment spec catalog file not found: " + path);
        }
        try {
            SegmentSpecCatalog catalog = parseCatalog(JsonSupport.MAPPER.readTree(path.toFile()));
            LOG.info("Loaded segment spec catalog version={} projects={} from {}",
                    catalog.version(), catalog.projectCount(), path);
            return catalog;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load segment spec catalog from file: " + path, ex);
        }
    }

    static SegmentSpecCatalog parseCatalog(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Segment spec catalog is not a JSON object");
        }
        String version = root.path("catalog_version").asText("unknown");
        try {
            List<SegmentSpec> defaults = root.has("default_segments")
                    ? SegmentSpecParser.parseList(root.path("default_segments"), "default_segments")
                    : List.of();

            Map<String, List<SegmentSpec>> byProject = new HashMap<>();
            JsonNode projects = root.path("projects");
            if (projects.isArray()) {
                for (int i = 0; i < projects.size(); i++) {
                    JsonNode project = projects.get(i);
                    String field = "projects[" + i + "]";
                    String projectId = JsonNodeUtils.requireText(project.path("project_id"), field + ".project_id");
                    byProject.put(projectId, SegmentSpecParser.parseList(project.path("segments"), field + ".segments"));
                }
            }
            return new SegmentSpecCatalog(version, defaults, byProject);
        } catch (TelemetryValidationException ex) {
            throw new IllegalStateException("Invalid segment spec catalog (field=" + ex.field() + "): " + ex.getMessage(), ex);
        }
    }
}
