package com.playpulse.analytics.catalog;

import com.playpulse.analytics.model.SegmentSpec;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only segment specs per project, used when a finalize request carries no spec snapshot.
 */
public final class SegmentSpecCatalog implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String version;
    private final List<SegmentSpec> defaultSpecs;
    private final Map<String, List<SegmentSpec>> specsByProject;

    public SegmentSpecCatalog(String version, List<SegmentSpec> defaultSpecs, Map<String, List<SegmentSpec>> specsByProject) {
        this.version = version;
        this.defaultSpecs = defaultSpecs == null ? new ArrayList<>() : new ArrayList<>(defaultSpecs);
        this.specsByProject = specsByProject == null ? new HashMap<>() : new HashMap<>(specsByProject);
    }

    public static SegmentSpecCatalog empty() {
        return new SegmentSpecCatalog("empty", Collections.emptyList(), Collections.emptyMap());
    }

    public String version() {
        return version;
    }

    /**
     * Project specs in authored order, the catalog defaults when the project is unknown.
     * Returns a copy; callers may freeze it as a snapshot.
     */
    public List<SegmentSpec> specsFor(String projectId) {
        List<SegmentSpec> specs = projectId == null ? null : specsByProject.get(projectId);
        return new ArrayList<>(specs == null ? defaultSpecs : specs);
    }

    public int projectCount() {
        return specsByProject.size();
    }
}
