package com.playpulse.analytics.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.Properties;

/**
 * Build version and commit, read from the filtered {@code build-info.properties} resource.
 */
public final class BuildMetadata implements Serializable {
    private static final long serialVersionUID = 1L;
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(BuildMetadata.class);

    static final String BUILD_INFO_RESOURCE = "build-info.properties";
    private static final BuildMetadata INSTANCE = fromProperties(loadProperties());

    private final String version;
    private final String gitCommit;

    private BuildMetadata(String version, String gitCommit) {
        this.version = orFallback(version, "dev");
        this.gitCommit = orFallback(gitCommit, "unknown");
    }

    public static BuildMetadata current() {
        return INSTANCE;
    }

    public String version() {
        return version;
    }

    public String gitCommit() {
        return gitCommit;
    }

    public String identity() {
        return version + "+" + gitCommit;
    }

    static BuildMetadata fromProperties(Properties props) {
        return new BuildMetadata(props.getProperty("build.version"), props.getProperty("build.git.commit"));
    }

    private static Properties loadProperties() {
        Properties props = new Properties();
        try (InputStream in = BuildMetadata.class.getClassLoader().getResourceAsStream(BUILD_INFO_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException ex) {
            LOG.warn("Unable to read {}: {}", BUILD_INFO_RESOURCE, ex.getMessage());
        }
        return props;
    }

    // Unfiltered placeholders (IDE runs) count as missing.
    private static String orFallback(String value, String fallback) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty() || (trimmed.startsWith("${") && trimmed.endsWith("}"))) {
            return fallback;
        }
        return trimmed;
    }
}
