package org.neuralchilli.festival.config;

import org.neuralchilli.festival.domain.TaskMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts dependency metadata from the content of a task file.
 *
 * Recognized sources, each optional:
 * <ul>
 *   <li>frontmatter hard/soft dependency lists, parallel group, autonomy and tracking flag</li>
 *   <li>a legacy {@code Dependencies: a, b} line in the body</li>
 *   <li>a legacy {@code Autonomy Level: high} line in the body</li>
 * </ul>
 * Extraction never fails; anything unreadable falls back to its default.
 */
public class TaskMetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(TaskMetadataExtractor.class);

    // "Dependencies: a, b", "**Dependencies:** a", "> Dependencies: a | Owner: x"
    private static final Pattern LEGACY_DEPENDENCIES = Pattern.compile(
            "(?im)^[ \\t>|*_-]*Dependencies[*_]*[ \\t]*:[*_ \\t]*([^|\\r\\n]*)");

    private static final Pattern LEGACY_AUTONOMY = Pattern.compile(
            "(?i)Autonomy\\s+Level\\*{0,2}[:\\s*]+(\\w+)");

    private final ResolverSettings settings;
    private final FrontmatterParser frontmatterParser;

    public TaskMetadataExtractor(ResolverSettings settings) {
        this(settings, new FrontmatterParser());
    }

    public TaskMetadataExtractor(ResolverSettings settings, FrontmatterParser frontmatterParser) {
        if (settings == null) {
            throw new IllegalArgumentException("Resolver settings cannot be null");
        }
        this.settings = settings;
        this.frontmatterParser = frontmatterParser;
    }

    /**
     * Extract metadata from a task file's content.
     *
     * @param path    file the content came from; used for logging only
     * @param content raw file content, may be null
     */
    public TaskMetadata extract(Path path, String content) {
        if (content == null || content.isBlank()) {
            return TaskMetadata.empty();
        }

        Frontmatter frontmatter = frontmatterParser.parse(content);

        Set<String> hard = new LinkedHashSet<>(parseLegacyDependencies(frontmatter.body()));
        hard.addAll(frontmatter.getStringList(settings.hardDependenciesField()));

        List<String> soft = frontmatter.getStringList(settings.softDependenciesField());
        Integer parallelGroup = frontmatter.getInteger(settings.parallelGroupField()).orElse(null);
        String autonomy = frontmatter.getString(settings.autonomyField())
                .map(value -> value.toLowerCase(Locale.ROOT))
                .or(() -> parseLegacyAutonomy(frontmatter.body()))
                .orElse(null);
        boolean tracked = frontmatter.getBoolean(settings.trackingField(), true);

        TaskMetadata metadata = new TaskMetadata(
                new ArrayList<>(hard),
                new ArrayList<>(new LinkedHashSet<>(soft)),
                parallelGroup,
                autonomy,
                tracked
        );

        log.trace("Extracted metadata from {}: {}", path, metadata);
        return metadata;
    }

    static List<String> parseLegacyDependencies(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        Matcher matcher = LEGACY_DEPENDENCIES.matcher(text);
        if (!matcher.find()) {
            return List.of();
        }

        String value = matcher.group(1).replace("*", "").trim();
        if (value.isEmpty() || value.equalsIgnoreCase("none")) {
            return List.of();
        }

        List<String> result = new ArrayList<>();
        for (String part : value.split(",")) {
            String ref = part.trim();
            if (!ref.isEmpty()) {
                result.add(ref);
            }
        }
        return result;
    }

    static Optional<String> parseLegacyAutonomy(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = LEGACY_AUTONOMY.matcher(text);
        if (matcher.find()) {
            return Optional.of(matcher.group(1).toLowerCase(Locale.ROOT));
        }
        return Optional.empty();
    }
}
