package org.neuralchilli.festival.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Splits a markdown file into YAML frontmatter and body.
 *
 * Frontmatter must open on the first line with {@code ---} and close with another
 * {@code ---} line. Unclosed or malformed frontmatter is treated as absent.
 */
public class FrontmatterParser {

    private static final Logger log = LoggerFactory.getLogger(FrontmatterParser.class);

    private static final String DELIMITER = "---";

    private final Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));

    public Frontmatter parse(String content) {
        if (content == null || content.isEmpty()) {
            return Frontmatter.none("");
        }

        String[] lines = content.split("\\R", -1);
        if (!lines[0].strip().equals(DELIMITER)) {
            return Frontmatter.none(content);
        }

        int closing = -1;
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].strip().equals(DELIMITER)) {
                closing = i;
                break;
            }
        }

        if (closing < 0) {
            log.trace("Unclosed frontmatter, treating file as plain markdown");
            return Frontmatter.none(content);
        }

        String yamlContent = String.join("\n", Arrays.copyOfRange(lines, 1, closing));
        String body = String.join("\n", Arrays.copyOfRange(lines, closing + 1, lines.length));

        return new Frontmatter(load(yamlContent), body);
    }

    private Map<String, Object> load(String yamlContent) {
        if (yamlContent.isBlank()) {
            return Map.of();
        }
        try {
            Object data = yaml.load(yamlContent);
            if (!(data instanceof Map<?, ?> map)) {
                return Map.of();
            }
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                if (k != null) {
                    result.put(k.toString(), v);
                }
            });
            return result;
        } catch (YAMLException e) {
            log.debug("Ignoring malformed frontmatter: {}", e.getMessage());
            return Map.of();
        }
    }
}
