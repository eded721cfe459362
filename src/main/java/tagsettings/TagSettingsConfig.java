package tagsettings;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Engine settings, read from the {@code tag-settings} section of a YAML document:
 *
 * <pre>
 * tag-settings:
 *   source: tag_settings.csv
 *   fallback-category: Other
 *   placeholder-names: ["*", default, unused1, unused2, unused3, unused4]
 *   fsync-on-commit: false
 * </pre>
 *
 * Keys that are left out keep their built-in values.
 */
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class TagSettingsConfig {

    public static final String DEFAULT_RESOURCE = "tag-settings.yml";

    private static final String ROOT_KEY = "tag-settings";

    @Builder.Default
    private String source = "tag_settings.csv";
    @Builder.Default
    private String fallbackCategory = "Other";
    @Builder.Default
    private List<String> placeholderNames = new ArrayList<>(
            List.of("*", "default", "unused1", "unused2", "unused3", "unused4"));
    @Builder.Default
    private boolean fsyncOnCommit = false;

    public static TagSettingsConfig defaults() {
        return TagSettingsConfig.builder().build();
    }

    public static TagSettingsConfig load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return fromYaml(new Yaml().load(reader));
        } catch (IOException e) {
            throw new TagSettingsException("Cannot read configuration " + file, e);
        }
    }

    public static TagSettingsConfig loadFromClasspath(String resource) {
        ClassLoader loader = TagSettingsConfig.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                return defaults();
            }
            return fromYaml(new Yaml().load(in));
        } catch (IOException e) {
            throw new TagSettingsException("Cannot read configuration resource " + resource, e);
        }
    }

    static TagSettingsConfig fromYaml(Object document) {
        TagSettingsConfig config = defaults();
        if (!(document instanceof Map)) {
            return config;
        }
        Object section = ((Map<?, ?>) document).get(ROOT_KEY);
        if (section == null) {
            return config;
        }
        if (!(section instanceof Map)) {
            throw new TagSettingsException("'" + ROOT_KEY + "' must be a mapping");
        }
        Map<?, ?> values = (Map<?, ?>) section;

        Object source = values.get("source");
        if (source != null) {
            config.setSource(source.toString());
        }
        Object fallbackCategory = values.get("fallback-category");
        if (fallbackCategory != null) {
            config.setFallbackCategory(fallbackCategory.toString());
        }
        Object placeholders = values.get("placeholder-names");
        if (placeholders != null) {
            if (!(placeholders instanceof List)) {
                throw new TagSettingsException("'placeholder-names' must be a list");
            }
            List<String> names = new ArrayList<>();
            for (Object name : (List<?>) placeholders) {
                names.add(String.valueOf(name));
            }
            config.setPlaceholderNames(names);
        }
        Object fsync = values.get("fsync-on-commit");
        if (fsync != null) {
            config.setFsyncOnCommit(BooleanTokens.parse(fsync.toString(), false));
        }
        return config;
    }

    public Path getSourcePath() {
        return Paths.get(StringUtils.trimToEmpty(source));
    }

    public Set<String> normalizedPlaceholderNames() {
        return placeholderNames.stream()
                .map(StringUtils::trimToEmpty)
                .map(x -> x.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
