package tagsettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tagsettings.csv.CsvTable;
import tagsettings.csv.FlatCsv;
import tagsettings.csv.FlatTableService;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

public class TagSettingsStore {

    private static final Logger log = LoggerFactory.getLogger(TagSettingsStore.class);

    private final Path source;
    private final boolean fsyncOnCommit;
    private final FlatTableService tableService;
    private final TagRowParser parser;
    private final TagSettingsResolver resolver;

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();
    private final ReentrantLock lock = new ReentrantLock();

    public TagSettingsStore(TagSettingsConfig config) {
        this(config.getSourcePath(), config);
    }

    public TagSettingsStore(Path source) {
        this(source, TagSettingsConfig.defaults());
    }

    public TagSettingsStore(Path source, TagSettingsConfig config) {
        this.source = source;
        this.fsyncOnCommit = config.isFsyncOnCommit();
        this.tableService = new FlatCsv();
        this.parser = new TagRowParser(tableService, config);
        this.resolver = new TagSettingsResolver(config);
    }

    public Path getSource() {
        return source;
    }

    public boolean isLoaded() {
        return snapshot.get() != null;
    }

    public void invalidate() {
        lock.lock();
        try {
            snapshot.set(null);
        } finally {
            lock.unlock();
        }
    }

    public void reload() {
        invalidate();
        current();
    }

    public Map<String, Boolean> getAllTagStatuses() {
        return current().index.asMap();
    }

    public Set<String> getEnabledTags() {
        return current().index.getEnabledTags();
    }

    public boolean isTagEnabled(String tagName) {
        return current().index.isEnabled(tagName);
    }

    public EffectiveSettings resolve(String tagName) {
        return current().resolve(tagName);
    }

    public List<EffectiveSettings> resolveAll(boolean includeDisabled) {
        return current().resolveAll(includeDisabled);
    }

    /**
     * Resolved tags and the default line taken from one and the same read of the file.
     */
    public ResolvedTags resolveAllWithDefaults(boolean includeDisabled) {
        Snapshot current = current();
        return new ResolvedTags(current.resolveAll(includeDisabled), current.parsed.getDefaults(), current.loaded);
    }

    public DefaultRow getDefaults() {
        return current().parsed.getDefaults();
    }

    public void updateTagEnabledStatus(Map<String, Boolean> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return;
        }
        Map<String, TagSettingsPatch> patches = new LinkedHashMap<>();
        statuses.forEach((name, enabled) -> patches.put(name, TagSettingsPatch.enabledOnly(enabled)));
        write(patches, "enabled status");
    }

    public void updateTagSettings(Map<String, TagSettingsPatch> settings) {
        if (settings == null || settings.isEmpty()) {
            return;
        }
        write(new LinkedHashMap<>(settings), "settings");
    }

    private void write(Map<String, TagSettingsPatch> patches, String what) {
        lock.lock();
        try {
            CsvTable table = readTableForWrite();
            int changed = new TagTableEditor(table, parser).apply(patches);
            if (changed == 0) {
                log.debug("No {} change for {} requested tag(s), {} left as is", what, patches.size(), source);
                return;
            }
            String text = tableService.flatToString(table);
            replaceSource(text);
            snapshot.set(new Snapshot(parser.parse(text), true));
            log.info("Wrote {} of {} tag(s) to {}", what, changed, source);
        } finally {
            lock.unlock();
        }
    }

    private Snapshot current() {
        Snapshot loaded = snapshot.get();
        if (loaded != null) {
            return loaded;
        }
        // cold loads share the write lock so a load cannot land on top of a newer write
        lock.lock();
        try {
            loaded = snapshot.get();
            if (loaded != null) {
                return loaded;
            }
            ParsedTags parsed;
            try {
                parsed = parser.parse(readSource());
            } catch (SourceUnavailableException | MissingHeaderException e) {
                log.warn("Tag settings are unavailable, serving no tags: {}", e.getMessage());
                return new Snapshot(ParsedTags.EMPTY, false);
            }
            Snapshot fresh = new Snapshot(parsed, true);
            snapshot.set(fresh);
            log.debug("Loaded {} tag(s) from {}", fresh.index.size(), source);
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    private String readSource() {
        try {
            return Files.readString(source, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new SourceUnavailableException(source, "Tag settings file does not exist", e);
        } catch (IOException e) {
            throw new SourceUnavailableException(source, "Tag settings file cannot be read", e);
        }
    }

    private CsvTable readTableForWrite() {
        try {
            CsvTable table = tableService.flatToTable(readSource());
            tableService.validate(table);
            return table;
        } catch (SourceUnavailableException | MissingHeaderException e) {
            throw new PersistFailureException("Cannot update tag settings: " + e.getMessage(), e);
        }
    }

    private void replaceSource(String text) {
        Path tmp = source.resolveSibling(source.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            if (fsyncOnCommit) {
                try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                    channel.force(true);
                }
            }
            try {
                Files.move(tmp, source, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, replacing in place", source);
                Files.move(tmp, source, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            discard(tmp);
            throw new PersistFailureException("Could not write tag settings to " + source, e);
        }
    }

    private static void discard(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", tmp, e.toString());
        }
    }

    private final class Snapshot {
        final ParsedTags parsed;
        final TagStatusIndex index;
        final boolean loaded;
        final Map<String, EffectiveSettings> resolved = new ConcurrentHashMap<>();

        Snapshot(ParsedTags parsed, boolean loaded) {
            this.parsed = parsed;
            this.loaded = loaded;
            this.index = TagStatusIndex.build(parsed, resolver);
        }

        List<EffectiveSettings> resolveAll(boolean includeDisabled) {
            List<EffectiveSettings> result = new ArrayList<>();
            for (String name : parsed.getRowsByName().keySet()) {
                EffectiveSettings settings = resolve(name);
                if (includeDisabled || settings.isEnabled()) {
                    result.add(settings);
                }
            }
            return result;
        }

        EffectiveSettings resolve(String tagName) {
            String key = TagSettingsResolver.normalize(tagName);
            if (parsed.find(key) == null) {
                return resolver.resolve(parsed, key);
            }
            return resolved.computeIfAbsent(key, name -> resolver.resolve(parsed, name));
        }
    }
}
