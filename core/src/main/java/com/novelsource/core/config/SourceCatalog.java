package com.novelsource.core.config;

import com.novelsource.common.error.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * File-backed store of source configs, one {@code <id>.json} per source.
 * <p>
 * Files that fail to parse are skipped and remembered in {@link #getLoadErrors()}; the rest of the
 * catalog stays usable. Lookups hand out copies, so callers may bind them to parsers freely.
 */
public class SourceCatalog {
    private static final Logger logger = LoggerFactory.getLogger(SourceCatalog.class);

    private final File dir;
    private final Map<String, SourceConfig> sources = new LinkedHashMap<>();
    private final Map<String, File> files = new LinkedHashMap<>();
    private final List<String> loadErrors = new ArrayList<>();

    public SourceCatalog(File dir) {
        this.dir = dir;
    }

    public File getDir() {
        return dir;
    }

    public synchronized void load() {
        sources.clear();
        files.clear();
        loadErrors.clear();

        if (!dir.exists() && !dir.mkdirs()) {
            logger.warn("Sources directory {} cannot be created", dir);
            return;
        }

        File[] candidates = dir.listFiles((d, name) -> name.toLowerCase().endsWith(".json"));
        if (candidates == null || candidates.length == 0) {
            logger.info("📚 No source configs in {}", dir);
            return;
        }
        Arrays.sort(candidates);

        for (File file : candidates) {
            try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
                SourceConfig config = SourceConfigs.parse(reader, file.getName());
                String id = config.getId();
                if (id.isEmpty()) {
                    recordError(file, "no id or name");
                } else if (sources.containsKey(id)) {
                    recordError(file, "duplicate source id '" + id + "'");
                } else {
                    sources.put(id, config);
                    files.put(id, file);
                }
            } catch (IOException e) {
                recordError(file, e.getMessage());
            } catch (ConfigException e) {
                recordError(file, e.getMessage());
            }
        }
        logger.info("📚 Loaded {} source config(s) from {}", sources.size(), dir);
    }

    private void recordError(File file, String message) {
        String line = file.getName() + ": " + message;
        loadErrors.add(line);
        logger.error("❌ Skipping source file {}", line);
    }

    public synchronized Optional<SourceConfig> get(String id) {
        if (id == null) return Optional.empty();
        SourceConfig config = sources.get(id.trim());
        return config == null ? Optional.empty() : Optional.of(SourceConfigs.copy(config));
    }

    /**
     * Copies of all loaded configs in file-name order.
     */
    public synchronized List<SourceConfig> all() {
        List<SourceConfig> copies = new ArrayList<>(sources.size());
        for (SourceConfig config : sources.values()) copies.add(SourceConfigs.copy(config));
        return copies;
    }

    public synchronized int size() {
        return sources.size();
    }

    public synchronized List<String> getLoadErrors() {
        return Collections.unmodifiableList(new ArrayList<>(loadErrors));
    }

    /**
     * Validates and writes {@code <id>.json}, replacing a source with the same id.
     */
    public synchronized void save(SourceConfig config) throws ConfigException, IOException {
        new SourceConfigValidator().requireValid(config);
        String id = config.getId();
        if (!dir.exists() && !dir.mkdirs()) {
            throw new IOException("Cannot create sources directory " + dir);
        }
        File target = files.getOrDefault(id, new File(dir, fileName(id)));
        try (Writer writer = Files.newBufferedWriter(target.toPath(), StandardCharsets.UTF_8)) {
            writer.write(SourceConfigs.toJson(config));
        }
        sources.put(id, SourceConfigs.copy(config));
        files.put(id, target);
        logger.info("💾 Saved source '{}' to {}", id, target.getName());
    }

    public synchronized boolean remove(String id) throws IOException {
        if (id == null || sources.remove(id) == null) return false;
        File file = files.remove(id);
        Files.deleteIfExists((file != null ? file : new File(dir, fileName(id))).toPath());
        logger.info("🗑️ Removed source '{}'", id);
        return true;
    }

    private static String fileName(String id) {
        return id.replaceAll("[^A-Za-z0-9._-]", "_") + ".json";
    }
}
