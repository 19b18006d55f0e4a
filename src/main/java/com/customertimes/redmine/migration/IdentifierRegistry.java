package com.customertimes.redmine.migration;

import org.apache.log4j.Logger;
import org.codehaus.jettison.json.JSONArray;
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Redmine issue id to Gitea issue number table. Every successful {@link #record} is written
 * through to disk, so an interrupted run can be resumed from the file.
 */
public class IdentifierRegistry {
    private static final Logger logger = Logger.getLogger(IdentifierRegistry.class);

    static final String SOURCE_KEY = "redmine";
    static final String TARGET_KEY = "gitea";

    private final Path file;
    private final TreeMap<Long, Long> sourceToTarget = new TreeMap<Long, Long>();
    private final Map<Long, Long> targetToSource = new HashMap<Long, Long>();
    private boolean closed;

    public IdentifierRegistry(Path file) {
        this.file = file;
    }

    /**
     * Seeds the registry from its file, if there is one.
     *
     * @return number of mappings loaded
     */
    public synchronized int load() throws MigrationException {
        if (file == null || !Files.exists(file)) {
            return 0;
        }
        try {
            String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            if (content.trim().isEmpty()) {
                return 0;
            }
            JSONArray entries = new JSONArray(content);
            for (int i = 0; i < entries.length(); i++) {
                JSONObject entry = entries.getJSONObject(i);
                put(entry.getLong(SOURCE_KEY), entry.getLong(TARGET_KEY));
            }
            logger.info("loaded " + entries.length() + " issue mappings from " + file);
            return entries.length();
        } catch (IOException e) {
            throw new MigrationException("cannot read registry file " + file, e);
        } catch (JSONException | NumberFormatException e) {
            throw new MigrationException("registry file " + file + " is corrupt", e);
        }
    }

    /**
     * Records and persists a mapping. Recording the same pair again is a no-op.
     *
     * @throws DuplicateMappingException if either id is already mapped to something else
     */
    public synchronized void record(long sourceId, long targetId) throws MigrationException {
        if (closed) {
            throw new IllegalStateException("registry is closed, cannot record #" + sourceId);
        }
        Long existing = sourceToTarget.get(sourceId);
        if (existing != null && existing == targetId) {
            return;
        }
        put(sourceId, targetId);
        persist();
    }

    private void put(long sourceId, long targetId) throws DuplicateMappingException {
        Long existing = sourceToTarget.get(sourceId);
        if (existing != null && existing != targetId) {
            throw new DuplicateMappingException("source issue #" + sourceId + " is already mapped to #" + existing
                    + ", refusing #" + targetId);
        }
        Long owner = targetToSource.get(targetId);
        if (owner != null && owner != sourceId) {
            throw new DuplicateMappingException("target issue #" + targetId + " already belongs to source issue #"
                    + owner + ", refusing #" + sourceId);
        }
        sourceToTarget.put(sourceId, targetId);
        targetToSource.put(targetId, sourceId);
    }

    /** Gitea number for a Redmine id, or null when the issue was never migrated. */
    public synchronized Long resolve(long sourceId) {
        return sourceToTarget.get(sourceId);
    }

    public synchronized boolean contains(long sourceId) {
        return sourceToTarget.containsKey(sourceId);
    }

    public synchronized int size() {
        return sourceToTarget.size();
    }

    public synchronized SortedMap<Long, Long> snapshot() {
        return Collections.unmodifiableSortedMap(new TreeMap<Long, Long>(sourceToTarget));
    }

    /** Ends the recording phase. Cross references may only be resolved against a closed registry. */
    public synchronized void close() {
        closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Writes the whole table as an array of {redmine, gitea} pairs sorted by Redmine id, replacing the previous file atomically.
     */
    public synchronized void persist() throws MigrationException {
        if (file == null) {
            return;
        }
        try {
            JSONArray entries = new JSONArray();
            for (Map.Entry<Long, Long> entry : sourceToTarget.entrySet()) {
                JSONObject json = new JSONObject();
                json.put(SOURCE_KEY, entry.getKey());
                json.put(TARGET_KEY, entry.getValue());
                entries.put(json);
            }
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.write(tmp, entries.toString(2).getBytes(StandardCharsets.UTF_8));
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                logger.debug("atomic move not supported, replacing " + file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | JSONException e) {
            throw new MigrationException("cannot write registry file " + file, e);
        }
    }
}
