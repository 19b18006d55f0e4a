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
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Issues that were created in Gitea but not finished yet: whether the body has been captured
 * for the rewrite pass and which journals have been posted. An entry is added before the issue
 * is created and removed once its last journal is posted, so a resumed run can finish the issue
 * instead of skipping it.
 */
public class IssueProgressStore {
    private static final Logger logger = Logger.getLogger(IssueProgressStore.class);

    private static class Progress {
        boolean bodyCaptured;
        final TreeSet<Long> postedJournals = new TreeSet<Long>();
    }

    private final Path file;
    private final TreeMap<Long, Progress> incomplete = new TreeMap<Long, Progress>();

    public IssueProgressStore(Path file) {
        this.file = file;
    }

    public synchronized int load() throws MigrationException {
        if (file == null || !Files.exists(file)) {
            return 0;
        }
        try {
            JSONArray entries = new JSONArray(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
            for (int i = 0; i < entries.length(); i++) {
                JSONObject entry = entries.getJSONObject(i);
                Progress progress = new Progress();
                progress.bodyCaptured = entry.optBoolean("body", false);
                JSONArray journals = entry.optJSONArray("journals");
                if (journals != null) {
                    for (int j = 0; j < journals.length(); j++) {
                        progress.postedJournals.add(journals.getLong(j));
                    }
                }
                incomplete.put(entry.getLong("redmine"), progress);
            }
        } catch (IOException e) {
            throw new MigrationException("cannot read progress file " + file, e);
        } catch (JSONException e) {
            throw new MigrationException("progress file " + file + " is corrupt", e);
        }
        if (!incomplete.isEmpty()) {
            logger.info("issues " + incomplete.keySet() + " were left unfinished by a previous run");
        }
        return incomplete.size();
    }

    public synchronized void start(long sourceId) throws MigrationException {
        incomplete.put(sourceId, new Progress());
        persist();
    }

    public synchronized boolean isIncomplete(long sourceId) {
        return incomplete.containsKey(sourceId);
    }

    public synchronized boolean isBodyCaptured(long sourceId) {
        Progress progress = incomplete.get(sourceId);
        return progress != null && progress.bodyCaptured;
    }

    public synchronized boolean isJournalPosted(long sourceId, long journalId) {
        Progress progress = incomplete.get(sourceId);
        return progress != null && progress.postedJournals.contains(journalId);
    }

    public synchronized void bodyCaptured(long sourceId) throws MigrationException {
        progress(sourceId).bodyCaptured = true;
        persist();
    }

    public synchronized void journalPosted(long sourceId, long journalId) throws MigrationException {
        progress(sourceId).postedJournals.add(journalId);
        persist();
    }

    public synchronized void complete(long sourceId) throws MigrationException {
        if (incomplete.remove(sourceId) != null) {
            persist();
        }
    }

    private Progress progress(long sourceId) {
        Progress progress = incomplete.get(sourceId);
        if (progress == null) {
            throw new IllegalStateException("issue #" + sourceId + " is not in progress");
        }
        return progress;
    }

    private void persist() throws MigrationException {
        if (file == null) {
            return;
        }
        try {
            if (incomplete.isEmpty()) {
                Files.deleteIfExists(file);
                return;
            }
            JSONArray entries = new JSONArray();
            for (Map.Entry<Long, Progress> entry : incomplete.entrySet()) {
                JSONObject json = new JSONObject();
                json.put("redmine", entry.getKey());
                json.put("body", entry.getValue().bodyCaptured);
                JSONArray journals = new JSONArray();
                for (Long journalId : entry.getValue().postedJournals) {
                    journals.put(journalId);
                }
                json.put("journals", journals);
                entries.put(json);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.write(tmp, entries.toString().getBytes(StandardCharsets.UTF_8));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | JSONException e) {
            throw new MigrationException("cannot write progress file " + file, e);
        }
    }
}
