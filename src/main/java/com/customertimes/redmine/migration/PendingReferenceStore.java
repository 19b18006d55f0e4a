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
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps captured references on disk until the rewrite pass has run, so that a resumed run
 * still rewrites text posted by the interrupted one.
 */
public class PendingReferenceStore {
    private static final Logger logger = Logger.getLogger(PendingReferenceStore.class);

    private final Path file;

    public PendingReferenceStore(Path file) {
        this.file = file;
    }

    public List<DeferredReference> load() throws MigrationException {
        List<DeferredReference> references = new ArrayList<DeferredReference>();
        if (file == null || !Files.exists(file)) {
            return references;
        }
        try {
            JSONArray jsonReferences = new JSONArray(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
            for (int i = 0; i < jsonReferences.length(); i++) {
                JSONObject json = jsonReferences.getJSONObject(i);
                JSONArray jsonTokens = json.getJSONArray("tokens");
                List<ReferenceToken> tokens = new ArrayList<ReferenceToken>();
                for (int j = 0; j < jsonTokens.length(); j++) {
                    long sourceId = jsonTokens.getLong(j);
                    tokens.add(new ReferenceToken("#" + sourceId, sourceId));
                }
                Long commentId = json.has("comment") ? json.getLong("comment") : null;
                references.add(new DeferredReference(json.getString("repository"), json.getLong("issue"),
                        commentId, json.getString("text"), tokens));
            }
        } catch (IOException e) {
            throw new MigrationException("cannot read pending references " + file, e);
        } catch (JSONException e) {
            throw new MigrationException("pending references file " + file + " is corrupt", e);
        }
        logger.info("loaded " + references.size() + " pending references from " + file);
        return references;
    }

    public void save(List<DeferredReference> references) throws MigrationException {
        if (file == null) {
            return;
        }
        try {
            JSONArray jsonReferences = new JSONArray();
            for (DeferredReference reference : references) {
                JSONObject json = new JSONObject();
                json.put("repository", reference.getRepository());
                json.put("issue", reference.getIssueNumber());
                if (!reference.isIssueBody()) {
                    json.put("comment", reference.getCommentId());
                }
                JSONArray jsonTokens = new JSONArray();
                for (ReferenceToken token : reference.getTokens()) {
                    jsonTokens.put(Long.valueOf(token.getSourceId()));
                }
                json.put("tokens", jsonTokens);
                json.put("text", reference.getOriginalText());
                jsonReferences.put(json);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.write(tmp, jsonReferences.toString().getBytes(StandardCharsets.UTF_8));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | JSONException e) {
            throw new MigrationException("cannot write pending references " + file, e);
        }
    }

    public void clear() throws MigrationException {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new MigrationException("cannot delete pending references " + file, e);
        }
    }
}
