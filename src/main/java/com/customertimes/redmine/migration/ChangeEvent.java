package com.customertimes.redmine.migration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Date;
import java.util.List;

/**
 * One Redmine journal entry.
 */
public class ChangeEvent {

    /** By timestamp, then by journal id. */
    public static final Comparator<ChangeEvent> CHRONOLOGICAL = new Comparator<ChangeEvent>() {
        @Override
        public int compare(ChangeEvent a, ChangeEvent b) {
            int byDate = a.createdOn.compareTo(b.createdOn);
            return byDate != 0 ? byDate : Long.compare(a.id, b.id);
        }
    };

    private final long id;
    private final List<FieldChange> changes;
    private final String notes;
    private final NamedRef user;
    private final Date createdOn;
    private final boolean privateNotes;

    public ChangeEvent(long id, List<FieldChange> changes, String notes, NamedRef user, Date createdOn,
                       boolean privateNotes) {
        this.id = id;
        this.changes = Collections.unmodifiableList(new ArrayList<FieldChange>(changes));
        this.notes = notes == null ? "" : notes;
        this.user = user;
        this.createdOn = new Date(createdOn.getTime());
        this.privateNotes = privateNotes;
    }

    public long getId() {
        return id;
    }

    public List<FieldChange> getChanges() {
        return changes;
    }

    public String getNotes() {
        return notes;
    }

    public boolean hasNotes() {
        return !notes.trim().isEmpty();
    }

    public boolean isEmpty() {
        return !hasNotes() && changes.isEmpty();
    }

    public NamedRef getUser() {
        return user;
    }

    public Date getCreatedOn() {
        return new Date(createdOn.getTime());
    }

    public boolean isPrivateNotes() {
        return privateNotes;
    }

    /** The same entry with its notes removed, for journals whose notes are private. */
    public ChangeEvent withoutNotes() {
        return new ChangeEvent(id, changes, "", user, createdOn, false);
    }
}
