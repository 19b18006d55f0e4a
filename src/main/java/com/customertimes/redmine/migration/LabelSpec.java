package com.customertimes.redmine.migration;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Labels an issue is meant to carry, sorted and de-duplicated both by name and by id.
 */
public class LabelSpec {
    private final List<String> names;
    private final List<Long> ids;

    private LabelSpec(List<String> names, List<Long> ids) {
        this.names = Collections.unmodifiableList(names);
        this.ids = Collections.unmodifiableList(ids);
    }

    /**
     * Resolves label names against the repository label table.
     *
     * @throws MigrationException if a label does not exist in the repository
     */
    public static LabelSpec resolve(Collection<String> labelNames, Map<String, Long> repositoryLabels)
            throws MigrationException {
        TreeSet<String> sortedNames = new TreeSet<String>(labelNames);
        TreeSet<Long> sortedIds = new TreeSet<Long>();
        for (String name : sortedNames) {
            Long id = repositoryLabels.get(name);
            if (id == null) {
                throw new MigrationException("label <" + name + "> does not exist in the target repository");
            }
            sortedIds.add(id);
        }
        return new LabelSpec(new ArrayList<String>(sortedNames), new ArrayList<Long>(sortedIds));
    }

    public List<String> getNames() {
        return names;
    }

    public List<Long> getIds() {
        return ids;
    }

    /** Order-independent comparison with the label ids observed on an issue. */
    public boolean matches(Collection<Long> observed) {
        return new ArrayList<Long>(new TreeSet<Long>(observed)).equals(ids);
    }

    @Override
    public String toString() {
        return names + " " + ids;
    }
}
