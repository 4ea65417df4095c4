package com.anirudhology.codeauthorship.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aligns the label spaces of independently built per-language datasets.
 * <p>
 * A username gets its master index the first time it is seen while walking
 * the datasets in order, and keeps it in every later dataset. Each dataset
 * then has its labels rewritten from its own indices to the master ones.
 */
public class DatasetConsolidator {

    private static final Logger LOG = LoggerFactory.getLogger(DatasetConsolidator.class);

    /**
     * Master label vocabulary and, per input mapping, the translation from
     * its own indices to master indices
     *
     * @param master       username to master index, in order of assignment
     * @param translations one old-index to master-index table per input mapping
     */
    public record MappingConsolidation(Map<String, Integer> master, List<Map<Integer, Integer>> translations) {
    }

    /**
     * Reindexes every dataset in place against one master vocabulary
     *
     * @param datasets per-language datasets, in processing order
     * @return the master username to index mapping now shared by all datasets
     */
    public Map<String, Integer> consolidate(List<Dataset> datasets) {
        final List<Map<String, Integer>> mappings = new ArrayList<>(datasets.size());
        for (Dataset dataset : datasets) {
            mappings.add(dataset.label2idx());
        }
        final MappingConsolidation consolidation = consolidateMappings(mappings);

        for (int i = 0; i < datasets.size(); i++) {
            final Dataset dataset = datasets.get(i);
            dataset.relabel(reindex(dataset.labels(), consolidation.translations().get(i)), consolidation.master());
        }

        LOG.info("Consolidated {} dataset(s) into {} distinct labels", datasets.size(), consolidation.master().size());
        return consolidation.master();
    }

    /**
     * @param mappings per-dataset username to index mappings, in processing order
     * @return master mapping plus one translation table per input mapping
     */
    public MappingConsolidation consolidateMappings(List<Map<String, Integer>> mappings) {
        final Map<String, Integer> master = new LinkedHashMap<>();
        final List<Map<Integer, Integer>> translations = new ArrayList<>(mappings.size());

        for (Map<String, Integer> mapping : mappings) {
            final Map<Integer, Integer> oldToMaster = new HashMap<>();

            // Walk the mapping in index order so assignment does not depend on hash order
            final List<Map.Entry<String, Integer>> entries = new ArrayList<>(mapping.entrySet());
            entries.sort(Map.Entry.comparingByValue(Comparator.naturalOrder()));

            for (Map.Entry<String, Integer> entry : entries) {
                final String username = entry.getKey();
                final int oldIndex = entry.getValue();
                final int masterIndex = master.computeIfAbsent(username, k -> master.size());

                final Integer previous = oldToMaster.putIfAbsent(oldIndex, masterIndex);
                if (previous != null && previous != masterIndex) {
                    throw new IllegalStateException("Index " + oldIndex + " resolves to master indices "
                            + previous + " and " + masterIndex + " (username '" + username + "')");
                }
            }
            translations.add(Collections.unmodifiableMap(oldToMaster));
        }
        return new MappingConsolidation(Collections.unmodifiableMap(master), List.copyOf(translations));
    }

    private static List<Integer> reindex(List<Integer> labels, Map<Integer, Integer> oldToMaster) {
        final List<Integer> reindexed = new ArrayList<>(labels.size());
        for (Integer label : labels) {
            final Integer masterIndex = oldToMaster.get(label);
            if (masterIndex == null) {
                throw new IllegalStateException("Label " + label + " has no entry in the label vocabulary");
            }
            reindexed.add(masterIndex);
        }
        return reindexed;
    }
}
