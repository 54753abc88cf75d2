package io.skymosaic.dispatch;

import io.skymosaic.catalog.CatalogRow;
import io.skymosaic.model.Job;
import io.skymosaic.observability.RunJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Catalog rows turned into jobs, in catalog order. Rows without a field are
 * skipped; a row whose output key is already taken is rejected, since two jobs
 * writing {@code <field>_<band>} would overwrite each other's outputs.
 */
public record Backlog(List<Job> jobs, int skippedRows, List<String> duplicateKeys) {
    private static final Logger LOG = LoggerFactory.getLogger(Backlog.class);

    public Backlog {
        jobs = List.copyOf(jobs);
        duplicateKeys = List.copyOf(duplicateKeys);
    }

    public static Backlog fromRows(List<CatalogRow> rows, RunJournal journal) {
        List<Job> jobs = new ArrayList<>();
        List<String> duplicates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int skipped = 0;
        for (CatalogRow row : rows) {
            var job = row.toJob();
            if (job.isEmpty()) {
                skipped++;
                LOG.debug("Skipping {}: no field identifier", row.image());
                record(journal, "catalog.skip", row.run(), "no_field", Map.of("image", row.image()));
                continue;
            }
            String key = job.get().destination();
            if (!seen.add(key)) {
                duplicates.add(key);
                LOG.warn("Skipping {}: output {} already belongs to another job", row.image(), key);
                record(journal, "catalog.skip", row.run(), "duplicate_destination",
                        Map.of("image", row.image(), "destination", key));
                continue;
            }
            jobs.add(job.get());
        }
        LOG.info("Backlog: {} jobs, {} rows without field, {} duplicate outputs",
                jobs.size(), skipped, duplicates.size());
        return new Backlog(jobs, skipped, duplicates);
    }

    public int size() {
        return jobs.size();
    }

    private static void record(RunJournal journal, String action, String resource, String result, Map<String, Object> details) {
        if (journal != null) {
            journal.log(RunJournal.Event.of(action, "master", resource, result, details));
        }
    }
}
