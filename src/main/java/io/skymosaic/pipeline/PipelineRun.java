package io.skymosaic.pipeline;

import io.skymosaic.model.Band;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Progress of one tile through the stages: one result per stage, plus the
 * stage at which a {@link FailurePolicy#HALT} run stopped.
 */
public final class PipelineRun {
    private final String tileName;
    private final Band band;
    private final FailurePolicy policy;
    private final List<StageResult> results = new ArrayList<>();
    private Stage haltedAt;

    public PipelineRun(String tileName, Band band, FailurePolicy policy) {
        this.tileName = tileName;
        this.band = band;
        this.policy = policy;
    }

    public String tileName() {
        return tileName;
    }

    public Band band() {
        return band;
    }

    public FailurePolicy policy() {
        return policy;
    }

    void record(StageResult result) {
        results.add(result);
    }

    void haltAt(Stage stage) {
        this.haltedAt = stage;
    }

    public List<StageResult> results() {
        return List.copyOf(results);
    }

    public Optional<StageResult> result(Stage stage) {
        for (StageResult result : results) {
            if (result.stage() == stage) {
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }

    public Optional<Stage> haltedAt() {
        return Optional.ofNullable(haltedAt);
    }

    public boolean isHalted() {
        return haltedAt != null;
    }

    public List<StageResult> failures() {
        List<StageResult> failed = new ArrayList<>();
        for (StageResult result : results) {
            if (result.isFailed()) {
                failed.add(result);
            }
        }
        return failed;
    }

    public boolean succeeded() {
        return failures().isEmpty();
    }
}
