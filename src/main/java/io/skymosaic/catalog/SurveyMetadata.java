package io.skymosaic.catalog;

import io.skymosaic.model.Band;

import java.util.Optional;

/**
 * Survey observation log: maps a run number onto the field it observed.
 */
public interface SurveyMetadata {
    Optional<FieldMatch> findField(int runNumber);

    record FieldMatch(String fieldId, Band band) {
    }
}
