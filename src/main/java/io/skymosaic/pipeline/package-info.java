/**
 * Per-tile mosaic pipeline: working directory layout, stage results and the
 * sequencer that runs them.
 */
package io.skymosaic.pipeline;
