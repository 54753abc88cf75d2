/**
 * SkyMosaic source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.skymosaic.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.skymosaic.geometry.TileGeometry} turns a tile index into projection headers.</li>
 *   <li>{@code io.skymosaic.dispatch.Dispatcher} and {@code io.skymosaic.dispatch.WorkerAgent} distribute per-exposure jobs.</li>
 *   <li>{@code io.skymosaic.pipeline.StageSequencer} drives the Montage stages of one tile.</li>
 * </ul>
 */
package io.skymosaic;
