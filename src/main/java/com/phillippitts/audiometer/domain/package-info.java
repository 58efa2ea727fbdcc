/**
 * Domain models shared across the processing, metering and recording layers.
 *
 * <p>All domain models are immutable records and independent of persistence concerns.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.audiometer.domain.DspParameters} - gain, filter and
 *       integration-time settings, with range clamping</li>
 *   <li>{@link com.phillippitts.audiometer.domain.MeteringSample} - RMS, spectrum and
 *       panning reported to a session</li>
 *   <li>{@link com.phillippitts.audiometer.domain.Recording} - metadata of a finished
 *       recording</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.audiometer.domain;
