/**
 * Service layer containing the audio processing, metering and recording logic.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.audio} - PCM codec, stream format constants, WAV file writing</li>
 *   <li>{@code service.dsp} - per-session gain, low-pass filter, level meter and analysis ring</li>
 *   <li>{@code service.metering} - spectrum analysis and the periodic metering scheduler</li>
 *   <li>{@code service.recording} - recording sinks, lifecycle and metadata store</li>
 *   <li>{@code service.session} - live session registry</li>
 *   <li>{@code service.orchestration} - routes session messages through the above</li>
 *   <li>{@code service.health}, {@code service.metrics}, {@code service.events} -
 *       actuator health, Micrometer counters, error event logging</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services depend on domain models, not presentation layer</li>
 *   <li>Services throw domain exceptions (not transport close codes)</li>
 *   <li>Per-session state is confined to one session; shared services are thread-safe</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.audiometer.service;
