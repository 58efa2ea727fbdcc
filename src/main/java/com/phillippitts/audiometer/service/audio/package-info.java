/**
 * Audio format utilities and conversions.
 *
 * <p>Clients stream interleaved 16-bit signed little-endian PCM, mono or stereo, at a
 * sample rate chosen on {@code init}. Processing is always stereo: mono input is duplicated
 * to both channels.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.audiometer.service.audio.AudioFormat} - Single source
 *       of truth for stream format constants and supported sample rates</li>
 *   <li>{@link com.phillippitts.audiometer.service.audio.SampleCodec} - PCM16LE bytes to
 *       and from normalized stereo float buffers</li>
 *   <li>{@link com.phillippitts.audiometer.service.audio.WavFileWriter} - Streams PCM into a
 *       RIFF/WAVE file and patches the header sizes on close</li>
 * </ul>
 *
 * @see com.phillippitts.audiometer.service.audio.AudioFormat
 * @since 1.0
 */
package com.phillippitts.audiometer.service.audio;
