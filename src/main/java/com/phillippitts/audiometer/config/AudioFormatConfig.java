package com.phillippitts.audiometer.config;

import com.phillippitts.audiometer.config.properties.MeteringProperties;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Configuration;

import static com.phillippitts.audiometer.service.audio.AudioFormat.BIG_ENDIAN;
import static com.phillippitts.audiometer.service.audio.AudioFormat.BITS_PER_SAMPLE;
import static com.phillippitts.audiometer.service.audio.AudioFormat.DEFAULT_SAMPLE_RATE;
import static com.phillippitts.audiometer.service.audio.AudioFormat.PROCESSING_CHANNELS;
import static com.phillippitts.audiometer.service.audio.AudioFormat.STEREO_BLOCK_ALIGN;
import static com.phillippitts.audiometer.service.audio.AudioFormat.isSupportedSampleRate;
import static com.phillippitts.audiometer.service.audio.AudioFormat.stereoByteRate;

/**
 * Startup sanity check for the stream format and the metering configuration.
 * Logs the effective format and fails fast if misconfigured.
 */
@Configuration
class AudioFormatConfig {
    private static final Logger LOG = LogManager.getLogger(AudioFormatConfig.class);

    private final MeteringProperties metering;

    AudioFormatConfig(MeteringProperties metering) {
        this.metering = metering;
    }

    @PostConstruct
    void validateAudioFormatConstants() {
        if (BITS_PER_SAMPLE != 16 || PROCESSING_CHANNELS != 2 || BIG_ENDIAN
                || STEREO_BLOCK_ALIGN != 4 || !isSupportedSampleRate(DEFAULT_SAMPLE_RATE)) {
            throw new IllegalStateException(
                    "Audio format constants misconfigured. Expected 16-bit, stereo, little-endian.");
        }
        if (metering.getSpectrumBins() > metering.getFftSize() / 2) {
            throw new IllegalStateException("metering.spectrum-bins (" + metering.getSpectrumBins()
                    + ") must not exceed metering.fft-size / 2 (" + metering.getFftSize() / 2 + ")");
        }
        LOG.info("Audio format configured: defaultSampleRate={} Hz, bitsPerSample={}, channels={}, "
                        + "byteRate={}, blockAlign={} (littleEndian={})",
                DEFAULT_SAMPLE_RATE, BITS_PER_SAMPLE, PROCESSING_CHANNELS,
                stereoByteRate(DEFAULT_SAMPLE_RATE), STEREO_BLOCK_ALIGN, !BIG_ENDIAN);
        LOG.info("Metering configured: intervalMs={}, fftSize={}, spectrumBins={}",
                metering.getIntervalMs(), metering.getFftSize(), metering.getSpectrumBins());
    }
}
