package com.phillippitts.audiometer.service.dsp;

import com.phillippitts.audiometer.domain.DspParameters;
import com.phillippitts.audiometer.domain.MeteringSample;
import com.phillippitts.audiometer.service.audio.StereoBuffer;
import com.phillippitts.audiometer.testutil.PcmFrames;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DspEngineTest {

    private static final int RATE = 44_100;
    private static final int FFT = 2048;

    @Test
    void defaultParametersShouldPassAudioThroughUnchanged() {
        DspEngine engine = new DspEngine(RATE, DspParameters.DEFAULTS, FFT);
        StereoBuffer input = PcmFrames.sineBuffer(1024, 440.0, RATE, 0.8, 0.3);

        StereoBuffer output = engine.process(input.copy());

        assertThat(output.left()).containsExactly(input.left());
        assertThat(output.right()).containsExactly(input.right());
    }

    @Test
    void processShouldNotModifyInput() {
        DspEngine engine = new DspEngine(RATE, new DspParameters(20.0, true, 500.0, 0.5), FFT);
        StereoBuffer input = PcmFrames.sineBuffer(256, 440.0, RATE, 0.1, 0.1);
        StereoBuffer snapshot = input.copy();

        engine.process(input);

        assertThat(input.left()).containsExactly(snapshot.left());
    }

    @Test
    void gainShouldScaleAndClip() {
        DspEngine engine = new DspEngine(RATE, new DspParameters(6.0, false, 1000.0, 0.5), FFT);
        StereoBuffer input = new StereoBuffer(new double[] {0.1, 0.9}, new double[] {-0.1, -0.9});

        StereoBuffer output = engine.process(input);

        double factor = Math.pow(10.0, 6.0 / 20.0);
        assertThat(output.left()[0]).isCloseTo(0.1 * factor, within(1e-12));
        assertThat(output.left()[1]).isEqualTo(1.0);
        assertThat(output.right()[1]).isEqualTo(-1.0);
    }

    @Test
    void configureShouldClampToValidRanges() {
        DspEngine engine = new DspEngine(RATE, DspParameters.DEFAULTS, FFT);

        DspParameters applied = engine.configure(new DspParameters(100.0, true, 30_000.0, 0.0));

        assertThat(applied.gainDb()).isEqualTo(DspParameters.MAX_GAIN_DB);
        assertThat(applied.cutoffHz()).isEqualTo(RATE * DspParameters.MAX_CUTOFF_RATIO);
        assertThat(applied.integrationTimeSeconds()).isEqualTo(DspParameters.MIN_INTEGRATION_SECONDS);
        assertThat(engine.parameters()).isEqualTo(applied);
    }

    @Test
    void cutoffChangeShouldNotResetFilterState() {
        DspEngine engine = new DspEngine(RATE, new DspParameters(0.0, true, 1000.0, 0.5), FFT);
        engine.process(PcmFrames.sineBuffer(1024, 200.0, RATE, 0.5, 0.5));
        double[][][] before = engine.filterState();

        engine.configure(new DspParameters(0.0, true, 3000.0, 0.5));

        assertThat(Arrays.deepEquals(engine.filterState(), before)).isTrue();
    }

    @Test
    void cutoffChangeShouldBeContinuousAcrossBlocks() {
        DspEngine engine = new DspEngine(RATE, new DspParameters(0.0, true, 1000.0, 0.5), FFT);
        StereoBuffer tone = PcmFrames.sineBuffer(4096, 100.0, RATE, 0.5, 0.5);
        StereoBuffer first = engine.process(slice(tone, 0, 2048));

        engine.configure(new DspParameters(0.0, true, 4000.0, 0.5));
        StereoBuffer second = engine.process(slice(tone, 2048, 4096));

        // A filter restarted from zero would jump by ~0.4 here
        double jump = Math.abs(second.left()[0] - first.left()[2047]);
        assertThat(jump).isLessThan(0.15);
    }

    @Test
    void enablingFilterShouldCrossfadeFromRawAudio() {
        DspEngine engine = new DspEngine(RATE, new DspParameters(0.0, false, 200.0, 0.5), FFT);
        DspEngine alwaysFiltered = new DspEngine(RATE, new DspParameters(0.0, true, 200.0, 0.5), FFT);
        StereoBuffer tone = PcmFrames.sineBuffer(4096, 5000.0, RATE, 0.5, 0.5);
        engine.process(slice(tone, 0, 2048));
        alwaysFiltered.process(slice(tone, 0, 2048));

        engine.configure(new DspParameters(0.0, true, 200.0, 0.5));
        StereoBuffer after = engine.process(slice(tone, 2048, 4096));
        StereoBuffer reference = alwaysFiltered.process(slice(tone, 2048, 4096));

        double raw = tone.left()[2048];
        double weight = 1.0 / DspEngine.TOGGLE_RAMP_FRAMES;
        assertThat(after.left()[0]).isCloseTo(raw * (1.0 - weight) + reference.left()[0] * weight, within(1e-12));
        for (int i = DspEngine.TOGGLE_RAMP_FRAMES; i < 2048; i++) {
            assertThat(after.left()[i]).isEqualTo(reference.left()[i]);
        }
    }

    @Test
    void disablingFilterShouldCrossfadeBackToRawAudio() {
        DspEngine engine = new DspEngine(RATE, new DspParameters(0.0, true, 200.0, 0.5), FFT);
        StereoBuffer tone = PcmFrames.sineBuffer(4096, 5000.0, RATE, 0.5, 0.5);
        StereoBuffer filtered = engine.process(slice(tone, 0, 2048));

        engine.configure(new DspParameters(0.0, false, 200.0, 0.5));
        StereoBuffer after = engine.process(slice(tone, 2048, 4096));

        // Starts near the filtered signal, which is almost silent at 5 kHz
        assertThat(Math.abs(after.left()[0])).isLessThan(0.05);
        assertThat(Math.abs(filtered.left()[2047])).isLessThan(0.05);
        for (int i = DspEngine.TOGGLE_RAMP_FRAMES; i < 2048; i++) {
            assertThat(after.left()[i]).isEqualTo(tone.left()[2048 + i]);
        }
    }

    @Test
    void onOffPairBetweenBlocksShouldLeaveOutputUntouched() {
        DspEngine engine = new DspEngine(RATE, new DspParameters(0.0, false, 200.0, 0.5), FFT);
        StereoBuffer tone = PcmFrames.sineBuffer(4096, 5000.0, RATE, 0.5, 0.5);
        engine.process(slice(tone, 0, 2048));

        engine.configure(new DspParameters(0.0, true, 200.0, 0.5));
        engine.configure(new DspParameters(0.0, false, 200.0, 0.5));
        StereoBuffer after = engine.process(slice(tone, 2048, 4096));

        assertThat(after.left()).containsExactly(slice(tone, 2048, 4096).left());
        assertThat(engine.filterMix()).isZero();
    }

    @Test
    void toggleDuringRampShouldReverseFromCurrentMix() {
        DspEngine engine = new DspEngine(RATE, new DspParameters(0.0, false, 200.0, 0.5), FFT);
        DspEngine alwaysFiltered = new DspEngine(RATE, new DspParameters(0.0, true, 200.0, 0.5), FFT);
        StereoBuffer tone = PcmFrames.sineBuffer(4096, 5000.0, RATE, 0.5, 0.5);
        engine.process(slice(tone, 0, 2048));
        alwaysFiltered.process(slice(tone, 0, 2048));
        int half = DspEngine.TOGGLE_RAMP_FRAMES / 2;

        engine.configure(new DspParameters(0.0, true, 200.0, 0.5));
        engine.process(slice(tone, 2048, 2048 + half));
        alwaysFiltered.process(slice(tone, 2048, 2048 + half));
        assertThat(engine.filterMix()).isEqualTo(0.5);

        engine.configure(new DspParameters(0.0, false, 200.0, 0.5));
        StereoBuffer after = engine.process(slice(tone, 2048 + half, 4096));
        StereoBuffer reference = alwaysFiltered.process(slice(tone, 2048 + half, 4096));

        // Ramp continues down from 0.5 instead of restarting at the filtered path
        double raw = tone.left()[2048 + half];
        double mix = 0.5 - 1.0 / DspEngine.TOGGLE_RAMP_FRAMES;
        assertThat(after.left()[0]).isCloseTo(raw + (reference.left()[0] - raw) * mix, within(1e-12));
        for (int i = half; i < after.frames(); i++) {
            assertThat(after.left()[i]).isEqualTo(tone.left()[2048 + half + i]);
        }
    }

    @Test
    void silenceAfterFilteredToneShouldReachFloor() {
        DspEngine engine = new DspEngine(RATE, new DspParameters(0.0, true, 20.0, 0.5), FFT);
        engine.process(PcmFrames.sineBuffer(RATE, 1000.0, RATE, 0.5, 0.5));

        // 0.5 s is 22050 frames; 22 blocks of 1024 cover it
        for (int i = 0; i < 22; i++) {
            engine.process(StereoBuffer.allocate(1024));
        }
        MeterReading reading = engine.read();

        assertThat(reading.rmsDb()).isEqualTo(MeteringSample.FLOOR_DB);
        assertThat(reading.panning()).isZero();
    }

    @Test
    void fullScaleSineShouldMeterNearMinusThreeDecibels() {
        DspEngine engine = new DspEngine(RATE, DspParameters.DEFAULTS, FFT);
        StereoBuffer tone = PcmFrames.sineBuffer(RATE * 5, 1000.0, RATE, 1.0, 1.0);

        engine.process(tone);
        MeterReading reading = engine.read();

        assertThat(reading.rmsDb()).isCloseTo(-3.01, within(0.1));
        assertThat(reading.panning()).isCloseTo(0.0, within(1e-9));
        assertThat(reading.framesProcessed()).isEqualTo(RATE * 5);
    }

    @Test
    void silenceShouldMeterAtFloor() {
        DspEngine engine = new DspEngine(RATE, DspParameters.DEFAULTS, FFT);

        for (int i = 0; i < 30; i++) {
            engine.process(StereoBuffer.allocate(1024));
        }
        MeterReading reading = engine.read();

        assertThat(reading.rmsDb()).isEqualTo(MeteringSample.FLOOR_DB);
        assertThat(reading.panning()).isZero();
        assertThat(reading.window()).containsOnly(0.0);
    }

    @Test
    void readingShouldExposeLatestWindow() {
        DspEngine engine = new DspEngine(RATE, DspParameters.DEFAULTS, 4);

        engine.process(new StereoBuffer(new double[] {0.2, 0.4}, new double[] {0.2, 0.0}));

        assertThat(engine.read().window()).containsExactly(0.0, 0.0, 0.2, 0.2);
    }

    private static StereoBuffer slice(StereoBuffer source, int from, int to) {
        double[] left = new double[to - from];
        double[] right = new double[to - from];
        System.arraycopy(source.left(), from, left, 0, left.length);
        System.arraycopy(source.right(), from, right, 0, right.length);
        return new StereoBuffer(left, right);
    }
}
