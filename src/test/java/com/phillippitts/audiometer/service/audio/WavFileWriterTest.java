package com.phillippitts.audiometer.service.audio;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.phillippitts.audiometer.service.audio.AudioFormat.WAV_BITS_PER_SAMPLE_OFFSET;
import static com.phillippitts.audiometer.service.audio.AudioFormat.WAV_BLOCK_ALIGN_OFFSET;
import static com.phillippitts.audiometer.service.audio.AudioFormat.WAV_BYTE_RATE_OFFSET;
import static com.phillippitts.audiometer.service.audio.AudioFormat.WAV_CHANNELS_OFFSET;
import static com.phillippitts.audiometer.service.audio.AudioFormat.WAV_DATA_SIZE_OFFSET;
import static com.phillippitts.audiometer.service.audio.AudioFormat.WAV_HEADER_SIZE;
import static com.phillippitts.audiometer.service.audio.AudioFormat.WAV_RIFF_SIZE_OFFSET;
import static com.phillippitts.audiometer.service.audio.AudioFormat.WAV_SAMPLE_RATE_OFFSET;
import static com.phillippitts.audiometer.testutil.PcmFrames.readLEInt;
import static com.phillippitts.audiometer.testutil.PcmFrames.readLEShort;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WavFileWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteValidStereoHeaderAndPayload() throws IOException {
        Path wav = tempDir.resolve("stereo.wav");
        byte[] chunk = new byte[AudioTestConstants.STEREO_CHUNK_BYTES];

        WavFileWriter writer = WavFileWriter.open(wav, 44_100, 2);
        writer.append(chunk);
        writer.append(chunk);
        writer.close();

        byte[] all = Files.readAllBytes(wav);
        int payload = 2 * chunk.length;

        assertThat(all.length).isEqualTo(WAV_HEADER_SIZE + payload);
        assertThat(new String(all, 0, 4)).isEqualTo("RIFF");
        assertThat(new String(all, 8, 4)).isEqualTo("WAVE");
        assertThat(new String(all, 12, 4)).isEqualTo("fmt ");
        assertThat(new String(all, 36, 4)).isEqualTo("data");

        assertThat(readLEInt(all, 16)).isEqualTo(16);
        assertThat(readLEShort(all, 20)).isEqualTo(1);
        assertThat(readLEShort(all, WAV_CHANNELS_OFFSET)).isEqualTo(2);
        assertThat(readLEInt(all, WAV_SAMPLE_RATE_OFFSET)).isEqualTo(44_100);
        assertThat(readLEInt(all, WAV_BYTE_RATE_OFFSET)).isEqualTo(176_400);
        assertThat(readLEShort(all, WAV_BLOCK_ALIGN_OFFSET)).isEqualTo(4);
        assertThat(readLEShort(all, WAV_BITS_PER_SAMPLE_OFFSET)).isEqualTo(16);

        assertThat(readLEInt(all, WAV_RIFF_SIZE_OFFSET)).isEqualTo(36 + payload);
        assertThat(readLEInt(all, WAV_DATA_SIZE_OFFSET)).isEqualTo(payload);
    }

    @Test
    void shouldDescribeMonoFormat() throws IOException {
        Path wav = tempDir.resolve("mono.wav");

        try (WavFileWriter writer = WavFileWriter.open(wav, 48_000, 1)) {
            writer.append(new byte[960]);
            assertThat(writer.framesWritten()).isEqualTo(480);
        }

        byte[] all = Files.readAllBytes(wav);
        assertThat(readLEShort(all, WAV_CHANNELS_OFFSET)).isEqualTo(1);
        assertThat(readLEInt(all, WAV_BYTE_RATE_OFFSET)).isEqualTo(96_000);
        assertThat(readLEShort(all, WAV_BLOCK_ALIGN_OFFSET)).isEqualTo(2);
    }

    @Test
    void emptyRecordingShouldStillBeValid() throws IOException {
        Path wav = tempDir.resolve("empty.wav");

        WavFileWriter.open(wav, 44_100, 2).close();

        byte[] all = Files.readAllBytes(wav);
        assertThat(all.length).isEqualTo(WAV_HEADER_SIZE);
        assertThat(readLEInt(all, WAV_RIFF_SIZE_OFFSET)).isEqualTo(36);
        assertThat(readLEInt(all, WAV_DATA_SIZE_OFFSET)).isZero();
    }

    @Test
    void shouldPreservePayloadBytesInOrder() throws IOException {
        Path wav = tempDir.resolve("order.wav");
        byte[] first = {1, 2, 3, 4};
        byte[] second = {5, 6, 7, 8};

        try (WavFileWriter writer = WavFileWriter.open(wav, 44_100, 2)) {
            writer.append(first);
            writer.append(second);
        }

        byte[] all = Files.readAllBytes(wav);
        assertThat(all).endsWith(1, 2, 3, 4, 5, 6, 7, 8);
    }

    @Test
    void closeTwiceShouldBeNoOp() throws IOException {
        WavFileWriter writer = WavFileWriter.open(tempDir.resolve("twice.wav"), 44_100, 2);
        writer.close();
        writer.close();
    }

    @Test
    void appendAfterCloseShouldFail() throws IOException {
        WavFileWriter writer = WavFileWriter.open(tempDir.resolve("closed.wav"), 44_100, 2);
        writer.close();

        assertThatThrownBy(() -> writer.append(new byte[4]))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("closed");
    }

    @Test
    void shouldRejectInvalidFormat() {
        assertThatThrownBy(() -> WavFileWriter.open(tempDir.resolve("bad.wav"), 0, 2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WavFileWriter.open(tempDir.resolve("bad.wav"), 44_100, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void openShouldFailWhenDirectoryIsMissing() {
        Path wav = tempDir.resolve("missing").resolve("x.wav");

        assertThatThrownBy(() -> WavFileWriter.open(wav, 44_100, 2))
                .isInstanceOf(IOException.class);
    }
}
