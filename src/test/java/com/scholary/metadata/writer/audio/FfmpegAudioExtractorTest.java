package com.scholary.metadata.writer.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/** Runs the extractor against small shell scripts standing in for ffmpeg and ffprobe. */
@EnabledOnOs({OS.LINUX, OS.MAC})
class FfmpegAudioExtractorTest {

  @TempDir Path tempDir;

  @Test
  void extract_shouldPassPcmOptionsToFfmpeg() throws IOException {
    Path args = tempDir.resolve("args.txt");
    Path ffmpeg = script("ffmpeg", "echo \"$@\" > " + args + "\nexit 0");
    FfmpegAudioExtractor extractor = extractor(ffmpeg.toString(), "ffprobe-missing");

    extractor.extract(tempDir.resolve("in.mp4"), tempDir.resolve("out.wav"));

    assertThat(Files.readString(args).strip())
        .isEqualTo(
            "-y -i "
                + tempDir.resolve("in.mp4")
                + " -vn -ac 1 -ar 16000 -c:a pcm_s16le "
                + tempDir.resolve("out.wav"));
  }

  @Test
  void extract_shouldReportStderrOnFailure() throws IOException {
    Path ffmpeg = script("ffmpeg", "echo 'moov atom not found' >&2\nexit 1");
    FfmpegAudioExtractor extractor = extractor(ffmpeg.toString(), "ffprobe-missing");

    assertThatThrownBy(() -> extractor.extract(tempDir.resolve("in.mp4"), tempDir.resolve("o.wav")))
        .isInstanceOf(AudioExtractionException.class)
        .hasMessage("moov atom not found");
  }

  @Test
  void extract_shouldUseGenericMessageWhenStderrIsEmpty() throws IOException {
    Path ffmpeg = script("ffmpeg", "exit 3");
    FfmpegAudioExtractor extractor = extractor(ffmpeg.toString(), "ffprobe-missing");

    assertThatThrownBy(() -> extractor.extract(tempDir.resolve("in.mp4"), tempDir.resolve("o.wav")))
        .isInstanceOf(AudioExtractionException.class)
        .hasMessage("Command failed");
  }

  @Test
  void extract_shouldFailWhenBinaryIsMissing() {
    FfmpegAudioExtractor extractor =
        extractor(tempDir.resolve("no-ffmpeg").toString(), "ffprobe-missing");

    assertThatThrownBy(() -> extractor.extract(tempDir.resolve("in.mp4"), tempDir.resolve("o.wav")))
        .isInstanceOf(AudioExtractionException.class)
        .hasMessageStartingWith("Failed to run ffmpeg");
  }

  @Test
  void probeDurationSeconds_shouldParseFfprobeOutput() throws IOException {
    Path ffprobe = script("ffprobe", "echo '125.48'");
    FfmpegAudioExtractor extractor = extractor("ffmpeg-missing", ffprobe.toString());

    assertThat(extractor.probeDurationSeconds(tempDir.resolve("a.wav"))).isEqualTo(125.48);
  }

  @Test
  void probeDurationSeconds_shouldReturnZeroOnFailure() throws IOException {
    Path garbage = script("ffprobe", "echo 'N/A'");
    Path failing = script("ffprobe-fail", "exit 1");

    assertThat(extractor("x", garbage.toString()).probeDurationSeconds(tempDir)).isZero();
    assertThat(extractor("x", failing.toString()).probeDurationSeconds(tempDir)).isZero();
    assertThat(
            extractor("x", tempDir.resolve("nope").toString()).probeDurationSeconds(tempDir))
        .isZero();
  }

  @Test
  void locate_shouldResolveExecutablesOnly() throws IOException {
    Path ffmpeg = script("ffmpeg", "exit 0");
    Path plain = Files.writeString(tempDir.resolve("plain"), "not executable");

    assertThat(FfmpegAudioExtractor.locate(ffmpeg.toString())).contains(ffmpeg);
    assertThat(FfmpegAudioExtractor.locate(plain.toString())).isEmpty();
    assertThat(FfmpegAudioExtractor.locate(tempDir.resolve("absent").toString())).isEmpty();
    assertThat(FfmpegAudioExtractor.locate("surely-not-a-real-binary-name")).isEmpty();
  }

  @Test
  void isAvailable_shouldRequireBothTools() throws IOException {
    Path ffmpeg = script("ffmpeg", "exit 0");
    Path ffprobe = script("ffprobe", "exit 0");

    assertThat(extractor(ffmpeg.toString(), ffprobe.toString()).isAvailable()).isTrue();
    assertThat(extractor(ffmpeg.toString(), tempDir.resolve("x").toString()).isAvailable())
        .isFalse();
  }

  private Path script(String name, String body) throws IOException {
    Path script = tempDir.resolve(name);
    Files.writeString(script, "#!/bin/sh\n" + body + "\n");
    Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
    return script;
  }

  private static FfmpegAudioExtractor extractor(String ffmpegPath, String ffprobePath) {
    return new FfmpegAudioExtractor(
        new FfmpegProperties(ffmpegPath, ffprobePath, 16000, 1, "pcm_s16le"));
  }
}
