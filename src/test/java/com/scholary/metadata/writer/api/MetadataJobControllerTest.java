package com.scholary.metadata.writer.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.metadata.writer.audio.AudioExtractor;
import com.scholary.metadata.writer.config.JobProperties;
import com.scholary.metadata.writer.generation.GenerationProperties;
import com.scholary.metadata.writer.job.JobNotFoundException;
import com.scholary.metadata.writer.job.JobStore;
import com.scholary.metadata.writer.job.LinkMode;
import com.scholary.metadata.writer.job.MetadataJob;
import com.scholary.metadata.writer.service.MetadataJobOrchestrator;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class MetadataJobControllerTest {

  @Mock private MetadataJobOrchestrator orchestrator;
  @Mock private AudioExtractor audioExtractor;

  @TempDir Path tempDir;

  private MockMvc mockMvc;
  private Path uploadDir;

  @BeforeEach
  void setUp() {
    uploadDir = tempDir.resolve("uploads");
    JobProperties jobProperties =
        new JobProperties(
            uploadDir.toString(),
            tempDir.resolve("work").toString(),
            List.of(".mp4", ".m4a", ".wav", ".webm"),
            "en",
            1,
            1);
    GenerationProperties generationProperties =
        new GenerationProperties(
            "sk-test",
            "https://api.openai.com",
            "gpt-5.2-thinking",
            List.of("gpt-5-mini", "gpt-4o"),
            "high",
            10,
            600,
            "classpath:prompts/metadata-writer.txt");
    SubmissionValidator submissionValidator =
        new SubmissionValidator(audioExtractor, generationProperties, jobProperties);

    MetadataJobController controller =
        new MetadataJobController(
            orchestrator,
            submissionValidator,
            audioExtractor,
            generationProperties,
            new JobStore(0, 0),
            jobProperties);
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
  }

  @Test
  void submit_shouldStoreUploadAndReturnJobId() throws Exception {
    when(audioExtractor.isAvailable()).thenReturn(true);
    ArgumentCaptor<Path> saved = ArgumentCaptor.forClass(Path.class);
    when(orchestrator.submit(saved.capture(), eq(LinkMode.PROVIDED), eq("https://youtu.be/a")))
        .thenReturn("job-1");

    mockMvc
        .perform(
            multipart("/api/jobs")
                .file(new MockMultipartFile("file", "lesson.MP4", "video/mp4", new byte[] {1, 2}))
                .param("linkMode", "provided")
                .param("links", "https://youtu.be/a"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("job-1"));

    assertThat(saved.getValue().getParent()).isEqualTo(uploadDir);
    assertThat(saved.getValue().getFileName().toString()).endsWith(".mp4");
    assertThat(Files.readAllBytes(saved.getValue())).containsExactly(1, 2);
  }

  @Test
  void submit_shouldDefaultToCheckedNoLinks() throws Exception {
    when(audioExtractor.isAvailable()).thenReturn(true);
    when(orchestrator.submit(any(), eq(LinkMode.CHECKED_NO_LINKS), eq(""))).thenReturn("job-2");

    mockMvc
        .perform(
            multipart("/api/jobs")
                .file(new MockMultipartFile("file", "a.wav", "audio/wav", new byte[] {1})))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("job-2"));
  }

  @Test
  void submit_shouldRejectUnsupportedFileType() throws Exception {
    when(audioExtractor.isAvailable()).thenReturn(true);

    mockMvc
        .perform(
            multipart("/api/jobs")
                .file(new MockMultipartFile("file", "notes.txt", "text/plain", new byte[] {1})))
        .andExpect(status().isBadRequest())
        .andExpect(
            jsonPath("$.error").value("Unsupported file type: .txt. Use mp4, m4a, wav, webm."));

    verify(orchestrator, never()).submit(any(), any(), any());
  }

  @Test
  void submit_shouldRejectMissingFile() throws Exception {
    when(audioExtractor.isAvailable()).thenReturn(true);

    mockMvc
        .perform(multipart("/api/jobs").param("linkMode", "provided"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("No file uploaded"));
  }

  @Test
  void getJobStatus_shouldReturnSnapshot() throws Exception {
    MetadataJob job =
        MetadataJob.queued("job-1")
            .withTranscript("00:00 hi")
            .withQaResult(List.of("Missing title label: X"))
            .completed("metadata text");
    when(orchestrator.poll("job-1")).thenReturn(job);

    mockMvc
        .perform(get("/api/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.jobId").value("job-1"))
        .andExpect(jsonPath("$.stage").value("COMPLETED"))
        .andExpect(jsonPath("$.stageLabel").value("Done."))
        .andExpect(jsonPath("$.progress").value(100))
        .andExpect(jsonPath("$.done").value(true))
        .andExpect(jsonPath("$.transcript").value("00:00 hi"))
        .andExpect(jsonPath("$.metadata").value("metadata text"))
        .andExpect(jsonPath("$.qaIssues[0]").value("Missing title label: X"))
        .andExpect(jsonPath("$.qaPass").value(false));
  }

  @Test
  void getJobStatus_shouldReturn404ForUnknownJob() throws Exception {
    when(orchestrator.poll("nope")).thenThrow(new JobNotFoundException("nope"));

    mockMvc
        .perform(get("/api/jobs/nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("Unknown job id"));
  }

  @Test
  void health_shouldReportToolsAndModels() throws Exception {
    when(audioExtractor.extractorLocation()).thenReturn(Optional.of(Path.of("/usr/bin/ffmpeg")));
    when(audioExtractor.probeLocation()).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ffmpeg").value(true))
        .andExpect(jsonPath("$.ffprobe").value(false))
        .andExpect(jsonPath("$.ffmpegPath").value("/usr/bin/ffmpeg"))
        .andExpect(jsonPath("$.apiKeyConfigured").value(true))
        .andExpect(jsonPath("$.model").value("gpt-5.2-thinking"))
        .andExpect(jsonPath("$.fallbackModels[1]").value("gpt-4o"))
        .andExpect(jsonPath("$.reasoningEffort").value("high"))
        .andExpect(jsonPath("$.jobs").value(0));
  }
}
