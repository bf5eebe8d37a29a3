package github.sarthakdev143.film_factory.integration.media;

import github.sarthakdev143.film_factory.integration.storage.ObjectStorage;
import github.sarthakdev143.film_factory.model.AssemblyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

public class FfmpegMediaAssembler implements MediaAssembler {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegMediaAssembler.class);
    static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";
    static final String DEFAULT_FFPROBE_BINARY = "ffprobe";
    private static final String VIDEO_CONTENT_TYPE = "video/mp4";

    private final ObjectStorage storage;
    private final String ffmpegBinary;
    private final String ffprobeBinary;
    private final Duration timeout;

    public FfmpegMediaAssembler(ObjectStorage storage, String ffmpegBinary, String ffprobeBinary, Duration timeout) {
        this.storage = storage;
        this.ffmpegBinary = ffmpegBinary;
        this.ffprobeBinary = ffprobeBinary;
        this.timeout = timeout;
    }

    /**
     * Uses {@code FFMPEG_PATH} when set and looks for ffprobe next to it.
     */
    public static FfmpegMediaAssembler fromEnvironment(ObjectStorage storage, Duration timeout) {
        String configuredPath = System.getenv(FFMPEG_PATH_ENV);
        if (configuredPath == null || configuredPath.isBlank()) {
            return new FfmpegMediaAssembler(storage, DEFAULT_FFMPEG_BINARY, DEFAULT_FFPROBE_BINARY, timeout);
        }
        Path ffmpeg = Path.of(configuredPath);
        Path parent = ffmpeg.getParent();
        String ffprobe = parent == null ? DEFAULT_FFPROBE_BINARY : parent.resolve(ffprobeFileName(ffmpeg)).toString();
        return new FfmpegMediaAssembler(storage, configuredPath, ffprobe, timeout);
    }

    @Override
    public AssemblyResult assemble(String filmId, List<String> orderedRefs) throws IOException, InterruptedException {
        if (orderedRefs == null || orderedRefs.isEmpty()) {
            throw new IllegalArgumentException("At least one clip is required for assembly.");
        }

        List<Path> clips = new ArrayList<>();
        for (String ref : orderedRefs) {
            Path clip = storage.resolve(ref);
            if (!Files.isRegularFile(clip)) {
                throw new IOException("Clip not found for ref " + ref);
            }
            clips.add(clip);
        }

        if (clips.size() == 1) {
            return new AssemblyResult(orderedRefs.get(0), probeDuration(clips.get(0)));
        }

        Path workDir = Files.createTempDirectory("film-factory-assembly-");
        Path listFile = workDir.resolve("clips.txt");
        Path output = workDir.resolve("film.mp4");
        try {
            Files.writeString(listFile, buildConcatList(clips), StandardCharsets.UTF_8);
            runCommand(buildConcatCommand(listFile, output), "concat " + clips.size() + " clips for film " + filmId);
            double duration = probeDuration(output);
            String ref = storage.uploadFile("films", output, VIDEO_CONTENT_TYPE);
            logger.info("Assembled film {} clips={} durationSeconds={}", filmId, clips.size(), duration);
            return new AssemblyResult(ref, duration);
        } finally {
            deleteIfExists(listFile);
            deleteIfExists(output);
            deleteIfExists(workDir);
        }
    }

    String buildConcatList(List<Path> clips) {
        StringBuilder list = new StringBuilder();
        for (Path clip : clips) {
            String escaped = clip.toAbsolutePath().toString().replace("'", "'\\''");
            list.append("file '").append(escaped).append("'\n");
        }
        return list.toString();
    }

    List<String> buildConcatCommand(Path listFile, Path output) {
        return List.of(
                ffmpegBinary,
                "-y",
                "-f",
                "concat",
                "-safe",
                "0",
                "-i",
                listFile.toString(),
                "-c",
                "copy",
                output.toString());
    }

    List<String> buildProbeCommand(Path video) {
        return List.of(
                ffprobeBinary,
                "-v",
                "error",
                "-show_entries",
                "format=duration",
                "-of",
                "default=noprint_wrappers=1:nokey=1",
                video.toString());
    }

    double parseDuration(String probeOutput) throws IOException {
        String trimmed = probeOutput == null ? "" : probeOutput.trim();
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            throw new IOException("FFprobe returned an unreadable duration: " + trimmed, e);
        }
    }

    private double probeDuration(Path video) throws IOException, InterruptedException {
        return parseDuration(runCommand(buildProbeCommand(video), "probe duration"));
    }

    private String runCommand(List<String> command, String stage) throws IOException, InterruptedException {
        logger.info("Running command for stage {}: {}", stage, String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();

        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append(System.lineSeparator());
            }
        }

        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            process.destroyForcibly();
            throw new IOException("Command timed out during stage: " + stage);
        }

        if (process.exitValue() != 0) {
            throw new IOException(
                    "Command failed during stage "
                            + stage
                            + " with exit code "
                            + process.exitValue()
                            + ". Output: "
                            + output);
        }
        return output.toString();
    }

    private static String ffprobeFileName(Path ffmpeg) {
        String name = ffmpeg.getFileName().toString();
        return name.endsWith(".exe") ? "ffprobe.exe" : DEFAULT_FFPROBE_BINARY;
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.debug("Could not delete temporary file {}", path, e);
        }
    }
}
