package com.example.ample.infrastructure.media;

import com.example.ample.common.config.AppScrobblerProperties;
import com.example.ample.domain.enumtype.MediaStatus;
import com.example.ample.domain.enumtype.MediaType;
import com.example.ample.domain.model.PlaybackSample;
import com.example.ample.domain.model.TrackIdentity;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the active MPRIS session through the {@code playerctl} CLI, one process per poll.
 * <p>
 * Output goes to a temp file so the wait is bounded by {@code app.scrobbler.poll-timeout-ms}; a
 * process still running at the deadline is killed.
 */
@Component
public class PlayerctlMediaSessionPoller implements MediaSessionPoller {

    private static final Logger log = LoggerFactory.getLogger(PlayerctlMediaSessionPoller.class);

    private static final String FIELD_SEPARATOR = "\t";
    private static final String FORMAT = String.join(FIELD_SEPARATOR,
            "{{playerName}}", "{{status}}", "{{artist}}", "{{title}}", "{{album}}",
            "{{mpris:length}}", "{{position}}");
    private static final String NO_PLAYERS = "No players found";
    private static final int FIELD_COUNT = 7;

    private final List<String> command;
    private final long timeoutMs;

    public PlayerctlMediaSessionPoller(AppScrobblerProperties properties) {
        List<String> cmd = new ArrayList<>(properties.getPlayerctlCommand());
        cmd.add("metadata");
        cmd.add("--format");
        cmd.add(FORMAT);
        this.command = cmd;
        this.timeoutMs = properties.getPollTimeoutMs();
    }

    @Override
    public Optional<PlaybackSample> poll() throws MediaPollException {
        Path outputFile;
        try {
            outputFile = Files.createTempFile("ample-playerctl", ".out");
        } catch (IOException e) {
            throw new MediaPollException("Cannot create playerctl output file: " + e.getMessage(), e);
        }
        try {
            return run(outputFile);
        } finally {
            deleteQuietly(outputFile);
        }
    }

    private Optional<PlaybackSample> run(Path outputFile) throws MediaPollException {
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile())
                    .start();
        } catch (IOException e) {
            throw new MediaPollException("Cannot start " + command.get(0) + ": " + e.getMessage(), e);
        }
        try {
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new MediaPollException(command.get(0) + " did not finish within " + timeoutMs + " ms");
            }
            String output = new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                if (output.contains(NO_PLAYERS)) {
                    return Optional.empty();
                }
                throw new MediaPollException(command.get(0) + " exited with " + process.exitValue() + ": " + output.trim());
            }
            return parse(output);
        } catch (IOException e) {
            throw new MediaPollException("Reading " + command.get(0) + " output failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new MediaPollException("Interrupted while polling media session", e);
        }
    }

    static Optional<PlaybackSample> parse(String output) throws MediaPollException {
        if (output == null) {
            return Optional.empty();
        }
        String line = output;
        int newline = line.indexOf('\n');
        if (newline >= 0) {
            line = line.substring(0, newline);
        }
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        if (line.trim().isEmpty()) {
            return Optional.empty();
        }
        String[] fields = line.split(FIELD_SEPARATOR, -1);
        if (fields.length < FIELD_COUNT) {
            throw new MediaPollException("Unexpected playerctl output: " + line);
        }
        TrackIdentity identity = new TrackIdentity(fields[0], fields[2], fields[3], fields[4]);
        PlaybackSample sample = new PlaybackSample(
                identity,
                toStatus(fields[1]),
                MediaType.UNKNOWN,
                toMicros(fields[5]),
                toMicros(fields[6]));
        log.debug("Polled media session, sample={}", sample);
        return Optional.of(sample);
    }

    private static MediaStatus toStatus(String raw) {
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "playing":
                return MediaStatus.PLAYING;
            case "paused":
                return MediaStatus.PAUSED;
            case "stopped":
                return MediaStatus.STOPPED;
            default:
                return MediaStatus.CLOSED;
        }
    }

    private static long toMicros(String raw) throws MediaPollException {
        String value = raw.trim();
        if (value.isEmpty()) {
            return 0L;
        }
        try {
            // some players report microseconds as a float
            return value.indexOf('.') >= 0 ? (long) Double.parseDouble(value) : Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new MediaPollException("Unexpected playerctl time value: " + value, e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Deleting playerctl output file failed, path={}", file, e);
        }
    }
}
