package relay.transform;

import relay.model.WatermarkConfig;
import relay.model.WatermarkPosition;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Watermarks videos by running an external {@code ffmpeg} process.
 *
 * <p>The overlay is fed through a {@code movie} source scaled relative to the frame width,
 * text through {@code drawtext}. With {@code videoCompress} the output is re-encoded with
 * libx264 at the configured CRF, otherwise streams are copied. The process is killed when it
 * exceeds {@code videoTimeout}.
 */
public final class VideoWatermarker {
    private static final Logger logger = Logger.getLogger(VideoWatermarker.class.getName());

    private final String ffmpegCommand;
    private volatile Boolean available;

    public VideoWatermarker() {
        this("ffmpeg");
    }

    public VideoWatermarker(String ffmpegCommand) {
        this.ffmpegCommand = Objects.requireNonNull(ffmpegCommand, "ffmpegCommand");
    }

    /**
     * Checks once whether {@code ffmpeg -version} runs; the answer is cached.
     */
    public boolean isAvailable() {
        Boolean cached = available;
        if (cached != null) {
            return cached;
        }
        boolean result;
        try {
            Process process = new ProcessBuilder(ffmpegCommand, "-version")
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            result = process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
            if (!result) {
                process.destroyForcibly();
            }
        } catch (IOException e) {
            result = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (!result) {
            logger.warning("ffmpeg not available (" + ffmpegCommand + "); videos will be forwarded unchanged");
        }
        available = result;
        return result;
    }

    public byte[] apply(byte[] input, String filename, WatermarkConfig config) throws IOException {
        Path workDir = Files.createTempDirectory("relay-video-");
        try {
            Path in = workDir.resolve("input" + extension(filename));
            Path out = workDir.resolve("output.mp4");
            Path log = workDir.resolve("ffmpeg.log");
            Files.write(in, input);

            Process process = new ProcessBuilder(command(in, out, config))
                    .redirectErrorStream(true)
                    .redirectOutput(log.toFile())
                    .start();
            boolean finished;
            try {
                finished = process.waitFor(config.videoTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while running ffmpeg");
            }
            if (!finished) {
                process.destroyForcibly();
                throw new IOException("ffmpeg timed out after " + config.videoTimeout().toSeconds() + "s");
            }
            if (process.exitValue() != 0) {
                throw new IOException("ffmpeg exited with " + process.exitValue() + ": " + tail(log));
            }
            if (!Files.isRegularFile(out) || Files.size(out) == 0) {
                throw new IOException("ffmpeg produced no output");
            }
            return Files.readAllBytes(out);
        } finally {
            deleteRecursively(workDir);
        }
    }

    List<String> command(Path in, Path out, WatermarkConfig config) {
        List<String> cmd = new ArrayList<>(List.of(ffmpegCommand, "-y", "-i", in.toString()));
        String drawtext = config.hasTextWatermark() ? drawtext(config) : null;
        boolean filtered = config.hasOverlayWatermark() || drawtext != null;
        if (config.hasOverlayWatermark()) {
            String graph = overlayGraph(config) + (drawtext == null ? "" : "," + drawtext) + "[v]";
            cmd.addAll(List.of("-filter_complex", graph, "-map", "[v]", "-map", "0:a?"));
        } else if (drawtext != null) {
            cmd.add("-vf");
            cmd.add(drawtext);
        }
        if (config.videoCompress()) {
            cmd.addAll(List.of("-c:v", "libx264", "-crf", String.valueOf(config.videoQuality()),
                    "-preset", "medium", "-c:a", "aac", "-b:a", "128k"));
        } else {
            // filters need a re-encode of the video stream; audio can be copied
            cmd.addAll(filtered ? List.of("-c:a", "copy") : List.of("-c", "copy"));
        }
        cmd.add(out.toString());
        return cmd;
    }

    /**
     * Overlay sized like the image path: its longer side is {@code overlayScale * min(W, H)} of
     * the video frame, aspect kept. {@code scale2ref} evaluates {@code main_w}/{@code main_h}
     * against the video and {@code a} against the overlay.
     */
    static String overlayGraph(WatermarkConfig config) {
        String[] pos = position(config.overlayPosition(), config.overlayCustomX(), config.overlayCustomY());
        return "movie=" + escape(Path.of(config.overlayPath()).toAbsolutePath().toString())
                + ",format=rgba,colorchannelmixer=aa=" + fmt(config.overlayOpacity()) + "[wm];"
                + "[wm][0:v]scale2ref=w='" + fmt(config.overlayScale()) + "*min(main_w,main_h)*min(1,a)'"
                + ":h='ow/a'[wm][base];"
                + "[base][wm]overlay=" + pos[0] + ":" + pos[1];
    }

    private static String drawtext(WatermarkConfig config) {
        String[] pos = position(config.textPosition(), config.textCustomX(), config.textCustomY());
        String text = "drawtext=text='" + escape(config.textContent().strip()) + "'"
                + ":fontcolor=" + ffmpegColor(config.fillColor())
                + ":fontsize=" + config.fontSize()
                + ":x=" + pos[0] + ":y=" + pos[1];
        if (config.outlineWidth() > 0) {
            text += ":borderw=" + config.outlineWidth() + ":bordercolor=" + ffmpegColor(config.outlineColor());
        }
        return text;
    }

    static String[] position(WatermarkPosition position, int customX, int customY) {
        String m = String.valueOf(PositionCalculator.MARGIN);
        return switch (position) {
            case TOP_LEFT -> new String[] {m, m};
            case TOP_RIGHT -> new String[] {"W-w-" + m, m};
            case BOTTOM_LEFT -> new String[] {m, "H-h-" + m};
            case BOTTOM_RIGHT -> new String[] {"W-w-" + m, "H-h-" + m};
            case CENTER -> new String[] {"(W-w)/2", "(H-h)/2"};
            case CUSTOM -> new String[] {String.valueOf(customX), String.valueOf(customY)};
        };
    }

    private static String ffmpegColor(String hex) {
        return "0x" + hex.substring(1);
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'").replace(":", "\\:");
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    private static String extension(String filename) {
        int dot = filename == null ? -1 : filename.lastIndexOf('.');
        return dot < 0 ? ".mp4" : filename.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static String tail(Path log) {
        try {
            String text = Files.readString(log, StandardCharsets.UTF_8);
            return text.length() <= 500 ? text.strip() : text.substring(text.length() - 500).strip();
        } catch (IOException e) {
            return "(no log: " + e.getMessage() + ")";
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    logger.log(Level.FINE, "Could not delete " + p, e);
                }
            });
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not clean up " + dir, e);
        }
    }
}
