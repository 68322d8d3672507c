package com.example.musicstreaming.infrastructure.dash;

import com.example.musicstreaming.common.config.AppStreamingProperties;
import com.example.musicstreaming.domain.DashManifestProfile;
import com.example.musicstreaming.domain.PlaybackCodec;
import com.example.musicstreaming.domain.SourceType;
import com.example.musicstreaming.domain.model.DashAsset;
import com.example.musicstreaming.domain.model.DashAssetRequest;
import com.example.musicstreaming.domain.model.PlaybackProfile;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs an external ffmpeg process that muxes the source into DASH segments.
 */
@Component
public class FfmpegDashSegmentGenerator implements DashSegmentGenerator {

    private static final Logger log = LoggerFactory.getLogger(FfmpegDashSegmentGenerator.class);

    private static final int OUTPUT_TAIL_LIMIT = 4096;
    private static final int FALLBACK_REPRESENTATION_BITRATE_KBPS = 96;

    private final AppStreamingProperties streamingProperties;

    public FfmpegDashSegmentGenerator(AppStreamingProperties streamingProperties) {
        this.streamingProperties = streamingProperties;
    }

    @Override
    public void generate(DashAssetRequest request, DashAsset asset) {
        Path outputDir = Paths.get(asset.getOutputDir());
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new DashBuildException("Cannot create DASH output directory " + outputDir, e);
        }

        List<String> command = buildCommand(request, asset);
        long startedAtNanos = System.nanoTime();
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(outputDir.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new DashBuildException("Cannot start ffmpeg: " + e.getMessage(), e);
        }

        try {
            String outputTail = drain(process.getInputStream());
            boolean finished = process.waitFor(streamingProperties.getBuildTimeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new DashBuildException("ffmpeg timed out after "
                        + streamingProperties.getBuildTimeoutSeconds() + "s");
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new DashBuildException("DASH segment generation failed with exit code " + exitCode + ": "
                        + (outputTail.isEmpty() ? "no output" : outputTail.trim()));
            }
            log.info("DASH_SEGMENTS_GENERATED trackId={} cacheKey={} profile={} costMs={}",
                    request.getTrackId(), asset.getCacheKey(), asset.getManifestProfile().getValue(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAtNanos));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new DashBuildException("DASH segment generation interrupted", e);
        } catch (IOException e) {
            process.destroyForcibly();
            throw new DashBuildException("Cannot read ffmpeg output: " + e.getMessage(), e);
        }
    }

    List<String> buildCommand(DashAssetRequest request, DashAsset asset) {
        PlaybackProfile profile = PlaybackProfile.resolve(SourceType.LOCAL, request.getQuality(),
                request.getSourcePath());
        boolean dual = asset.getManifestProfile() == DashManifestProfile.STEADY_STATE_DUAL;

        List<String> command = new ArrayList<>();
        command.add(streamingProperties.getFfmpegPath());
        command.add("-hide_banner");
        command.add("-nostdin");
        command.add("-y");
        command.add("-i");
        command.add(request.getSourcePath());
        command.add("-map");
        command.add("0:a:0");
        if (dual) {
            command.add("-map");
            command.add("0:a:0");
        }
        command.add("-vn");
        if (profile.getCodec() == PlaybackCodec.FLAC) {
            command.add("-c:a:0");
            command.add("flac");
            command.add("-strict");
            command.add("experimental");
        } else {
            command.add("-c:a:0");
            command.add("aac");
            command.add("-b:a:0");
            command.add(profile.getBitrateKbps() + "k");
        }
        if (dual) {
            command.add("-c:a:1");
            command.add("aac");
            command.add("-b:a:1");
            command.add(FALLBACK_REPRESENTATION_BITRATE_KBPS + "k");
        }
        command.add("-f");
        command.add("dash");
        command.add("-seg_duration");
        command.add(String.valueOf(streamingProperties.getSegmentDurationSeconds()));
        command.add("-use_template");
        command.add("1");
        command.add("-use_timeline");
        command.add("1");
        command.add("-init_seg_name");
        command.add("init-$RepresentationID$.m4s");
        command.add("-media_seg_name");
        command.add("chunk-$RepresentationID$-$Number%05d$.m4s");
        command.add("-adaptation_sets");
        command.add("id=0,streams=a");
        command.add(Paths.get(asset.getManifestPath()).getFileName().toString());
        return command;
    }

    private String drain(InputStream stream) throws IOException {
        byte[] buffer = new byte[4096];
        StringBuilder tail = new StringBuilder();
        int read;
        while ((read = stream.read(buffer)) != -1) {
            tail.append(new String(buffer, 0, read, StandardCharsets.UTF_8));
            if (tail.length() > OUTPUT_TAIL_LIMIT) {
                tail.delete(0, tail.length() - OUTPUT_TAIL_LIMIT);
            }
        }
        return tail.toString();
    }
}
