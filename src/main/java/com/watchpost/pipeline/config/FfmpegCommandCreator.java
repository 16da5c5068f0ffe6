package com.watchpost.pipeline.config;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.net.URI;
import java.net.URISyntaxException;

import static com.watchpost.pipeline.config.Config.Camera;
import static com.watchpost.pipeline.config.Config.Credentials;
import static com.watchpost.pipeline.config.Config.RtspCamera;
import static com.watchpost.pipeline.config.Config.CommandCamera;

/** Builds the ffmpeg command that decodes a camera stream into raw 8-bit grey frames on stdout. */
public class FfmpegCommandCreator {
    public static final String FFMPEG = "ffmpeg";

    public static ImmutableList<String> createFfmpegCommand(Camera camera, Long socketTimeout_us) throws URISyntaxException {
        ImmutableList.Builder<String> command = ImmutableList.builder();
        if (camera instanceof RtspCamera) {
            RtspCamera rtspCamera = (RtspCamera)camera;

            String rtspUrlNoCreds = rtspCamera.rtspUrl();
            URI url = new URI(rtspUrlNoCreds);
            if (rtspCamera.credentials() != null) {
                //Add RTSP credentials if specified
                Credentials creds = rtspCamera.credentials();
                url = new URI(url.getScheme(),
                        String.format("%s:%s", creds.username(), creds.password()),
                        url.getHost(),
                        url.getPort(),
                        url.getPath(),
                        url.getQuery(),
                        url.getFragment());
            }

            command.add(FFMPEG, "-loglevel", "error", "-rtsp_transport", "tcp",
                    "-timeout", String.valueOf(socketTimeout_us), "-i", url.toString());
        } else if (camera instanceof CommandCamera) {
            CommandCamera commandCamera = (CommandCamera)camera;
            command.addAll(Splitter.on(' ').omitEmptyStrings().trimResults().split(commandCamera.commandPrefix()));
        } else {
            throw new IllegalArgumentException("Unknown camera type:" + camera.getClass().getCanonicalName());
        }

        command.add("-an",
                "-vf", String.format("fps=%d,scale=%d:%d", camera.frameRate(), camera.frameWidth(), camera.frameHeight()),
                "-pix_fmt", "gray",
                "-f", "rawvideo",
                "-");
        return command.build();
    }
}
