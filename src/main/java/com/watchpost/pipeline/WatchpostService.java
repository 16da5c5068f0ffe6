package com.watchpost.pipeline;

import com.watchpost.pipeline.acquisition.FfmpegFrameSource;
import com.watchpost.pipeline.config.Config;
import com.watchpost.pipeline.config.ConfigWatcher;
import com.watchpost.pipeline.config.YamlConfigSource;
import com.watchpost.pipeline.core.DatedFilePipelineEventNotifier;
import com.watchpost.pipeline.core.FatalPipelineException;
import com.watchpost.pipeline.core.FatalReason;
import com.watchpost.pipeline.core.LogPipelineEventNotifier;
import com.watchpost.pipeline.core.PipelineEventNotifier;
import com.watchpost.pipeline.inference.ClassificationService;
import com.watchpost.pipeline.inference.DescriptionService;
import com.watchpost.pipeline.pipeline.PipelineOutcome;
import com.watchpost.pipeline.pipeline.PipelineSupervisor;
import com.watchpost.pipeline.sink.DatedJsonEventSink;
import com.watchpost.pipeline.sink.LoggingEventSink;
import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.ServiceLoader;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the pipeline from configuration. Classification and description engines are discovered
 * through {@link ServiceLoader}; without a classification engine the pipeline runs motion-only.
 */
public class WatchpostService {
    final static Logger LOGGER = LoggerFactory.getLogger(WatchpostService.class);
    static final Duration SHUTDOWN_MARGIN = Duration.ofSeconds(1);

    public static PipelineSupervisor createSupervisor(Config config, @Nullable YamlConfigSource configSource,
                                                      PipelineEventNotifier eventNotifier) {
        return PipelineSupervisor.builder()
                .config(config)
                .configSource(configSource)
                .frameSource(new FfmpegFrameSource(config.cameraName(), config.camera(), config.socketTimeout_us()))
                .classificationService(loadService(ClassificationService.class))
                .descriptionService(loadService(DescriptionService.class))
                .addEventSink(new DatedJsonEventSink(new File(config.eventDataFolder()), config.partitionZoneId()))
                .addEventSink(new LoggingEventSink())
                .eventNotifier(eventNotifier)
                .build();
    }

    @Nullable
    static <T> T loadService(Class<T> serviceClass) {
        T service = ServiceLoader.load(serviceClass).findFirst().orElse(null);
        if (service == null) {
            LOGGER.info("No {} found on the classpath", serviceClass.getSimpleName());
        } else {
            LOGGER.info("Using {} {}", serviceClass.getSimpleName(), service.getClass().getName());
        }
        return service;
    }

    /** Validates collaborators and returns without consuming frames. */
    public static PipelineOutcome dryRun(Config config) {
        PipelineSupervisor supervisor = createSupervisor(config, null, new LogPipelineEventNotifier());
        try {
            supervisor.runHealthChecks();
            LOGGER.info("Dry run OK: camera [{}], event data in {}, storage limit {} GB, retention floor {} days",
                    config.cameraName(), config.eventDataFolder(), config.maxStorageGb(), config.minRetentionDays());
            return PipelineOutcome.clean();
        } catch (FatalPipelineException e) {
            return PipelineOutcome.fatal(e);
        }
    }

    /** This will block until the pipeline stops. */
    public static PipelineOutcome run(Config config, YamlConfigSource configSource) {
        PipelineEventNotifier eventNotifier = new DatedFilePipelineEventNotifier(new File(config.operationsLogFolder()));
        PipelineSupervisor supervisor = createSupervisor(config, configSource, eventNotifier);

        File configFile = configSource.configFile();
        if (config.watchConfigFile() && configFile != null) {
            try {
                supervisor.watchConfig(new ConfigWatcher(configFile, supervisor::requestReload));
            } catch (IOException e) {
                LOGGER.warn("Can't watch config file {}, hot reload disabled", configFile, e);
            }
        }

        Duration shutdownCeiling = Duration.ofSeconds(config.drainTimeoutSeconds())
                .plusMillis(config.queuePollMillis())
                .plus(SHUTDOWN_MARGIN);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            supervisor.requestShutdown(null);
            try {
                if (!supervisor.awaitStopped(shutdownCeiling)) {
                    LOGGER.error("Pipeline didn't stop within {}, halting", shutdownCeiling);
                    Runtime.getRuntime().halt(FatalReason.DRAIN_TIMEOUT.exitCode());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "watchpost-shutdown"));

        return supervisor.run();
    }
}
