package com.watchpost.pipeline;

import com.watchpost.pipeline.config.Config;
import com.watchpost.pipeline.config.YamlConfigSource;
import com.watchpost.pipeline.core.ConfigurationException;
import com.watchpost.pipeline.core.FatalPipelineException;
import com.watchpost.pipeline.core.FatalReason;
import com.watchpost.pipeline.pipeline.PipelineOutcome;
import java.io.File;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

public class Main {
    final static Logger LOGGER = LoggerFactory.getLogger(Main.class);

    static final String CONFIG_OPTION_NAME = "config";
    static final String DRY_RUN_OPTION_NAME = "dry-run";
    static final String WATCHPOST_APP_NAME = "Watchpost";

    public static void resetLog4j2Context() {
        LoggerContext context = (LoggerContext)LogManager.getContext(false);
        context.reconfigure();
    }

    static Options createOptions() {
        Options options = new Options();
        options.addOption("c", CONFIG_OPTION_NAME, true, "Config file name");
        options.addOption(Option.builder()
                .longOpt(DRY_RUN_OPTION_NAME)
                .desc("Validate config and collaborators, then exit")
                .build());
        return options;
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /** @return process exit code */
    static int execute(String[] args) {
        // create the command line parser
        CommandLineParser parser = new DefaultParser();
        Options options = createOptions();

        try {
            // Parse the command line arguments
            CommandLine line = parser.parse(options, args);

            if (!line.hasOption(CONFIG_OPTION_NAME)) {
                System.out.println("Please specify config name");

                HelpFormatter formatter = new HelpFormatter();
                formatter.printHelp(WATCHPOST_APP_NAME, options);
                return FatalReason.INVALID_CONFIGURATION.exitCode();
            }

            String configName = line.getOptionValue(CONFIG_OPTION_NAME);
            YamlConfigSource configSource = new YamlConfigSource(configName);
            Config config = configSource.load();

            if (!Strings.isBlank(config.log4jFolder())) {
                File logsFolder = new File(checkNotNull(config.log4jFolder()));
                if (!logsFolder.exists()) {
                    logsFolder.mkdirs();
                }
                String fullLogsFolderPaths = logsFolder.getAbsolutePath();
                if (!fullLogsFolderPaths.endsWith("/")) {
                    fullLogsFolderPaths = fullLogsFolderPaths + "/";
                }

                System.setProperty("LOG_FOLDER", fullLogsFolderPaths);
                resetLog4j2Context();
            }

            PipelineOutcome outcome = line.hasOption(DRY_RUN_OPTION_NAME)
                    ? WatchpostService.dryRun(config)
                    : WatchpostService.run(config, configSource);

            if (!outcome.isClean()) {
                System.err.println(outcome.diagnostic());
            }
            LOGGER.info("Exiting with code {}", outcome.exitCode());
            return outcome.exitCode();
        } catch (ParseException pe) {
            System.out.println("Argument parsing error: " + pe.getMessage());

            HelpFormatter formatter = new HelpFormatter();
            formatter.printHelp(WATCHPOST_APP_NAME, options);
            return FatalReason.INVALID_CONFIGURATION.exitCode();
        } catch (ConfigurationException e) {
            FatalPipelineException fatal = new FatalPipelineException(FatalReason.INVALID_CONFIGURATION, e.getMessage(), e);
            System.err.println(fatal.diagnostic());
            return fatal.getReason().exitCode();
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected error", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
