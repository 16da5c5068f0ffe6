package com.watchpost.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class MainTest {
    @TempDir
    File tempDir;

    @Test
    public void missingConfigOptionIsAConfigurationError() {
        assertEquals(2, Main.execute(new String[0]));
    }

    @Test
    public void unknownOptionIsAConfigurationError() {
        assertEquals(2, Main.execute(new String[] {"--no-such-option"}));
    }

    @Test
    public void invalidConfigExitsBeforeStarting() throws IOException {
        File configFile = new File(tempDir, "bad.yaml");
        Files.writeString(configFile.toPath(), String.join("\n",
                "eventDataFolder: " + new File(tempDir, "events").getAbsolutePath(),
                "commandCamera:",
                "  commandPrefix: ffmpeg -i test.mp4",
                "samplingRate: 0",
                ""), StandardCharsets.UTF_8);

        assertEquals(2, Main.execute(new String[] {"-c", configFile.getAbsolutePath()}));
    }

    @Test
    public void missingConfigFileExitsWithConfigurationCode() {
        assertEquals(2, Main.execute(new String[] {"--config", new File(tempDir, "absent.yaml").getAbsolutePath()}));
    }
}
