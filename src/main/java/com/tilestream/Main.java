package com.tilestream;

import com.tilestream.core.StreamLoop;
import com.tilestream.world.gen.GenConfig;
import com.tilestream.world.gen.GenConfigLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for the headless terrain streamer.
 * <p>
 * Usage:
 *   java -jar tilestream.jar                           # default config, 600 frames
 *   java -jar tilestream.jar --config world.properties # load config file
 *   java -jar tilestream.jar --ticks 1200 --pan 400,0  # frames and camera pan (px/s)
 *   java -jar tilestream.jar --viewport 1280x720 --fast
 */
public class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws IOException, InterruptedException {
        installLogging();

        String configPath = null;
        int ticks = 600;
        float panX = 300f, panY = 0f;
        float width = 1280f, height = 720f;
        boolean fast = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config" -> {
                    if (i + 1 < args.length) configPath = args[++i];
                }
                case "--ticks" -> {
                    if (i + 1 < args.length) ticks = Integer.parseInt(args[++i]);
                }
                case "--pan" -> {
                    if (i + 1 < args.length) {
                        String[] parts = args[++i].split(",");
                        panX = Float.parseFloat(parts[0]);
                        panY = parts.length > 1 ? Float.parseFloat(parts[1]) : 0f;
                    }
                }
                case "--viewport" -> {
                    if (i + 1 < args.length) {
                        String[] parts = args[++i].toLowerCase().split("x");
                        width = Float.parseFloat(parts[0]);
                        height = Float.parseFloat(parts[1]);
                    }
                }
                case "--fast" -> fast = true;
                default -> LOG.warning("Ignoring unknown argument: " + args[i]);
            }
        }

        GenConfig config = configPath != null
            ? GenConfigLoader.load(Path.of(configPath))
            : GenConfigLoader.loadDefaults();
        LOG.info("Starting with " + config);

        StreamLoop loop = new StreamLoop(config, width, height);
        loop.setPan(panX, panY);
        if (fast) loop.setTickRate(0);
        try {
            loop.run(ticks);
        } finally {
            loop.shutdown();
        }
    }

    private static void installLogging() {
        try (InputStream is = Main.class.getResourceAsStream("/logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            System.err.println("Failed to read logging.properties: " + e.getMessage());
        }
    }
}
