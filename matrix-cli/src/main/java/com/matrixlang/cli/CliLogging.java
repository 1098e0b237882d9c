package com.matrixlang.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * 加载类路径上的 logging.properties；--verbose 时把根日志级别降到 FINE
 */
final class CliLogging {

    private CliLogging() {
    }

    static void configure(boolean verbose) {
        try (InputStream in = CliLogging.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            Logger.getLogger(CliLogging.class.getName())
                    .log(Level.WARNING, "cannot load logging.properties", e);
        }
        if (!verbose) return;
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }
}
