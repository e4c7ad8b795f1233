package org.imbalance.logging;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

public class Printer {

    // ANSI
    private static final String WHITE  = "\u001B[97m";
    private static final String RED    = "\u001B[31m";
    private static final String GREEN  = "\u001B[32m";
    private static final String YELLOW = "\u001B[33m";
    private static final String BLUE   = "\u001B[34m";
    private static final String RESET  = "\u001B[0m";

    private static final String LOGGER_NAME = Printer.class.getSimpleName();

    private static Printer instance = null;
    private Logger logger = null;

    private Printer() {}

    public static synchronized Printer getInstance() {
        if (instance == null) {
            instance = new Printer();
        }
        return instance;
    }

    synchronized Logger getLogger() {
        if (logger == null) {
            try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream("logging.properties")) {
                if (inputStream != null) {
                    LogManager.getLogManager().readConfiguration(inputStream);
                }
            } catch (IOException e) {
                // keep the JUL defaults, the console handler below is enough
                Logger.getLogger(LOGGER_NAME).warning("Cannot read logging.properties: " + e.getMessage());
            }

            logger = Logger.getLogger(LOGGER_NAME);
            logger.setUseParentHandlers(false);

            ConsoleHandler handler = new ConsoleHandler();
            handler.setLevel(Level.ALL);
            handler.setFormatter(new Formatter() {
                @Override
                public String format(LogRecord logRecord) {
                    String color = switch (logRecord.getLevel().getName()) {
                        case "SEVERE"  -> RED;
                        case "WARNING" -> YELLOW;
                        case "INFO"    -> GREEN;
                        case "CONFIG"  -> BLUE;
                        default        -> WHITE;
                    };

                    // white brackets, colored level, message as the caller built it
                    return String.format(
                            "%s[%s%s%s%s] %s%n",
                            WHITE,
                            color,
                            logRecord.getLevel(),
                            RESET,
                            WHITE,
                            logRecord.getMessage()
                    );
                }
            });

            logger.addHandler(handler);
            logger.setLevel(Level.ALL);
        }
        return logger;
    }

    public static void println(String s) {
        getInstance().getLogger().log(Level.INFO, WHITE + s + RESET);
    }

    public static void printlnBlue(String s) {
        getInstance().getLogger().log(Level.INFO, BLUE + s + RESET);
    }

    public static void printlnGreen(String s) {
        getInstance().getLogger().config(GREEN + s + RESET);
    }

    public static void printYellow(String s) {
        getInstance().getLogger().warning(YELLOW + s + RESET);
    }

    public static void errorPrint(String s) {
        getInstance().getLogger().severe(RED + s + RESET);
    }

    /**
     * Removes the ANSI color codes added by the print methods, for sinks that are not a terminal.
     */
    static String stripColors(String s) {
        return s == null ? null : s.replaceAll("\u001B\\[[0-9;]*m", "");
    }
}
