package org.imbalance.logging;

import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

public class CollectLogger {

    private Logger logger;

    private CollectLogger() {}

    private static class Holder {
        private static final CollectLogger INSTANCE = new CollectLogger();
    }

    public static CollectLogger getInstance() {
        return Holder.INSTANCE;
    }

    public synchronized Logger getLogger() {
        if (logger == null) {
            // logging.properties is read once, by Printer; reading it again would reset every handler
            Printer.getInstance().getLogger();
            this.logger = Logger.getLogger(CollectLogger.class.getSimpleName());
        }
        return this.logger;
    }

    public void info(String msg, Object... args) {
        getLogger().log(Level.INFO, msg, args);
    }

    public void warning(String msg, Object... args) {
        getLogger().log(Level.WARNING, msg, args);
    }

    public void severe(String msg, Object... args) {
        getLogger().log(Level.SEVERE, msg, args);
    }

    // lazy variant: the message is built only if the level is enabled
    public void log(Level level, Supplier<String> msgSupplier) {
        Logger l = getLogger();
        if (l.isLoggable(level)) {
            l.log(level, msgSupplier);
        }
    }
}
