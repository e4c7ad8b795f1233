package org.imbalance.logging;

import java.util.Locale;

/**
 * Logs how long a block took, used with try-with-resources:
 * <pre>
 * try (PhaseTimer ignored = PhaseTimer.start("Loading dataset")) { ... }
 * </pre>
 */
public final class PhaseTimer implements AutoCloseable {

    private final String title;
    private final long start;

    private PhaseTimer(String title) {
        this.title = title;
        this.start = System.currentTimeMillis();
    }

    public static PhaseTimer start(String title) {
        Printer.printlnBlue(title + "...");
        return new PhaseTimer(title);
    }

    public long elapsedSeconds() {
        return Math.round((System.currentTimeMillis() - start) / 1000.0);
    }

    @Override
    public void close() {
        Printer.println(String.format(Locale.US, "%s - done in %ds", title, elapsedSeconds()));
    }
}
