package org.taskfarm.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colors the wrapped pattern by level on ANSI terminals: errors red, warnings yellow,
 * INFO progress lines cyan. Used as {@code %levelColor(...)} in {@code logback.xml}.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String RESET = "\u001B[0m";
    static final String RED = "\u001B[31m";
    static final String YELLOW = "\u001B[33m";
    static final String CYAN = "\u001B[36m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        int level = event.getLevel().toInt();
        if (level >= Level.ERROR_INT) {
            return RED + in + RESET;
        }
        if (level == Level.WARN_INT) {
            return YELLOW + in + RESET;
        }
        if (level == Level.INFO_INT) {
            return CYAN + in + RESET;
        }
        return in;
    }
}
