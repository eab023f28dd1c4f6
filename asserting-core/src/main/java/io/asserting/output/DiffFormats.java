/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.asserting.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Selects the diff format from the process environment.
 * <p>
 * The highlight mode is read from the system property {@value #PROPERTY_HIGHLIGHT_DIFFS}
 * or, if that is not set, from the environment variable {@value #ENV_HIGHLIGHT_DIFFS}.
 * Recognized modes are {@code red-green} (default), {@code red-blue}, {@code red-yellow},
 * {@code bold} and {@code off}, compared case-insensitively.
 * <p>
 * A non-empty {@value #ENV_NO_COLOR} variable (https://no-color.org) turns every
 * colored mode into no highlighting. The {@code bold} mode uses no color and is kept.
 */
public final class DiffFormats {

    private static final Logger logger = LoggerFactory.getLogger(DiffFormats.class);

    public static final String ENV_HIGHLIGHT_DIFFS = "ASSERTING_HIGHLIGHT_DIFFS";
    public static final String PROPERTY_HIGHLIGHT_DIFFS = "asserting.highlight.diffs";
    public static final String ENV_NO_COLOR = "NO_COLOR";

    public static final String MODE_RED_GREEN = "red-green";
    public static final String MODE_RED_BLUE = "red-blue";
    public static final String MODE_RED_YELLOW = "red-yellow";
    public static final String MODE_BOLD = "bold";
    public static final String MODE_OFF = "off";

    public static final String DEFAULT_MODE = MODE_RED_GREEN;

    private DiffFormats() {
        // only static methods
    }

    public static Optional<DiffFormat> forMode(String mode) {
        if (mode == null) {
            return Optional.empty();
        }
        return switch (mode.trim().toLowerCase(Locale.ROOT)) {
            case MODE_RED_GREEN -> Optional.of(DiffFormat.RED_GREEN);
            case MODE_RED_BLUE -> Optional.of(DiffFormat.RED_BLUE);
            case MODE_RED_YELLOW -> Optional.of(DiffFormat.RED_YELLOW);
            case MODE_BOLD -> Optional.of(DiffFormat.BOLD);
            case MODE_OFF -> Optional.of(DiffFormat.NO_HIGHLIGHT);
            default -> Optional.empty();
        };
    }

    /**
     * Resolves the diff format for the given setting values without touching any
     * process state.
     *
     * @param mode    value of the highlight mode setting, null if not set
     * @param noColor value of the NO_COLOR variable, null if not set
     */
    public static DiffFormat resolve(String mode, String noColor) {
        return resolve(mode, "highlight mode", noColor);
    }

    /**
     * Like {@link #resolve(String, String)}, naming the setting the mode was read
     * from when the value is not recognized.
     */
    public static DiffFormat resolve(String mode, String setting, String noColor) {
        boolean colorDisabled = noColor != null && !noColor.isEmpty();
        DiffFormat format;
        if (mode == null) {
            format = DiffFormat.DEFAULT;
        } else {
            Optional<DiffFormat> found = forMode(mode);
            if (found.isPresent()) {
                format = found.get();
            } else {
                logger.warn("{} is set to the unrecognized value '{}', default highlight mode '{}' is used",
                        setting, mode, DEFAULT_MODE);
                format = DiffFormat.DEFAULT;
            }
        }
        if (colorDisabled && !DiffFormat.BOLD.equals(format)) {
            return DiffFormat.NO_HIGHLIGHT;
        }
        return format;
    }

    /**
     * Name of the setting the highlight mode is taken from: the system property
     * when it is set, the environment variable otherwise.
     */
    static String modeSetting(String propertyValue) {
        return propertyValue != null ? PROPERTY_HIGHLIGHT_DIFFS : ENV_HIGHLIGHT_DIFFS;
    }

    /**
     * The diff format configured for this process. Resolved once on first use.
     */
    public static DiffFormat configured() {
        return Holder.CONFIGURED;
    }

    private static class Holder {

        static final DiffFormat CONFIGURED = init();

        static DiffFormat init() {
            String property = System.getProperty(PROPERTY_HIGHLIGHT_DIFFS);
            String mode = property != null ? property : System.getenv(ENV_HIGHLIGHT_DIFFS);
            DiffFormat format = resolve(mode, modeSetting(property), System.getenv(ENV_NO_COLOR));
            logger.debug("highlight mode: {}, resolved diff format: {}", mode, format);
            return format;
        }

    }

}
