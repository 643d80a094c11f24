package work.flowscript.exporter.api;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable settings for one export: script layout and the browser the script launches.
 */
public record ExportConfiguration(
    String indentUnit,
    String browser,
    boolean headless,
    Duration defaultTimeout,
    Optional<Clock> timestampClock
) {
    public static final Set<String> BROWSERS = Set.of("chromium", "firefox", "webkit");

    public ExportConfiguration {
        Objects.requireNonNull(indentUnit, "indentUnit");
        Objects.requireNonNull(browser, "browser");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        Objects.requireNonNull(timestampClock, "timestampClock");
        if (indentUnit.isEmpty() || !indentUnit.isBlank()) {
            throw new IllegalArgumentException("Indent unit must be non-empty whitespace");
        }
        browser = browser.trim().toLowerCase(Locale.ROOT);
        if (!BROWSERS.contains(browser)) {
            throw new IllegalArgumentException("Unsupported browser: " + browser);
        }
        if (defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("Default timeout must not be negative");
        }
    }

    public static ExportConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .indentUnit(indentUnit)
            .browser(browser)
            .headless(headless)
            .defaultTimeout(defaultTimeout)
            .timestampClock(timestampClock);
    }

    public static final class Builder {
        private String indentUnit = "    ";
        private String browser = "chromium";
        private boolean headless;
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private Optional<Clock> timestampClock = Optional.of(Clock.systemDefaultZone());

        public Builder indentUnit(String indentUnit) {
            this.indentUnit = indentUnit;
            return this;
        }

        public Builder indentWidth(int spaces) {
            this.indentUnit = " ".repeat(Math.max(spaces, 0));
            return this;
        }

        public Builder browser(String browser) {
            this.browser = browser;
            return this;
        }

        public Builder headless(boolean headless) {
            this.headless = headless;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder timestampClock(Optional<Clock> timestampClock) {
            this.timestampClock = timestampClock;
            return this;
        }

        public Builder withoutTimestamp() {
            this.timestampClock = Optional.empty();
            return this;
        }

        public ExportConfiguration build() {
            return new ExportConfiguration(indentUnit, browser, headless, defaultTimeout, timestampClock);
        }
    }
}
