package io.patchbay.config;

import io.patchbay.util.AtomicWrites;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;

/**
 * User settings backed by a properties file, {@code ~/.config/patchbay/patchbay.properties} unless another path is
 * given. Reads are served from a cached copy; writes go to disk atomically and then notify listeners.
 */
public final class PatchbaySettings {
    private static final Logger logger = LogManager.getLogger(PatchbaySettings.class);

    public static final String SETTINGS_FILE_NAME = "patchbay.properties";
    public static final String PATCH_DETAILS_PREFIX = "views.patchDetails.";

    public static final String AVATARS = "views.patchDetails.avatars";
    public static final String DATE_FORMAT = "defaultDateFormat";
    public static final String FILES_LAYOUT = "views.patchDetails.files.layout";
    public static final String FILES_COMPACT = "views.patchDetails.files.compact";
    public static final String FILES_ICON = "views.patchDetails.files.icon";
    public static final String FILES_THRESHOLD = "views.patchDetails.files.threshold";
    public static final String INDENT_GUIDES = "workbench.tree.renderIndentGuides";
    public static final String AUTOLINKS_ENABLED = "views.patchDetails.autolinks.enabled";
    public static final String DEBOUNCE_MILLIS = "views.patchDetails.debounceMillis";

    public static final String API_BASE_URL = "cloud.api.baseUrl";
    public static final String API_TOKEN = "cloud.api.token";
    public static final String CONNECT_TIMEOUT_SECONDS = "cloud.api.connectTimeoutSeconds";
    public static final String READ_TIMEOUT_SECONDS = "cloud.api.readTimeoutSeconds";

    static final String TOKEN_ENV = "PATCHBAY_API_TOKEN";
    static final String CONFIG_DIR_ENV = "PATCHBAY_CONFIG_DIR";

    public static final String DEFAULT_DATE_FORMAT = "MMMM Do, YYYY h:mma";
    public static final String DEFAULT_API_BASE_URL = "https://api.patchbay.io/";
    public static final int DEFAULT_FILES_THRESHOLD = 5;
    public static final long DEFAULT_DEBOUNCE_MILLIS = 500;
    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 10;
    public static final int DEFAULT_READ_TIMEOUT_SECONDS = 30;

    private final Path file;
    private final List<SettingsChangeListener> listeners = new CopyOnWriteArrayList<>();
    private @Nullable Properties cachedProps;

    public PatchbaySettings(Path file) {
        this.file = file;
    }

    /** Settings in the user's config directory ({@code $PATCHBAY_CONFIG_DIR} or {@code ~/.config/patchbay}). */
    public static PatchbaySettings forUser() {
        return new PatchbaySettings(getConfigDir().resolve(SETTINGS_FILE_NAME));
    }

    public static Path getConfigDir() {
        var override = System.getenv(CONFIG_DIR_ENV);
        if (override != null && !override.isBlank()) {
            return Path.of(override);
        }
        return Path.of(System.getProperty("user.home"), ".config", "patchbay");
    }

    public Path getFile() {
        return file;
    }

    private synchronized Properties loadProps() {
        if (cachedProps != null) {
            return (Properties) cachedProps.clone();
        }

        var props = new Properties();
        if (Files.exists(file)) {
            try (var reader = Files.newBufferedReader(file)) {
                props.load(reader);
            } catch (IOException e) {
                logger.error("Failed to load settings from {}: {}", file, e.getMessage());
            }
        }
        cachedProps = (Properties) props.clone();
        return props;
    }

    private synchronized void saveProps(Properties props) throws IOException {
        AtomicWrites.atomicSaveProperties(file, props, "Patchbay settings");
        cachedProps = (Properties) props.clone();
    }

    public String getString(String key, String defaultValue) {
        return loadProps().getProperty(key, defaultValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        var value = loadProps().getProperty(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    public int getInt(String key, int defaultValue) {
        var value = loadProps().getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}", value, key);
            return defaultValue;
        }
    }

    public void set(String key, @Nullable String value) throws IOException {
        var change = new HashMap<String, @Nullable String>();
        change.put(key, value);
        update(change);
    }

    /**
     * Writes several keys at once; a null or blank value removes the key. Listeners are notified once with the keys
     * that actually changed, and not at all if nothing did.
     */
    public void update(Map<String, @Nullable String> values) throws IOException {
        Set<String> changed = new LinkedHashSet<>();
        synchronized (this) {
            var props = loadProps();
            for (var entry : values.entrySet()) {
                var key = entry.getKey();
                var value = entry.getValue();
                var previous = props.getProperty(key);
                if (value == null || value.isBlank()) {
                    if (previous != null) {
                        props.remove(key);
                        changed.add(key);
                    }
                } else if (!Objects.equals(previous, value.trim())) {
                    props.setProperty(key, value.trim());
                    changed.add(key);
                }
            }
            if (changed.isEmpty()) {
                return;
            }
            saveProps(props);
        }
        logger.debug("Settings changed: {}", changed);
        var keys = Set.copyOf(changed);
        for (var listener : listeners) {
            listener.settingsChanged(keys);
        }
    }

    public void addListener(SettingsChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SettingsChangeListener listener) {
        listeners.remove(listener);
    }

    @VisibleForTesting
    synchronized void resetCache() {
        cachedProps = null;
    }

    // ---- typed accessors ----

    public boolean isAvatarsEnabled() {
        return getBoolean(AVATARS, true);
    }

    public String getDateFormat() {
        return getString(DATE_FORMAT, DEFAULT_DATE_FORMAT);
    }

    public String getFilesLayout() {
        return getString(FILES_LAYOUT, "auto");
    }

    public boolean isFilesCompact() {
        return getBoolean(FILES_COMPACT, true);
    }

    public String getFilesIcon() {
        return getString(FILES_ICON, "type");
    }

    public int getFilesThreshold() {
        return getInt(FILES_THRESHOLD, DEFAULT_FILES_THRESHOLD);
    }

    public String getIndentGuides() {
        return getString(INDENT_GUIDES, "onHover");
    }

    public boolean isAutolinksEnabled() {
        return getBoolean(AUTOLINKS_ENABLED, true);
    }

    public Duration getDebounce() {
        return Duration.ofMillis(Math.max(0, getInt(DEBOUNCE_MILLIS, (int) DEFAULT_DEBOUNCE_MILLIS)));
    }

    public URI getApiBaseUri() {
        var value = getString(API_BASE_URL, DEFAULT_API_BASE_URL).trim();
        return URI.create(value.endsWith("/") ? value : value + "/");
    }

    /** The API token from the settings file, else from {@code $PATCHBAY_API_TOKEN}. */
    public Optional<String> getApiToken() {
        var token = loadProps().getProperty(API_TOKEN);
        if (token == null || token.isBlank()) {
            token = System.getenv(TOKEN_ENV);
        }
        return token == null || token.isBlank() ? Optional.empty() : Optional.of(token.trim());
    }

    public Duration getConnectTimeout() {
        return Duration.ofSeconds(getInt(CONNECT_TIMEOUT_SECONDS, DEFAULT_CONNECT_TIMEOUT_SECONDS));
    }

    public Duration getReadTimeout() {
        return Duration.ofSeconds(getInt(READ_TIMEOUT_SECONDS, DEFAULT_READ_TIMEOUT_SECONDS));
    }
}
