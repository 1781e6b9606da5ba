package com.slicereport.config;

import com.slicereport.logging.AppLogger;

import java.nio.file.Path;
import java.util.Optional;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Lightweight wrapper around {@link Preferences} so the last export root survives between runs.
 */
public final class PreferencesStore {
    private static final String ROOT_NODE = "com/slicereport";

    private final Preferences delegate;

    private PreferencesStore(Preferences delegate) {
        this.delegate = delegate;
    }

    public static PreferencesStore global() {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE));
    }

    public static PreferencesStore of(Preferences node) {
        return new PreferencesStore(node);
    }

    public Optional<Path> getPath(String key) {
        return getString(key).map(Path::of);
    }

    public void putPath(String key, Path path) {
        if (path == null) return;
        putString(key, path.toString());
    }

    public Optional<String> getString(String key) {
        String value = delegate.get(key, null);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public void putString(String key, String value) {
        if (key == null || key.isBlank() || value == null) return;
        delegate.put(key, value);
        flush();
    }

    private void flush() {
        try {
            delegate.flush();
        } catch (BackingStoreException ex) {
            AppLogger.get().fine("Preferences not persisted: " + ex.getMessage());
        }
    }
}
