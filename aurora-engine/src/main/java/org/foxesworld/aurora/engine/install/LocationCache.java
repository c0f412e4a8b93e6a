package org.foxesworld.aurora.engine.install;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Lazily loaded, explicitly invalidated holder for one location's index.
 * <p>
 * Either {@code UNLOADED} or {@code LOADED(data)}; an empty index is still loaded.
 * No eviction and no locking: the owning installation is single-owner.
 */
public final class LocationCache<T> {

    public enum State { UNLOADED, LOADED }

    private final String name;
    private final Supplier<T> loader;

    private State state = State.UNLOADED;
    private T data;

    public LocationCache(String name, Supplier<T> loader) {
        this.name = Objects.requireNonNull(name, "name");
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    public T get() {
        if (state == State.UNLOADED) {
            load();
        }
        return data;
    }

    /** Rebuilds the index regardless of state and swaps it in whole. */
    public T reload() {
        load();
        return data;
    }

    /** Replaces the loaded value in place, used for partial reloads. */
    public void set(T value) {
        data = Objects.requireNonNull(value, "value");
        state = State.LOADED;
    }

    public void clear() {
        data = null;
        state = State.UNLOADED;
    }

    public State state() { return state; }

    public boolean isLoaded() { return state == State.LOADED; }

    public String name() { return name; }

    private void load() {
        T v = Objects.requireNonNull(loader.get(), () -> "loader for " + name + " returned null");
        data = v;
        state = State.LOADED;
    }

    @Override
    public String toString() {
        return "LocationCache{" + name + ", " + state + '}';
    }
}
