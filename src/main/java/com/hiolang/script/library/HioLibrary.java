package com.hiolang.script.library;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A named, versioned group of {@link LibraryFunction}s. */
public final class HioLibrary {
    private final String name;
    private final String version;
    private final String description;
    private final String language;
    private final Map<String, LibraryFunction> functions = new LinkedHashMap<>();

    public HioLibrary(String name, String version, String description, String language) {
        this.name = Objects.requireNonNull(name, "name");
        this.version = version == null ? "1.0.0" : version;
        this.description = description == null ? "" : description;
        this.language = language == null ? "" : language;
    }

    public String name() { return name; }
    public String version() { return version; }
    public String description() { return description; }
    public String language() { return language; }

    public HioLibrary addFunction(LibraryFunction fn) {
        functions.put(fn.name(), fn);
        return this;
    }

    /** Null when absent. */
    public LibraryFunction getFunction(String fnName) {
        return functions.get(fnName);
    }

    public Collection<LibraryFunction> functions() {
        return Collections.unmodifiableCollection(functions.values());
    }
}
