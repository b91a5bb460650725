package com.hiolang.script.library;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hiolang.debug.Debug;

/**
 * Libraries by name, with (namespace, function) lookup for call resolution.
 *
 * Libraries persist as pretty-printed JSON ".hiolib" files:
 * <pre>
 * { "name": ..., "version": ..., "description": ..., "language": ...,
 *   "functions": { "fn": { "params": [...], "return_type": ..., "implementation_language": ..., "source_code": ... } } }
 * </pre>
 */
public class LibraryRegistry {
    public static final String FILE_EXTENSION = ".hiolib";

    private static final String TAG = "hio.lib";
    private static final ObjectMapper om = new ObjectMapper();

    private final Map<String, HioLibrary> libraries = new TreeMap<>();

    public void register(HioLibrary lib) {
        libraries.put(lib.name(), lib);
        Debug.get().d(TAG, "registered library " + lib.name() + " v" + lib.version());
    }

    /** Null when absent. */
    public HioLibrary get(String name) {
        return libraries.get(name);
    }

    /** Library names in sorted order. */
    public List<String> list() {
        return Collections.unmodifiableList(new ArrayList<>(libraries.keySet()));
    }

    /** The function {@code namespace.fn}, or null. */
    public LibraryFunction lookup(String namespace, String fn) {
        HioLibrary lib = libraries.get(namespace);
        return lib == null ? null : lib.getFunction(fn);
    }

    /** Splits a qualified path at its last dot; null for unqualified names. */
    public LibraryFunction lookupPath(String path) {
        int dot = path.lastIndexOf('.');
        if (dot <= 0 || dot == path.length() - 1) return null;
        return lookup(path.substring(0, dot), path.substring(dot + 1));
    }

    // -------------------------
    // JSON persistence
    // -------------------------

    public HioLibrary loadFile(Path file) throws IOException {
        HioLibrary lib = fromJson(Files.readString(file, StandardCharsets.UTF_8));
        register(lib);
        return lib;
    }

    /** Loads every *.hiolib file in {@code dir}; returns how many were loaded. */
    public int loadDirectory(Path dir) throws IOException {
        int count = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + FILE_EXTENSION)) {
            for (Path f : files) {
                loadFile(f);
                count++;
            }
        }
        Debug.get().i(TAG, "loaded " + count + " libraries from " + dir);
        return count;
    }

    public void save(String name, Path file) throws IOException {
        HioLibrary lib = libraries.get(name);
        if (lib == null) throw new IllegalArgumentException("Library not found: " + name);
        Files.writeString(file, toJson(lib), StandardCharsets.UTF_8);
    }

    public static String toJson(HioLibrary lib) throws IOException {
        ObjectNode root = om.createObjectNode();
        root.put("name", lib.name());
        root.put("version", lib.version());
        root.put("description", lib.description());
        root.put("language", lib.language());

        ObjectNode fns = root.putObject("functions");
        for (LibraryFunction fn : lib.functions()) {
            ObjectNode f = fns.putObject(fn.name());
            ArrayNode params = f.putArray("params");
            for (String p : fn.params()) params.add(p);
            f.put("return_type", fn.returnType());
            f.put("implementation_language", fn.implementationLanguage());
            f.put("source_code", fn.sourceCode());
        }
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    }

    public static HioLibrary fromJson(String json) throws IOException {
        JsonNode root = om.readTree(json);
        if (root == null || !root.isObject()) throw new IOException("Library definition must be a JSON object");

        String name = root.path("name").asText("");
        if (name.isEmpty()) throw new IOException("Library definition has no 'name'");

        HioLibrary lib = new HioLibrary(
                name,
                root.path("version").asText("1.0.0"),
                root.path("description").asText(""),
                root.path("language").asText(""));

        JsonNode fns = root.path("functions");
        if (fns.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = fns.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                JsonNode f = e.getValue();
                List<String> params = new ArrayList<>();
                for (JsonNode p : f.path("params")) params.add(p.asText());
                lib.addFunction(new LibraryFunction(
                        e.getKey(),
                        params,
                        f.path("return_type").asText("void"),
                        f.path("implementation_language").asText(lib.language()),
                        f.path("source_code").asText("")));
            }
        }
        return lib;
    }
}
