package com.hiolang.script.library;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Metadata for the libraries bundled with every registry. */
public final class StandardLibraries {

    private StandardLibraries() {}

    public static List<HioLibrary> all() {
        return Arrays.asList(c(), cpp(), rust(), go());
    }

    /** A registry preloaded with {@link #all()}. */
    public static LibraryRegistry newRegistry() {
        LibraryRegistry registry = new LibraryRegistry();
        for (HioLibrary lib : all()) registry.register(lib);
        return registry;
    }

    public static HioLibrary c() {
        return new HioLibrary("stdlib_c", "1.0.0", "Standard library implemented in C", "C")
                .addFunction(new LibraryFunction("strlen", Collections.singletonList("str"), "number", "C",
                        "#include <string.h>\n"
                                + "int strlen_hio(const char* str) {\n"
                                + "    return strlen(str);\n"
                                + "}\n"))
                .addFunction(new LibraryFunction("strcpy", Arrays.asList("dest", "src"), "string", "C",
                        "#include <string.h>\n"
                                + "char* strcpy_hio(char* dest, const char* src) {\n"
                                + "    return strcpy(dest, src);\n"
                                + "}\n"));
    }

    public static HioLibrary cpp() {
        return new HioLibrary("stdlib_cpp", "1.0.0", "Standard library implemented in C++", "C++")
                .addFunction(new LibraryFunction("string_length", Collections.singletonList("str"), "number", "C++",
                        "#include <string>\n"
                                + "int string_length(const std::string& str) {\n"
                                + "    return str.length();\n"
                                + "}\n"));
    }

    public static HioLibrary rust() {
        return new HioLibrary("stdlib_rust", "1.0.0", "Standard library implemented in Rust", "Rust")
                .addFunction(new LibraryFunction("string_reverse", Collections.singletonList("str"), "string", "Rust",
                        "pub fn string_reverse(s: &str) -> String {\n"
                                + "    s.chars().rev().collect()\n"
                                + "}\n"));
    }

    public static HioLibrary go() {
        return new HioLibrary("stdlib_go", "1.0.0", "Standard library implemented in Go", "Go")
                .addFunction(new LibraryFunction("bytes_to_string", Collections.singletonList("data"), "string", "Go",
                        "func BytesToString(data []byte) string {\n"
                                + "    return string(data)\n"
                                + "}\n"));
    }
}
