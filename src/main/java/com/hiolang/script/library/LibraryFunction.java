package com.hiolang.script.library;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Signature of a function implemented in a foreign language. Only metadata:
 * scripts can see and arity-check these, but never invoke them.
 */
public final class LibraryFunction {
    private final String name;
    private final List<String> params;
    private final String returnType;
    private final String implementationLanguage;
    private final String sourceCode;

    public LibraryFunction(String name, List<String> params, String returnType,
                           String implementationLanguage, String sourceCode) {
        this.name = Objects.requireNonNull(name, "name");
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.returnType = returnType == null ? "void" : returnType;
        this.implementationLanguage = implementationLanguage == null ? "" : implementationLanguage;
        this.sourceCode = sourceCode == null ? "" : sourceCode;
    }

    public String name() { return name; }
    public List<String> params() { return params; }
    public int arity() { return params.size(); }
    public String returnType() { return returnType; }
    public String implementationLanguage() { return implementationLanguage; }
    public String sourceCode() { return sourceCode; }

    /** "strlen(str) -> number" */
    public String signature() {
        return name + "(" + String.join(", ", params) + ") -> " + returnType;
    }

    @Override
    public String toString() {
        return signature();
    }
}
