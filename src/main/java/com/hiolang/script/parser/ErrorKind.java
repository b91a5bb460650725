package com.hiolang.script.parser;

/** Tags carried by runtime and compile errors. */
public enum ErrorKind {
    UNDEFINED_VARIABLE,
    UNDEFINED_FUNCTION,
    ARITY_MISMATCH,
    TYPE_MISMATCH,
    INDEX_OUT_OF_BOUNDS,
    UNDEFINED_KEY,
    DIVISION_BY_ZERO,
    CALL_DEPTH_EXCEEDED,
    INVALID_CALL_TARGET,
    UNBOUND_LIBRARY_FUNCTION,
    UNRESOLVED_JUMP
}
