package com.hiolang.script.parser;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Candidate names tried, in order, when resolving a callee path. */
public final class CallTargets {

    private CallTargets() {}

    /**
     * An unqualified name called inside a space tries {@code space.name} first,
     * then {@code name}. Qualified paths are only ever tried as written.
     */
    public static List<String> candidates(String path, String space) {
        if (space == null || space.isEmpty() || path.indexOf('.') >= 0) {
            return Collections.singletonList(path);
        }
        return Arrays.asList(space + "." + path, path);
    }

    public static String qualify(String space, String name) {
        return (space == null || space.isEmpty()) ? name : space + "." + name;
    }
}
