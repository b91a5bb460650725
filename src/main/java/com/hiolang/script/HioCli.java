package com.hiolang.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.hiolang.debug.ConsoleDebugSink;
import com.hiolang.debug.Debug;
import com.hiolang.debug.DebugLevel;
import com.hiolang.script.compiler.BytecodeJson;
import com.hiolang.script.compiler.Chunk;
import com.hiolang.script.library.HioLibrary;
import com.hiolang.script.library.LibraryFunction;
import com.hiolang.script.library.LibraryRegistry;
import com.hiolang.script.parser.HioException;

/**
 * Command line entry point:
 * <pre>
 *   hio run &lt;file&gt;                 [--mode=auto|interpret|compile]
 *   hio compile &lt;file&gt; [out]       [--disassemble]
 *   hio exec &lt;bytecode-file&gt;
 *   hio lib | lib info &lt;name&gt; | lib create &lt;name&gt; &lt;language&gt;
 *   hio repl | version | help
 * </pre>
 * Common flags: --max-depth=N, --libs=&lt;dir&gt;, --debug.
 */
public final class HioCli {
    static final int EXIT_OK = 0;
    static final int EXIT_SCRIPT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private static final String TAG = "hio.cli";

    private final PrintStream out;
    private final PrintStream err;
    private final InputStream in;
    private final Path workDir;

    HioCli(PrintStream out, PrintStream err, InputStream in, Path workDir) {
        this.out = out;
        this.err = err;
        this.in = in;
        this.workDir = workDir;
    }

    public static void main(String[] args) {
        int code = new HioCli(System.out, System.err, System.in, Path.of("")).run(args);
        if (code != EXIT_OK) System.exit(code);
    }

    int run(String[] args) {
        Map<String, String> flags = parseArgs(args);
        List<String> positional = positional(args);

        if (flags.containsKey("debug")) {
            Debug.get().setSink(new ConsoleDebugSink(err, DebugLevel.TRACE));
        }
        if (positional.isEmpty()) {
            printHelp();
            return EXIT_OK;
        }

        HioScript engine = new HioScript(out);
        try {
            configure(engine, flags);
        } catch (NumberFormatException e) {
            err.println("Invalid --max-depth: " + flags.get("max-depth"));
            return EXIT_USAGE;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("Failed to load libraries: " + e.getMessage());
            return EXIT_IO;
        }

        String command = positional.get(0);
        Debug.get().d(TAG, "command " + command);
        try {
            switch (command) {
                case "run":
                    if (positional.size() < 2) return usage("Usage: hio run <file>");
                    return runFile(engine, resolve(positional.get(1)), flags.getOrDefault("mode", "auto"));
                case "compile":
                    if (positional.size() < 2) return usage("Usage: hio compile <file> [output]");
                    return compileFile(engine, resolve(positional.get(1)),
                            resolve(positional.size() > 2 ? positional.get(2) : "a.hio"),
                            flags.containsKey("disassemble"));
                case "exec":
                    if (positional.size() < 2) return usage("Usage: hio exec <bytecode-file>");
                    return execFile(engine, resolve(positional.get(1)));
                case "lib":
                    return library(engine.libraries(), positional);
                case "repl":
                    new HioRepl(engine, new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)), out, err).loop();
                    return EXIT_OK;
                case "version":
                    out.println("Hiolang v" + HioScript.VERSION);
                    return EXIT_OK;
                case "help":
                case "-h":
                    printHelp();
                    return EXIT_OK;
                default:
                    err.println("Unknown command: " + command);
                    printHelp();
                    return EXIT_USAGE;
            }
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        }
    }

    private void configure(HioScript engine, Map<String, String> flags) throws IOException {
        if (flags.containsKey("max-depth")) {
            engine.setMaxCallDepth(Integer.parseInt(flags.get("max-depth")));
        }
        if (flags.containsKey("libs")) {
            engine.libraries().loadDirectory(resolve(flags.get("libs")));
        }
    }

    // -------------------------
    // Commands
    // -------------------------

    private int runFile(HioScript engine, Path file, String mode) throws IOException {
        String source = read(file);
        if (source == null) return EXIT_IO;
        try {
            RunResult result;
            switch (mode) {
                case "auto": result = engine.execute(source); break;
                case "interpret": result = engine.interpret(source); break;
                case "compile": result = engine.compileAndRun(source); break;
                default: return usage("Unknown --mode: " + mode + " (expected auto, interpret or compile)");
            }
            if (!result.value().isVoid()) out.println("Result: " + result.value().display());
            return EXIT_OK;
        } catch (HioException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_SCRIPT_ERROR;
        }
    }

    private int compileFile(HioScript engine, Path file, Path output, boolean disassemble) throws IOException {
        String source = read(file);
        if (source == null) return EXIT_IO;
        Chunk chunk;
        try {
            chunk = engine.compile(source);
        } catch (HioException e) {
            err.println("Compilation error: " + e.getMessage());
            return EXIT_SCRIPT_ERROR;
        }
        if (disassemble) out.print(chunk.disassemble());
        BytecodeJson.writeFile(chunk, output);
        out.println("Successfully compiled to " + output);
        return EXIT_OK;
    }

    private int execFile(HioScript engine, Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            err.println("Failed to read file " + file);
            return EXIT_IO;
        }
        Chunk chunk;
        try {
            chunk = BytecodeJson.readFile(file);
        } catch (IOException e) {
            err.println("Invalid bytecode file " + file + ": " + e.getMessage());
            return EXIT_IO;
        } catch (HioException e) {
            err.println("Invalid bytecode file " + file + ": " + e.getMessage());
            return EXIT_SCRIPT_ERROR;
        }
        try {
            RunResult result = engine.runCompiled(chunk);
            if (!result.value().isVoid()) out.println("Result: " + result.value().display());
            return EXIT_OK;
        } catch (HioException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_SCRIPT_ERROR;
        }
    }

    private int library(LibraryRegistry registry, List<String> positional) throws IOException {
        if (positional.size() < 2) {
            out.println("Available Libraries:");
            for (String name : registry.list()) {
                HioLibrary lib = registry.get(name);
                out.println("  " + lib.name() + " v" + lib.version() + " (" + lib.language() + ")");
                out.println("    " + lib.description());
            }
            return EXIT_OK;
        }

        switch (positional.get(1)) {
            case "info": {
                if (positional.size() < 3) return usage("Usage: hio lib info <name>");
                HioLibrary lib = registry.get(positional.get(2));
                if (lib == null) {
                    err.println("Library not found: " + positional.get(2));
                    return EXIT_SCRIPT_ERROR;
                }
                out.println("Library: " + lib.name() + " v" + lib.version());
                out.println("Language: " + lib.language());
                out.println("Description: " + lib.description());
                out.println();
                out.println("Functions:");
                for (LibraryFunction fn : lib.functions()) {
                    out.println("  " + fn.signature());
                    out.println("    Implementation: " + fn.implementationLanguage());
                }
                return EXIT_OK;
            }
            case "create": {
                if (positional.size() < 4) return usage("Usage: hio lib create <name> <language>");
                String name = positional.get(2);
                String language = positional.get(3);
                registry.register(new HioLibrary(name, "1.0.0", "Custom library in " + language, language));
                Path file = resolve(name + LibraryRegistry.FILE_EXTENSION);
                registry.save(name, file);
                out.println("Created library " + name + " at " + file);
                return EXIT_OK;
            }
            default:
                err.println("Unknown library command: " + positional.get(1));
                return EXIT_USAGE;
        }
    }

    private void printHelp() {
        out.println("Hiolang Compiler/Interpreter v" + HioScript.VERSION);
        out.println();
        out.println("USAGE:");
        out.println("    hio <COMMAND> [ARGS] [--max-depth=N] [--libs=DIR] [--debug]");
        out.println();
        out.println("COMMANDS:");
        out.println("    run <FILE>               Run a Hiolang file (--mode=auto|interpret|compile)");
        out.println("    compile <FILE> [OUT]     Compile to bytecode (default a.hio, --disassemble)");
        out.println("    exec <FILE>              Run a compiled bytecode file");
        out.println("    lib                      List available libraries");
        out.println("    lib info <NAME>          Show library information");
        out.println("    lib create <NAME> <LANG> Create a new library");
        out.println("    repl                     Start interactive REPL");
        out.println("    version                  Show version");
        out.println("    help                     Show this help message");
    }

    // -------------------------
    // Helpers
    // -------------------------

    private int usage(String message) {
        err.println(message);
        return EXIT_USAGE;
    }

    private Path resolve(String path) {
        return workDir.resolve(path);
    }

    /** File contents, or null after reporting the failure. */
    private String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read file " + file + ": " + e.getMessage());
            return null;
        }
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            }
        }
        return out;
    }

    private static List<String> positional(String[] args) {
        List<String> out = new ArrayList<>();
        for (String a : args) {
            if (!a.startsWith("--")) out.add(a);
        }
        return out;
    }
}
