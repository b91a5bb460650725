package com.hiolang.script.compiler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hiolang.script.parser.Value;

/**
 * JSON form of a compiled program, written by {@code hio compile} and read by
 * {@code hio exec}. Format version 1:
 * <pre>
 * { "format": 1, "chunk": { "name", "arity", "slots", "code": [ {"op", "line", ...} ], "functions": { name: chunk } } }
 * </pre>
 */
public final class BytecodeJson {
    public static final int FORMAT = 1;

    private static final ObjectMapper om = new ObjectMapper();

    private BytecodeJson() {}

    public static String write(Chunk main) throws IOException {
        ObjectNode root = om.createObjectNode();
        root.put("format", FORMAT);
        root.set("chunk", chunkNode(main));
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    }

    public static void writeFile(Chunk main, Path file) throws IOException {
        Files.writeString(file, write(main), StandardCharsets.UTF_8);
    }

    public static Chunk read(String json) throws IOException {
        JsonNode root = om.readTree(json);
        if (root == null || !root.isObject()) throw new IOException("Bytecode file must be a JSON object");
        int format = root.path("format").asInt(-1);
        if (format != FORMAT) throw new IOException("Unsupported bytecode format: " + root.path("format"));
        JsonNode chunk = root.path("chunk");
        if (!chunk.isObject()) throw new IOException("Bytecode file has no 'chunk'");
        return readChunk(chunk).verify();
    }

    public static Chunk readFile(Path file) throws IOException {
        return read(Files.readString(file, StandardCharsets.UTF_8));
    }

    // -------------------------
    // Encoding
    // -------------------------

    private static ObjectNode chunkNode(Chunk c) {
        ObjectNode n = om.createObjectNode();
        n.put("name", c.name());
        n.put("arity", c.arity());
        n.put("slots", c.slotCount());

        ArrayNode code = n.putArray("code");
        for (BytecodeOp op : c.ops()) {
            ObjectNode o = code.addObject();
            o.put("op", op.opcode.name());
            switch (op.opcode.operand) {
                case CONST: o.set("const", constNode(op.constant)); break;
                case NAME: o.put("name", op.name); break;
                case NAME_COUNT: o.put("name", op.name); o.put("arg", op.arg); break;
                case SLOT:
                case TARGET:
                case COUNT: o.put("arg", op.arg); break;
                default: break;
            }
            o.put("line", op.line);
        }

        if (!c.functions().isEmpty()) {
            ObjectNode fns = n.putObject("functions");
            for (Map.Entry<String, Chunk> e : c.functions().entrySet()) {
                fns.set(e.getKey(), chunkNode(e.getValue()));
            }
        }
        return n;
    }

    private static ObjectNode constNode(Value v) {
        ObjectNode n = om.createObjectNode();
        n.put("type", v.type.name());
        switch (v.type) {
            case INTEGER: n.put("value", v.asInteger()); break;
            case FLOAT: n.put("value", v.asFloat()); break;
            case TEXT: n.put("value", v.asText()); break;
            case BOOLEAN: n.put("value", v.asBool()); break;
            default:
                throw new IllegalArgumentException("Not a constant: " + v);
        }
        return n;
    }

    // -------------------------
    // Decoding
    // -------------------------

    private static Chunk readChunk(JsonNode n) throws IOException {
        Chunk c = new Chunk(n.path("name").asText("<main>"), n.path("arity").asInt(0));
        int slots = n.path("slots").asInt(0);
        if (slots < 0 || c.arity() < 0) {
            throw new IOException(c.name() + ": bad arity/slots " + c.arity() + "/" + slots);
        }
        c.setSlotCount(slots);

        for (JsonNode o : n.path("code")) {
            OpCode code;
            try {
                code = OpCode.valueOf(o.path("op").asText());
            } catch (IllegalArgumentException e) {
                throw new IOException("Unknown opcode: " + o.path("op").asText(), e);
            }
            int line = o.path("line").asInt(0);
            int arg = o.path("arg").asInt(0);
            String name = o.hasNonNull("name") ? o.get("name").asText() : null;
            Value constant = code.operand == OpCode.Operand.CONST ? readConst(o.path("const")) : null;
            if ((code.operand == OpCode.Operand.NAME || code.operand == OpCode.Operand.NAME_COUNT) && name == null) {
                throw new IOException(code + " without a name");
            }
            if (code.operand == OpCode.Operand.SLOT && (arg < 0 || arg >= slots)) {
                throw new IOException(c.name() + ": " + code + " slot " + arg + " outside 0.." + (slots - 1));
            }
            if ((code.operand == OpCode.Operand.COUNT || code.operand == OpCode.Operand.NAME_COUNT) && arg < 0) {
                throw new IOException(c.name() + ": " + code + " with negative count " + arg);
            }
            c.emit(new BytecodeOp(code, constant, name, arg, line));
        }
        List<BytecodeOp> ops = c.ops();
        if (ops.isEmpty() || ops.get(ops.size() - 1).opcode != OpCode.RETURN) {
            throw new IOException(c.name() + ": code must end with RETURN");
        }

        JsonNode fns = n.path("functions");
        Iterator<Map.Entry<String, JsonNode>> it = fns.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            c.addFunction(e.getKey(), readChunk(e.getValue()));
        }
        return c;
    }

    private static Value readConst(JsonNode n) throws IOException {
        String type = n.path("type").asText("");
        JsonNode v = n.path("value");
        switch (type) {
            case "INTEGER": return Value.integer(v.asLong());
            case "FLOAT": return Value.floating(v.asDouble());
            case "TEXT": return Value.text(v.asText());
            case "BOOLEAN": return Value.bool(v.asBoolean());
            default: throw new IOException("Unknown constant type: " + type);
        }
    }
}
