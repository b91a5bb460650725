import com.hiolang.script.library.HioLibrary;
import com.hiolang.script.library.LibraryFunction;
import com.hiolang.script.library.LibraryRegistry;
import com.hiolang.script.library.StandardLibraries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class LibraryRegistryTest {

    @TempDir
    Path dir;

    @Test
    void standardLibraries_areRegisteredSorted() {
        LibraryRegistry reg = StandardLibraries.newRegistry();
        assertEquals(Arrays.asList("stdlib_c", "stdlib_cpp", "stdlib_go", "stdlib_rust"), reg.list());
        assertEquals("C++", reg.get("stdlib_cpp").language());
        assertNull(reg.get("nope"));
    }

    @Test
    void lookup_byNamespaceAndPath() {
        LibraryRegistry reg = StandardLibraries.newRegistry();
        LibraryFunction fn = reg.lookup("stdlib_c", "strcpy");
        assertNotNull(fn);
        assertEquals(2, fn.arity());
        assertEquals("strcpy(dest, src) -> string", fn.signature());
        assertSame(fn, reg.lookupPath("stdlib_c.strcpy"));
        assertNull(reg.lookupPath("strcpy"));
        assertNull(reg.lookupPath("stdlib_c."));
        assertNull(reg.lookupPath("stdlib_c.missing"));
    }

    @Test
    void json_keepsEveryField() throws IOException {
        HioLibrary lib = new HioLibrary("mathx", "2.1.0", "Extra math", "Rust")
                .addFunction(new LibraryFunction("clamp", Arrays.asList("v", "lo", "hi"), "number", "Rust",
                        "pub fn clamp(v: i64, lo: i64, hi: i64) -> i64 { v.max(lo).min(hi) }\n"));
        HioLibrary back = LibraryRegistry.fromJson(LibraryRegistry.toJson(lib));

        assertEquals("mathx", back.name());
        assertEquals("2.1.0", back.version());
        assertEquals("Extra math", back.description());
        assertEquals("Rust", back.language());
        LibraryFunction clamp = back.getFunction("clamp");
        assertEquals(Arrays.asList("v", "lo", "hi"), clamp.params());
        assertEquals("number", clamp.returnType());
        assertEquals("Rust", clamp.implementationLanguage());
        assertTrue(clamp.sourceCode().contains("v.max(lo)"));
    }

    @Test
    void json_usesSnakeCaseKeys() throws IOException {
        String json = LibraryRegistry.toJson(StandardLibraries.c());
        assertTrue(json.contains("\"return_type\""));
        assertTrue(json.contains("\"implementation_language\""));
        assertTrue(json.contains("\"source_code\""));
    }

    @Test
    void fromJson_defaultsAndErrors() throws IOException {
        HioLibrary lib = LibraryRegistry.fromJson("{\"name\": \"tiny\", \"language\": \"Go\", "
                + "\"functions\": {\"nop\": {}}}");
        assertEquals("1.0.0", lib.version());
        LibraryFunction nop = lib.getFunction("nop");
        assertEquals(0, nop.arity());
        assertEquals("void", nop.returnType());
        assertEquals("Go", nop.implementationLanguage());

        assertThrows(IOException.class, () -> LibraryRegistry.fromJson("[1, 2]"));
        assertThrows(IOException.class, () -> LibraryRegistry.fromJson("{\"version\": \"1\"}"));
        assertThrows(IOException.class, () -> LibraryRegistry.fromJson("{not json"));
    }

    @Test
    void saveAndLoadDirectory() throws IOException {
        LibraryRegistry reg = new LibraryRegistry();
        reg.register(new HioLibrary("one", "1.0.0", "first", "C")
                .addFunction(new LibraryFunction("f", Collections.singletonList("x"), "number", "C", "")));
        reg.register(new HioLibrary("two", "1.0.0", "second", "Go"));
        reg.save("one", dir.resolve("one" + LibraryRegistry.FILE_EXTENSION));
        reg.save("two", dir.resolve("two" + LibraryRegistry.FILE_EXTENSION));
        Files.writeString(dir.resolve("ignored.json"), "{}", StandardCharsets.UTF_8);

        LibraryRegistry loaded = new LibraryRegistry();
        assertEquals(2, loaded.loadDirectory(dir));
        assertEquals(Arrays.asList("one", "two"), loaded.list());
        assertEquals(1, loaded.lookupPath("one.f").arity());
    }

    @Test
    void save_unknownLibrary() {
        assertThrows(IllegalArgumentException.class,
                () -> new LibraryRegistry().save("ghost", dir.resolve("ghost.hiolib")));
    }

    @Test
    void register_replacesSameName() {
        LibraryRegistry reg = new LibraryRegistry();
        reg.register(new HioLibrary("lib", "1.0.0", "old", "C"));
        reg.register(new HioLibrary("lib", "2.0.0", "new", "C"));
        assertEquals("2.0.0", reg.get("lib").version());
        assertEquals(1, reg.list().size());
    }
}
