import com.hiolang.debug.Debug;
import com.hiolang.script.HioScript;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs in a fresh JVM (surefire does not reuse forks), so nothing has
 * installed or cleared a sink before these tests.
 */
public class DebugDefaultsTest {

    @Test
    void freshHub_hasNoopSink() {
        assertNotNull(Debug.get().getSink());
        assertFalse(Debug.get().enabled());
        Debug.get().t("hio.test", "dropped");
        Debug.get().w("hio.test", "dropped", new RuntimeException("x"));
    }

    @Test
    void engineRuns_withoutSink() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HioScript es = new HioScript(new PrintStream(out, true, StandardCharsets.UTF_8));
        es.run("print(1 + 2);");
        es.compileAndRun("print(3 * 4);");
        assertEquals("3\n12\n", out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"));
    }
}
