package org.shapes.app;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.Assert.*;

public class MainTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) {
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return Main.run(args, out, err);
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    private static String fixture(String name) throws Exception {
        return Paths.get(MainTest.class.getResource("/fixtures/" + name).toURI()).toString();
    }

    @Test
    public void noArgumentsPrintsUsage() {
        assertEquals(Main.EXIT_USAGE, run());
        assertTrue(err().contains("Usage:"));
    }

    @Test
    public void unknownCommandPrintsUsage() {
        assertEquals(Main.EXIT_USAGE, run("explode", "x.lua"));
        assertTrue(err().contains("Unknown command: explode"));
    }

    @Test
    public void formatWritesCanonicalTextToStdout() throws Exception {
        assertEquals(Main.EXIT_OK, run("format", fixture("square.lua")));
        assertTrue(out().contains("{5001, --Square"));
        assertTrue(out().contains("{1, 0.5, THRUSTER_OUT},"));
        assertTrue(out().contains("--scale 1"));
    }

    @Test
    public void formatToFileWithPortAnnotations() throws Exception {
        Path target = tmp.getRoot().toPath().resolve("formatted.lua");
        assertEquals(Main.EXIT_OK, run("format", fixture("square.lua"), "-o", target.toString(), "--annotate-ports"));

        String text = Files.readString(target, StandardCharsets.UTF_8);
        assertTrue(text.contains("-- Edge 1, position 0.5, type THRUSTER_OUT"));
        assertTrue(err().contains("[WRITE]"));
        assertEquals("", out());
    }

    @Test
    public void formatWarnsWhenLineScannerWasUsed() throws Exception {
        assertEquals(Main.EXIT_OK, run("format", fixture("broken.lua")));
        assertTrue(err().contains("[WARN]"));
        assertTrue(out().contains("{300,"));
    }

    @Test
    public void formatFailsWhenFallbackIsDisabled() throws Exception {
        assertEquals(Main.EXIT_FAIL, run("format", fixture("broken.lua"), "--no-fallback"));
        assertTrue(err().contains("[FAIL]"));
        assertTrue(err().contains("PARSE"));
    }

    @Test
    public void jsonCommand() throws Exception {
        assertEquals(Main.EXIT_OK, run("json", fixture("extended.lua")));
        assertTrue(out().contains("\"shapes\""));
        assertTrue(out().contains("\"FINAL|PROXIMITY\""));
    }

    @Test
    public void checkReportsEachFile() throws Exception {
        int code = run("check", fixture("square.lua"), fixture("garbage.txt"));

        assertEquals(Main.EXIT_FAIL, code);
        assertTrue(out().contains("strategy=STRICT status=PARSED shapes=1 scales=1"));
        assertTrue(out().contains("[WARN]"));
        assertTrue(out().contains("status=RECOVERED_NOTHING"));
    }

    @Test
    public void checkReportsUnreadableFile() {
        String missing = tmp.getRoot().toPath().resolve("missing.lua").toString();
        assertEquals(Main.EXIT_FAIL, run("check", missing));
        assertTrue(out().contains("[FAIL]"));
        assertTrue(out().contains("IO"));
    }

    @Test
    public void verboseListenerWritesToStderr() throws Exception {
        assertEquals(Main.EXIT_OK, run("check", fixture("square.lua"), "--verbose"));
        assertTrue(err().contains("[PARSE START] STRICT"));
        assertFalse(out().contains("[PARSE"));
    }
}
