package org.calista.unglish.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileIOTests {

    @TempDir
    Path tmp;

    @Test
    void createsTheBaseDirectory() {
        Path base = tmp.resolve("a/b/c");
        FileIO io = new FileIO(base);
        assertTrue(Files.isDirectory(base));
        assertEquals(base.toAbsolutePath().normalize(), io.baseDir());
    }

    @Test
    void resolveStaysInsideBaseDir() {
        FileIO io = new FileIO(tmp);
        assertEquals(tmp.toAbsolutePath().normalize().resolve("export/words.jsonl"), io.resolve("export/words.jsonl"));
        assertEquals(tmp.toAbsolutePath().normalize().resolve("export/words.jsonl"), io.resolve("export\\words.jsonl"));
        assertEquals(tmp.toAbsolutePath().normalize().resolve("b.txt"), io.resolve("a/../b.txt"));

        assertThrows(IllegalArgumentException.class, () -> io.resolve("../outside.txt"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve("a/../../outside.txt"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve(tmp.toAbsolutePath().resolve("x").toString()));
    }

    @Test
    void resolveExternalAcceptsAnyPath() {
        FileIO io = new FileIO(tmp.resolve("base"));
        Path outside = tmp.resolve("other/lang.json").toAbsolutePath();
        assertEquals(outside.normalize(), io.resolveExternal(outside));
        assertEquals(io.baseDir().resolve("x.json"), io.resolveExternal(Path.of("x.json")));
    }

    @Test
    void writeThenRead() throws Exception {
        FileIO io = new FileIO(tmp);
        Path file = io.resolve("nested/dir/text.txt");
        io.writeString(file, "ˈbæ.nə\n");
        assertEquals("ˈbæ.nə\n", io.readString(file));
        assertFalse(Files.exists(file.resolveSibling("text.txt.tmp")));

        io.writeString(file, "other");
        assertEquals("other", io.readString(file));
    }

    @Test
    void unchangedContentIsNotRewritten() throws Exception {
        FileIO io = new FileIO(tmp);
        Path file = io.resolve("same.txt");
        io.writeString(file, "content");

        FileTime old = FileTime.fromMillis(1_000_000L);
        Files.setLastModifiedTime(file, old);
        io.writeString(file, "content");
        assertEquals(old, Files.getLastModifiedTime(file));
    }

    @Test
    void nonAtomicWritesWork() throws Exception {
        FileIO io = new FileIO(tmp, java.nio.charset.StandardCharsets.UTF_8, false);
        Path file = io.resolve("plain.txt");
        io.writeString(file, "one");
        io.writeString(file, "two");
        assertEquals("two", io.readString(file));
    }

    @Test
    void jsonlWriteReplacesAndAppendAdds() throws Exception {
        FileIO io = new FileIO(tmp);
        Path file = io.resolve("export/words.jsonl");

        io.writeJsonl(file, List.of("{\"a\":1}", "  ", "{\"b\":2}"));
        assertEquals(List.of("{\"a\":1}", "{\"b\":2}"), Files.readAllLines(file));

        io.appendJsonl(file, List.of("{\"c\":3}"));
        assertEquals(List.of("{\"a\":1}", "{\"b\":2}", "{\"c\":3}"), Files.readAllLines(file));

        io.writeJsonl(file, List.of("{\"d\":4}"));
        assertEquals(List.of("{\"d\":4}"), Files.readAllLines(file));
    }

    @Test
    void appendCreatesMissingFileAndIgnoresEmptyBatches() throws Exception {
        FileIO io = new FileIO(tmp);
        Path file = io.resolve("fresh/words.jsonl");

        io.appendJsonl(file, List.of());
        assertFalse(Files.exists(file));

        io.appendJsonl(file, List.of("{\"x\":0}"));
        assertEquals(List.of("{\"x\":0}"), Files.readAllLines(file));
    }
}
