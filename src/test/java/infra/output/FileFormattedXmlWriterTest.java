package infra.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileFormattedXmlWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void write_mirrorsRelativePathUnderOutDir() throws Exception {
        Path source = tempDir.resolve("in/user/UserMapper.xml");
        Path out = tempDir.resolve("out");

        Path written = new FileFormattedXmlWriter(out).write(source, Path.of("user", "UserMapper.xml"), "<mapper/>\n");

        assertEquals(out.resolve("user/UserMapper.xml"), written);
        assertEquals("<mapper/>\n", Files.readString(written, StandardCharsets.UTF_8));
    }

    @Test
    void write_inPlace_overwritesSource() throws Exception {
        Path source = tempDir.resolve("UserMapper.xml");
        Files.writeString(source, "old");

        FileFormattedXmlWriter w = FileFormattedXmlWriter.inPlace();
        assertTrue(w.isInPlace());
        w.write(source, Path.of("UserMapper.xml"), "새 내용");

        assertEquals("새 내용", Files.readString(source, StandardCharsets.UTF_8));
    }

    @Test
    void write_rejectsPathEscapingOutDir() {
        FileFormattedXmlWriter w = new FileFormattedXmlWriter(tempDir.resolve("out"));
        assertThrows(IllegalArgumentException.class,
                () -> w.write(null, Path.of("..", "evil.xml"), "x"));
    }
}
