package mybatis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MapperXmlScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void scan_directory_recursiveSortedXmlOnly() throws Exception {
        Files.createDirectories(tempDir.resolve("b/sub"));
        Files.writeString(tempDir.resolve("b/sub/Z.xml"), "<mapper/>");
        Files.writeString(tempDir.resolve("a.XML"), "<mapper/>");
        Files.writeString(tempDir.resolve("b/readme.txt"), "x");

        List<Path> files = MapperXmlScanner.scan(tempDir);

        assertEquals(2, files.size());
        assertTrue(files.get(0).endsWith("a.XML"));
        assertTrue(files.get(1).endsWith(Path.of("b", "sub", "Z.xml")));
        assertEquals(Path.of("b", "sub", "Z.xml"), MapperXmlScanner.relativize(tempDir, files.get(1)));
    }

    @Test
    void scan_singleFile() throws Exception {
        Path f = tempDir.resolve("UserMapper.xml");
        Files.writeString(f, "<mapper/>");

        assertEquals(List.of(f.toAbsolutePath().normalize()), MapperXmlScanner.scan(f));
        assertEquals(Path.of("UserMapper.xml"), MapperXmlScanner.relativize(f, f));
    }

    @Test
    void scan_missingInput_isEmpty() {
        assertTrue(MapperXmlScanner.scan(tempDir.resolve("nope")).isEmpty());
    }
}
