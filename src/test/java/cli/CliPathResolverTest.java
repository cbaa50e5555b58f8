package cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliPathResolverTest {

    @TempDir
    Path tmp;

    @Test
    void resolve_relativeAgainstBaseDir_absoluteKept() {
        CliPathResolver paths = CliPathResolver.fromArgs(Map.of("baseDir", tmp.toString()));

        assertEquals(tmp.toAbsolutePath().normalize(), paths.getBaseDir());
        assertEquals(tmp.resolve("mappers").toAbsolutePath().normalize(), paths.resolve(null, CliPathResolver.DEFAULT_IN));
        assertEquals(tmp.resolve("x/y.xml").toAbsolutePath().normalize(), paths.resolve(" x/y.xml ", CliPathResolver.DEFAULT_IN));

        Path abs = tmp.resolve("elsewhere").toAbsolutePath();
        assertEquals(abs, paths.resolve(abs.toString(), CliPathResolver.DEFAULT_OUT));
    }

    @Test
    void requireExists_throwsForMissingPath() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> CliPathResolver.requireExists(tmp.resolve("nope"), "mapper input"));
        assertTrue(ex.getMessage().startsWith("mapper input not found"));
        assertDoesNotThrow(() -> CliPathResolver.requireExists(tmp, "dir"));
    }
}
