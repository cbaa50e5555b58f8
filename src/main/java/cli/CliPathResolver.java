package cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Resolves CLI path options against one base directory.
 *
 * <p>Base directory: {@code --baseDir}, else {@code -DbaseDir}, else the working directory.
 * Relative option values are taken relative to it; absolute ones are kept.</p>
 */
public final class CliPathResolver {

    public static final String PROP_BASE_DIR = "baseDir";

    public static final String DEFAULT_IN = "mappers";
    public static final String DEFAULT_OUT = "output/formatted";
    public static final String DEFAULT_RESULT = "output/format-result.xlsx";

    private final Path baseDir;

    public CliPathResolver(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    public static CliPathResolver fromArgs(Map<String, String> argv) {
        String raw = CliArgParser.option(argv, PROP_BASE_DIR);
        Path cwd = Paths.get(System.getProperty("user.dir"));
        return new CliPathResolver(raw == null ? cwd : cwd.resolve(raw));
    }

    public Path getBaseDir() {
        return baseDir;
    }

    /** {@code raw} if given, else {@code fallback}; both relative to the base directory */
    public Path resolve(String raw, String fallback) {
        String v = (raw == null || raw.isBlank()) ? fallback : raw.trim();
        return baseDir.resolve(v).normalize();
    }

    /**
     * @throws IllegalArgumentException path does not exist
     */
    public static void requireExists(Path p, String label) {
        if (!Files.exists(p)) {
            throw new IllegalArgumentException(label + " not found: " + p);
        }
    }
}
