package mybatis;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Collects mapper XML candidates for the batch formatter.
 *
 * <p>Input may be a single file or a directory (scanned recursively). Only {@code *.xml} files are
 * returned, sorted by path. Whether a file really is a mapper is decided later from its content.</p>
 */
public final class MapperXmlScanner {

    private MapperXmlScanner() {
    }

    public static List<Path> scan(Path input) {
        if (input == null) throw new IllegalArgumentException("input is null");
        if (!Files.exists(input)) return List.of();

        if (Files.isRegularFile(input)) {
            return isXml(input) ? List.of(input.toAbsolutePath().normalize()) : List.of();
        }

        List<Path> out = new ArrayList<>(256);
        try (Stream<Path> s = Files.walk(input)) {
            s.filter(p -> Files.isRegularFile(p))
                    .filter(MapperXmlScanner::isXml)
                    .map(p -> p.toAbsolutePath().normalize())
                    .forEach(out::add);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to scan mapper xmls under: " + input, e);
        }
        out.sort(Comparator.comparing(Path::toString));
        return out;
    }

    /**
     * Path of {@code file} below the scan root; a single-file input yields just the file name.
     */
    public static Path relativize(Path input, Path file) {
        Path root = input.toAbsolutePath().normalize();
        Path f = file.toAbsolutePath().normalize();
        if (Files.isRegularFile(root) || root.equals(f)) return f.getFileName();
        if (f.startsWith(root)) return root.relativize(f);
        return f.getFileName();
    }

    private static boolean isXml(Path p) {
        return p.getFileName()
                .toString()
                .toLowerCase(Locale.ROOT)
                .endsWith(".xml");
    }
}
