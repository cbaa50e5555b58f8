package infra.output;

import domain.output.FormattedXmlWriter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link FormattedXmlWriter} that stores formatted mappers as files.
 * <p>
 * Output layout: {@code <outDir>/<relative path of the source>}; with no outDir the source
 * file itself is overwritten (in place).
 */
public final class FileFormattedXmlWriter implements FormattedXmlWriter {

    private final Path outDir;

    /**
     * @param outDir target root, or null for in-place
     */
    public FileFormattedXmlWriter(Path outDir) {
        this.outDir = outDir;
    }

    public static FileFormattedXmlWriter inPlace() {
        return new FileFormattedXmlWriter(null);
    }

    public boolean isInPlace() {
        return outDir == null;
    }

    @Override
    public Path write(Path source, Path relative, String text) {
        if (text == null) throw new IllegalArgumentException("text is null");

        Path target;
        if (outDir == null) {
            if (source == null) throw new IllegalArgumentException("source is null");
            target = source;
        } else {
            Path rel = relative != null ? relative : (source == null ? null : source.getFileName());
            if (rel == null) throw new IllegalArgumentException("relative path is null");
            target = outDir.resolve(rel).normalize();
            if (!target.startsWith(outDir.normalize())) {
                throw new IllegalArgumentException("relative path escapes outDir: " + rel);
            }
        }

        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create output directory: " + target, e);
        }

        try {
            Files.writeString(target, text, StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
        return target;
    }
}
