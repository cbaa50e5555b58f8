package infra.output;

import java.nio.file.Files;
import java.nio.file.Path;

final class ReportFiles {

    private ReportFiles() {
    }

    static void createParentDirectories(Path file) {
        try {
            Path parent = file.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create parent dir: " + file, e);
        }
    }
}
