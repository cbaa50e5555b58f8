package domain.output;

import java.nio.file.Path;

/** 포맷된 mapper XML 을 내보내는 책임. */
public interface FormattedXmlWriter {

    /**
     * @param source   the mapper file that was read
     * @param relative path of {@code source} below the scanned input root
     * @param text     full formatted document
     * @return the file actually written
     */
    Path write(Path source, Path relative, String text);
}
