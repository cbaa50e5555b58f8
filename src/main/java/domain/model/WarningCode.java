package domain.model;

/**
 * Warning codes for the format report.
 */
public enum WarningCode {

    /**
     * The XML file has no {@code <mapper namespace="...">} root and was left untouched.
     */
    NOT_MAPPER_XML,

    /**
     * The statement body could not be parsed (e.g. mismatched closing tag); original text kept.
     */
    FORMAT_FALLBACK,

    /**
     * MyBatis dynamic tags appear to be lost in the formatted text; original text kept.
     */
    MYBATIS_TAG_LOST,

    /**
     * MyBatis dynamic tags are unbalanced in the formatted text; original text kept.
     */
    MYBATIS_TAG_UNBALANCED,

    /**
     * Formatted text has a comma right after a closing dynamic tag (e.g. {@code </if>,}).
     */
    MYBATIS_TAG_BOUNDARY_SUSPICIOUS,

    /**
     * Reading or writing a file failed.
     */
    IO_ERROR,

    /**
     * Unexpected exception while formatting a file.
     */
    TRANSFORM_ERROR
}
