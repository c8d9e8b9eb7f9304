package com.dikit.core.generator;

/**
 * Kinds of artifacts produced from a validated schema.
 */
public enum ArtifactType {
    /** Java record declarations mirroring the models */
    TYPE_DECLARATIONS("java", "text/x-java-source"),

    /** Entity-relationship diagram */
    ER_DIAGRAM("md", "text/markdown");

    private final String fileExtension;
    private final String contentType;

    ArtifactType(String fileExtension, String contentType) {
        this.fileExtension = fileExtension;
        this.contentType = contentType;
    }

    /**
     * @return file extension without leading dot
     */
    public String fileExtension() {
        return fileExtension;
    }

    public String contentType() {
        return contentType;
    }
}
