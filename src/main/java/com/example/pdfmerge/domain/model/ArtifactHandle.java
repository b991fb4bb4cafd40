package com.example.pdfmerge.domain.model;

import java.util.Objects;

/**
 * Address of one stored artifact.
 *
 * @param area storage area
 * @param name file name within the area
 */
public record ArtifactHandle(StorageArea area, String name) {

    public ArtifactHandle {
        Objects.requireNonNull(area, "area");
        Objects.requireNonNull(name, "name");
    }
}
