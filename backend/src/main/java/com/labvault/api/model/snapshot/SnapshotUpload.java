package com.labvault.api.model.snapshot;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A snapshot file handed in by an operator. {@code size} is the declared size of the upload,
 * checked before the content is parsed.
 */
@Getter
@AllArgsConstructor
public class SnapshotUpload {

    private final String filename;
    private final long size;
    private final byte[] content;

    public static SnapshotUpload of(String filename, byte[] content) {
        return new SnapshotUpload(filename, content.length, content);
    }
}
