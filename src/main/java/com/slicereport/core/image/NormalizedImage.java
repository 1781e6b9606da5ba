package com.slicereport.core.image;

import java.nio.file.Path;

/**
 * Outcome of a bounded re-encode.
 *
 * @param path        where the accepted (or best-effort) JPEG was written
 * @param sizeBytes   size of the written encoding
 * @param quality     JPEG quality (0-100) of the written encoding
 * @param withinLimit whether {@code sizeBytes} satisfies the requested ceiling
 * @param attempts    number of encodings produced during the search
 */
public record NormalizedImage(Path path, long sizeBytes, int quality, boolean withinLimit, int attempts) {
}
