package io.backup4j.core;

/**
 * Raw progress reported by the engine.
 *
 * @param progress overall progress of the current engine operation, 0..100
 */
public record ProgressUpdate(
        String phase,
        int progress,
        String message,
        String currentFilename,
        long processedFileCount,
        long processedFileSize,
        long totalFileCount,
        long totalFileSize,
        boolean stillCounting
) {

    public static ProgressUpdate of(String phase, int progress) {
        return new ProgressUpdate(phase, progress, null, null, 0, 0, 0, 0, false);
    }
}
