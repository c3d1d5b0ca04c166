package org.learningjava.biasscore.application.progress;

/**
 * Snapshot of one article's scoring progress.
 *
 * @param errorDetails JSON with provider error details, or {@code ""}
 * @param finalScore   composite score once the run completed, otherwise {@code null}
 * @param lastUpdated  epoch seconds of the last write
 */
public record ProgressState(
        String step,
        String message,
        int percent,
        ProgressStatus status,
        String error,
        String errorDetails,
        Double finalScore,
        long lastUpdated
) {
    public ProgressState {
        step = step == null ? "" : step;
        message = message == null ? "" : message;
        status = status == null ? ProgressStatus.IN_PROGRESS : status;
        error = error == null ? "" : error;
        errorDetails = errorDetails == null ? "" : errorDetails;
    }

    public static ProgressState of(String step, String message, int percent, ProgressStatus status) {
        return new ProgressState(step, message, percent, status, "", "", null, 0L);
    }

    ProgressState touchedAt(long epochSeconds) {
        return new ProgressState(step, message, percent, status, error, errorDetails, finalScore, epochSeconds);
    }
}
