package io.hearthwarrio.veilguard.core;

import java.util.Objects;

/**
 * Default stdout logger for hide events.
 */
public final class StdOutHideEventLogger implements HideEventLogger {

    private final LogDetail detail;

    public StdOutHideEventLogger(LogDetail detail) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
    }

    @Override
    public LogDetail detail() {
        return detail;
    }

    @Override
    public void logHidden(HideReason reason, ElementSnapshot snapshot) {
        System.out.println(format(reason, snapshot));
    }

    @Override
    public void logSuppressedError(String operation, Throwable error) {
        System.out.println("[Veilguard] suppressed error in " + safe(operation) + ": " + describe(error));
    }

    String format(HideReason reason, ElementSnapshot snapshot) {
        StringBuilder sb = new StringBuilder(128);
        sb.append("[Veilguard] hidden reason=").append(reason);
        if (detail == LogDetail.NONE || snapshot == null) {
            return sb.toString();
        }

        sb.append(", tag=").append(snapshot.getTagName())
                .append(", id=").append(snapshot.getId());

        if (detail == LogDetail.FULL) {
            sb.append(", class='").append(snapshot.getCssClasses()).append('\'');
            if (!snapshot.getMarkerAttribute().isEmpty()) {
                sb.append(", marker=").append(snapshot.getMarkerAttribute());
            }
        }
        return sb.toString();
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "null";
        }
        String msg = error.getMessage();
        return error.getClass().getSimpleName() + (msg == null ? "" : " - " + msg);
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
