package skillcron.cron.model;

import java.util.Locale;

/**
 * Kind of unit of work a job invokes.
 */
public enum TargetKind {
    SKILL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TargetKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            return SKILL;
        }
        try {
            return TargetKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unsupported target type: " + value);
        }
    }
}
