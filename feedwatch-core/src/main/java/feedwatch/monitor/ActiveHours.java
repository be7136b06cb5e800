package feedwatch.monitor;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Daily window of hours during which monitor cycles run.
 *
 * <p>The window is {@code [startHour, endHour)} in {@code zone}. When {@code startHour > endHour}
 * it wraps midnight, e.g. {@code 22..6} covers the night. {@code startHour == endHour} follows the
 * same wrap rule and therefore covers the whole day.
 *
 * @param startHour first active hour, 0-23
 * @param endHour   first inactive hour, 0-23
 * @param zone      time zone the hours are expressed in
 */
public record ActiveHours(int startHour, int endHour, ZoneId zone) {
    public ActiveHours {
        checkHour("startHour", startHour);
        checkHour("endHour", endHour);
        Objects.requireNonNull(zone, "zone");
    }

    public boolean isActive(Instant now) {
        int hour = now.atZone(zone).getHour();
        if (startHour < endHour) {
            return hour >= startHour && hour < endHour;
        }
        return hour >= startHour || hour < endHour;
    }

    private static void checkHour(String name, int hour) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException(name + " must be in 0..23, got: " + hour);
        }
    }
}
