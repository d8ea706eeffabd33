package com.gnovoa.reminders.dispatch;

import com.gnovoa.reminders.model.ReminderPayload;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class ReminderMessageFormatter {

    private static final DateTimeFormatter KICKOFF = DateTimeFormatter.ofPattern("h:mm a", Locale.ENGLISH);

    private final ZoneId zone;

    public ReminderMessageFormatter(ZoneId zone) {
        this.zone = zone;
    }

    public String format(ReminderPayload p) {
        return label(p.offsetMinutes()) + "\n"
                + p.home() + " vs " + p.away() + "\n"
                + "Kick-off " + KICKOFF.format(p.kickoff().atZone(zone)) + " (" + zone.getId() + ")\n"
                + p.league();
    }

    public String summary(int countries, int reminders) {
        return "Scheduled today's reminders (" + countries + " countries): " + reminders + " reminders.";
    }

    static String label(int offsetMinutes) {
        if (offsetMinutes == 0) return "Kick-off now";
        if (offsetMinutes == 60) return "Kick-off in 1 hour";
        return "Kick-off in " + offsetMinutes + " minutes";
    }
}
