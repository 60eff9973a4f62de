package planner.io;

import planner.model.Day;
import planner.model.TimeSlot;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Text form of an offering's slots as typed in the course list:
 * {@code "Mon 1; Tue 3; Fri 6 B312"} - entries split by ';', each
 * {@code <day> <period> [room]}.
 */
public class TimeSlotParser {

    public static List<TimeSlot> parse(String text) {
        List<TimeSlot> result = new ArrayList<>();
        if (text == null)
            return result;

        for (String raw : stripBom(text).split(";")) {
            String entry = raw.trim();
            if (entry.isEmpty()) continue;

            // tabs and repeated blanks are common in pasted text
            String[] parts = entry.replace('\t', ' ').split(" +", 3);
            if (parts.length < 2)
                throw new IllegalArgumentException("Time slot must be '<day> <period>': '" + entry + "'");

            Day day;
            try {
                day = Day.parse(parts[0]);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Bad day in time slot '" + entry + "'", e);
            }

            int period;
            try {
                period = Integer.parseInt(parts[1]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Bad period in time slot '" + entry + "'", e);
            }
            if (period < 1)
                throw new IllegalArgumentException("Period must be positive in time slot '" + entry + "'");

            String room = parts.length == 3 ? parts[2].trim() : "";
            result.add(new TimeSlot(day, period, room));
        }
        return result;
    }

    public static String format(List<TimeSlot> slots) {
        if (slots == null || slots.isEmpty())
            return "";
        return slots.stream().map(TimeSlot::toString).collect(Collectors.joining("; "));
    }

    private static String stripBom(String s) {
        return s.startsWith("\uFEFF") ? s.substring(1) : s;
    }
}
