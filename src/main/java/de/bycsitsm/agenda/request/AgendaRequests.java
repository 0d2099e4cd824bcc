package de.bycsitsm.agenda.request;

import de.bycsitsm.agenda.AgendaProperties;
import de.bycsitsm.agenda.ValidationException;
import de.bycsitsm.agenda.mutation.DesiredChange;
import de.bycsitsm.agenda.source.DraftEvent;
import de.bycsitsm.agenda.source.EventPatch;
import de.bycsitsm.agenda.time.CivilTime;
import de.bycsitsm.agenda.time.TimeNormalizer;
import de.bycsitsm.agenda.time.TimeWindow;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns an {@code {action, args}} call of the assistant layer into a typed
 * {@link AgendaRequest}. All argument checking happens here, so no untyped map
 * reaches the scheduling components.
 * <p>
 * Action names are matched ignoring case and underscores, so {@code GetSchedule}
 * and {@code get_schedule} are the same action. Times are local civil times as
 * understood by {@link TimeNormalizer}.
 */
@Component
public class AgendaRequests {

    static final int DEFAULT_DURATION_MINUTES = 60;
    static final int DEFAULT_SEARCH_DAYS = 7;

    private static final List<String> ACTIONS = List.of("GetSchedule", "GetUpcoming", "FindFreeTime", "CreateEvent",
            "RescheduleEvent", "MoveEvent", "UpdateEvent", "DeleteEvent", "GetBriefing");

    private final TimeNormalizer timeNormalizer;
    private final AgendaProperties properties;

    public AgendaRequests(TimeNormalizer timeNormalizer, AgendaProperties properties) {
        this.timeNormalizer = timeNormalizer;
        this.properties = properties;
    }

    /**
     * Validates a call.
     *
     * @throws ValidationException                            if the action is unknown or an argument is
     *                                                        missing or of the wrong type
     * @throws de.bycsitsm.agenda.InvalidTimeFormatException if a time argument cannot be parsed
     */
    public AgendaRequest fromCall(String action, @Nullable Map<String, ?> args) {
        var arguments = args == null ? Map.<String, Object>of() : args;
        var key = action == null ? "" : action.replace("_", "").toLowerCase(Locale.ROOT);
        return switch (key) {
            case "getschedule", "gettodayschedule" -> new AgendaRequest.GetSchedule(dateOrToday(arguments, "date"));
            case "getupcoming", "getupcomingevents" -> getUpcoming(arguments);
            case "findfreetime" -> findFreeTime(arguments);
            case "createevent", "createcalendarevent" -> createEvent(arguments);
            case "rescheduleevent" -> rescheduleEvent(arguments);
            case "moveevent", "movetaskbetweencalendars" -> moveEvent(arguments);
            case "updateevent" -> updateEvent(arguments);
            case "deleteevent", "deletecalendarevent" -> new AgendaRequest.DeleteEvent(
                    requireString(arguments, "event_search"), window(arguments));
            case "getbriefing", "getmorningbriefing" -> getBriefing(arguments);
            default -> throw new ValidationException("Unknown action '" + action + "'. Supported: "
                    + String.join(", ", ACTIONS) + ".");
        };
    }

    private AgendaRequest getUpcoming(Map<String, ?> args) {
        var days = optionalInt(args, "days", DEFAULT_SEARCH_DAYS);
        if (days < 1) {
            throw new ValidationException("'days' must be at least 1, got " + days + ".");
        }
        return new AgendaRequest.GetUpcoming(Math.min(days, properties.upcoming().maxDays()));
    }

    private AgendaRequest findFreeTime(Map<String, ?> args) {
        var duration = optionalInt(args, "duration", DEFAULT_DURATION_MINUTES);
        if (duration < 1) {
            throw new ValidationException("'duration' must be a positive number of minutes, got " + duration + ".");
        }
        var date = optionalString(args, "date");
        // A single named day is searched alone unless more days are asked for
        var days = optionalInt(args, "days", date != null ? 1 : DEFAULT_SEARCH_DAYS);
        if (days < 1) {
            throw new ValidationException("'days' must be at least 1, got " + days + ".");
        }
        var firstDay = date != null ? timeNormalizer.parse(date).date() : timeNormalizer.today();
        if (firstDay.isBefore(timeNormalizer.today())) {
            throw new ValidationException("Cannot search free time on " + firstDay + ", it is in the past.");
        }
        return new AgendaRequest.FindFreeTime(firstDay, days, duration, weekdays(args));
    }

    private AgendaRequest createEvent(Map<String, ?> args) {
        var title = requireString(args, "title");
        var start = timeNormalizer.parse(requireString(args, "start_time"));
        var endText = optionalString(args, "end_time");
        var end = endText == null ? null : timeNormalizer.parse(endText);
        var allDay = optionalBoolean(args, "all_day", start.isDateOnly());

        Instant startInstant;
        Instant endInstant = null;
        if (allDay) {
            if (end != null && !end.isDateOnly()) {
                throw new ValidationException("All-day event '" + title + "' needs a date-only end_time, got '"
                        + endText + "'.");
            }
            startInstant = timeNormalizer.startOfDay(start.date());
            // The end date of an all-day event is its last day
            endInstant = end == null ? null : timeNormalizer.startOfDay(end.date().plusDays(1));
        } else {
            if (start.isDateOnly() || (end != null && end.isDateOnly())) {
                throw new ValidationException("Event '" + title + "' needs start_time and end_time with a time of day"
                        + " (YYYY-MM-DDTHH:MM), or set all_day.");
            }
            startInstant = toInstant(start);
            endInstant = end == null ? null : toInstant(end);
        }
        if (endInstant != null && endInstant.isBefore(startInstant)) {
            throw new ValidationException("Event '" + title + "' would end before it starts.");
        }

        var draft = new DraftEvent(title, startInstant, endInstant, allDay, optionalString(args, "location"),
                optionalStringList(args, "attendees"), optionalString(args, "description"));
        var calendar = optionalString(args, "calendar");
        return new AgendaRequest.CreateEvent(draft, calendar != null ? calendar : optionalString(args, "calendar_type"));
    }

    private AgendaRequest rescheduleEvent(Map<String, ?> args) {
        return new AgendaRequest.RescheduleEvent(
                requireString(args, "event_search"),
                reschedule(args, requireString(args, "new_start_time")),
                optionalString(args, "target_calendar"),
                window(args));
    }

    private AgendaRequest moveEvent(Map<String, ?> args) {
        var eventSearch = optionalString(args, "event_search");
        if (eventSearch == null) {
            eventSearch = requireString(args, "task_search");
        }
        var newStart = optionalString(args, "new_start_time");
        return new AgendaRequest.MoveEvent(
                eventSearch,
                requireString(args, "target_calendar"),
                newStart == null ? null : reschedule(args, newStart),
                window(args));
    }

    private AgendaRequest updateEvent(Map<String, ?> args) {
        var patch = new EventPatch(optionalString(args, "new_title"), null, null, optionalString(args, "location"),
                optionalString(args, "description"));
        if (patch.isEmpty()) {
            throw new ValidationException("UpdateEvent needs at least one of new_title, location or description.");
        }
        return new AgendaRequest.UpdateEvent(requireString(args, "event_search"), patch, window(args));
    }

    private AgendaRequest getBriefing(Map<String, ?> args) {
        var budget = optionalInt(args, "character_budget", properties.briefing().characterBudget());
        if (budget < 1) {
            throw new ValidationException("'character_budget' must be positive, got " + budget + ".");
        }
        return new AgendaRequest.GetBriefing(dateOrToday(args, "date"), budget);
    }

    private DesiredChange.Reschedule reschedule(Map<String, ?> args, String newStartText) {
        var newStart = timeNormalizer.parse(newStartText);
        var newEndText = optionalString(args, "new_end_time");
        if (newStart.isDateOnly()) {
            if (newEndText != null) {
                throw new ValidationException("new_end_time needs a new_start_time with a time of day, got '"
                        + newStartText + "'.");
            }
            return new DesiredChange.Reschedule(timeNormalizer.startOfDay(newStart.date()), null, true);
        }
        Instant newEnd = null;
        if (newEndText != null) {
            var end = timeNormalizer.parse(newEndText);
            if (end.isDateOnly()) {
                throw new ValidationException("new_end_time needs a time of day, got '" + newEndText + "'.");
            }
            newEnd = toInstant(end);
        }
        return new DesiredChange.Reschedule(toInstant(newStart), newEnd, false);
    }

    private @Nullable TimeWindow window(Map<String, ?> args) {
        var startText = optionalString(args, "window_start");
        var endText = optionalString(args, "window_end");
        if (startText == null && endText == null) {
            return null;
        }
        if (startText == null) {
            throw new ValidationException("window_end needs a window_start.");
        }
        var start = timeNormalizer.parse(startText);
        var startInstant = start.isDateOnly() ? timeNormalizer.startOfDay(start.date()) : toInstant(start);
        Instant endInstant;
        if (endText == null) {
            endInstant = timeNormalizer.startOfDay(start.date().plusDays(1));
        } else {
            var end = timeNormalizer.parse(endText);
            endInstant = end.isDateOnly() ? timeNormalizer.startOfDay(end.date().plusDays(1)) : toInstant(end);
        }
        if (endInstant.isBefore(startInstant)) {
            throw new ValidationException("window_end '" + endText + "' is before window_start '" + startText + "'.");
        }
        return new TimeWindow(startInstant, endInstant);
    }

    private LocalDate dateOrToday(Map<String, ?> args, String field) {
        var text = optionalString(args, field);
        return text == null ? timeNormalizer.today() : timeNormalizer.parse(text).date();
    }

    private Instant toInstant(CivilTime civil) {
        return timeNormalizer.toInstant(civil.date().atTime(civil.time()));
    }

    private static Set<DayOfWeek> weekdays(Map<String, ?> args) {
        var names = optionalStringList(args, "weekdays");
        var weekdays = EnumSet.noneOf(DayOfWeek.class);
        for (var name : names) {
            var normalized = name.strip().toUpperCase(Locale.ROOT);
            var match = Arrays.stream(DayOfWeek.values())
                    .filter(day -> day.name().equals(normalized)
                            || (normalized.length() >= 3 && day.name().startsWith(normalized)))
                    .findFirst()
                    .orElseThrow(() -> new ValidationException("'" + name + "' is not a day of the week."));
            weekdays.add(match);
        }
        return weekdays;
    }

    static String requireString(Map<String, ?> args, String field) {
        var value = optionalString(args, field);
        if (value == null) {
            throw new ValidationException("Missing required argument '" + field + "'.");
        }
        return value;
    }

    static @Nullable String optionalString(Map<String, ?> args, String field) {
        var value = args.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new ValidationException("'" + field + "' must be a string.");
        }
        return text.isBlank() ? null : text.strip();
    }

    static int optionalInt(Map<String, ?> args, String field, int defaultValue) {
        var value = args.get(field);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.strip());
            } catch (NumberFormatException e) {
                throw new ValidationException("'" + field + "' must be a whole number, got '" + text + "'.");
            }
        }
        throw new ValidationException("'" + field + "' must be a whole number.");
    }

    static boolean optionalBoolean(Map<String, ?> args, String field, boolean defaultValue) {
        var value = args.get(field);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
                return Boolean.parseBoolean(text);
            }
        }
        throw new ValidationException("'" + field + "' must be true or false.");
    }

    static List<String> optionalStringList(Map<String, ?> args, String field) {
        var value = args.get(field);
        if (value == null) {
            return List.of();
        }
        if (value instanceof String text) {
            return Arrays.stream(text.split(","))
                    .map(String::strip)
                    .filter(item -> !item.isEmpty())
                    .toList();
        }
        if (value instanceof List<?> items) {
            var result = new ArrayList<String>();
            for (var item : items) {
                if (!(item instanceof String text)) {
                    throw new ValidationException("'" + field + "' must be a list of strings.");
                }
                if (!text.isBlank()) {
                    result.add(text.strip());
                }
            }
            return result;
        }
        throw new ValidationException("'" + field + "' must be a list of strings.");
    }
}
