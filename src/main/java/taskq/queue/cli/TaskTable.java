package taskq.queue.cli;

import taskq.queue.model.Task;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text table of tasks: ID | Name | Priority | Status | Created | Started | Ended | PID.
 */
final class TaskTable {

    private static final String[] HEADERS = { "ID", "Name", "Priority", "Status", "Created", "Started", "Ended",
            "PID" };
    private static final int MAX_NAME_WIDTH = 40;
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private TaskTable() {
    }

    static String render(List<Task> tasks) {
        List<String[]> rows = new ArrayList<>();
        rows.add(HEADERS);
        for (Task t : tasks) {
            rows.add(new String[] {
                    String.valueOf(t.id()),
                    abbreviate(t.name()),
                    String.valueOf(t.priority()),
                    t.status().label(),
                    time(t.createdAt()),
                    time(t.startTime()),
                    time(t.endTime()),
                    t.pid() != null ? String.valueOf(t.pid()) : "-"
            });
        }

        int[] widths = new int[HEADERS.length];
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }

        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < rows.size(); r++) {
            appendRow(sb, rows.get(r), widths);
            if (r == 0) {
                appendSeparator(sb, widths);
            }
        }
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, String[] row, int[] widths) {
        for (int i = 0; i < row.length; i++) {
            if (i > 0) {
                sb.append(" | ");
            }
            sb.append(row[i]);
            if (i < row.length - 1) {
                sb.append(" ".repeat(widths[i] - row[i].length()));
            }
        }
        sb.append(System.lineSeparator());
    }

    private static void appendSeparator(StringBuilder sb, int[] widths) {
        for (int i = 0; i < widths.length; i++) {
            if (i > 0) {
                sb.append("-+-");
            }
            sb.append("-".repeat(widths[i]));
        }
        sb.append(System.lineSeparator());
    }

    private static String time(Instant instant) {
        return instant != null ? TIME.format(instant) : "-";
    }

    private static String abbreviate(String name) {
        String flat = name.replaceAll("\\s+", " ");
        return flat.length() > MAX_NAME_WIDTH ? flat.substring(0, MAX_NAME_WIDTH - 3) + "..." : flat;
    }
}
