package com.dbexplorer.bot;

import com.dbexplorer.api.ChatReply;
import com.dbexplorer.api.KeyboardButton;
import com.dbexplorer.error.DomainUnavailableException;
import com.dbexplorer.error.ExplorerException;
import com.dbexplorer.error.QueryRejectedException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reply building blocks shared by the command handlers.
 */
final class Replies {
    static final String PAGE_RESET_NOTE = "That page link is no longer valid, showing the first page.";

    private Replies() {
    }

    /**
     * Friendly reply for a core failure. Never exposes stack traces or driver internals beyond the
     * database's own message for a failed query.
     */
    static ChatReply error(ExplorerException e) {
        String text;
        String reason = null;
        switch (e.getKind()) {
            case CATALOG_UNAVAILABLE:
                text = "The database is unavailable right now. Try again later.";
                break;
            case DOMAIN_UNAVAILABLE:
                text = "No data available for " + ((DomainUnavailableException) e).getDomainId()
                        + ". Send /domains to see what was detected.";
                break;
            case VALIDATION_REJECTED:
                reason = ((QueryRejectedException) e).getReason().getCode();
                text = "Query rejected (" + reason + "): " + e.getMessage();
                break;
            case POOL_TIMEOUT:
                text = "The database is busy. Try again in a moment.";
                break;
            case INVALID_CURSOR:
                text = PAGE_RESET_NOTE;
                break;
            case QUERY_FAILED:
                text = "Query failed: " + e.getMessage();
                break;
            case TABLE_NOT_FOUND:
                text = e.getMessage();
                break;
            case CANCELLED:
                text = "Cancelled.";
                break;
            default:
                text = "Something went wrong.";
        }
        return ChatReply.builder()
                .text(text)
                .errorCode(e.getKind().name())
                .reason(reason)
                .build();
    }

    static List<KeyboardButton> navRow(String prevData, String nextData) {
        List<KeyboardButton> row = new ArrayList<>(2);
        if (prevData != null) {
            row.add(new KeyboardButton("« Prev", prevData));
        }
        if (nextData != null) {
            row.add(new KeyboardButton("Next »", nextData));
        }
        return row;
    }

    static List<List<KeyboardButton>> rows(List<KeyboardButton> buttons, int perRow) {
        List<List<KeyboardButton>> rows = new ArrayList<>();
        for (int i = 0; i < buttons.size(); i += perRow) {
            rows.add(new ArrayList<>(buttons.subList(i, Math.min(i + perRow, buttons.size()))));
        }
        return rows;
    }

    static String number(Double value) {
        if (value == null) {
            return "n/a";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf(value.longValue());
        }
        return String.format(Locale.ROOT, "%.1f", value);
    }

    static String signed(Double value) {
        if (value == null) {
            return "n/a";
        }
        return (value > 0 ? "+" : "") + number(value);
    }

    static String uptime(long seconds) {
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        return hours + "h " + minutes + "m " + (seconds % 60) + "s";
    }
}
