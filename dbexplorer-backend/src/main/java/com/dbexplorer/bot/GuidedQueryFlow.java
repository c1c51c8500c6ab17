package com.dbexplorer.bot;

import com.dbexplorer.api.ChatReply;
import com.dbexplorer.api.KeyboardButton;
import com.dbexplorer.api.QueryResult;
import com.dbexplorer.error.InvalidCursorException;
import com.dbexplorer.error.QueryRejectedException;
import com.dbexplorer.error.RejectionReason;
import com.dbexplorer.model.ColumnDescriptor;
import com.dbexplorer.model.TableDescriptor;
import com.dbexplorer.paging.PaginationCodec;
import com.dbexplorer.query.ExplorerQueryService;
import com.dbexplorer.query.FilterOperator;
import com.dbexplorer.query.GuidedPage;
import com.dbexplorer.query.GuidedQueryRequest;
import com.dbexplorer.query.OrderChoice;
import com.dbexplorer.query.SortDirection;
import com.dbexplorer.service.SchemaCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The step-by-step query flow driven by {@code q:} button callbacks: table, columns, filter,
 * order, page size, then paging through the result.
 */
@Slf4j
@Component
public class GuidedQueryFlow {
    static final String CALLBACK_PREFIX = "q:";
    private static final int[] PAGE_SIZE_CHOICES = {10, 50, 100};
    private static final int MAX_TABLE_BUTTONS = 60;

    private final GuidedSessionStore sessions;
    private final SchemaCatalog catalog;
    private final ExplorerQueryService queries;
    private final PaginationCodec codec;

    public GuidedQueryFlow(GuidedSessionStore sessions, SchemaCatalog catalog,
                           ExplorerQueryService queries, PaginationCodec codec) {
        this.sessions = sessions;
        this.catalog = catalog;
        this.queries = queries;
        this.codec = codec;
    }

    public ChatReply start(Long userId) {
        sessions.start(userId);
        List<String> tables = catalog.listTables();
        if (tables.isEmpty()) {
            sessions.remove(userId);
            return ChatReply.text("No tables found in schema " + catalog.getSchema() + ".");
        }
        List<KeyboardButton> buttons = new ArrayList<>();
        for (String table : tables.subList(0, Math.min(tables.size(), MAX_TABLE_BUTTONS))) {
            buttons.add(new KeyboardButton(table, CALLBACK_PREFIX + "t:" + table));
        }
        List<List<KeyboardButton>> keyboard = Replies.rows(buttons, 2);
        keyboard.add(List.of(new KeyboardButton("Raw SQL", "/sql")));
        return ChatReply.builder()
                .text("Guided query. Step 1: pick a table.")
                .keyboard(keyboard)
                .build();
    }

    public ChatReply awaitRawSql(Long userId) {
        GuidedSession session = sessions.start(userId);
        session.setStep(GuidedStep.AWAIT_RAW_SQL);
        return ChatReply.text("Send a single SELECT statement (at most " + queries.getRawMaxRows()
                + " rows are returned). Send /cancel to abort.");
    }

    public ChatReply runRaw(String sql) {
        QueryResult result = queries.runRaw(sql);
        String text = result.getRows().size() + " row(s), limit " + result.getAppliedLimit()
                + ", " + result.getElapsedMs() + " ms" + (result.isTruncated() ? " (truncated)" : "");
        return ChatReply.builder().text(text).result(result).build();
    }

    public void cancel(Long userId) {
        sessions.remove(userId);
    }

    /**
     * Handle a {@code q:} callback payload.
     *
     * @param userId user id
     * @param data callback payload
     * @return reply for the next step
     */
    public ChatReply onCallback(Long userId, String data) {
        Optional<GuidedSession> found = sessions.get(userId);
        if (found.isEmpty()) {
            return ChatReply.builder()
                    .text("This guided query has expired. Send /q to start again.")
                    .errorCode("SESSION_EXPIRED")
                    .build();
        }
        GuidedSession session = found.get();

        String body = data.substring(CALLBACK_PREFIX.length());
        int colon = body.indexOf(':');
        String kind = colon < 0 ? body : body.substring(0, colon);
        String rest = colon < 0 ? "" : body.substring(colon + 1);

        switch (kind) {
            case "t":
                return pickTable(session, rest);
            case "c":
                return pickColumn(session, rest);
            case "f":
                return pickFilter(session, rest);
            case "o":
                return pickOrder(session, rest);
            case "n":
                return pickPageSize(session, rest);
            case "p":
                return page(session, rest);
            default:
                return ChatReply.text("Unknown action. Send /q to start again.");
        }
    }

    /**
     * Handle plain text while the session waits for a filter value or a raw statement.
     *
     * @return reply, empty when no session is waiting for text
     */
    public Optional<ChatReply> onText(Long userId, String text) {
        Optional<GuidedSession> found = sessions.get(userId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        GuidedSession session = found.get();
        if (session.getStep() == GuidedStep.AWAIT_RAW_SQL) {
            sessions.remove(userId);
            return Optional.of(runRaw(text));
        }
        if (session.getStep() != GuidedStep.AWAIT_FILTER_VALUE) {
            return Optional.empty();
        }

        session.setFilterValue(text.trim());
        try {
            // Builds once to coerce the value against the column type
            queries.fingerprintOf(session.toRequest(0).toBuilder().pageSize(1).build());
        } catch (QueryRejectedException e) {
            session.setFilterValue(null);
            ChatReply reply = Replies.error(e);
            reply.setText(reply.getText() + "\nSend another value or /cancel.");
            return Optional.of(reply);
        }
        session.setStep(GuidedStep.PICK_ORDER);
        return Optional.of(orderReply(session));
    }

    private ChatReply pickTable(GuidedSession session, String tableName) {
        if (session.getStep() != GuidedStep.PICK_TABLE && session.getStep() != GuidedStep.PICK_COLUMNS) {
            return outOfOrder();
        }
        TableDescriptor table = describe(tableName);
        session.setTable(table.getName());
        session.getColumns().clear();
        session.clearFilter();
        session.setOrder(null);
        session.setStep(GuidedStep.PICK_COLUMNS);
        return columnsReply(session, table);
    }

    private ChatReply pickColumn(GuidedSession session, String columnName) {
        if (session.getStep() != GuidedStep.PICK_COLUMNS) {
            return outOfOrder();
        }
        TableDescriptor table = describe(session.getTable());
        if ("*".equals(columnName)) {
            session.setStep(GuidedStep.PICK_FILTER);
            return filterReply(table);
        }
        String canonical = column(table, columnName).getName();
        if (!session.getColumns().remove(canonical)) {
            session.getColumns().add(canonical);
        }
        return columnsReply(session, table);
    }

    private ChatReply pickFilter(GuidedSession session, String choice) {
        if (session.getStep() != GuidedStep.PICK_FILTER) {
            return outOfOrder();
        }
        if ("-".equals(choice)) {
            session.clearFilter();
            session.setStep(GuidedStep.PICK_ORDER);
            return orderReply(session);
        }
        int sep = choice.lastIndexOf(':');
        if (sep <= 0) {
            return ChatReply.text("Unknown filter choice.");
        }
        TableDescriptor table = describe(session.getTable());
        ColumnDescriptor column = column(table, choice.substring(0, sep));
        FilterOperator op = FilterOperator.fromCode(choice.substring(sep + 1))
                .orElseThrow(() -> new QueryRejectedException(RejectionReason.INVALID_FILTER_VALUE,
                        "Unknown operator " + choice.substring(sep + 1)));

        session.setFilterColumn(column.getName());
        session.setFilterOperator(op);
        session.setFilterValue(null);
        if (op.isValueRequired()) {
            session.setStep(GuidedStep.AWAIT_FILTER_VALUE);
            return ChatReply.text("Send the value for " + column.getName() + " " + label(op)
                    + " (" + column.getDataType() + ").");
        }
        session.setStep(GuidedStep.PICK_ORDER);
        return orderReply(session);
    }

    private ChatReply pickOrder(GuidedSession session, String choice) {
        if (session.getStep() != GuidedStep.PICK_ORDER) {
            return outOfOrder();
        }
        if ("-".equals(choice)) {
            session.setOrder(null);
        } else {
            int sep = choice.lastIndexOf(':');
            if (sep <= 0) {
                return ChatReply.text("Unknown sort choice.");
            }
            TableDescriptor table = describe(session.getTable());
            String column = column(table, choice.substring(0, sep)).getName();
            SortDirection direction = SortDirection.fromCode(choice.substring(sep + 1)).orElse(SortDirection.ASC);
            session.setOrder(new OrderChoice(column, direction));
        }
        session.setStep(GuidedStep.PICK_PAGE_SIZE);

        List<KeyboardButton> sizes = new ArrayList<>();
        for (int size : PAGE_SIZE_CHOICES) {
            sizes.add(new KeyboardButton(size + " rows", CALLBACK_PREFIX + "n:" + size));
        }
        return ChatReply.builder()
                .text("Step 5: rows per page.")
                .keyboard(List.of(sizes))
                .build();
    }

    private ChatReply pickPageSize(GuidedSession session, String size) {
        if (session.getStep() != GuidedStep.PICK_PAGE_SIZE) {
            return outOfOrder();
        }
        int pageSize;
        try {
            pageSize = Integer.parseInt(size);
        } catch (NumberFormatException e) {
            return ChatReply.text("Unknown page size: " + size);
        }
        if (pageSize < 1) {
            return ChatReply.text("Unknown page size: " + size);
        }
        session.setPageSize(pageSize);
        session.setFingerprint(queries.fingerprintOf(session.toRequest(0)));
        session.setStep(GuidedStep.READY);
        return runPage(session, 0, false);
    }

    private ChatReply page(GuidedSession session, String token) {
        if (session.getStep() != GuidedStep.READY || session.getFingerprint() == null) {
            return outOfOrder();
        }
        int page;
        boolean reset = false;
        try {
            page = codec.decode(token, session.getFingerprint()).getPage();
        } catch (InvalidCursorException e) {
            log.debug("Guided cursor rejected for user {}: {}", session.getUserId(), e.getMessage());
            page = 0;
            reset = true;
        }
        return runPage(session, page, reset);
    }

    private ChatReply runPage(GuidedSession session, int page, boolean reset) {
        GuidedQueryRequest request = session.toRequest(page);
        GuidedPage result = queries.runGuided(request);
        long fingerprint = result.getQuery().getFingerprint();
        int pageSize = result.getQuery().getPageSize();

        String prev = page > 0 ? CALLBACK_PREFIX + "p:" + codec.encode(page - 1, fingerprint, true) : null;
        String nextToken = result.isHasNext() ? codec.encode(page + 1, fingerprint, true) : null;
        String next = nextToken != null ? CALLBACK_PREFIX + "p:" + nextToken : null;

        long first = result.getQuery().getOffset() + 1;
        long last = result.getQuery().getOffset() + result.getResult().getRows().size();
        StringBuilder text = new StringBuilder();
        if (reset) {
            text.append(Replies.PAGE_RESET_NOTE).append('\n');
        }
        text.append(result.getQuery().getTable()).append(": ");
        if (result.getResult().getRows().isEmpty()) {
            text.append("no rows");
        } else {
            text.append("rows ").append(first).append('-').append(last).append(" of ").append(result.getTotal());
        }
        text.append(" (page size ").append(pageSize).append(')');

        List<List<KeyboardButton>> keyboard = new ArrayList<>();
        List<KeyboardButton> nav = Replies.navRow(prev, next);
        if (!nav.isEmpty()) {
            keyboard.add(nav);
        }
        keyboard.add(List.of(new KeyboardButton("New query", "/q")));
        return ChatReply.builder()
                .text(text.toString())
                .result(result.getResult())
                .cursor(nextToken)
                .keyboard(keyboard)
                .build();
    }

    private ChatReply columnsReply(GuidedSession session, TableDescriptor table) {
        List<KeyboardButton> buttons = new ArrayList<>();
        for (ColumnDescriptor c : table.getColumns()) {
            String text = session.getColumns().contains(c.getName()) ? "✓ " + c.getName() : c.getName();
            buttons.add(new KeyboardButton(text, CALLBACK_PREFIX + "c:" + c.getName()));
        }
        List<List<KeyboardButton>> keyboard = Replies.rows(buttons, 3);
        keyboard.add(List.of(new KeyboardButton("Done", CALLBACK_PREFIX + "c:*")));
        String selected = session.getColumns().isEmpty() ? "all" : String.join(", ", session.getColumns());
        return ChatReply.builder()
                .text("Table: " + table.getName() + "\nStep 2: pick columns, then Done. Selected: " + selected)
                .keyboard(keyboard)
                .build();
    }

    private ChatReply filterReply(TableDescriptor table) {
        List<List<KeyboardButton>> keyboard = new ArrayList<>();
        for (ColumnDescriptor c : table.getColumns()) {
            List<KeyboardButton> row = new ArrayList<>();
            for (FilterOperator op : operatorsFor(c)) {
                row.add(new KeyboardButton(c.getName() + " " + label(op),
                        CALLBACK_PREFIX + "f:" + c.getName() + ":" + op.getCode()));
            }
            keyboard.add(row);
        }
        keyboard.add(List.of(new KeyboardButton("No filter", CALLBACK_PREFIX + "f:-")));
        return ChatReply.builder()
                .text("Step 3: add a filter or skip.")
                .keyboard(keyboard)
                .build();
    }

    private ChatReply orderReply(GuidedSession session) {
        TableDescriptor table = describe(session.getTable());
        List<List<KeyboardButton>> keyboard = new ArrayList<>();
        for (ColumnDescriptor c : table.getColumns()) {
            keyboard.add(List.of(
                    new KeyboardButton(c.getName() + " ↑", CALLBACK_PREFIX + "o:" + c.getName() + ":asc"),
                    new KeyboardButton(c.getName() + " ↓", CALLBACK_PREFIX + "o:" + c.getName() + ":desc")));
        }
        keyboard.add(List.of(new KeyboardButton("Default order", CALLBACK_PREFIX + "o:-")));
        return ChatReply.builder()
                .text("Step 4: pick the sort order.")
                .keyboard(keyboard)
                .build();
    }

    static List<FilterOperator> operatorsFor(ColumnDescriptor column) {
        switch (column.getCategory()) {
            case TEXT:
                return List.of(FilterOperator.EQ, FilterOperator.CONTAINS, FilterOperator.IS_NULL);
            case NUMERIC:
            case TIMESTAMP:
                return List.of(FilterOperator.EQ, FilterOperator.GT, FilterOperator.LT, FilterOperator.IS_NULL);
            case BOOLEAN:
                return List.of(FilterOperator.EQ, FilterOperator.IS_NULL);
            default:
                return List.of(FilterOperator.IS_NULL, FilterOperator.IS_NOT_NULL);
        }
    }

    private static String label(FilterOperator op) {
        return op == FilterOperator.CONTAINS ? "contains" : op.getSql().toLowerCase(Locale.ROOT);
    }

    private TableDescriptor describe(String tableName) {
        return catalog.find(tableName).orElseThrow(() -> new QueryRejectedException(
                RejectionReason.UNKNOWN_IDENTIFIER, "Unknown table: " + tableName));
    }

    private static ColumnDescriptor column(TableDescriptor table, String name) {
        return table.findColumn(name).orElseThrow(() -> new QueryRejectedException(
                RejectionReason.UNKNOWN_IDENTIFIER, "Unknown column " + name + " in " + table.getName()));
    }

    private static ChatReply outOfOrder() {
        return ChatReply.text("That button belongs to an earlier step. Send /q to start again.");
    }
}
