package com.dbexplorer.bot;

import com.dbexplorer.api.ChatMessageEnvelope;
import com.dbexplorer.api.ChatReply;
import com.dbexplorer.api.HealthResponse;
import com.dbexplorer.api.KeyboardButton;
import com.dbexplorer.api.QueryResult;
import com.dbexplorer.domain.DomainPage;
import com.dbexplorer.domain.DomainQueryService;
import com.dbexplorer.domain.DomainResolver;
import com.dbexplorer.domain.DomainSpec;
import com.dbexplorer.domain.DomainSpecs;
import com.dbexplorer.domain.DomainStatus;
import com.dbexplorer.domain.PeriodSummary;
import com.dbexplorer.domain.RangeAggregate;
import com.dbexplorer.domain.SummaryService;
import com.dbexplorer.domain.TodaySummary;
import com.dbexplorer.domain.Trend;
import com.dbexplorer.error.ExplorerException;
import com.dbexplorer.error.InvalidCursorException;
import com.dbexplorer.model.ColumnDescriptor;
import com.dbexplorer.model.IndexDescriptor;
import com.dbexplorer.model.TableDescriptor;
import com.dbexplorer.paging.FilterFingerprint;
import com.dbexplorer.paging.PaginationCodec;
import com.dbexplorer.query.ExplorerQueryService;
import com.dbexplorer.query.GuidedPage;
import com.dbexplorer.query.GuidedQueryRequest;
import com.dbexplorer.service.HealthService;
import com.dbexplorer.service.SchemaCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Routes one interaction to the explorer core and turns the outcome into a reply.
 *
 * <p>Authorization is checked before anything else; a denied user never reaches the catalog, the
 * resolver or the pool.
 */
@Slf4j
@Component
public class ExplorerCommandHandler {
    private static final int TREND_WINDOW = 7;
    private static final int DEFAULT_SERIES_LENGTH = 30;
    private static final int MAX_SERIES_LENGTH = 365;

    private final AuthorizationPolicy authorization;
    private final SchemaCatalog catalog;
    private final DomainResolver resolver;
    private final DomainQueryService domains;
    private final SummaryService summaries;
    private final ExplorerQueryService queries;
    private final GuidedQueryFlow guided;
    private final PaginationCodec codec;
    private final HealthService health;
    private final int pageSize;

    public ExplorerCommandHandler(AuthorizationPolicy authorization,
                                  SchemaCatalog catalog,
                                  DomainResolver resolver,
                                  DomainQueryService domains,
                                  SummaryService summaries,
                                  ExplorerQueryService queries,
                                  GuidedQueryFlow guided,
                                  PaginationCodec codec,
                                  HealthService health,
                                  @Value("${explorer.query.page-size:10}") int pageSize) {
        this.authorization = authorization;
        this.catalog = catalog;
        this.resolver = resolver;
        this.domains = domains;
        this.summaries = summaries;
        this.queries = queries;
        this.guided = guided;
        this.codec = codec;
        this.health = health;
        this.pageSize = pageSize;
    }

    /**
     * Handle one interaction.
     *
     * @param envelope inbound interaction
     * @return reply, never null; failures are turned into error replies
     */
    public ChatReply handle(ChatMessageEnvelope envelope) {
        if (!isAuthorized(envelope)) {
            return withId(denied(), envelope);
        }

        String command = envelope.getCommand().trim();
        String args = envelope.getArgs() == null ? "" : envelope.getArgs().trim();
        int space = indexOfWhitespace(command);
        if (space > 0) {
            args = (command.substring(space + 1).trim() + " " + args).trim();
            command = command.substring(0, space);
        }

        ChatReply reply;
        try {
            reply = route(envelope.getUserId(), command, args);
        } catch (ExplorerException e) {
            log.info("Interaction {} failed: {} {}", envelope.getInteractionId(), e.getKind(), e.getMessage());
            reply = Replies.error(e);
        } catch (IllegalArgumentException e) {
            reply = ChatReply.builder().text(e.getMessage()).errorCode("INVALID_ARGUMENT").build();
        }
        return withId(reply, envelope);
    }

    public boolean isAuthorized(ChatMessageEnvelope envelope) {
        if (authorization.isAllowed(envelope.getUserId())) {
            return true;
        }
        log.warn("Auth denied for user_id={}", envelope.getUserId());
        return false;
    }

    static ChatReply denied() {
        return ChatReply.builder().text("Sorry, this bot is private.").errorCode("UNAUTHORIZED").build();
    }

    private ChatReply route(Long userId, String command, String args) {
        if (command.startsWith(GuidedQueryFlow.CALLBACK_PREFIX)) {
            return guided.onCallback(userId, command);
        }
        if (!command.startsWith("/")) {
            String text = (command + " " + args).trim();
            return guided.onText(userId, text)
                    .orElseGet(() -> ChatReply.text("Unknown command. Send /help for the menu."));
        }

        String name = command.toLowerCase(Locale.ROOT);
        int at = name.indexOf('@');
        if (at > 0) {
            name = name.substring(0, at);
        }

        switch (name) {
            case "/start":
            case "/help":
                return menu();
            case "/tables":
                return tables(args);
            case "/describe":
                return describe(args);
            case "/browse":
                return browse(args);
            case "/weight":
            case "/steps":
            case "/sleep":
            case "/heart":
                return domainPage(name.substring(1), args);
            case "/latest":
                return latest(args);
            case "/trend":
                return trend(args);
            case "/series":
                return series(args);
            case "/today":
                return today();
            case "/week":
                return period(7);
            case "/month":
                return period(30);
            case "/health":
                return health();
            case "/domains":
                return domainStatuses("Detected domains:", resolver.statuses());
            case "/refresh":
                return domainStatuses("Re-detected domains:", resolver.refresh());
            case "/sql":
                return args.isEmpty() ? guided.awaitRawSql(userId) : guided.runRaw(args);
            case "/q":
                return guided.start(userId);
            case "/cancel":
                guided.cancel(userId);
                return ChatReply.text("Cancelled.");
            default:
                return ChatReply.text("Unknown command " + command + ". Send /help for the menu.");
        }
    }

    private ChatReply menu() {
        List<KeyboardButton> buttons = List.of(
                new KeyboardButton("Today", "/today"),
                new KeyboardButton("Week", "/week"),
                new KeyboardButton("Month", "/month"),
                new KeyboardButton("Weight", "/weight"),
                new KeyboardButton("Steps", "/steps"),
                new KeyboardButton("Sleep", "/sleep"),
                new KeyboardButton("Heart", "/heart"),
                new KeyboardButton("Tables", "/tables"),
                new KeyboardButton("Query", "/q"),
                new KeyboardButton("Health", "/health")
        );
        String text = "DB Explorer\n"
                + "/today /week /month - summaries\n"
                + "/weight /steps /sleep /heart - recent records\n"
                + "/latest <domain>, /trend [domain], /series <domain> [n]\n"
                + "/tables, /describe <table>, /browse <table>\n"
                + "/q - guided query, /sql <select> - raw query, /cancel\n"
                + "/domains, /refresh, /health";
        return ChatReply.builder().text(text).keyboard(Replies.rows(buttons, 3)).build();
    }

    private ChatReply tables(String cursor) {
        List<String> all = catalog.listTables();
        long fingerprint = FilterFingerprint.of("tables", catalog.getSchema(), pageSize);
        PageStart start = pageStart(cursor, fingerprint);
        int page = start.page;
        if ((long) page * pageSize >= all.size() && page > 0) {
            page = 0;
        }
        int from = page * pageSize;
        List<String> slice = all.subList(Math.min(from, all.size()), Math.min(from + pageSize, all.size()));

        List<List<Object>> rows = slice.stream().map(t -> List.<Object>of(t)).collect(Collectors.toList());
        QueryResult result = QueryResult.builder()
                .columns(List.of("table_name"))
                .rows(rows)
                .appliedLimit(pageSize)
                .build();

        List<KeyboardButton> buttons = new ArrayList<>();
        for (String t : slice) {
            buttons.add(new KeyboardButton(t, "/describe " + t));
        }
        List<List<KeyboardButton>> keyboard = Replies.rows(buttons, 2);
        boolean hasNext = from + pageSize < all.size();
        String nextToken = hasNext ? codec.encode(page + 1, fingerprint, true) : null;
        List<KeyboardButton> nav = Replies.navRow(
                page > 0 ? "/tables " + codec.encode(page - 1, fingerprint, true) : null,
                nextToken != null ? "/tables " + nextToken : null);
        if (!nav.isEmpty()) {
            keyboard.add(nav);
        }

        String text = (start.reset ? Replies.PAGE_RESET_NOTE + "\n" : "")
                + all.size() + " table(s) in " + catalog.getSchema() + ", page " + (page + 1) + " of " + pageCount(all.size());
        return ChatReply.builder().text(text).result(result).keyboard(keyboard).cursor(nextToken).build();
    }

    private ChatReply describe(String tableName) {
        if (tableName.isEmpty()) {
            return ChatReply.text("Usage: /describe <table>");
        }
        TableDescriptor table = catalog.describeFresh(tableName);
        List<IndexDescriptor> indexes = catalog.listIndexes(table.getName());

        List<List<Object>> rows = new ArrayList<>();
        for (ColumnDescriptor c : table.getColumns()) {
            rows.add(List.of(c.getName(), c.getDataType(), c.getCategory().name(), c.isNullable()));
        }
        QueryResult result = QueryResult.builder()
                .columns(List.of("column", "type", "category", "nullable"))
                .rows(rows)
                .build();

        StringBuilder text = new StringBuilder();
        text.append(table.getSchema()).append('.').append(table.getName())
                .append(": ").append(table.getColumns().size()).append(" column(s)");
        if (!indexes.isEmpty()) {
            text.append("\nIndexes:");
            for (IndexDescriptor index : indexes) {
                text.append("\n").append(index.getName()).append(": ").append(index.getDefinition());
            }
        }
        return ChatReply.builder()
                .text(text.toString())
                .result(result)
                .data(Map.of("indexes", indexes))
                .keyboard(List.of(List.of(new KeyboardButton("Browse", "/browse " + table.getName()))))
                .build();
    }

    private ChatReply browse(String args) {
        if (args.isEmpty()) {
            return ChatReply.text("Usage: /browse <table>");
        }
        String[] parts = args.split("\\s+", 2);
        String table = parts[0];
        String cursor = parts.length > 1 ? parts[1] : "";

        GuidedQueryRequest first = queries.browseRequest(table, 0);
        long fingerprint = queries.fingerprintOf(first);
        PageStart start = pageStart(cursor, fingerprint);
        GuidedPage page = queries.runGuided(first.toBuilder().page(start.page).build());

        String name = page.getQuery().getTable();
        String nextToken = page.isHasNext() ? codec.encode(start.page + 1, fingerprint, true) : null;
        List<KeyboardButton> nav = Replies.navRow(
                start.page > 0 ? "/browse " + name + " " + codec.encode(start.page - 1, fingerprint, true) : null,
                nextToken != null ? "/browse " + name + " " + nextToken : null);

        String text = (start.reset ? Replies.PAGE_RESET_NOTE + "\n" : "")
                + name + ": " + page.getTotal() + " row(s), page " + (start.page + 1) + " of "
                + pageCount(page.getTotal(), page.getQuery().getPageSize());
        return ChatReply.builder()
                .text(text)
                .result(page.getResult())
                .cursor(nextToken)
                .keyboard(nav.isEmpty() ? null : List.of(nav))
                .build();
    }

    private ChatReply domainPage(String domainId, String cursor) {
        long fingerprint = FilterFingerprint.of("domain", domainId, pageSize);
        PageStart start = pageStart(cursor, fingerprint);
        DomainPage page = domains.recent(domainId, start.page, pageSize);

        String command = "/" + domainId;
        String nextToken = page.isHasNext() ? codec.encode(start.page + 1, fingerprint, true) : null;
        List<KeyboardButton> nav = Replies.navRow(
                start.page > 0 ? command + " " + codec.encode(start.page - 1, fingerprint, true) : null,
                nextToken != null ? command + " " + nextToken : null);

        String label = DomainSpecs.find(domainId).map(DomainSpec::getLabel).orElse(domainId);
        String text = (start.reset ? Replies.PAGE_RESET_NOTE + "\n" : "")
                + label + ": " + page.getTotal() + " record(s), page " + (start.page + 1) + " of " + pageCount(page.getTotal());
        List<List<KeyboardButton>> keyboard = new ArrayList<>();
        if (!nav.isEmpty()) {
            keyboard.add(nav);
        }
        keyboard.add(List.of(new KeyboardButton("Trend", "/trend " + domainId),
                new KeyboardButton("Series", "/series " + domainId)));
        return ChatReply.builder()
                .text(text)
                .result(page.getResult())
                .cursor(nextToken)
                .keyboard(keyboard)
                .build();
    }

    private ChatReply latest(String domainArg) {
        Optional<DomainSpec> spec = DomainSpecs.find(domainArg);
        if (spec.isEmpty()) {
            return ChatReply.text("Usage: /latest <" + domainIds() + ">");
        }
        QueryResult result = domains.latest(spec.get().getId());
        if (result.getRows().isEmpty()) {
            return ChatReply.builder().text(spec.get().getLabel() + ": no records yet.").result(result).build();
        }
        List<Object> row = result.getRows().get(0);
        StringBuilder text = new StringBuilder("Latest ").append(spec.get().getLabel().toLowerCase(Locale.ROOT)).append(':');
        for (int i = 0; i < result.getColumns().size(); i++) {
            text.append("\n").append(result.getColumns().get(i)).append(": ").append(row.get(i));
        }
        return ChatReply.builder().text(text.toString()).result(result).build();
    }

    private ChatReply trend(String domainArg) {
        String id = domainArg.isEmpty() ? DomainSpecs.WEIGHT.getId() : domainArg;
        Optional<DomainSpec> spec = DomainSpecs.find(id);
        if (spec.isEmpty()) {
            return ChatReply.text("Usage: /trend [" + domainIds() + "]");
        }
        Trend trend = domains.trend(spec.get().getId(), TREND_WINDOW);
        String text = spec.get().getLabel() + " trend, last " + TREND_WINDOW + " vs previous " + TREND_WINDOW + " values:"
                + "\nRecent avg: " + Replies.number(trend.getRecentAverage())
                + "\nPrevious avg: " + Replies.number(trend.getPreviousAverage())
                + "\nChange: " + Replies.signed(trend.getDelta());
        return ChatReply.builder().text(text).data(trend).build();
    }

    private ChatReply series(String args) {
        String[] parts = args.isEmpty() ? new String[0] : args.split("\\s+");
        Optional<DomainSpec> spec = parts.length > 0 ? DomainSpecs.find(parts[0]) : Optional.empty();
        if (spec.isEmpty()) {
            return ChatReply.text("Usage: /series <" + domainIds() + "> [n]");
        }
        int n = DEFAULT_SERIES_LENGTH;
        if (parts.length > 1) {
            try {
                n = Integer.parseInt(parts[1]);
            } catch (NumberFormatException e) {
                return ChatReply.text("Series length must be a number: " + parts[1]);
            }
        }
        n = Math.max(1, Math.min(n, MAX_SERIES_LENGTH));
        List<Double> values = domains.series(spec.get().getId(), n);
        return ChatReply.builder()
                .text(spec.get().getLabel() + ": last " + values.size() + " value(s), oldest first")
                .series(values)
                .build();
    }

    private ChatReply today() {
        TodaySummary s = summaries.today();
        StringBuilder text = new StringBuilder("Today, ").append(s.getDate()).append(" (").append(s.getTimeZone()).append(')');
        if (s.getWeightLatest() != null) {
            Object weight = resolver.current(DomainSpecs.WEIGHT.getId()).getDomain()
                    .flatMap(d -> d.column(DomainSpecs.VALUE))
                    .map(column -> s.getWeightLatest().get(column))
                    .orElse(s.getWeightLatest());
            text.append("\nWeight (latest): ").append(weight);
        }
        if (s.getStepsToday() != null) {
            text.append("\nSteps: ").append(Replies.number(s.getStepsToday()));
        }
        if (s.getSleepLast() != null) {
            text.append("\nSleep: ").append(s.getSleepLast());
        }
        appendHeart(text, s.getHeart());
        return ChatReply.builder().text(text.toString()).data(s).build();
    }

    private ChatReply period(int days) {
        PeriodSummary s = summaries.period(days);
        StringBuilder text = new StringBuilder("Last ").append(days).append(" days (").append(s.getTimeZone()).append(')');
        if (s.getWeightLast() != null) {
            text.append("\nWeight: ").append(Replies.number(s.getWeightFirst()))
                    .append(" -> ").append(Replies.number(s.getWeightLast()))
                    .append(" (").append(Replies.signed(s.getWeightDelta())).append(')');
        }
        if (s.getStepsTotal() != null) {
            text.append("\nSteps: ").append(Replies.number(s.getStepsTotal()))
                    .append(" total, ").append(Replies.number(s.getStepsAverage())).append(" avg");
        }
        if (s.getSleepAverageDuration() != null) {
            text.append("\nSleep avg duration: ").append(Replies.number(s.getSleepAverageDuration()));
        }
        appendHeart(text, s.getHeart());
        return ChatReply.builder().text(text.toString()).data(s).build();
    }

    private static void appendHeart(StringBuilder text, RangeAggregate heart) {
        if (heart != null && heart.getCount() > 0) {
            text.append("\nHeart rate: avg ").append(Replies.number(heart.getAverage()))
                    .append(", min ").append(Replies.number(heart.getMin()))
                    .append(", max ").append(Replies.number(heart.getMax()))
                    .append(" (").append(heart.getCount()).append(" samples)");
        }
    }

    private ChatReply health() {
        HealthResponse h = health.check();
        String text = "Bot health"
                + "\nUptime: " + Replies.uptime(h.getUptimeSeconds())
                + "\nDB status: " + (h.isDatabaseOk() ? "OK" : "UNREACHABLE")
                + "\nLast query: " + (h.getLastQueryAt() != null ? h.getLastQueryAt().toString() : "never")
                + "\nPool: " + h.getPoolActive() + " active, " + h.getPoolIdle() + " idle, max " + h.getPoolMax()
                + "\nTimezone: " + h.getTimeZone();
        return ChatReply.builder().text(text).data(h).build();
    }

    private static ChatReply domainStatuses(String title, List<DomainStatus> statuses) {
        StringBuilder text = new StringBuilder(title);
        for (DomainStatus s : statuses) {
            text.append("\n").append(s.getDomainId()).append(": ");
            if (s.isAvailable()) {
                text.append("ready (table ").append(s.getTable()).append(')');
            } else {
                text.append("unavailable (").append(s.getReason()).append(')');
            }
        }
        return ChatReply.builder().text(text.toString()).data(statuses).build();
    }

    private PageStart pageStart(String cursor, long fingerprint) {
        if (cursor == null || cursor.isBlank()) {
            return new PageStart(0, false);
        }
        try {
            return new PageStart(codec.decode(cursor.trim(), fingerprint).getPage(), false);
        } catch (InvalidCursorException e) {
            log.debug("Cursor rejected, restarting at page 0: {}", e.getMessage());
            return new PageStart(0, true);
        }
    }

    private int pageCount(long total) {
        return pageCount(total, pageSize);
    }

    private static int pageCount(long total, int size) {
        return (int) Math.max(1, (total + size - 1) / size);
    }

    private static String domainIds() {
        return DomainSpecs.ALL.stream().map(DomainSpec::getId).collect(Collectors.joining("|"));
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static ChatReply withId(ChatReply reply, ChatMessageEnvelope envelope) {
        reply.setInteractionId(envelope.getInteractionId());
        return reply;
    }

    private static final class PageStart {
        private final int page;
        private final boolean reset;

        private PageStart(int page, boolean reset) {
            this.page = page;
            this.reset = reset;
        }
    }
}
