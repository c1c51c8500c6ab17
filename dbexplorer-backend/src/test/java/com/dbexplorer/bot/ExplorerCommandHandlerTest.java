package com.dbexplorer.bot;

import com.dbexplorer.api.ChatMessageEnvelope;
import com.dbexplorer.api.ChatReply;
import com.dbexplorer.api.KeyboardButton;
import com.dbexplorer.domain.DomainQueryService;
import com.dbexplorer.domain.DomainResolver;
import com.dbexplorer.domain.SummaryService;
import com.dbexplorer.domain.Trend;
import com.dbexplorer.paging.PaginationCodec;
import com.dbexplorer.query.ExplorerQueryService;
import com.dbexplorer.service.HealthService;
import com.dbexplorer.service.SchemaCatalog;
import com.dbexplorer.support.ExplorerStack;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class ExplorerCommandHandlerTest {

    private ExplorerStack stack;
    private ExplorerCommandHandler handler;

    @BeforeEach
    void setUp() {
        stack = new ExplorerStack(2);
        handler = stack.handler;
    }

    @AfterEach
    void tearDown() {
        stack.close();
    }

    @Test
    void strangerIsDeniedBeforeAnyDatabaseWork() {
        SchemaCatalog catalog = mock(SchemaCatalog.class);
        DomainResolver resolver = mock(DomainResolver.class);
        DomainQueryService domains = mock(DomainQueryService.class);
        SummaryService summaries = mock(SummaryService.class);
        ExplorerQueryService queries = mock(ExplorerQueryService.class);
        GuidedQueryFlow guided = mock(GuidedQueryFlow.class);
        HealthService health = mock(HealthService.class);
        ExplorerCommandHandler locked = new ExplorerCommandHandler(userId -> false, catalog, resolver, domains,
                summaries, queries, guided, new PaginationCodec(), health, 10);

        ChatReply reply = locked.handle(envelope("/sql SELECT * FROM measurements_weight"));

        assertThat(reply.getErrorCode()).isEqualTo("UNAUTHORIZED");
        assertThat(reply.getText()).isEqualTo("Sorry, this bot is private.");
        assertThat(reply.getResult()).isNull();
        verifyNoInteractions(catalog, resolver, domains, summaries, queries, guided, health);
    }

    @Test
    void replyCarriesInteractionId() {
        ChatMessageEnvelope envelope = envelope("/help");
        envelope.setInteractionId("abc-1");

        ChatReply reply = handler.handle(envelope);

        assertThat(reply.getInteractionId()).isEqualTo("abc-1");
        assertThat(reply.getText()).contains("/tables");
        assertThat(callbacks(reply)).contains("/today", "/q", "/health");
    }

    @Test
    void commandWithBotSuffixIsRouted() {
        assertThat(handler.handle(envelope("/HELP@explorer_bot")).getText()).startsWith("DB Explorer");
    }

    @Test
    void tablesArePagedWithSignedCursor() {
        ChatReply first = handler.handle(envelope("/tables"));

        assertThat(first.getResult().getRows()).extracting(r -> r.get(0))
                .containsExactly("measurements_weight", "notes");
        assertThat(first.getText()).contains("3 table(s)").contains("page 1 of 2");
        assertThat(first.getCursor()).isNotNull();
        assertThat(callbacks(first)).contains("/describe notes", "/tables " + first.getCursor());

        ChatReply second = handler.handle(envelope("/tables " + first.getCursor()));

        assertThat(second.getResult().getRows()).extracting(r -> r.get(0)).containsExactly("sleep_sessions");
        assertThat(second.getCursor()).isNull();
        assertThat(second.getText()).doesNotContain(Replies.PAGE_RESET_NOTE);
    }

    @Test
    void invalidCursorFallsBackToFirstPage() {
        ChatReply reply = handler.handle(envelope("/tables not-a-real-cursor"));

        assertThat(reply.getErrorCode()).isNull();
        assertThat(reply.getText()).startsWith(Replies.PAGE_RESET_NOTE);
        assertThat(reply.getResult().getRows()).extracting(r -> r.get(0))
                .containsExactly("measurements_weight", "notes");
    }

    @Test
    void cursorFromAnotherListingIsNotAccepted() {
        String tablesCursor = handler.handle(envelope("/tables")).getCursor();

        ChatReply reply = handler.handle(envelope("/weight " + tablesCursor));

        assertThat(reply.getText()).startsWith(Replies.PAGE_RESET_NOTE);
        assertThat(reply.getResult().getRows()).extracting(r -> r.get(0)).containsExactly(5, 4);
    }

    @Test
    void domainRecordsPageNewestFirst() {
        ChatReply first = handler.handle(envelope("/weight"));
        ChatReply second = handler.handle(envelope("/weight " + first.getCursor()));

        assertThat(first.getText()).contains("5 record(s)").contains("page 1 of 3");
        assertThat(first.getResult().getRows()).extracting(r -> r.get(0)).containsExactly(5, 4);
        assertThat(second.getResult().getRows()).extracting(r -> r.get(0)).containsExactly(3, 2);
        assertThat(callbacks(second)).contains("/trend weight", "/series weight");
    }

    @Test
    void missingDomainGetsFriendlyError() {
        ChatReply reply = handler.handle(envelope("/steps"));

        assertThat(reply.getErrorCode()).isEqualTo("DOMAIN_UNAVAILABLE");
        assertThat(reply.getText()).contains("No data available for steps");
    }

    @Test
    void describeListsColumnsAndOffersBrowse() {
        ChatReply reply = handler.handle(envelope("/describe measurements_weight"));

        assertThat(reply.getResult().getColumns()).containsExactly("column", "type", "category", "nullable");
        assertThat(reply.getResult().getRows()).extracting(r -> r.get(0))
                .containsExactly("id", "measured_at", "weight_kg", "source");
        assertThat(reply.getResult().getRows().get(2).get(2)).isEqualTo("NUMERIC");
        assertThat(callbacks(reply)).containsExactly("/browse measurements_weight");
    }

    @Test
    void describeUnknownTableIsReported() {
        ChatReply reply = handler.handle(envelope("/describe nope"));

        assertThat(reply.getErrorCode()).isEqualTo("TABLE_NOT_FOUND");
    }

    @Test
    void browseUsesBrowsePageSize() {
        ChatReply reply = handler.handle(envelope("/browse notes"));

        assertThat(reply.getResult().getRows()).hasSize(2);
        assertThat(reply.getText()).startsWith("notes: 2 row(s), page 1 of 1");
        assertThat(reply.getCursor()).isNull();
    }

    @Test
    void latestShowsNewestRow() {
        ChatReply reply = handler.handle(envelope("/latest weight"));

        assertThat(reply.getText()).contains("weight_kg: 84.0");
        assertThat(handler.handle(envelope("/latest cholesterol")).getText()).startsWith("Usage: /latest");
    }

    @Test
    void trendDefaultsToWeight() {
        ChatReply reply = handler.handle(envelope("/trend"));

        assertThat(reply.getData()).isInstanceOf(Trend.class);
        assertThat(reply.getText()).contains("Recent avg: 82").contains("Change: n/a");
    }

    @Test
    void seriesIsOldestFirstAndClamped() {
        assertThat(handler.handle(envelope("/series weight 3")).getSeries()).containsExactly(82.0, 83.0, 84.0);
        assertThat(handler.handle(envelope("/series weight 0")).getSeries()).containsExactly(84.0);
        assertThat(handler.handle(envelope("/series weight many")).getText()).contains("must be a number");
    }

    @Test
    void todaySkipsMissingDomains() {
        ChatReply reply = handler.handle(envelope("/today"));

        assertThat(reply.getText())
                .contains("2024-01-05")
                .contains("Weight (latest): 84.0")
                .doesNotContain("Steps")
                .doesNotContain("Heart");
    }

    @Test
    void weekSummarizesWeightAndSleep() {
        ChatReply reply = handler.handle(envelope("/week"));

        assertThat(reply.getText())
                .contains("Weight: 80 -> 84 (+4)")
                .contains("Sleep avg duration: 450");
    }

    @Test
    void healthReportsDatabase() {
        assertThat(handler.handle(envelope("/health")).getText()).contains("DB status: OK");
    }

    @Test
    void domainsListsAvailability() {
        ChatReply reply = handler.handle(envelope("/domains"));

        assertThat(reply.getText())
                .contains("weight: ready (table measurements_weight)")
                .contains("steps: unavailable");
    }

    @Test
    void rawSelectRunsWithLimit() {
        ChatReply reply = handler.handle(envelope("/sql SELECT id FROM measurements_weight ORDER BY id"));

        assertThat(reply.getErrorCode()).isNull();
        assertThat(reply.getResult().getRows()).hasSize(5);
        assertThat(reply.getResult().getAppliedLimit()).isEqualTo(100);
    }

    @Test
    void rawWriteIsRejectedWithReason() {
        ChatReply reply = handler.handle(envelope("/sql DELETE FROM measurements_weight"));

        assertThat(reply.getErrorCode()).isEqualTo("VALIDATION_REJECTED");
        assertThat(reply.getReason()).isEqualTo("notSelect");
        assertThat(handler.handle(envelope("/sql SELECT count(*) AS n FROM measurements_weight"))
                .getResult().getRows().get(0).get(0)).isEqualTo(5L);
    }

    @Test
    void rawSqlCanArriveAsNextMessage() {
        assertThat(handler.handle(envelope("/sql")).getText()).startsWith("Send a single SELECT statement");

        ChatReply reply = handler.handle(envelope("SELECT body FROM notes ORDER BY id"));

        assertThat(reply.getResult().getRows()).extracting(r -> r.get(0)).containsExactly("first", "second");
        assertThat(handler.handle(envelope("SELECT 1")).getText()).startsWith("Unknown command");
    }

    @Test
    void failingQueryReportsDatabaseError() {
        ChatReply reply = handler.handle(envelope("/sql SELECT missing_column FROM notes"));

        assertThat(reply.getErrorCode()).isEqualTo("QUERY_FAILED");
        assertThat(reply.getText()).startsWith("Query failed:");
    }

    @Test
    void cancelDropsGuidedSession() {
        handler.handle(envelope("/q"));

        assertThat(handler.handle(envelope("/cancel")).getText()).isEqualTo("Cancelled.");
        assertThat(handler.handle(envelope("q:t:notes")).getErrorCode()).isEqualTo("SESSION_EXPIRED");
    }

    @Test
    void unknownCommandPointsToHelp() {
        assertThat(handler.handle(envelope("/frobnicate")).getText())
                .isEqualTo("Unknown command /frobnicate. Send /help for the menu.");
    }

    private static ChatMessageEnvelope envelope(String command) {
        return ChatMessageEnvelope.builder().userId(ExplorerStack.OWNER).command(command).build();
    }

    private static List<String> callbacks(ChatReply reply) {
        return reply.getKeyboard().stream()
                .flatMap(List::stream)
                .map(KeyboardButton::getCallbackData)
                .collect(Collectors.toList());
    }
}
