package com.dbexplorer.query;

import com.dbexplorer.error.QueryRejectedException;
import com.dbexplorer.error.RejectionReason;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Vets free-text SQL typed by the user.
 *
 * <p>Rules run in a fixed order and the first violation wins:
 * <ol>
 *   <li>after trimming whitespace and one trailing {@code ;}, no further separator may remain</li>
 *   <li>the first token must be {@code SELECT}</li>
 *   <li>no blocked keyword may appear as a whole token</li>
 *   <li>no comment opener may appear</li>
 *   <li>a missing row limit is appended; a larger or unverifiable one is refused</li>
 * </ol>
 */
@Component
public class QueryValidator {

    /**
     * Validate raw text.
     *
     * @param rawText text as typed by the user
     * @param maxRows largest row count the caller accepts
     * @return sanitized query with the limit that will apply
     * @throws QueryRejectedException with the first violated rule
     */
    public ValidatedQuery validate(String rawText, int maxRows) {
        if (maxRows < 1) {
            throw new IllegalArgumentException("maxRows must be positive: " + maxRows);
        }
        if (rawText == null || rawText.isBlank()) {
            throw new QueryRejectedException(RejectionReason.NOT_SELECT, "Empty query");
        }

        String body = stripTrailingSeparator(rawText);
        SqlTokenScanner.Scan scan = SqlTokenScanner.scan(body);

        if (scan.getSeparatorCount() > 0) {
            throw new QueryRejectedException(RejectionReason.MULTI_STATEMENT,
                    "Only a single statement is allowed");
        }

        boolean startsWithSelect = scan.firstToken().map(t -> t.isWord("SELECT")).orElse(false);
        if (!startsWithSelect) {
            throw new QueryRejectedException(RejectionReason.NOT_SELECT,
                    "Only SELECT statements are allowed");
        }

        Optional<String> blocked = scan.firstBlockedKeyword();
        if (blocked.isPresent()) {
            throw new QueryRejectedException(RejectionReason.BLOCKED_KEYWORD,
                    "Keyword " + blocked.get() + " is not allowed");
        }

        if (scan.hasComment()) {
            throw new QueryRejectedException(RejectionReason.COMMENT_INJECTION,
                    "Comments are not allowed");
        }

        SqlTokenScanner.RowLimit limit = scan.topLevelRowLimit();
        if (!limit.isPresent()) {
            return new ValidatedQuery(body + " LIMIT " + maxRows, maxRows);
        }
        if (limit.getValue() == null || limit.getValue() > maxRows) {
            throw new QueryRejectedException(RejectionReason.LIMIT_EXCEEDED,
                    "Row limit must be a number no greater than " + maxRows);
        }
        return new ValidatedQuery(body, limit.getValue().intValue());
    }

    static String stripTrailingSeparator(String rawText) {
        String body = rawText.strip();
        if (body.endsWith(";")) {
            body = body.substring(0, body.length() - 1).strip();
        }
        return body;
    }
}
