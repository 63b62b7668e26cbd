package com.flagship.split_ledger.comment;

import com.flagship.split_ledger.common.exception.LedgerValidationException;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.UUID;

/**
 * Position of the last comment on a page. Clients treat the encoded form as opaque.
 */
@Value
public class CommentCursor {
    Instant createdAt;
    UUID id;

    public static CommentCursor after(Comment comment) {
        return new CommentCursor(comment.getCreatedAt(), comment.getId());
    }

    public String encode() {
        String raw = createdAt + "|" + id;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws LedgerValidationException if the value was not produced by {@link #encode()}
     */
    public static CommentCursor decode(String encoded) {
        try {
            String raw = new String(Base64.getUrlDecoder().decode(encoded), StandardCharsets.UTF_8);
            int separator = raw.indexOf('|');
            if (separator < 0) {
                throw new IllegalArgumentException("missing separator");
            }
            return new CommentCursor(Instant.parse(raw.substring(0, separator)),
                    UUID.fromString(raw.substring(separator + 1)));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new LedgerValidationException("INVALID_CURSOR", "Cursor is not valid for this list");
        }
    }
}
