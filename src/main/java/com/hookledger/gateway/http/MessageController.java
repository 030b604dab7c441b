package com.hookledger.gateway.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hookledger.shared.model.StoredMessage;
import com.hookledger.store.MessageFilter;
import com.hookledger.store.MessageStore;
import com.hookledger.store.MessageStats;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

@RestController
public class MessageController {

    private final MessageStore store;

    public MessageController(MessageStore store) {
        this.store = store;
    }

    @GetMapping("/messages")
    public MessagesResponse list(
            @RequestParam(defaultValue = "" + MessageStore.DEFAULT_LIMIT) int limit,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(name = "from", required = false) String from,
            @RequestParam(required = false) String since,
            @RequestParam(name = "q", required = false) String q) {
        var filter = new MessageFilter(normalizeSender(from), parseSince(since), q);
        var page = store.list(filter, limit, offset);
        var data = page.items().stream().map(MessageView::of).toList();
        return new MessagesResponse(data, page.total(), limit, offset);
    }

    @GetMapping("/stats")
    public StatsResponse stats() {
        return StatsResponse.of(store.stats());
    }

    // an unencoded '+' in a query string arrives as a space
    static String normalizeSender(String from) {
        if (from == null || from.isBlank()) return null;
        return from.startsWith(" ") ? "+" + from.strip() : from.strip();
    }

    // same for the sign of a +hh:mm offset; a valid timestamp never contains a space
    static Instant parseSince(String since) {
        if (since == null || since.isBlank()) return null;
        try {
            return OffsetDateTime.parse(since.strip().replace(' ', '+'), DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("since must be ISO-8601 with a timezone designator");
        }
    }

    private static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    public record MessageView(
        @JsonProperty("message_id") String messageId,
        @JsonProperty("from") String from,
        @JsonProperty("to") String to,
        @JsonProperty("ts") String ts,
        @JsonProperty("text") String text
    ) {
        static MessageView of(StoredMessage m) {
            return new MessageView(m.messageId(), m.from(), m.to(), iso(m.ts()), m.text());
        }
    }

    public record MessagesResponse(List<MessageView> data, long total, int limit, int offset) {}

    public record SenderView(@JsonProperty("from") String from, @JsonProperty("count") long count) {}

    public record StatsResponse(
        @JsonProperty("total_messages") long totalMessages,
        @JsonProperty("senders_count") long sendersCount,
        @JsonProperty("messages_per_sender") List<SenderView> messagesPerSender,
        @JsonProperty("first_message_ts") String firstMessageTs,
        @JsonProperty("last_message_ts") String lastMessageTs
    ) {
        static StatsResponse of(MessageStats stats) {
            return new StatsResponse(
                stats.totalMessages(),
                stats.sendersCount(),
                stats.topSenders().stream().map(s -> new SenderView(s.from(), s.count())).toList(),
                iso(stats.firstMessageTs()),
                iso(stats.lastMessageTs()));
        }
    }
}
