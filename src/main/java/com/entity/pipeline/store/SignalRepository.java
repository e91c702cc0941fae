package com.entity.pipeline.store;

import com.entity.pipeline.core.model.Communication;
import com.entity.pipeline.core.model.TimelineEvent;

import java.util.List;

/**
 * Structured relationship signals written by ingestion: message headers and curated timeline events.
 */
public class SignalRepository {

    private final SqlExecutor executor;

    public SignalRepository(SqlExecutor executor) {
        this.executor = executor;
    }

    public SignalRepository(StoreConnection connection) {
        this(new SqlExecutor(connection));
    }

    public Communication saveCommunication(Long documentId, String sender, List<String> recipients, String sentAt) {
        long id = executor.insertCommunication(documentId, sender, JsonColumns.writeStrings(recipients), sentAt);
        return new Communication(id, documentId, sender, recipients, sentAt);
    }

    public List<Communication> findCommunicationPage(long afterId, int limit) {
        return executor.findCommunicationPage(afterId, limit).stream()
                .map(row -> new Communication(
                        Rows.getLong(row, "id"),
                        Rows.getNullableLong(row, "document_id"),
                        Rows.getString(row, "sender"),
                        JsonColumns.readStrings(Rows.getString(row, "recipients")),
                        Rows.getString(row, "sent_at")))
                .toList();
    }

    public TimelineEvent saveTimelineEvent(String title, String eventDate, List<String> participants) {
        long id = executor.insertTimelineEvent(title, eventDate, JsonColumns.writeStrings(participants));
        return new TimelineEvent(id, title, eventDate, participants);
    }

    public List<TimelineEvent> findTimelineEventPage(long afterId, int limit) {
        return executor.findTimelineEventPage(afterId, limit).stream()
                .map(row -> new TimelineEvent(
                        Rows.getLong(row, "id"),
                        Rows.getString(row, "title"),
                        Rows.getString(row, "event_date"),
                        JsonColumns.readStrings(Rows.getString(row, "participants"))))
                .toList();
    }
}
