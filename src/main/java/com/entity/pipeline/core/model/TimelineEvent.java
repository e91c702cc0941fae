package com.entity.pipeline.core.model;

import java.util.List;

/**
 * Curated timeline event with its participant names.
 */
public record TimelineEvent(long id, String title, String eventDate, List<String> participants) {

    public TimelineEvent {
        participants = participants != null ? List.copyOf(participants) : List.of();
    }
}
