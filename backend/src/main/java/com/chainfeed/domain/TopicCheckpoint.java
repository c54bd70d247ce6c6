package com.chainfeed.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Per (subscriber identity, topic) progress: last synced block timestamp and cached topic string.
 */
@Document(collection = "topic_checkpoint")
@CompoundIndex(name = "identity_topic", def = "{'identity': 1, 'topicKey': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TopicCheckpoint {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String identity;
    private String topicKey;
    private Long lastSyncedTimestamp;
    private String filterString;
    private Instant updatedAt;

    public static String idOf(String identity, String topicKey) {
        return identity + ":" + topicKey;
    }
}
