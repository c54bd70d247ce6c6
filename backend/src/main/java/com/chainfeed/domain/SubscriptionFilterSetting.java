package com.chainfeed.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Topic filter cached for a subscriber identity, so restarts resolve the same topic set.
 */
@Document(collection = "subscription_filter")
@NoArgsConstructor
@Getter
@Setter
public class SubscriptionFilterSetting {

    /** Subscriber identity. */
    @Id
    private String id;
    private TopicFilter filter;
    private Instant updatedAt;
}
