package com.chainfeed.subscription.config;

import com.chainfeed.domain.TopicFilter;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Subscriber identity, topic selection and backfill page size.
 */
@ConfigurationProperties(prefix = "chainfeed.subscriber")
@NoArgsConstructor
@Getter
@Setter
public class SubscriberProperties {

    /** Account address the subscriber reads as. Also scopes stored progress. */
    private String identity;

    /** Transactions per snapshot page. */
    private int pageSize = 500;

    /** Used when the progress store has no cached filter for this identity. */
    private TopicFilter topicFilter = new TopicFilter();

    /** Start a subscriber on application ready and relay its channels as application events. */
    private boolean autoStart = false;
}
