package com.chainfeed.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for topic_checkpoint. Used by MongoProgressStore.
 */
public interface TopicCheckpointRepository extends MongoRepository<TopicCheckpoint, String> {

    Optional<TopicCheckpoint> findByIdentityAndTopicKey(String identity, String topicKey);

    List<TopicCheckpoint> findByIdentity(String identity);
}
