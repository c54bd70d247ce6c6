package com.chainfeed.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface SubscriptionFilterSettingRepository extends MongoRepository<SubscriptionFilterSetting, String> {
}
