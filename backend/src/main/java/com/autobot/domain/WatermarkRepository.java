package com.autobot.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for polling cursors, keyed by entity id.
 */
public interface WatermarkRepository extends MongoRepository<Watermark, String> {
}
