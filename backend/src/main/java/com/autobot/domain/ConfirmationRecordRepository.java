package com.autobot.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for pending deposit confirmations. Used by DepositRecordStore.
 */
public interface ConfirmationRecordRepository extends MongoRepository<ConfirmationRecord, String> {

    List<ConfirmationRecord> findAllByOrderByCreatedAtAsc();
}
