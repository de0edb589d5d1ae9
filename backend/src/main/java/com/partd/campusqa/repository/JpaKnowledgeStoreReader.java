package com.partd.campusqa.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.partd.campusqa.model.HallRecord;
import com.partd.campusqa.model.KnowledgeRecordEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Knowledge store backed by the knowledge_records table.
 */
@Component
@ConditionalOnProperty(name = "knowledge.store", havingValue = "jpa")
@Slf4j
public class JpaKnowledgeStoreReader implements KnowledgeStoreReader {

    private final KnowledgeRecordRepository repository;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public JpaKnowledgeStoreReader(KnowledgeRecordRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<HallRecord> fetchAllRecords(String collection) {
        List<KnowledgeRecordEntity> rows = repository.findByCollectionOrderByPositionAsc(collection);
        List<HallRecord> records = new ArrayList<>(rows.size());

        for (KnowledgeRecordEntity row : rows) {
            HallRecord record = toRecord(row);
            if (record != null) {
                records.add(record);
            }
        }

        log.debug("Fetched {} records from collection '{}'", records.size(), collection);
        return records;
    }

    private HallRecord toRecord(KnowledgeRecordEntity row) {
        try {
            HallRecord record = row.getPayload() == null
                    ? new HallRecord()
                    : objectMapper.convertValue(row.getPayload(), HallRecord.class);
            if (record.getName() == null || record.getName().isBlank()) {
                record.setName(row.getName());
            }
            return record;
        } catch (IllegalArgumentException e) {
            log.warn("⚠️  Skipping knowledge record {} ('{}'): unreadable payload: {}",
                    row.getId(), row.getName(), e.getMessage());
            return null;
        }
    }
}
