package com.partd.campusqa.repository;

import com.partd.campusqa.model.KnowledgeRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface KnowledgeRecordRepository extends JpaRepository<KnowledgeRecordEntity, UUID> {

    List<KnowledgeRecordEntity> findByCollectionOrderByPositionAsc(String collection);
}
