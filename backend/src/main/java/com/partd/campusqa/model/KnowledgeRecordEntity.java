package com.partd.campusqa.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Row of the knowledge_records table. The record body lives in the JSON payload
 * and uses the same snake_case shape as the classpath knowledge files.
 */
@Entity
@Table(name = "knowledge_records", indexes = {
    @Index(name = "idx_knowledge_collection", columnList = "collection,position"),
    @Index(name = "idx_knowledge_name", columnList = "name")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(name = "collection", nullable = false)
    private String collection;  // halls

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "position", nullable = false)
    private Integer position;  // store order, used as the ranking tie-break

    @Column(name = "payload", columnDefinition = "jsonb", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> payload;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
