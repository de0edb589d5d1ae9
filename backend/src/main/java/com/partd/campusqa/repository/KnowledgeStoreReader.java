package com.partd.campusqa.repository;

import com.partd.campusqa.model.HallRecord;

import java.util.List;

/**
 * Read-only access to the knowledge store.
 * An empty list is a valid answer: nothing has been loaded for that collection yet.
 */
public interface KnowledgeStoreReader {

    String HALLS = "halls";

    /**
     * All records of a collection in store order.
     */
    List<HallRecord> fetchAllRecords(String collection);
}
