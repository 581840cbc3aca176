package com.di.creatormatch.agent.store;

import com.di.creatormatch.agent.creator.CreatorRecord;

import java.util.List;
import java.util.Optional;

/**
 * Local repository of previously ingested creators. Supplies candidate pools without network calls
 * and receives verified metrics back. Inactive records are never returned by the query methods.
 * Implementations: in-memory (default), JDBC, and a Caffeine cache in front of JDBC.
 * <p>Query results are ordered by follower count descending (unknown last), then by id.
 */
public interface CandidateStore {

    /** Creators whose primary niche or interests match {@code niche}. */
    List<CreatorRecord> findByNiche(String niche, int limit);

    /** Creators whose handle, display name, bio or interests contain {@code keyword}. */
    List<CreatorRecord> findByKeyword(String keyword, int limit);

    /** Generic pool when niche and keyword queries come up short. Records with complete metrics first. */
    List<CreatorRecord> findFallback(int limit);

    Optional<CreatorRecord> findById(String id);

    /** Inserts or replaces a record by id (ingestion path). */
    void save(CreatorRecord record);

    /**
     * Replaces the stored record with newly verified data, matched by id.
     *
     * @return false when no record with that id exists
     */
    boolean updateVerified(CreatorRecord verified);
}
