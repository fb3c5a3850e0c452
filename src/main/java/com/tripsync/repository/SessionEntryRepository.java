package com.tripsync.repository;

import com.tripsync.entity.SessionEntry;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository interface for managing {@link SessionEntry} entities.
 */
public interface SessionEntryRepository extends JpaRepository<SessionEntry, String> {
}
