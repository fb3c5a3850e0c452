package com.tripsync.store;

import com.tripsync.entity.SessionEntry;
import com.tripsync.repository.SessionEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Session store backed by the {@code session_entry} table.
 */
@RequiredArgsConstructor
@Slf4j
public class JpaSessionStore implements SessionStore {

    private final SessionEntryRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<String> get(String key) {
        try {
            return repository.findById(key).map(SessionEntry::getValue);
        } catch (DataAccessException ex) {
            throw new SessionStoreException("Failed to read session entry " + key, ex);
        }
    }

    @Override
    @Transactional
    public void set(String key, String value) {
        try {
            SessionEntry entry = repository.findById(key)
                    .orElseGet(() -> SessionEntry.builder().key(key).build());
            entry.setValue(value);
            repository.save(entry);
            log.debug("Stored session entry {} ({} chars)", key, value.length());
        } catch (DataAccessException ex) {
            throw new SessionStoreException("Failed to write session entry " + key, ex);
        }
    }

    @Override
    @Transactional
    public void delete(String key) {
        try {
            repository.deleteById(key);
        } catch (DataAccessException ex) {
            throw new SessionStoreException("Failed to delete session entry " + key, ex);
        }
    }
}
