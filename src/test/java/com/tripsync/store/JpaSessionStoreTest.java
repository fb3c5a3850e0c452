package com.tripsync.store;

import com.tripsync.repository.BaseRepositoryTest;
import com.tripsync.repository.SessionEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.junit.jupiter.api.Assertions.*;

class JpaSessionStoreTest extends BaseRepositoryTest {

    @Autowired
    private SessionEntryRepository sessionEntryRepository;

    private JpaSessionStore store;

    @BeforeEach
    void setUp() {
        store = new JpaSessionStore(sessionEntryRepository);
    }

    @Test
    void testSetOverwritesAndGetReadsBack() {
        store.set(SessionStore.stateKey("s1"), "{\"v\": 1}");
        store.set(SessionStore.stateKey("s1"), "{\"v\": 2}");

        assertEquals("{\"v\": 2}", store.get(SessionStore.stateKey("s1")).orElseThrow());
        assertEquals(1, sessionEntryRepository.count());
    }

    @Test
    void testMissingKeyIsEmpty() {
        assertTrue(store.get(SessionStore.stateKey("unknown")).isEmpty());
    }

    @Test
    void testDeleteRemovesEntry() {
        store.set(SessionStore.historyKey("s1"), "[]");

        store.delete(SessionStore.historyKey("s1"));

        assertTrue(store.get(SessionStore.historyKey("s1")).isEmpty());
    }
}
