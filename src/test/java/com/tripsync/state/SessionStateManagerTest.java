package com.tripsync.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripsync.config.TripSyncProperties;
import com.tripsync.state.model.SessionState;
import com.tripsync.state.model.StateDiff;
import com.tripsync.state.model.Task;
import com.tripsync.state.model.TaskStatus;
import com.tripsync.store.ChatMessage;
import com.tripsync.store.ConversationHistory;
import com.tripsync.store.InMemorySessionStore;
import com.tripsync.store.SessionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionStateManagerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ExecutorService pool = Executors.newFixedThreadPool(8);

    private ControllableStore store;
    private ConversationHistory history;
    private StateTemplate template;
    private SessionStateManager manager;

    @BeforeEach
    void setUp() {
        TripSyncProperties properties = new TripSyncProperties();
        properties.getState().setLockTimeout(Duration.ofMillis(200));
        store = new ControllableStore();
        history = new ConversationHistory(store, objectMapper);
        template = new StateTemplate(new DefaultResourceLoader(), objectMapper, properties);
        manager = new SessionStateManager(store, history, new MergeEngine(), template, objectMapper, properties);
    }

    @AfterEach
    void tearDown() {
        store.releaseWrites();
        pool.shutdownNow();
    }

    private StateDiff travelInfo(String json) throws Exception {
        return StateDiff.builder()
                .nested(StateDiff.TRAVEL_INFO_FIELD, StateDiff.fromJson(objectMapper.readTree(json)))
                .build();
    }

    @Test
    void testNewSessionStartsFromTemplate() {
        SessionState state = manager.getState("s1");

        assertEquals(template.initialState(), state);
        assertEquals("", state.at("/travel_info/outbound/seat_number").asText());
        assertEquals("home", state.at("/user_profile/home/event_type").asText());
        assertFalse(manager.exists("s1"));
    }

    @Test
    void testCommitPersistsAndPublishes() throws Exception {
        SessionState committed = manager.commit("s1", travelInfo("{\"origin\": \"BOM\", \"destination\": \"GOI\"}"));

        assertTrue(manager.exists("s1"));
        assertEquals(committed, manager.getState("s1"));
        assertEquals("GOI", manager.getState("s1").at("/travel_info/destination").asText());
        String stored = store.get(SessionStore.stateKey("s1")).orElseThrow();
        assertEquals("BOM", objectMapper.readTree(stored).at("/travel_info/origin").asText());
    }

    @Test
    void testStatusOnlyCommitKeepsIntent() throws Exception {
        manager.commit("s1", StateDiff.fromJson(objectMapper.readTree("""
                {"tasks": [{"task_id": "t1", "intent": "flight_search", "status": "pending"}]}
                """)));

        SessionState state = manager.commit("s1", StateDiff.builder().taskStatus("t1", TaskStatus.DONE).build());

        Task task = state.task("t1").orElseThrow();
        assertEquals("flight_search", task.intent());
        assertEquals(TaskStatus.DONE, task.status());
    }

    @Test
    void testSnapshotsAreNotAffectedByLaterCommits() throws Exception {
        SessionState before = manager.commit("s1", travelInfo("{\"origin\": \"BOM\"}"));

        manager.commit("s1", travelInfo("{\"origin\": \"PNQ\"}"));

        assertEquals("BOM", before.at("/travel_info/origin").asText());
        assertEquals("PNQ", manager.getState("s1").at("/travel_info/origin").asText());
    }

    @Test
    void testConcurrentCommitsLoseNoUpdates() throws Exception {
        int writers = 8;
        int perWriter = 25;
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            int writer = w;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perWriter; i++) {
                    commitWithRetry("shared", StateDiff.fromJson(objectMapper.readTree(
                            "{\"tasks\": [{\"task_id\": \"w" + writer + "_" + i + "\"}]}")));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }

        SessionState state = manager.getState("shared");
        assertEquals(writers * perWriter, state.taskCount());
        assertEquals(writers * perWriter, state.tasks().stream().map(Task::taskId).distinct().count());
    }

    private void commitWithRetry(String sessionId, StateDiff diff) {
        while (true) {
            try {
                manager.commit(sessionId, diff);
                return;
            } catch (CommitContentionException ex) {
                // retry
            }
        }
    }

    @Test
    void testSessionsAreIsolated() throws Exception {
        manager.commit("a", travelInfo("{\"destination\": \"GOI\"}"));
        manager.commit("b", travelInfo("{\"destination\": \"DEL\"}"));

        assertEquals("GOI", manager.getState("a").at("/travel_info/destination").asText());
        assertEquals("DEL", manager.getState("b").at("/travel_info/destination").asText());
    }

    @Test
    void testFailedWriteRollsBack() throws Exception {
        try (SessionContext context = manager.open("s1")) {
            SessionState committed = context.commit(travelInfo("{\"origin\": \"BOM\"}"));
            store.failWrites = true;

            StatePersistenceException ex = assertThrows(StatePersistenceException.class,
                    () -> context.commit(travelInfo("{\"origin\": \"PNQ\"}")));

            assertEquals("s1", ex.getSessionId());
            assertEquals(committed, context.state());
            assertEquals("BOM", context.view().getState().at("/travel_info/origin").asText());
        }
        store.failWrites = false;
        assertEquals("BOM", manager.getState("s1").at("/travel_info/origin").asText());
    }

    @Test
    void testInvalidDiffLeavesStateUntouched() throws Exception {
        manager.commit("s1", StateDiff.fromJson(objectMapper.readTree("""
                {"tasks": [{"task_id": "t1", "status": "done"}]}
                """)));
        SessionState before = manager.getState("s1");

        assertThrows(DiffValidationException.class,
                () -> manager.commit("s1", StateDiff.builder().taskStatus("t1", TaskStatus.IN_PROGRESS).build()));

        assertEquals(before, manager.getState("s1"));
    }

    @Test
    void testCommitTimesOutWhileAnotherCommitHoldsTheLock() throws Exception {
        store.blockWrites();
        Future<SessionState> first = pool.submit(() -> manager.commit("s1", travelInfo("{\"origin\": \"BOM\"}")));
        assertTrue(store.writeStarted.await(5, TimeUnit.SECONDS));

        CommitContentionException ex = assertThrows(CommitContentionException.class,
                () -> manager.commit("s1", travelInfo("{\"origin\": \"PNQ\"}")));
        assertEquals("s1", ex.getSessionId());

        store.releaseWrites();
        assertEquals("BOM", first.get(5, TimeUnit.SECONDS).at("/travel_info/origin").asText());
        assertEquals("BOM", manager.getState("s1").at("/travel_info/origin").asText());
    }

    @Test
    void testContentionOnOneSessionDoesNotBlockAnother() throws Exception {
        store.blockWrites("state_slow");
        Future<SessionState> slow = pool.submit(() -> manager.commit("slow", travelInfo("{\"origin\": \"BOM\"}")));
        assertTrue(store.writeStarted.await(5, TimeUnit.SECONDS));

        SessionState fast = manager.commit("fast", travelInfo("{\"origin\": \"DEL\"}"));

        assertEquals("DEL", fast.at("/travel_info/origin").asText());
        store.releaseWrites();
        slow.get(5, TimeUnit.SECONDS);
    }

    @Test
    void testCorruptStoredStateIsReported() {
        store.set(SessionStore.stateKey("s1"), "not json");

        assertThrows(StatePersistenceException.class, () -> manager.getState("s1"));
    }

    @Test
    void testClearResetsStateAndHistory() throws Exception {
        manager.commit("s1", travelInfo("{\"origin\": \"BOM\"}"));
        history.append("s1", ChatMessage.human("hi"), ChatMessage.ai("hello"));
        store.set(SessionStore.planKey("s1"), "[]");

        manager.clear("s1");

        assertFalse(manager.exists("s1"));
        assertEquals(template.initialState(), manager.getState("s1"));
        assertTrue(history.messages("s1").isEmpty());
        assertTrue(store.get(SessionStore.planKey("s1")).isEmpty());
    }

    @Test
    void testSessionIsEvictedWhenLastContextCloses() throws Exception {
        SessionContext first = manager.open("s1");
        SessionContext second = manager.open("s1");
        first.commit(travelInfo("{\"origin\": \"BOM\"}"));
        assertEquals(1, manager.residentSessions());

        first.close();
        first.close();
        assertEquals(1, manager.residentSessions());
        assertTrue(first.isClosed());

        second.close();
        assertEquals(0, manager.residentSessions());
        assertEquals("BOM", manager.getState("s1").at("/travel_info/origin").asText());
        assertEquals(0, manager.residentSessions());
    }

    @Test
    void testClosedContextCannotCommit() {
        SessionContext context = manager.open("s1");
        context.close();

        assertThrows(IllegalStateException.class, () -> context.commit(StateDiff.empty()));
    }

    @Test
    void testProposeDiffChecksAgainstCurrentStateWithoutCommitting() throws Exception {
        manager.commit("s1", StateDiff.fromJson(objectMapper.readTree("""
                {"tasks": [{"task_id": "t1", "status": "done"}]}
                """)));
        StateView view = manager.viewOf("s1");

        assertThrows(DiffValidationException.class, () -> view.proposeDiff(objectMapper.readTree("""
                {"tasks": [{"task_id": "t1", "status": "pending"}]}
                """)));

        StateDiff proposed = view.proposeDiff(objectMapper.readTree("""
                {"travel_info": {"destination": "GOI"}}
                """));
        assertFalse(proposed.isEmpty());
        assertEquals("", manager.getState("s1").at("/travel_info/destination").asText());
    }

    @Test
    void testAddTaskFillsDefaultsAndRejectsDuplicates() {
        Task task = new Task(null, null, "root", "flight_search", null, Map.of("user_query", "flights to Goa"));

        assertTrue(manager.addTask("s1", task));

        Task stored = manager.getState("s1").tasks().get(0);
        assertNotNull(stored.taskId());
        assertTrue(stored.taskId().startsWith("task_"));
        assertNotNull(stored.timestamp());
        assertEquals(TaskStatus.PENDING, stored.status());
        assertFalse(manager.addTask("s1", stored));
        assertEquals(1, manager.getState("s1").taskCount());
    }

    @Test
    void testConcurrentAddTaskWithSameIdReportsOneWinner() throws Exception {
        int callers = 8;
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return manager.addTask("s1", new Task("t1", null, "root", "flight_search", null, Map.of()));
            }));
        }
        start.countDown();

        int added = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(10, TimeUnit.SECONDS)) {
                added++;
            }
        }

        assertEquals(1, added);
        assertEquals(1, manager.getState("s1").taskCount());
    }

    @Test
    void testUpdateUserProfileMergesFields() throws Exception {
        manager.updateUserProfile("s1", objectMapper.readTree("{\"seat_preference\": \"window\"}"));

        SessionState state = manager.updateUserProfile("s1", objectMapper.readTree("{\"food_preference\": \"veg\"}"));

        assertEquals("window", state.at("/user_profile/seat_preference").asText());
        assertEquals("veg", state.at("/user_profile/food_preference").asText());
    }

    @Test
    void testUpdateTravelInfoKeepsSiblingSelections() throws Exception {
        assertFalse(manager.exists("s1"));

        manager.updateTravelInfo("s1", objectMapper.readTree("{\"outbound\": {\"seat_number\": \"12A\"}}"));

        SessionState loaded = manager.load("s1");
        assertTrue(manager.exists("s1"));
        assertEquals("12A", loaded.at("/travel_info/outbound/seat_number").asText());
        assertTrue(loaded.at("/travel_info/outbound").has("flight_selection"));
        assertTrue(loaded.at("/travel_info").has("hotel"));
    }

    @Test
    void testBlankSessionIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> manager.getState(" "));
        assertThrows(IllegalArgumentException.class, () -> manager.open(null));
    }

    static class ControllableStore extends InMemorySessionStore {

        volatile boolean failWrites;
        final CountDownLatch writeStarted = new CountDownLatch(1);
        private final CountDownLatch writeGate = new CountDownLatch(1);
        private volatile String blockedKey;

        void blockWrites() {
            blockWrites("*");
        }

        void blockWrites(String key) {
            blockedKey = key;
        }

        void releaseWrites() {
            writeGate.countDown();
        }

        @Override
        public void set(String key, String value) {
            if (failWrites) {
                throw new IllegalStateException("disk full");
            }
            String blocked = blockedKey;
            if (blocked != null && (blocked.equals("*") || blocked.equals(key))) {
                writeStarted.countDown();
                try {
                    writeGate.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }
            super.set(key, value);
        }
    }
}
