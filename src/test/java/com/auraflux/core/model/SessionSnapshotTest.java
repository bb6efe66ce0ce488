package com.auraflux.core.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionSnapshotTest {

    @Nested
    @DisplayName("start")
    class StartTests {

        @Test
        @DisplayName("new session is in INITIATION with a draft question and empty collections")
        void freshSession() {
            var s = SessionSnapshot.start("s-1", "Why?", Instant.now());
            assertEquals(Phase.INITIATION, s.phase());
            assertEquals("Why?", s.question().text());
            assertFalse(s.question().isLocked());
            assertTrue(s.keywords().isEmpty());
            assertTrue(s.scopeElements().isEmpty());
            assertTrue(s.reflectionLog().isEmpty());
            assertNull(s.feasibility());
            assertEquals(0L, s.version());
        }
    }

    @Nested
    @DisplayName("keywords")
    class KeywordTests {

        @Test
        @DisplayName("keywords are trimmed and de-duplicated case-insensitively")
        void deduplicates() {
            var s = TestSnapshots.fresh("s-1", "q")
                    .withKeywordsAdded(List.of(" Heat ", "heat", "Sleep", "", "  "));
            assertEquals(List.of("Heat", "Sleep"), s.keywords().stream().map(Keyword::text).toList());
            assertTrue(s.hasKeyword("HEAT"));
            assertEquals(ItemStatus.USER_DRAFT, s.findKeyword("sleep").orElseThrow().status());
        }

        @Test
        @DisplayName("an existing keyword keeps its status when added again with another")
        void keepsExistingStatus() {
            var s = TestSnapshots.fresh("s-1", "q")
                    .withKeywordsAdded(List.of("heat"), ItemStatus.LOCKED)
                    .withKeywordsAdded(List.of("Heat", "humidity"), ItemStatus.AI_EXTRACTED);
            assertEquals(ItemStatus.LOCKED, s.findKeyword("heat").orElseThrow().status());
            assertEquals(ItemStatus.AI_EXTRACTED, s.findKeyword("humidity").orElseThrow().status());
        }

        @Test
        @DisplayName("replacing a keyword keeps its position")
        void replaceInPlace() {
            var s = TestSnapshots.fresh("s-1", "q").withKeywordsAdded(List.of("heat", "sleep", "noise"))
                    .withKeywordReplaced("SLEEP", new Keyword("sleep quality", ItemStatus.LOCKED));
            assertEquals(List.of("heat", "sleep quality", "noise"), s.keywords().stream().map(Keyword::text).toList());
            assertEquals(List.of("sleep quality"), s.lockedKeywords());
        }

        @Test
        @DisplayName("archived keywords are not counted as active")
        void archivedNotActive() {
            var s = TestSnapshots.fresh("s-1", "q").withKeywordsAdded(List.of("heat", "sleep"))
                    .withKeywordReplaced("heat", new Keyword("heat", ItemStatus.ARCHIVED));
            assertEquals(2, s.keywords().size());
            assertEquals(1, s.activeKeywordCount());
        }

        @Test
        @DisplayName("adding only existing keywords yields an equal snapshot")
        void noOpWhenAllPresent() {
            var s = TestSnapshots.fresh("s-1", "q").withKeywordsAdded(List.of("heat"));
            assertEquals(s, s.withKeywordsAdded(List.of("HEAT")));
        }

        @Test
        @DisplayName("keyword list is unmodifiable")
        void unmodifiable() {
            var s = TestSnapshots.fresh("s-1", "q").withKeywordsAdded(List.of("heat"));
            assertThrows(UnsupportedOperationException.class, () -> s.keywords().add(new Keyword("x", null)));
        }
    }

    @Nested
    @DisplayName("scope elements")
    class ScopeTests {

        @Test
        @DisplayName("elements with an existing name are skipped")
        void skipsExistingNames() {
            var s = TestSnapshots.fresh("s-1", "q")
                    .withScopeElementsAdded(List.of(new ScopeElement("Population", "adults")))
                    .withScopeElementsAdded(List.of(new ScopeElement("population", "children"),
                            new ScopeElement("Geography", "EU")));
            assertEquals(2, s.scopeElements().size());
            assertEquals("adults", s.scopeElements().get(0).description());
            assertTrue(s.hasScopeElement("GEOGRAPHY"));
        }

        @Test
        @DisplayName("locked and archived elements are reported separately")
        void statusQueries() {
            var s = TestSnapshots.fresh("s-1", "q")
                    .withScopeElementsAdded(List.of(new ScopeElement("Population", "adults", ItemStatus.LOCKED),
                            new ScopeElement("Geography", "EU", ItemStatus.ARCHIVED),
                            new ScopeElement("Timeframe", "2010-2020")));
            assertEquals(List.of("Population"), s.lockedScopeElements().stream().map(ScopeElement::name).toList());
            assertEquals(2, s.activeScopeElementCount());
        }

        @Test
        @DisplayName("replacing an element can rename it")
        void replaceRenames() {
            var s = TestSnapshots.fresh("s-1", "q")
                    .withScopeElementsAdded(List.of(new ScopeElement("Region", "EU")))
                    .withScopeElementReplaced("region", new ScopeElement("Geography", "EU", ItemStatus.LOCKED));
            assertFalse(s.hasScopeElement("Region"));
            assertTrue(s.findScopeElement("geography").orElseThrow().isLocked());
        }

        @Test
        @DisplayName("elements with blank names are ignored")
        void ignoresBlankNames() {
            var s = TestSnapshots.fresh("s-1", "q")
                    .withScopeElementsAdded(List.of(new ScopeElement("  ", "nothing")));
            assertTrue(s.scopeElements().isEmpty());
        }
    }

    @Test
    @DisplayName("chat entries are numbered from 1 in the order they are added")
    void chatSequence() {
        Instant at = Instant.parse("2026-01-02T00:00:00Z");
        var s = TestSnapshots.fresh("s-1", "q")
                .withChatEntry(Author.USER, "user", "Where do I start?", at)
                .withChatEntry(Author.AGENT, "explorer-chat", "With your question.", at);
        assertEquals(List.of(1, 2), s.chatHistory().stream().map(ChatEntry::sequenceNumber).toList());
        assertEquals(Author.AGENT, s.chatHistory().get(1).author());
        assertEquals(1L, s.version());
    }

    @Test
    @DisplayName("with-methods keep the version; committedAs stamps a new one")
    void versionOnlyChangesOnCommit() {
        var s = TestSnapshots.fresh("s-1", "q");
        var edited = s.withPhase(Phase.EXPLORATION);
        assertEquals(1L, edited.version());
        var committed = edited.committedAs(2L, Instant.now());
        assertEquals(2L, committed.version());
        assertEquals(Phase.EXPLORATION, committed.phase());
    }

    @Test
    @DisplayName("feasibility status follows the score and niche rule")
    void feasibilityRating() {
        assertEquals(FeasibilityStatus.HIGH, FeasibilityStatus.fromScore(9, false));
        assertEquals(FeasibilityStatus.HIGH, FeasibilityStatus.fromScore(8, false));
        assertEquals(FeasibilityStatus.MEDIUM, FeasibilityStatus.fromScore(5, false));
        assertEquals(FeasibilityStatus.LOW, FeasibilityStatus.fromScore(3, false));
        assertEquals(FeasibilityStatus.LOW, FeasibilityStatus.fromScore(10, true));
    }

    @Test
    @DisplayName("snapshot survives a JSON round trip with snake_case fields")
    void jsonRoundTrip() throws Exception {
        var mapper = new ObjectMapper().findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        var s = TestSnapshots.readyForExploration("s-1", 3)
                .withScopeElementsAdded(List.of(new ScopeElement("Population", "adults")))
                .withReflection(new ReflectionEntry(Instant.parse("2026-01-02T00:00:00Z"), Author.USER, "note"))
                .withFeasibility(new FeasibilityAssessment(FeasibilityStatus.MEDIUM, 6, "ok"))
                .withChatEntry(Author.USER, "user", "hi", Instant.parse("2026-01-02T00:00:00Z"));

        String json = mapper.writeValueAsString(s);
        assertTrue(json.contains("\"session_id\""));
        assertTrue(json.contains("\"scope_elements\""));
        assertTrue(json.contains("\"resource_suggestion\""));
        assertTrue(json.contains("\"chat_history\""));
        assertTrue(json.contains("\"sequence_number\""));

        assertEquals(s, mapper.readValue(json, SessionSnapshot.class));
    }
}
