package taskgrid.engine.matching;

import org.junit.jupiter.api.Test;
import taskgrid.engine.config.EngineConfig;
import taskgrid.engine.model.Worker;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityMatcherTest {

    private final CapabilityMatcher matcher = new CapabilityMatcher();

    @Test
    void scoreIsFractionOfRequiredCovered() {
        assertEquals(1.0, matcher.matchScore(Set.of("java"), Set.of("java", "sql")));
        assertEquals(0.5, matcher.matchScore(List.of("java", "sql"), List.of("java")));
        assertEquals(0.0, matcher.matchScore(List.of("java"), List.of("go")));
        assertEquals(0.0, matcher.matchScore(List.of("java"), List.of()));
    }

    @Test
    void emptyRequirementScoresOne() {
        assertEquals(1.0, matcher.matchScore(List.of(), List.of("anything")));
        assertEquals(1.0, matcher.matchScore(List.of(), List.of()));
    }

    @Test
    void capabilitiesAreComparedCaseInsensitively() {
        assertEquals(1.0, matcher.matchScore(List.of("NodeJS", " api "), List.of("nodejs", "API")));

        CapabilityMatcher strict = new CapabilityMatcher(1.0, 0.0, false);
        assertEquals(0.0, strict.matchScore(List.of("NodeJS"), List.of("nodejs")));
    }

    @Test
    void noOverlapMeansNoMatch() {
        assertTrue(matcher.findBestMatch(List.of("javascript"), List.of(Worker.of("ios", "swift"))).isEmpty());
    }

    @Test
    void noCandidatesMeansNoMatch() {
        assertTrue(matcher.findBestMatch(List.of("java"), List.of()).isEmpty());
    }

    @Test
    void supersetWorkerWins() {
        List<Worker> agents = List.of(
                Worker.of("frontend", "javascript", "react"),
                Worker.of("half", "nodejs"),
                Worker.of("backend", "nodejs", "api", "postgres"),
                Worker.of("mobile", "swift"));

        assertEquals("backend", matcher.findBestMatch(List.of("nodejs", "api"), agents).orElseThrow().id());
    }

    @Test
    void partialMatchIsStillReturned() {
        List<Worker> agents = List.of(Worker.of("w1", "swift"), Worker.of("w2", "java"));

        assertEquals("w2", matcher.findBestMatch(List.of("java", "kotlin"), agents).orElseThrow().id());
    }

    @Test
    void tiesGoToTheFirstCandidate() {
        List<Worker> agents = List.of(Worker.of("w1", "java"), Worker.of("w2", "java"), Worker.of("w3", "java"));

        assertEquals("w1", matcher.findBestMatch(List.of("java"), agents).orElseThrow().id());
        assertEquals("w1", matcher.findBestMatch(List.of(), agents).orElseThrow().id());
    }

    @Test
    void minimumScoreIsExclusive() {
        CapabilityMatcher demanding = CapabilityMatcher.fromConfig(EngineConfig.defaults().withMinMatchScore(0.5));
        List<Worker> half = List.of(Worker.of("w1", "java"));

        assertTrue(demanding.findBestMatch(List.of("java", "sql"), half).isEmpty());
        assertTrue(demanding.findBestMatch(List.of("java"), half).isPresent());
    }

    @Test
    void rankWorkersSortsBestFirstAndKeepsInputOrderOnTies() {
        List<Worker> agents = List.of(
                Worker.of("a", "java"),
                Worker.of("b", "java", "sql"),
                Worker.of("c", "go"),
                Worker.of("d", "sql", "java"));

        List<CapabilityMatcher.WorkerScore> ranked = matcher.rankWorkers(List.of("java", "sql"), agents);

        assertEquals(List.of("b", "d", "a", "c"), ranked.stream().map(s -> s.worker().id()).toList());
        assertEquals(1.0, ranked.get(0).score());
        assertEquals(0.0, ranked.get(3).score());
    }
}
