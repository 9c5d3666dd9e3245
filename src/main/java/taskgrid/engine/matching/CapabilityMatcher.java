package taskgrid.engine.matching;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskgrid.engine.config.EngineConfig;
import taskgrid.engine.model.Worker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Scores how well a worker's capabilities cover a task's requirements and
 * picks the best candidate. Stateless apart from its policy settings.
 *
 * The score is {@code |required ∩ available| / |required|}.
 */
public class CapabilityMatcher {

    private static final Logger log = LoggerFactory.getLogger(CapabilityMatcher.class);

    private final double emptyRequirementScore;
    private final double minMatchScore;
    private final boolean caseInsensitive;

    public CapabilityMatcher() {
        this(1.0, 0.0, true);
    }

    /**
     * @param emptyRequirementScore score when nothing is required
     * @param minMatchScore         a candidate must score strictly above this to be picked
     * @param caseInsensitive       compare capabilities trimmed and lower-cased
     */
    public CapabilityMatcher(double emptyRequirementScore, double minMatchScore, boolean caseInsensitive) {
        this.emptyRequirementScore = emptyRequirementScore;
        this.minMatchScore = minMatchScore;
        this.caseInsensitive = caseInsensitive;
    }

    public static CapabilityMatcher fromConfig(EngineConfig config) {
        return new CapabilityMatcher(config.emptyRequirementScore(), config.minMatchScore(),
                config.caseInsensitiveCapabilities());
    }

    /**
     * Fraction of required capabilities present in {@code available}.
     */
    public double matchScore(Collection<String> required, Collection<String> available) {
        Set<String> req = normalize(required);
        if (req.isEmpty()) {
            return emptyRequirementScore;
        }
        Set<String> avail = normalize(available);
        long matched = req.stream().filter(avail::contains).count();
        return (double) matched / req.size();
    }

    /**
     * Highest-scoring candidate; ties go to the earliest candidate.
     * Empty when there are no candidates or the best score does not exceed
     * the minimum (with the default minimum of 0: no overlap at all).
     */
    public Optional<Worker> findBestMatch(Collection<String> required, List<Worker> candidates) {
        Worker best = null;
        double bestScore = -1;
        for (Worker candidate : candidates) {
            double score = matchScore(required, candidate.capabilities());
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }

        if (best == null) {
            return Optional.empty();
        }
        if (bestScore <= minMatchScore) {
            log.debug("Best worker {} scored {} for {}, not above minimum {}",
                    best.id(), String.format(Locale.ROOT, "%.2f", bestScore), required, minMatchScore);
            return Optional.empty();
        }
        log.debug("Best worker for {}: {} (score {})", required, best.id(),
                String.format(Locale.ROOT, "%.2f", bestScore));
        return Optional.of(best);
    }

    /**
     * All candidates with their scores, best first; equal scores keep input order.
     */
    public List<WorkerScore> rankWorkers(Collection<String> required, List<Worker> candidates) {
        List<WorkerScore> ranked = new ArrayList<>(candidates.size());
        for (Worker candidate : candidates) {
            ranked.add(new WorkerScore(candidate, matchScore(required, candidate.capabilities())));
        }
        ranked.sort(Comparator.comparingDouble(WorkerScore::score).reversed());
        return ranked;
    }

    private Set<String> normalize(Collection<String> capabilities) {
        Set<String> result = new LinkedHashSet<>();
        if (capabilities == null) {
            return result;
        }
        for (String cap : capabilities) {
            if (cap == null || cap.isBlank()) continue;
            result.add(caseInsensitive ? cap.trim().toLowerCase(Locale.ROOT) : cap);
        }
        return result;
    }

    /**
     * A candidate together with its match score.
     */
    public record WorkerScore(Worker worker, double score) {
    }
}
