package fr.lapetina.llm.verifier.infrastructure.store;

import fr.lapetina.llm.verifier.domain.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only in-process store. Results are never edited in place.
 */
public final class InMemoryVerificationStore implements VerificationStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVerificationStore.class);

    private final List<VerificationResult> results = new CopyOnWriteArrayList<>();

    @Override
    public void save(VerificationResult result) {
        results.add(result);
        log.debug("Verification result stored: provider={}, model={}, score={}",
                result.provider(), result.model(), result.score());
    }

    @Override
    public List<VerificationResult> list(VerificationFilter filter, int limit, int offset) {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must not be negative");
        }
        List<VerificationResult> snapshot = new ArrayList<>(results);
        // Newest insertion first so equal timestamps keep the latest save on top
        Collections.reverse(snapshot);
        return snapshot.stream()
                .filter(filter)
                .sorted(Comparator.comparing(VerificationResult::verifiedAt).reversed())
                .skip(offset)
                .limit(limit)
                .toList();
    }

    @Override
    public Optional<VerificationResult> latest(String provider, String model) {
        return list(VerificationFilter.forModel(provider, model), 1, 0).stream().findFirst();
    }

    public int size() {
        return results.size();
    }
}
