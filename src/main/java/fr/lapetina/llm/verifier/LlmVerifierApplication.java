package fr.lapetina.llm.verifier;

import fr.lapetina.llm.verifier.domain.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the LLM verifier.
 *
 * <p>Verifies every configured model once, then keeps re-verifying on the
 * scheduler interval until shut down. Without a scheduler interval it exits after the first pass.
 */
public class LlmVerifierApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LlmVerifierApplication.class);

    private final VerifierFactory factory;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public LlmVerifierApplication(String configPath) {
        log.info("Starting LLM verifier...");
        this.factory = VerifierFactory.create(configPath).start();
        log.info("LLM verifier initialized");
    }

    /**
     * Runs one verification pass over every registered model.
     */
    public List<VerificationResult> verifyOnce() {
        List<VerificationResult> results = factory.getOrchestrator().verifyAllRegistered(false).join();
        for (VerificationResult result : results) {
            log.info("Verification result: provider={}, model={}, score={}, category={}, passed={}/{}",
                    result.provider(), result.model(), result.score(), result.category().getLabel(),
                    result.passedCount(), result.probes().size());
        }
        return results;
    }

    public boolean isScheduled() {
        return factory.getScheduler() != null;
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public VerifierFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down LLM verifier...");

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("LLM verifier shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            LlmVerifierApplication app = new LlmVerifierApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            List<VerificationResult> results = app.verifyOnce();
            log.info("Initial verification pass completed: models={}", results.size());

            if (!app.isScheduled()) {
                return;
            }
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start LLM verifier", e);
            System.exit(1);
        }
    }
}
