package com.survivaladvisor.orchestrator.ai;

import com.survivaladvisor.common.model.ClassifiedRequest;
import com.survivaladvisor.common.model.PlayerSnapshot;
import reactor.core.publisher.Mono;

/**
 * Generative-AI collaborator used when rules cannot answer a question on their own.
 *
 * <p>Implementations make a single attempt with no retry. Failures are signalled as
 * {@code Mono.error}, never thrown, so callers can recover with {@code onErrorResume}.
 */
public interface AiFallbackClient {

    /** False when the collaborator is not configured; callers then skip it entirely. */
    boolean isAvailable();

    /**
     * Free-text answer to {@code question} given the player's state.
     *
     * @param classified routing metadata; a {@code HYBRID} intent means the call enriches a rule answer
     * @param window     caller-supplied cooldown; a closed window fails with a rate-limit error
     * @return the answer text, never blank on success
     */
    Mono<String> ask(PlayerSnapshot snapshot, String question, ClassifiedRequest classified, AiRequestWindow window);
}
