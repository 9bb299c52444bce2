package io.github.manjago.talos.generator;

import io.github.manjago.talos.encode.FeatureTensor;

import java.util.List;

/**
 * Proposes candidate sequences for an encoded block.
 * <p>
 * Contract: deterministic for fixed parameters, no I/O, no blocking on external
 * resources, termination within a bounded number of steps. Returns at most {@code k}
 * candidates; an empty list means the generator declines.
 */
@FunctionalInterface
public interface CandidateGenerator {

    List<Candidate> propose(FeatureTensor tensor, int k);

    /** Generator that never proposes anything. */
    CandidateGenerator NONE = (tensor, k) -> List.of();
}
