package io.github.manjago.talos.verify;

import io.github.manjago.talos.core.Disassembler;
import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.ir.BasicBlock;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Memoizes definite verdicts per (block, candidate).
 * <p>
 * Inconclusive answers are not cached, they may have been caused by a timeout.
 */
public final class CachingVerifier implements EquivalenceVerifier {

    private record Key(String blockId, String source) {}

    private final EquivalenceVerifier delegate;
    private final Map<Key, Verdict> cache = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public CachingVerifier(EquivalenceVerifier delegate) {
        this.delegate = delegate;
    }

    @Override
    public Verdict verify(BasicBlock block, List<Instruction> candidate) {
        Key key = new Key(block.fingerprint(), Disassembler.toSource(candidate));
        Verdict cached = cache.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        misses.incrementAndGet();
        Verdict verdict = delegate.verify(block, candidate);
        if (verdict != Verdict.INCONCLUSIVE) {
            cache.put(key, verdict);
        }
        return verdict;
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public int size() {
        return cache.size();
    }
}
