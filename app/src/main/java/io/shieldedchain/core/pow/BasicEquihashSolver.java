package io.shieldedchain.core.pow;

import io.shieldedchain.core.consensus.EquihashParams;
import io.shieldedchain.core.pow.Equihash.Row;
import org.bouncycastle.crypto.digests.Blake2bDigest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Straightforward Wagner-style solver: sort on the next collision chunk, XOR colliding pairs
 * with disjoint indices, repeat K-1 times, then look for pairs whose remaining two chunks
 * cancel out. Memory grows with {@code 2^(N/(K+1)+1)} rows, which suits regtest-sized
 * parameters; production-sized N needs an optimised solver behind the same interface.
 */
public final class BasicEquihashSolver implements EquihashSolver {
    /** Largest initial row list this solver accepts; (96,5) is the biggest standard size under it. */
    public static final int MAX_INITIAL_LIST_SIZE = 1 << 17;

    @Override
    public Stream<byte[]> solutions(EquihashParams params, Blake2bDigest state) {
        if (params.initialListSize() > MAX_INITIAL_LIST_SIZE) {
            throw new IllegalArgumentException(params + " needs " + params.initialListSize()
                    + " initial rows, above the basic solver's limit of " + MAX_INITIAL_LIST_SIZE);
        }
        // Deferred until the consumer starts pulling.
        return Stream.of(params).flatMap(p -> solve(p, state).stream());
    }

    List<byte[]> solve(EquihashParams p, Blake2bDigest state) {
        int k = p.k();
        int perOutput = p.indicesPerHashOutput();
        int initial = p.initialListSize();

        List<Row> rows = new ArrayList<>(initial);
        for (int g = 0; g * perOutput < initial; g++) {
            byte[] digest = Equihash.hashBlock(p, state, g);
            for (int j = 0; j < perOutput && g * perOutput + j < initial; j++) {
                rows.add(new Row(Equihash.chunks(p, digest, j * p.hashLength()), new int[]{g * perOutput + j}));
            }
        }

        for (int r = 0; r < k - 1; r++) {
            final int col = r;
            rows.sort(Comparator.comparingInt(row -> row.chunks[col]));
            List<Row> next = new ArrayList<>(rows.size());
            int start = 0;
            while (start < rows.size()) {
                int end = start + 1;
                while (end < rows.size() && rows.get(end).chunks[col] == rows.get(start).chunks[col]) {
                    end++;
                }
                for (int a = start; a < end; a++) {
                    for (int b = a + 1; b < end; b++) {
                        if (Row.distinct(rows.get(a), rows.get(b))) {
                            next.add(Row.ordered(rows.get(a), rows.get(b)));
                        }
                    }
                }
                start = end;
            }
            rows = next;
        }

        // Final round: the last two chunks must cancel together.
        final int last = k - 1;
        rows.sort(Comparator.<Row>comparingInt(row -> row.chunks[last]).thenComparingInt(row -> row.chunks[last + 1]));
        List<byte[]> found = new ArrayList<>();
        int start = 0;
        while (start < rows.size()) {
            int end = start + 1;
            while (end < rows.size() && sameTail(rows.get(start), rows.get(end), last)) {
                end++;
            }
            for (int a = start; a < end; a++) {
                for (int b = a + 1; b < end; b++) {
                    if (Row.distinct(rows.get(a), rows.get(b))) {
                        Row solution = Row.ordered(rows.get(a), rows.get(b));
                        found.add(Equihash.encodeIndices(solution.indices, p.collisionBitLength() + 1));
                    }
                }
            }
            start = end;
        }
        return found;
    }

    private static boolean sameTail(Row a, Row b, int from) {
        return a.chunks[from] == b.chunks[from] && a.chunks[from + 1] == b.chunks[from + 1];
    }
}
