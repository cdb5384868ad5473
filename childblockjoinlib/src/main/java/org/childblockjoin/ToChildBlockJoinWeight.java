package org.childblockjoin;

import java.io.IOException;
import java.util.logging.Logger;

import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.search.Explanation;
import org.apache.lucene.search.Scorer;
import org.apache.lucene.search.ScorerSupplier;
import org.apache.lucene.search.Weight;
import org.apache.lucene.search.join.BitSetProducer;
import org.apache.lucene.util.BitSet;
import org.apache.lucene.util.Bits;

/**
 * Builds a {@link ToChildBlockJoinScorer} per segment over the parent weight. Accept docs are checked in the child
 * space only, the parent scorer never sees them.
 */
public class ToChildBlockJoinWeight extends Weight {

    private static final Logger LOGGER = Logger.getLogger(ToChildBlockJoinWeight.class.getName());

    private final Weight parentWeight;
    private final BitSetProducer parentsFilter;
    private final boolean doScores;

    ToChildBlockJoinWeight(ToChildBlockJoinQuery joinQuery, Weight parentWeight, BitSetProducer parentsFilter,
                           boolean doScores) {
        super(joinQuery);
        this.parentWeight = parentWeight;
        this.parentsFilter = parentsFilter;
        this.doScores = doScores;
    }

    @Override
    public Explanation explain(LeafReaderContext context, int doc) throws IOException {
        throw new UnsupportedOperationException(getClass().getName() + " cannot explain match on parent document");
    }

    /**
     * Accepts all children, deleted ones included: live docs are applied by the bulk scorer, and the query cache
     * shares the matches across readers of the same segment core.
     */
    @Override
    public ScorerSupplier scorerSupplier(LeafReaderContext context) throws IOException {
        return scorerSupplier(context, null);
    }

    /**
     * @param acceptDocs children to accept, {@code null} accepts all
     * @return {@code null} if no parent matches in the segment
     * @throws IllegalStateException if the parents filter doesn't cover the whole segment
     */
    public ScorerSupplier scorerSupplier(LeafReaderContext context, Bits acceptDocs) throws IOException {
        ScorerSupplier parentScorerSupplier = parentWeight.scorerSupplier(context);
        if (parentScorerSupplier == null) {
            LOGGER.fine(() -> "no parent matches in segment ord=" + context.ord);
            return null;
        }
        BitSet parents = parentsFilter.getBitSet(context);
        if (parents == null) {
            LOGGER.fine(() -> "no parents in segment ord=" + context.ord);
            return null;
        }
        int maxDoc = context.reader().maxDoc();
        if (parents.length() < maxDoc) {
            throw new IllegalStateException("parentsFilter must produce a bit set spanning the segment, maxDoc="
                    + maxDoc + "; got length=" + parents.length() + " from " + parentsFilter);
        }
        return new ToChildBlockJoinScorerSupplier(this, parentScorerSupplier, parents, doScores, acceptDocs);
    }

    @Override
    public Scorer scorer(LeafReaderContext context) throws IOException {
        return scorer(context, null);
    }

    public Scorer scorer(LeafReaderContext context, Bits acceptDocs) throws IOException {
        ScorerSupplier scorerSupplier = scorerSupplier(context, acceptDocs);
        if (scorerSupplier == null) {
            return null;
        }
        return scorerSupplier.get(Long.MAX_VALUE);
    }

    @Override
    public boolean isCacheable(LeafReaderContext ctx) {
        return parentWeight.isCacheable(ctx);
    }
}
