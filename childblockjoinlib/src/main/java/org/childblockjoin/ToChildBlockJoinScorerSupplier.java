package org.childblockjoin;

import java.io.IOException;

import org.apache.lucene.search.ScorerSupplier;
import org.apache.lucene.search.Weight;
import org.apache.lucene.util.BitSet;
import org.apache.lucene.util.Bits;

/**
 * Defers the parent scorer until the join scorer is pulled. Cost is the parent cost: the number of children per
 * parent isn't known without walking the blocks.
 */
class ToChildBlockJoinScorerSupplier extends ScorerSupplier {

    private final Weight weight;
    private final ScorerSupplier parentScorerSupplier;
    private final BitSet parentBits;
    private final boolean doScores;
    private final Bits acceptDocs;

    ToChildBlockJoinScorerSupplier(Weight weight, ScorerSupplier parentScorerSupplier, BitSet parentBits,
                                   boolean doScores, Bits acceptDocs) {
        this.weight = weight;
        this.parentScorerSupplier = parentScorerSupplier;
        this.parentBits = parentBits;
        this.doScores = doScores;
        this.acceptDocs = acceptDocs;
    }

    @Override
    public ToChildBlockJoinScorer get(long leadCost) throws IOException {
        return new ToChildBlockJoinScorer(weight, parentScorerSupplier.get(leadCost), parentBits, doScores,
                acceptDocs);
    }

    @Override
    public long cost() {
        return parentScorerSupplier.cost();
    }
}
