package org.childblockjoin;

import java.io.IOException;
import java.util.Collection;
import java.util.Collections;

import org.apache.lucene.search.DocIdSetIterator;
import org.apache.lucene.search.Scorer;
import org.apache.lucene.search.TermScorer;
import org.apache.lucene.search.Weight;
import org.apache.lucene.util.BitSet;
import org.apache.lucene.util.Bits;

/**
 * Walks the children of the parents matched by the parent scorer. A block is the docs in
 * {@code (prevSetBit(parentDoc - 1), parentDoc)}; blocks without children are skipped, and {@code acceptDocs} is
 * checked in the child space only.
 * <p>
 * Score and freq are taken from the parent once per block and repeated for each of its children.
 */
public final class ToChildBlockJoinScorer extends Scorer {

    static final String PARENT_RELATIONSHIP = "BLOCK_JOIN";

    private enum State {
        BEFORE_START,
        IN_BLOCK,
        EXHAUSTED
    }

    private final Scorer parentScorer;
    private final DocIdSetIterator parentIt;
    private final BitSet parentBits;
    private final boolean doScores;
    private final Bits acceptDocs;
    private final DocIdSetIterator childIt;

    private State state = State.BEFORE_START;
    private int childDoc = -1;
    private int parentDoc = -1;
    private float parentScore;
    private int parentFreq = 1;

    ToChildBlockJoinScorer(Weight weight, Scorer parentScorer, BitSet parentBits, boolean doScores,
                           Bits acceptDocs) {
        super(weight);
        this.parentScorer = parentScorer;
        this.parentIt = parentScorer.iterator();
        this.parentBits = parentBits;
        this.doScores = doScores;
        this.acceptDocs = acceptDocs;
        this.childIt = new ChildIterator();
    }

    @Override
    public Collection<ChildScorable> getChildren() {
        return Collections.singleton(new ChildScorable(parentScorer, PARENT_RELATIONSHIP));
    }

    @Override
    public DocIdSetIterator iterator() {
        return childIt;
    }

    @Override
    public int docID() {
        return childDoc;
    }

    @Override
    public float score() {
        return parentScore;
    }

    /**
     * @return freq of the parent term when the parent is scored by a {@link TermScorer}, 1 otherwise
     */
    public int freq() {
        return parentFreq;
    }

    @Override
    public float getMaxScore(int upTo) {
        return doScores ? Float.POSITIVE_INFINITY : 0f;
    }

    private final class ChildIterator extends DocIdSetIterator {

        @Override
        public int docID() {
            return childDoc;
        }

        @Override
        public int nextDoc() throws IOException {
            if (state == State.EXHAUSTED) {
                return NO_MORE_DOCS;
            }
            assert state == State.BEFORE_START || childDoc < parentDoc
                    : "childDoc=" + childDoc + " parentDoc=" + parentDoc;
            if (state == State.IN_BLOCK && nextAcceptedInBlock(childDoc + 1)) {
                return childDoc;
            }
            return nextBlock();
        }

        @Override
        public int advance(int target) throws IOException {
            if (target == NO_MORE_DOCS || state == State.EXHAUSTED) {
                return exhaust();
            }
            if (target <= childDoc) {
                return childDoc;
            }
            if (target > parentDoc) {
                parentDoc = parentIt.advance(target);
                validateParentDoc();
                if (parentDoc == NO_MORE_DOCS) {
                    return exhaust();
                }
                enterBlock();
                // a target before the block's first child isn't a child of this parent
                target = Math.max(target, firstChild(parentDoc));
            }
            if (target < parentDoc && nextAcceptedInBlock(target)) {
                return childDoc;
            }
            // the target is the parent itself, or nothing accepted is left in the block
            childDoc = parentDoc - 1;
            return nextBlock();
        }

        @Override
        public long cost() {
            return parentIt.cost();
        }
    }

    /**
     * Moves to the next parent with at least one accepted child.
     */
    private int nextBlock() throws IOException {
        while (true) {
            parentDoc = parentIt.nextDoc();
            validateParentDoc();
            if (parentDoc == DocIdSetIterator.NO_MORE_DOCS) {
                return exhaust();
            }
            int firstChild = firstChild(parentDoc);
            if (firstChild == parentDoc) {
                // no children, including a parent at doc 0
                continue;
            }
            enterBlock();
            if (nextAcceptedInBlock(firstChild)) {
                return childDoc;
            }
            childDoc = parentDoc - 1;
        }
    }

    /**
     * Positions on the first accepted doc in {@code [from, parentDoc)}.
     *
     * @return false if there is none, the position is left unchanged then
     */
    private boolean nextAcceptedInBlock(int from) {
        for (int doc = from; doc < parentDoc; doc++) {
            if (acceptDocs == null || acceptDocs.get(doc)) {
                childDoc = doc;
                return true;
            }
        }
        return false;
    }

    private int firstChild(int parent) {
        return parent == 0 ? 0 : parentBits.prevSetBit(parent - 1) + 1;
    }

    private void enterBlock() throws IOException {
        state = State.IN_BLOCK;
        if (doScores) {
            parentScore = parentScorer.score();
            parentFreq = parentScorer instanceof TermScorer ? ((TermScorer) parentScorer).freq() : 1;
        }
    }

    private int exhaust() {
        state = State.EXHAUSTED;
        childDoc = parentDoc = DocIdSetIterator.NO_MORE_DOCS;
        return childDoc;
    }

    /**
     * Detects a parent query that in fact matches child docs.
     */
    private void validateParentDoc() {
        if (parentDoc != DocIdSetIterator.NO_MORE_DOCS && !parentBits.get(parentDoc)) {
            throw new IllegalStateException(ToChildBlockJoinQuery.INVALID_QUERY_MESSAGE + parentDoc);
        }
    }
}
