package org.childblockjoin;

import java.io.IOException;
import java.util.Objects;

import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.QueryVisitor;
import org.apache.lucene.search.ScoreMode;
import org.apache.lucene.search.Weight;
import org.apache.lucene.search.join.BitSetProducer;

/**
 * Joins parents down to their children: matches every child doc whose parent matches {@code parentQuery}.
 * Children are indexed as a block right before their parent, and {@link BitSetProducer} marks the parents.
 * <p>
 * The parent query must only ever match docs marked by the parents filter, otherwise the search fails with
 * {@link IllegalStateException}. When {@code doScores} is set, every child scores and counts freq as its parent.
 */
public class ToChildBlockJoinQuery extends Query {

    static final String INVALID_QUERY_MESSAGE =
            "Parent query yields document which is not matched by parents filter, docID=";

    private final BitSetProducer parentsFilter;
    private final Query parentQuery;
    // the query caller passed in, even after rewrite. equals() and hashCode() rely on it, so a rewritten
    // join stays equal to the one the caller built
    private final Query origParentQuery;
    private final boolean doScores;

    /**
     * @param parentQuery   matches parent docs only
     * @param parentsFilter marks all parent docs
     * @param doScores      propagate parent score and freq to children
     */
    public ToChildBlockJoinQuery(Query parentQuery, BitSetProducer parentsFilter, boolean doScores) {
        this(parentQuery, parentQuery, parentsFilter, doScores);
    }

    private ToChildBlockJoinQuery(Query origParentQuery, Query parentQuery, BitSetProducer parentsFilter,
                                  boolean doScores) {
        this.origParentQuery = Objects.requireNonNull(origParentQuery, "parentQuery must not be null");
        this.parentQuery = Objects.requireNonNull(parentQuery, "parentQuery must not be null");
        this.parentsFilter = Objects.requireNonNull(parentsFilter, "parentsFilter must not be null");
        this.doScores = doScores;
    }

    @Override
    public ToChildBlockJoinWeight createWeight(IndexSearcher searcher, ScoreMode scoreMode, float boost)
            throws IOException {
        boolean propagateScores = doScores && scoreMode.needsScores();
        ScoreMode parentScoreMode = propagateScores ? ScoreMode.COMPLETE : ScoreMode.COMPLETE_NO_SCORES;
        // boost goes as is to the parent weight, so children score boost * parentScore
        Weight parentWeight = searcher.createWeight(searcher.rewrite(parentQuery), parentScoreMode, boost);
        return new ToChildBlockJoinWeight(this, parentWeight, parentsFilter, propagateScores);
    }

    @Override
    public Query rewrite(IndexSearcher indexSearcher) throws IOException {
        Query parentRewrite = parentQuery.rewrite(indexSearcher);
        if (parentRewrite != parentQuery) {
            return new ToChildBlockJoinQuery(origParentQuery, parentRewrite, parentsFilter, doScores);
        }
        return super.rewrite(indexSearcher);
    }

    @Override
    public void visit(QueryVisitor visitor) {
        parentQuery.visit(visitor.getSubVisitor(BooleanClause.Occur.MUST, this));
    }

    public Query getParentQuery() {
        return parentQuery;
    }

    public BitSetProducer getParentsFilter() {
        return parentsFilter;
    }

    @Override
    public String toString(String field) {
        return "ToChildBlockJoinQuery (" + parentQuery.toString(field) + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (!sameClassAs(o)) {
            return false;
        }
        ToChildBlockJoinQuery that = (ToChildBlockJoinQuery) o;
        return doScores == that.doScores
                && origParentQuery.equals(that.origParentQuery)
                && parentsFilter.equals(that.parentsFilter);
    }

    @Override
    public int hashCode() {
        int hash = classHash();
        hash = 31 * hash + origParentQuery.hashCode();
        hash = 31 * hash + Boolean.hashCode(doScores);
        hash = 31 * hash + parentsFilter.hashCode();
        return hash;
    }
}
