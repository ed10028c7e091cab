package ai.duel.player.ai.minimax;

/**
 * Counters from one top-level search.
 *
 * @param nodesEvaluated number of minimax calls, leaves included
 * @param pruneCount     number of alpha-beta cut-offs
 * @param elapsedNanos   wall time spent searching
 */
public record SearchStatistics(long nodesEvaluated, long pruneCount, long elapsedNanos) {

    public static final SearchStatistics EMPTY = new SearchStatistics(0, 0, 0);

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}
