package ai.duel.player.ai.minimax;

import ai.duel.game.Action;
import ai.duel.game.MatchState;
import ai.duel.game.Side;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Depth-limited minimax with optional alpha-beta pruning. The AI maximises, the human minimises.
 * <p>
 * Every child is explored on a deep copy of its parent. After an action is applied, a battle is
 * resolved with the mover attacking whenever both fields are occupied. A fusion does not end the
 * mover's turn: the child is searched at the same depth with the same role. Plays and passes
 * consume one level of depth and hand the move over.
 * <p>
 * Actions are explored in {@link MatchState#legalActions} order and a later action replaces the
 * current best only when strictly better, so ties keep the first action found. With pruning off the
 * same recursion visits the whole tree; both modes choose the same action.
 * <p>
 * Not thread-safe: the counters belong to the instance.
 */
public class MinimaxSearch {
    private static final Logger log = LoggerFactory.getLogger(MinimaxSearch.class);

    private final StateEvaluator evaluator;
    private final boolean pruning;

    private long nodesEvaluated;
    private long pruneCount;
    private SearchStatistics lastStatistics = SearchStatistics.EMPTY;

    public MinimaxSearch(StateEvaluator evaluator, boolean pruning) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.pruning = pruning;
    }

    /**
     * Searches from {@code state} with the AI to move, resetting the counters first.
     */
    public SearchResult search(MatchState state, int depth) {
        nodesEvaluated = 0;
        pruneCount = 0;
        long start = System.nanoTime();
        SearchResult result = minimax(state, depth, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, true);
        lastStatistics = new SearchStatistics(nodesEvaluated, pruneCount, System.nanoTime() - start);
        if (log.isDebugEnabled()) {
            log.debug("Minimax depth {} (pruning {}): {} nodes, {} prunes, score {}, best {} in {} ms",
                    depth, pruning ? "on" : "off", nodesEvaluated, pruneCount,
                    String.format("%.1f", result.score()), result.action(),
                    String.format("%.1f", lastStatistics.elapsedMillis()));
        }
        return result;
    }

    /**
     * One minimax node.
     *
     * @param depth      remaining plies; 0 evaluates immediately
     * @param maximizing {@code true} when the AI is to move
     */
    public SearchResult minimax(MatchState state, int depth, double alpha, double beta, boolean maximizing) {
        nodesEvaluated++;
        if (depth <= 0 || state.isGameOver()) {
            return SearchResult.leaf(evaluator.evaluate(state));
        }
        Side mover = maximizing ? Side.AI : Side.HUMAN;
        List<Action> actions = state.legalActions(mover);
        if (actions.isEmpty()) {
            return SearchResult.leaf(evaluator.evaluate(state));
        }

        double best = maximizing ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        Action bestAction = actions.get(0);
        for (Action action : actions) {
            MatchState child = state.copy();
            child.applyAction(mover, action);
            if (child.getHuman().hasFieldCard() && child.getAi().hasFieldCard()) {
                child.resolveBattle(mover);
            }

            double value;
            if (action.isCombine()) {
                value = minimax(child, depth, alpha, beta, maximizing).score();
            } else {
                value = minimax(child, depth - 1, alpha, beta, !maximizing).score();
            }
            if (log.isTraceEnabled()) {
                log.trace("depth {} {} {} -> {}", depth, mover, action, value);
            }

            if (maximizing) {
                if (value > best) {
                    best = value;
                    bestAction = action;
                }
                alpha = Math.max(alpha, value);
            } else {
                if (value < best) {
                    best = value;
                    bestAction = action;
                }
                beta = Math.min(beta, value);
            }
            if (pruning && beta <= alpha) {
                pruneCount++;
                break;
            }
        }
        return new SearchResult(best, bestAction);
    }

    public boolean isPruning() {
        return pruning;
    }

    public StateEvaluator getEvaluator() {
        return evaluator;
    }

    /**
     * Counters of the most recent {@link #search} call.
     */
    public SearchStatistics getLastStatistics() {
        return lastStatistics;
    }
}
