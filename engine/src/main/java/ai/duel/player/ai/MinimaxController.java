package ai.duel.player.ai;

import ai.duel.catalog.CardCatalog;
import ai.duel.config.SearchProperties;
import ai.duel.game.Action;
import ai.duel.game.Card;
import ai.duel.game.CardInstance;
import ai.duel.game.MatchState;
import ai.duel.player.AIController;
import ai.duel.player.ai.minimax.MinimaxSearch;
import ai.duel.player.ai.minimax.MoveRefiner;
import ai.duel.player.ai.minimax.SearchResult;
import ai.duel.player.ai.minimax.SearchStatistics;
import ai.duel.player.ai.minimax.StateEvaluator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Minimax opponent.
 *
 * <p>Each decision goes through three steps:
 * <ol>
 *   <li><b>Fusion shortcut:</b> if some pair in the AI's hand fuses into a card that beats the
 *   better material's attack by more than {@value #FUSION_IMPROVEMENT_MARGIN}, or reaches
 *   {@value #FUSION_ATTACK_THRESHOLD} attack, the pair with the greatest improvement is fused
 *   without searching.</li>
 *   <li><b>Search:</b> otherwise a full {@link MinimaxSearch} runs from the current state at the
 *   configured depth with the AI maximising.</li>
 *   <li><b>Refinement:</b> a play chosen by the search gets its stance and star re-derived by
 *   {@link MoveRefiner}.</li>
 * </ol>
 */
@Component("aiSeat")
public class MinimaxController extends AIController {

    private static final Logger log = LoggerFactory.getLogger(MinimaxController.class);

    static final int FUSION_IMPROVEMENT_MARGIN = 500;
    static final int FUSION_ATTACK_THRESHOLD = 2500;

    private final CardCatalog catalog;
    private final MinimaxSearch search;
    private final MoveRefiner refiner = new MoveRefiner();
    private final int depth;

    @Autowired
    public MinimaxController(CardCatalog catalog, SearchProperties properties) {
        this(catalog, new MinimaxSearch(new StateEvaluator(catalog, properties.getWeights().toEvaluationWeights()),
                properties.isPruning()), properties.getDepth());
    }

    public MinimaxController(CardCatalog catalog, MinimaxSearch search, int depth) {
        this.catalog = catalog;
        this.search = search;
        this.depth = depth;
    }

    @Override
    public Optional<Action> chooseAction(MatchState state) {
        return getBestMove(state);
    }

    /**
     * Picks the AI's next action in {@code state}. The state itself is never modified.
     *
     * @return the action to apply, or empty if the game is already over
     */
    public Optional<Action> getBestMove(MatchState state) {
        if (state.isGameOver()) {
            return Optional.empty();
        }
        Optional<Action> fusion = findValuableFusion(state);
        if (fusion.isPresent()) {
            log.debug("Valuable fusion found, skipping search: {}", fusion.get().describe());
            return fusion;
        }

        SearchResult result = search.search(state, depth);
        Optional<Action> best = result.bestAction();
        if (best.isPresent() && best.get().isPlay()) {
            Action searched = best.get();
            Action refined = refiner.refine(searched, state.getAi().getHand(), opponentField(state));
            if (log.isDebugEnabled() && !refined.equals(searched)) {
                log.debug("Refined searched play {} to {}", searched, refined.describe());
            }
            best = Optional.of(refined);
        }
        return best;
    }

    /**
     * Scans the AI's hand for a fusion worth making without search.
     *
     * @return the qualifying fusion with the greatest attack improvement (the first found on ties),
     *         or empty if none qualifies
     */
    public Optional<Action> findValuableFusion(MatchState state) {
        List<CardInstance> hand = state.getAi().getHand();
        Action best = null;
        int bestImprovement = Integer.MIN_VALUE;
        for (int i = 0; i < hand.size(); i++) {
            for (int j = i + 1; j < hand.size(); j++) {
                Card first = hand.get(i).getCard();
                Card second = hand.get(j).getCard();
                Optional<Card> result = catalog.fuse(first, second);
                if (result.isEmpty()) {
                    continue;
                }
                int resultAttack = result.get().getAttack();
                int improvement = resultAttack - Math.max(first.getAttack(), second.getAttack());
                boolean valuable = improvement > FUSION_IMPROVEMENT_MARGIN || resultAttack >= FUSION_ATTACK_THRESHOLD;
                if (valuable && improvement > bestImprovement) {
                    bestImprovement = improvement;
                    best = Action.combine(i, j, result.get().getName());
                }
            }
        }
        return Optional.ofNullable(best);
    }

    public int getDepth() {
        return depth;
    }

    public Difficulty getDifficulty() {
        return Difficulty.forDepth(depth);
    }

    public String getDifficultyName() {
        return getDifficulty().getDisplayName();
    }

    /**
     * Counters of the latest full search; unchanged when a decision took the fusion shortcut.
     */
    public SearchStatistics getLastStatistics() {
        return search.getLastStatistics();
    }
}
