package ai.duel.game;

import ai.duel.catalog.CardCatalog;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Complete state of one duel: both players, whose turn it is, the phase, the battle log and the
 * game-over verdict.
 * <p>
 * <strong>Turn flow:</strong> the current side applies actions in the main phase; once both fields
 * are occupied a battle is resolved with the current side attacking ({@link #resolveBattle}), and
 * {@link #nextTurn()} hands control over and draws for the new side. Turn numbers count rounds, so
 * the number increases each time control returns to the human.
 * <p>
 * <strong>Perfect information:</strong> both decks, hands and fields are visible to everyone,
 * including the search engine.
 * <p>
 * <strong>Failure signalling:</strong> no operation here throws on bad input or on the wrong game
 * state. Mutators return {@code false} or {@link Optional#empty()} and leave the state untouched,
 * and once the game is over every mutator is a no-op.
 */
public class MatchState {
    private static final Logger log = LoggerFactory.getLogger(MatchState.class);

    public static final int DEFAULT_LOOKAHEAD = 3;

    private final CardCatalog catalog;
    private final MatchRules rules;
    private final Player human;
    private final Player ai;

    private Side currentSide = Side.HUMAN;
    private int turnNumber = 1;
    private Phase phase = Phase.DRAW;
    private boolean gameOver;
    private Side winner;

    /** Append-only; results are immutable and shared between copies. */
    private final List<BattleResult> battleLog = new ArrayList<>();
    private BattleResult lastBattleResult;

    /**
     * Creates a state with two empty players. Use {@link DeckDealer} to deal a playable match.
     */
    public MatchState(CardCatalog catalog, MatchRules rules, String humanName, String aiName) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.human = new Player(humanName, false, catalog, rules);
        this.ai = new Player(aiName, true, catalog, rules);
    }

    private MatchState(MatchState source) {
        this.catalog = source.catalog;
        this.rules = source.rules;
        this.human = source.human.copy();
        this.ai = source.ai.copy();
        this.currentSide = source.currentSide;
        this.turnNumber = source.turnNumber;
        this.phase = source.phase;
        this.gameOver = source.gameOver;
        this.winner = source.winner;
        this.battleLog.addAll(source.battleLog);
        this.lastBattleResult = source.lastBattleResult;
    }

    /**
     * Creates a deep copy for simulation. Every card instance of both players is copied; the
     * catalog, rules and logged battle results are immutable and shared.
     *
     * @return a state whose mutation never affects this one
     */
    public MatchState copy() {
        return new MatchState(this);
    }

    // ---------------------------------------------------------------------
    // Actions
    // ---------------------------------------------------------------------

    /**
     * Enumerates the actions available to {@code player}, in a stable order:
     * <ol>
     *   <li>for each hand index, the plays ATK/1, ATK/2, DEF/1, DEF/2;</li>
     *   <li>one fusion per combinable pair, in {@link Player#possibleCombinations()} order;</li>
     *   <li>a pass, when nothing else is available or when the player already holds the field.</li>
     * </ol>
     * The list is never empty.
     */
    public List<Action> legalActions(Player player) {
        Objects.requireNonNull(player, "player");
        List<Action> actions = new ArrayList<>();
        List<CardInstance> hand = player.getHand();
        for (int i = 0; i < hand.size(); i++) {
            String name = hand.get(i).getName();
            for (Stance stance : Stance.values()) {
                for (StarChoice star : StarChoice.values()) {
                    actions.add(Action.play(i, stance, star, name));
                }
            }
        }
        for (Combination combination : player.possibleCombinations()) {
            actions.add(Action.combine(combination.first(), combination.second(), combination.result().getName()));
        }
        if (actions.isEmpty() || player.hasFieldCard()) {
            actions.add(Action.pass());
        }
        return actions;
    }

    public List<Action> legalActions(Side side) {
        return legalActions(player(side));
    }

    /**
     * Applies {@code action} for {@code player} in place.
     *
     * @return whether the action took effect; {@code false} after game over, for a player that is
     *         not part of this state, or when the underlying play or fusion fails
     */
    public boolean applyAction(Player player, Action action) {
        Objects.requireNonNull(action, "action");
        if (gameOver || (player != human && player != ai)) {
            return false;
        }
        return switch (action.type()) {
            case PLAY -> player.playToField(action.handIndex(), action.stance(), action.starChoice());
            case COMBINE -> {
                Optional<CardInstance> result = player.combine(action.first(), action.second());
                if (result.isPresent() && log.isDebugEnabled()) {
                    log.debug("{} fused hand cards {} and {} into {}", player.getName(),
                            action.first(), action.second(), result.get().getCard());
                }
                yield result.isPresent();
            }
            case PASS -> true;
        };
    }

    public boolean applyAction(Side side, Action action) {
        return applyAction(player(side), action);
    }

    // ---------------------------------------------------------------------
    // Battle
    // ---------------------------------------------------------------------

    /**
     * Resolves a confrontation between the two field cards with {@code attacker} attacking.
     * <p>
     * The attacker always fights with its attack stat; the defender fights with the stat of its
     * stance. Each side adds the bonus of its active star against the other's.
     * <table>
     *   <caption>Outcomes</caption>
     *   <tr><th>Values</th><th>Defender stance</th><th>Effect</th></tr>
     *   <tr><td>A &gt; D</td><td>ATK</td><td>defender destroyed, its owner loses A-D</td></tr>
     *   <tr><td>A &gt; D</td><td>DEF</td><td>defender destroyed</td></tr>
     *   <tr><td>D &gt; A</td><td>ATK</td><td>attacker destroyed, its owner loses D-A</td></tr>
     *   <tr><td>D &gt; A</td><td>DEF</td><td>attacker's owner loses D-A (rebound)</td></tr>
     *   <tr><td>A = D</td><td>ATK</td><td>both destroyed</td></tr>
     *   <tr><td>A = D</td><td>DEF</td><td>nothing</td></tr>
     * </table>
     * The result is appended to the battle log and the game-over check runs.
     *
     * @return the result, or empty if either field is empty or the game is over
     */
    public Optional<BattleResult> resolveBattle(Side attackerSide) {
        Objects.requireNonNull(attackerSide, "attackerSide");
        if (gameOver || !human.hasFieldCard() || !ai.hasFieldCard()) {
            return Optional.empty();
        }
        phase = Phase.BATTLE;
        Player attackerOwner = player(attackerSide);
        Player defenderOwner = player(attackerSide.opponent());
        CardInstance attacker = attackerOwner.getField().orElseThrow();
        CardInstance defender = defenderOwner.getField().orElseThrow();

        int attackerBonus = GuardianStar.combatBonus(attacker.getActiveStar(), defender.getActiveStar());
        int defenderBonus = GuardianStar.combatBonus(defender.getActiveStar(), attacker.getActiveStar());
        int attackValue = attacker.getAttack() + attackerBonus;
        int defendValue = defender.getStanceValue() + defenderBonus;
        boolean defenderAttacking = defender.getStance() == Stance.ATTACK;

        BattleOutcome outcome;
        Side winningSide;
        int damage = 0;
        String text;
        if (attackValue > defendValue) {
            winningSide = attackerSide;
            defenderOwner.destroyFieldCard();
            if (defenderAttacking) {
                outcome = BattleOutcome.ATTACKER_WINS;
                damage = attackValue - defendValue;
                defenderOwner.loseLifePoints(damage);
                text = String.format("%s (%d) destroys %s (%d); %s loses %d LP",
                        attacker.getName(), attackValue, defender.getName(), defendValue, defenderOwner.getName(), damage);
            } else {
                outcome = BattleOutcome.DEFENDER_DESTROYED;
                text = String.format("%s (%d) breaks through %s (%d DEF)",
                        attacker.getName(), attackValue, defender.getName(), defendValue);
            }
        } else if (defendValue > attackValue) {
            winningSide = attackerSide.opponent();
            damage = defendValue - attackValue;
            attackerOwner.loseLifePoints(damage);
            if (defenderAttacking) {
                outcome = BattleOutcome.DEFENDER_WINS;
                attackerOwner.destroyFieldCard();
                text = String.format("%s (%d) is destroyed by %s (%d); %s loses %d LP",
                        attacker.getName(), attackValue, defender.getName(), defendValue, attackerOwner.getName(), damage);
            } else {
                outcome = BattleOutcome.REBOUND;
                text = String.format("%s (%d) bounces off %s (%d DEF); %s loses %d LP",
                        attacker.getName(), attackValue, defender.getName(), defendValue, attackerOwner.getName(), damage);
            }
        } else {
            winningSide = null;
            if (defenderAttacking) {
                outcome = BattleOutcome.MUTUAL_DESTRUCTION;
                attackerOwner.destroyFieldCard();
                defenderOwner.destroyFieldCard();
                text = String.format("%s and %s destroy each other (%d)",
                        attacker.getName(), defender.getName(), attackValue);
            } else {
                outcome = BattleOutcome.STALEMATE;
                text = String.format("%s (%d) and %s (%d DEF) are evenly matched",
                        attacker.getName(), attackValue, defender.getName(), defendValue);
            }
        }

        CardInstance humanCard = attackerSide == Side.HUMAN ? attacker : defender;
        CardInstance aiCard = attackerSide == Side.AI ? attacker : defender;
        BattleResult result = new BattleResult(
                attackerSide,
                humanCard.getName(),
                aiCard.getName(),
                attackValue,
                defendValue,
                attackerBonus,
                defenderBonus,
                humanCard.getActiveStar(),
                aiCard.getActiveStar(),
                humanCard.getStance(),
                aiCard.getStance(),
                damage,
                outcome,
                winningSide,
                text);
        battleLog.add(result);
        lastBattleResult = result;
        if (log.isDebugEnabled()) {
            log.debug("Turn {} battle ({} attacking): {} [{}]", turnNumber, attackerSide, text, outcome);
        }
        phase = Phase.END;
        checkGameOver();
        return Optional.of(result);
    }

    /**
     * Prospective value of {@code card} against {@code opponent} without changing anything: the
     * stat of its stance plus its star bonus against the opponent's active star.
     */
    public static int battleValue(CardInstance card, CardInstance opponent) {
        Objects.requireNonNull(card, "card");
        int bonus = opponent != null ? GuardianStar.combatBonus(card.getActiveStar(), opponent.getActiveStar()) : 0;
        return card.getStanceValue() + bonus;
    }

    // ---------------------------------------------------------------------
    // Terminal checks and turns
    // ---------------------------------------------------------------------

    /**
     * Re-evaluates the end of the game. Checks run in a fixed order, human first, so a double
     * knockout is an AI win:
     * <ol>
     *   <li>human life at or below zero: AI wins</li>
     *   <li>AI life at or below zero: human wins</li>
     *   <li>human out of deck, hand and field: AI wins</li>
     *   <li>AI out of deck, hand and field: human wins</li>
     * </ol>
     *
     * @return whether the game is over
     */
    public boolean checkGameOver() {
        if (gameOver) {
            return true;
        }
        if (human.getLifePoints() <= 0) {
            finish(Side.AI, "human life points exhausted");
        } else if (ai.getLifePoints() <= 0) {
            finish(Side.HUMAN, "AI life points exhausted");
        } else if (human.isOutOfCards()) {
            finish(Side.AI, "human decked out");
        } else if (ai.isOutOfCards()) {
            finish(Side.HUMAN, "AI decked out");
        }
        return gameOver;
    }

    /**
     * Ends the game in favour of {@code side}'s opponent.
     *
     * @return {@code false} if the game was already over
     */
    public boolean concede(Side side) {
        if (gameOver) {
            return false;
        }
        finish(side.opponent(), side + " conceded");
        return true;
    }

    private void finish(Side winningSide, String reason) {
        gameOver = true;
        winner = winningSide;
        phase = Phase.END;
        if (log.isDebugEnabled()) {
            log.debug("Game over on turn {}: {} wins ({})", turnNumber, winningSide, reason);
        }
    }

    /**
     * Passes control to the other side, bumping the turn number when it comes back to the human,
     * and draws a card for the new current side. Field cards stay where they are.
     *
     * @return {@code false} if the game is already over
     */
    public boolean nextTurn() {
        if (gameOver) {
            return false;
        }
        currentSide = currentSide.opponent();
        if (currentSide == Side.HUMAN) {
            turnNumber++;
        }
        phase = Phase.DRAW;
        getCurrentPlayer().draw();
        phase = Phase.MAIN;
        checkGameOver();
        return true;
    }

    // ---------------------------------------------------------------------
    // Views
    // ---------------------------------------------------------------------

    /**
     * The next {@code count} cards {@code player} will draw, top first.
     */
    public List<CardInstance> upcomingCards(Player player, int count) {
        List<CardInstance> deck = player.getDeck();
        return List.copyOf(deck.subList(0, Math.max(0, Math.min(count, deck.size()))));
    }

    public List<CardInstance> upcomingCards(Player player) {
        return upcomingCards(player, DEFAULT_LOOKAHEAD);
    }

    /**
     * Snapshot of the headline numbers for display.
     */
    public MatchSummary summary() {
        return new MatchSummary(
                turnNumber,
                getCurrentPlayer().getName(),
                phase,
                human.getLifePoints(),
                ai.getLifePoints(),
                human.getHand().size(),
                ai.getHand().size(),
                human.getDeck().size(),
                ai.getDeck().size(),
                human.getField().map(CardInstance::getName).orElse(null),
                ai.getField().map(CardInstance::getName).orElse(null),
                gameOver,
                winner != null ? player(winner).getName() : null);
    }

    public Player player(Side side) {
        return side == Side.HUMAN ? human : ai;
    }

    public Player getHuman() {
        return human;
    }

    public Player getAi() {
        return ai;
    }

    public Side getCurrentSide() {
        return currentSide;
    }

    public Player getCurrentPlayer() {
        return player(currentSide);
    }

    /**
     * Hands the move to {@code side} without drawing. Intended for match setup.
     */
    public void setCurrentSide(Side side) {
        this.currentSide = Objects.requireNonNull(side, "side");
    }

    public int getTurnNumber() {
        return turnNumber;
    }

    public Phase getPhase() {
        return phase;
    }

    public void setPhase(Phase phase) {
        this.phase = Objects.requireNonNull(phase, "phase");
    }

    public boolean isGameOver() {
        return gameOver;
    }

    /**
     * Winning side. Empty while the game runs, and also when it ended without a winner.
     */
    public Optional<Side> getWinner() {
        return Optional.ofNullable(winner);
    }

    public List<BattleResult> getBattleLog() {
        return Collections.unmodifiableList(battleLog);
    }

    public Optional<BattleResult> getLastBattleResult() {
        return Optional.ofNullable(lastBattleResult);
    }

    public CardCatalog getCatalog() {
        return catalog;
    }

    public MatchRules getRules() {
        return rules;
    }

    @Override
    public String toString() {
        return "MatchState(turn=" + turnNumber + ", current=" + currentSide + ", phase=" + phase
                + ", human=" + human + ", ai=" + ai + (gameOver ? ", winner=" + winner : "") + ")";
    }
}
