package ai.duel.game;

import ai.duel.catalog.CardCatalog;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One side of a duel: life points and the four card zones.
 * <p>
 * <strong>Zones:</strong>
 * <ul>
 *   <li><strong>Deck:</strong> ordered draw pile; index 0 is the next card drawn. Fully visible.</li>
 *   <li><strong>Hand:</strong> at most {@link #getHandLimit()} cards.</li>
 *   <li><strong>Field:</strong> zero or one card.</li>
 *   <li><strong>Graveyard:</strong> destroyed, replaced and fused-away cards.</li>
 * </ul>
 * <p>
 * Every operation that can fail reports it through its return value ({@code false} or
 * {@link Optional#empty()}) and leaves the player untouched; nothing here throws on bad indices.
 * <p>
 * Undo is single-level: only the card sacrificed by the most recent {@link #playToField} is
 * remembered, and only while it is still the top of the graveyard.
 */
public class Player {
    private final String name;
    private final boolean aiControlled;
    private final CardCatalog catalog;
    private final int handLimit;
    private int lifePoints;

    private final List<CardInstance> deck = new ArrayList<>();
    private final List<CardInstance> hand = new ArrayList<>();
    private final List<CardInstance> graveyard = new ArrayList<>();
    private CardInstance field;

    /** Card replaced by the latest play, kept so the play can be undone. */
    private CardInstance lastSacrificed;

    public Player(String name, boolean aiControlled, CardCatalog catalog, MatchRules rules) {
        this.name = Objects.requireNonNull(name, "name");
        this.aiControlled = aiControlled;
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(rules, "rules");
        this.handLimit = rules.handLimit();
        this.lifePoints = rules.startingLifePoints();
    }

    private Player(Player source) {
        this.name = source.name;
        this.aiControlled = source.aiControlled;
        this.catalog = source.catalog;
        this.handLimit = source.handLimit;
        this.lifePoints = source.lifePoints;
    }

    /**
     * Creates a fully independent copy: every card instance in every zone is copied.
     * <p>
     * The undo record survives the copy only while it still points at the graveyard top, in which
     * case it points at the copied top card.
     *
     * @return a new player that shares no mutable state with this one
     */
    public Player copy() {
        Player clone = new Player(this);
        for (CardInstance card : deck) {
            clone.deck.add(card.copy());
        }
        for (CardInstance card : hand) {
            clone.hand.add(card.copy());
        }
        for (CardInstance card : graveyard) {
            clone.graveyard.add(card.copy());
        }
        clone.field = field != null ? field.copy() : null;
        if (lastSacrificed != null && !graveyard.isEmpty() && graveyard.get(graveyard.size() - 1) == lastSacrificed) {
            clone.lastSacrificed = clone.graveyard.get(clone.graveyard.size() - 1);
        }
        return clone;
    }

    /**
     * Moves the top of the deck into the hand.
     *
     * @return the drawn card, or empty if the deck is empty or the hand is full
     */
    public Optional<CardInstance> draw() {
        if (deck.isEmpty() || hand.size() >= handLimit) {
            return Optional.empty();
        }
        CardInstance card = deck.remove(0);
        hand.add(card);
        return Optional.of(card);
    }

    /**
     * Plays a hand card onto the field with the given stance and star.
     * <p>
     * A card already on the field is sacrificed to the graveyard and remembered for
     * {@link #undoLastPlay()}.
     *
     * @return {@code false} if {@code handIndex} is out of range
     */
    public boolean playToField(int handIndex, Stance stance, StarChoice starChoice) {
        if (handIndex < 0 || handIndex >= hand.size() || stance == null || starChoice == null) {
            return false;
        }
        lastSacrificed = null;
        if (field != null) {
            graveyard.add(field);
            lastSacrificed = field;
        }
        CardInstance card = hand.remove(handIndex);
        card.setStance(stance);
        card.selectStar(starChoice);
        field = card;
        return true;
    }

    /**
     * Returns the field card to the end of the hand and, if the card it replaced is still on top of
     * the graveyard, puts that card back on the field.
     *
     * @return {@code false} if the field is empty
     */
    public boolean undoLastPlay() {
        if (field == null) {
            return false;
        }
        hand.add(field);
        field = null;
        if (lastSacrificed != null) {
            if (!graveyard.isEmpty() && graveyard.get(graveyard.size() - 1) == lastSacrificed) {
                field = graveyard.remove(graveyard.size() - 1);
            }
            lastSacrificed = null;
        }
        return true;
    }

    /**
     * Checks whether the hand cards at {@code i} and {@code j} fuse.
     *
     * @return a fresh instance of the result, or empty when the indices are equal, out of range or
     *         no recipe matches
     */
    public Optional<CardInstance> canCombine(int i, int j) {
        if (i == j || i < 0 || j < 0 || i >= hand.size() || j >= hand.size()) {
            return Optional.empty();
        }
        return catalog.fuse(hand.get(i).getCard(), hand.get(j).getCard()).map(CardInstance::new);
    }

    /**
     * Fuses the hand cards at {@code i} and {@code j}: both go to the graveyard and the result joins
     * the end of the hand.
     *
     * @return the result card, or empty (state unchanged) if the pair does not fuse
     */
    public Optional<CardInstance> combine(int i, int j) {
        Optional<CardInstance> result = canCombine(i, j);
        if (result.isEmpty()) {
            return result;
        }
        // Remove the higher index first so the lower one stays valid.
        int high = Math.max(i, j);
        int low = Math.min(i, j);
        graveyard.add(hand.remove(high));
        graveyard.add(hand.remove(low));
        hand.add(result.get());
        return result;
    }

    /**
     * Lists every fusable pair in the hand, scanning {@code i < j} in index order.
     */
    public List<Combination> possibleCombinations() {
        List<Combination> combinations = new ArrayList<>();
        for (int i = 0; i < hand.size(); i++) {
            for (int j = i + 1; j < hand.size(); j++) {
                Optional<CardInstance> result = canCombine(i, j);
                if (result.isPresent()) {
                    combinations.add(new Combination(i, j, result.get()));
                }
            }
        }
        return combinations;
    }

    /**
     * Returns true when deck, hand and field are all empty (the player has decked out).
     */
    public boolean isOutOfCards() {
        return deck.isEmpty() && hand.isEmpty() && field == null;
    }

    /**
     * Moves the field card to the graveyard. Used by battle resolution.
     */
    void destroyFieldCard() {
        if (field != null) {
            graveyard.add(field);
            field = null;
        }
    }

    /**
     * Subtracts battle damage from the life total. Life may go negative.
     */
    public void loseLifePoints(int amount) {
        lifePoints -= amount;
    }

    // ---------------------------------------------------------------------
    // Dealing and seeding
    // ---------------------------------------------------------------------

    /**
     * Appends cards to the bottom of the deck.
     */
    public void addToDeck(Collection<CardInstance> cards) {
        for (CardInstance card : cards) {
            deck.add(Objects.requireNonNull(card, "card"));
        }
    }

    /**
     * Puts a card straight into the hand if there is room.
     *
     * @return {@code false} if the hand is full
     */
    public boolean addToHand(CardInstance card) {
        Objects.requireNonNull(card, "card");
        if (hand.size() >= handLimit) {
            return false;
        }
        hand.add(card);
        return true;
    }

    /**
     * Puts a card straight onto the field, replacing (and discarding) any card already there.
     * Does not touch the undo record.
     */
    public void placeOnField(CardInstance card) {
        Objects.requireNonNull(card, "card");
        if (field != null) {
            graveyard.add(field);
        }
        field = card;
    }

    public void setLifePoints(int lifePoints) {
        this.lifePoints = lifePoints;
    }

    // ---------------------------------------------------------------------
    // Read-only views
    // ---------------------------------------------------------------------

    public String getName() {
        return name;
    }

    public boolean isAiControlled() {
        return aiControlled;
    }

    public int getLifePoints() {
        return lifePoints;
    }

    public int getHandLimit() {
        return handLimit;
    }

    public List<CardInstance> getDeck() {
        return Collections.unmodifiableList(deck);
    }

    public List<CardInstance> getHand() {
        return Collections.unmodifiableList(hand);
    }

    public List<CardInstance> getGraveyard() {
        return Collections.unmodifiableList(graveyard);
    }

    public Optional<CardInstance> getField() {
        return Optional.ofNullable(field);
    }

    public boolean hasFieldCard() {
        return field != null;
    }

    /**
     * The card the latest play replaced, if it can still be restored.
     */
    public Optional<CardInstance> getLastSacrificed() {
        return Optional.ofNullable(lastSacrificed);
    }

    /**
     * The next card this player will draw, if any.
     */
    public Optional<CardInstance> peekDeck() {
        return deck.isEmpty() ? Optional.empty() : Optional.of(deck.get(0));
    }

    @Override
    public String toString() {
        return name + "(LP=" + lifePoints + ", deck=" + deck.size() + ", hand=" + hand.size()
                + ", field=" + (field != null ? field.getName() : "-") + ")";
    }
}
