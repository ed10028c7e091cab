package ai.duel.game;

import java.util.Objects;

/**
 * A card as it exists inside one duel: a {@link Card} definition plus the stance and active star
 * chosen when it was played.
 * <p>
 * Instances are mutable and owned by exactly one {@link Player}. Whenever a state is copied for
 * search, every instance is copied with {@link #copy()} so sibling branches never share one.
 * Equality is identity; two instances of the same definition are different cards.
 */
public final class CardInstance {
    private final Card card;
    private Stance stance = Stance.ATTACK;
    private StarChoice starChoice = StarChoice.FIRST;

    public CardInstance(Card card) {
        this.card = Objects.requireNonNull(card, "card");
    }

    /**
     * Returns an independent copy carrying the same stance and active star.
     */
    public CardInstance copy() {
        CardInstance clone = new CardInstance(card);
        clone.stance = stance;
        clone.starChoice = starChoice;
        return clone;
    }

    public Card getCard() {
        return card;
    }

    public String getName() {
        return card.getName();
    }

    public int getAttack() {
        return card.getAttack();
    }

    public int getDefense() {
        return card.getDefense();
    }

    public GuardianStar getFirstStar() {
        return card.getFirstStar();
    }

    public GuardianStar getSecondStar() {
        return card.getSecondStar();
    }

    public Stance getStance() {
        return stance;
    }

    public void setStance(Stance stance) {
        this.stance = Objects.requireNonNull(stance, "stance");
    }

    public StarChoice getStarChoice() {
        return starChoice;
    }

    public void selectStar(StarChoice choice) {
        this.starChoice = Objects.requireNonNull(choice, "choice");
    }

    /**
     * The guardian star this card currently fights under.
     */
    public GuardianStar getActiveStar() {
        return card.star(starChoice);
    }

    /**
     * Stat this card contributes when defending: attack in {@link Stance#ATTACK},
     * defense in {@link Stance#DEFENSE}.
     */
    public int getStanceValue() {
        return stance == Stance.ATTACK ? card.getAttack() : card.getDefense();
    }

    @Override
    public String toString() {
        return card.getName() + " " + stance.getCode() + " " + getActiveStar();
    }
}
