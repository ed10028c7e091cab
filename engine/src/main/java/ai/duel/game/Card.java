package ai.duel.game;

import java.util.Objects;

/**
 * Immutable catalog definition of a monster card.
 * <p>
 * A card carries its base stats and the two guardian stars derived from its attribute and type.
 * Per-duel state (stance, active star) lives on {@link CardInstance}; a definition is shared freely
 * between instances and between copies of a {@link MatchState}.
 */
public final class Card {
    private final int id;
    private final String name;
    private final MonsterType type;
    private final int attack;
    private final int defense;
    private final Attribute attribute;
    private final int level;
    private final GuardianStar firstStar;
    private final GuardianStar secondStar;

    /**
     * Constructs a card and assigns its guardian stars.
     *
     * @throws NullPointerException if name, type or attribute is null
     */
    public Card(int id, String name, MonsterType type, int attack, int defense, Attribute attribute, int level) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.attack = attack;
        this.defense = defense;
        this.attribute = Objects.requireNonNull(attribute, "attribute");
        this.level = level;
        this.firstStar = attribute.getPrimaryStar();
        this.secondStar = assignSecondStar(attribute, type);
    }

    /**
     * The second star comes from the type; when it would repeat the first star the attribute's
     * secondary star is used instead, so the pair is always distinct.
     */
    private static GuardianStar assignSecondStar(Attribute attribute, MonsterType type) {
        GuardianStar candidate = type.getSecondaryStar();
        if (candidate == attribute.getPrimaryStar()) {
            candidate = attribute.getSecondaryStar();
        }
        if (candidate == attribute.getPrimaryStar()) {
            throw new IllegalStateException("Cannot assign distinct guardian stars for " + attribute + "/" + type);
        }
        return candidate;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public MonsterType getType() {
        return type;
    }

    public int getAttack() {
        return attack;
    }

    public int getDefense() {
        return defense;
    }

    public Attribute getAttribute() {
        return attribute;
    }

    public int getLevel() {
        return level;
    }

    public GuardianStar getFirstStar() {
        return firstStar;
    }

    public GuardianStar getSecondStar() {
        return secondStar;
    }

    /**
     * Returns the star selected by {@code choice}.
     */
    public GuardianStar star(StarChoice choice) {
        return choice == StarChoice.SECOND ? secondStar : firstStar;
    }

    /**
     * Better of attack and defense; used when judging a card's raw strength.
     */
    public int strongestStat() {
        return Math.max(attack, defense);
    }

    /**
     * Checks whether this card has the given name (case-insensitive).
     */
    public boolean matchesName(String other) {
        if (other == null) {
            return false;
        }
        return name.equalsIgnoreCase(other.trim());
    }

    @Override
    public String toString() {
        return name + " (ATK:" + attack + "/DEF:" + defense + ") [" + firstStar + "/" + secondStar + "]";
    }

    /**
     * Two definitions are equal when id and name match; stats are assumed to follow.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return id == card.id && name.equals(card.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }
}
