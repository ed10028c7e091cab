package ai.duel.game;

/**
 * The ten guardian stars a card can fight under.
 * <p>
 * Every star is strong against exactly one other star and weak against exactly one other star.
 * The stars split into two rings: the celestial ring (Sun, Moon, Venus, Mercury) and the
 * planetary ring (Mars, Jupiter, Saturn, Uranus, Pluto, Neptune). Within a ring each star beats
 * the next one, and the last beats the first.
 * <p>
 * The star advantage is directional: {@code SUN.bonusAgainst(MOON)} is {@code +500} while
 * {@code MOON.bonusAgainst(SUN)} is {@code -500}. Always compute the bonus separately for each
 * side of a confrontation.
 */
public enum GuardianStar {
    SUN("Sun"),
    MOON("Moon"),
    VENUS("Venus"),
    MERCURY("Mercury"),
    MARS("Mars"),
    JUPITER("Jupiter"),
    SATURN("Saturn"),
    URANUS("Uranus"),
    PLUTO("Pluto"),
    NEPTUNE("Neptune");

    /** Battle value adjustment granted (or taken) by a star advantage. */
    public static final int STAR_BONUS = 500;

    private final String label;

    GuardianStar(String label) {
        this.label = label;
    }

    /**
     * Returns the star this star dominates.
     *
     * @return the star that loses {@link #STAR_BONUS} against this one
     */
    public GuardianStar strongAgainst() {
        return switch (this) {
            case SUN -> MOON;
            case MOON -> VENUS;
            case VENUS -> MERCURY;
            case MERCURY -> SUN;
            case MARS -> JUPITER;
            case JUPITER -> SATURN;
            case SATURN -> URANUS;
            case URANUS -> PLUTO;
            case PLUTO -> NEPTUNE;
            case NEPTUNE -> MARS;
        };
    }

    /**
     * Returns the star that dominates this star.
     *
     * @return the star that gains {@link #STAR_BONUS} against this one
     */
    public GuardianStar weakAgainst() {
        return switch (this) {
            case SUN -> MERCURY;
            case MOON -> SUN;
            case VENUS -> MOON;
            case MERCURY -> VENUS;
            case MARS -> NEPTUNE;
            case JUPITER -> MARS;
            case SATURN -> JUPITER;
            case URANUS -> SATURN;
            case PLUTO -> URANUS;
            case NEPTUNE -> PLUTO;
        };
    }

    /**
     * Combat bonus this star earns when fighting a card under {@code opponent}.
     *
     * @param opponent the opposing card's active star; {@code null} yields no bonus
     * @return {@code +500} on advantage, {@code -500} on disadvantage, otherwise {@code 0}
     */
    public int bonusAgainst(GuardianStar opponent) {
        if (opponent == null) {
            return 0;
        }
        if (strongAgainst() == opponent) {
            return STAR_BONUS;
        }
        if (weakAgainst() == opponent) {
            return -STAR_BONUS;
        }
        return 0;
    }

    /**
     * Static form of {@link #bonusAgainst(GuardianStar)}; the attacker's star comes first.
     */
    public static int combatBonus(GuardianStar attacker, GuardianStar defender) {
        if (attacker == null) {
            return 0;
        }
        return attacker.bonusAgainst(defender);
    }

    /**
     * Returns the display label (e.g. "Sun").
     */
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
