package ai.duel.game;

import java.util.Locale;

/**
 * Elemental attribute of a monster card.
 * <p>
 * Each attribute maps to a pair of guardian stars. The primary star becomes a card's first star;
 * the secondary star is the fallback used when the type-derived star would duplicate the first.
 */
public enum Attribute {
    LIGHT("Light", GuardianStar.SUN, GuardianStar.MERCURY),
    DARK("Dark", GuardianStar.MOON, GuardianStar.VENUS),
    FIRE("Fire", GuardianStar.MARS, GuardianStar.SUN),
    WATER("Water", GuardianStar.NEPTUNE, GuardianStar.MOON),
    EARTH("Earth", GuardianStar.URANUS, GuardianStar.JUPITER),
    WIND("Wind", GuardianStar.SATURN, GuardianStar.JUPITER),
    DIVINE("Divine", GuardianStar.SUN, GuardianStar.MOON);

    private final String label;
    private final GuardianStar primaryStar;
    private final GuardianStar secondaryStar;

    Attribute(String label, GuardianStar primaryStar, GuardianStar secondaryStar) {
        this.label = label;
        this.primaryStar = primaryStar;
        this.secondaryStar = secondaryStar;
    }

    public String getLabel() {
        return label;
    }

    public GuardianStar getPrimaryStar() {
        return primaryStar;
    }

    public GuardianStar getSecondaryStar() {
        return secondaryStar;
    }

    /**
     * Resolves an attribute from its label, ignoring case and surrounding whitespace.
     *
     * @param label attribute label such as "Dark"
     * @return the matching attribute
     * @throws IllegalArgumentException if the label is unknown
     */
    public static Attribute fromLabel(String label) {
        if (label != null) {
            String wanted = label.trim().toLowerCase(Locale.ROOT);
            for (Attribute attribute : values()) {
                if (attribute.label.toLowerCase(Locale.ROOT).equals(wanted)) {
                    return attribute;
                }
            }
        }
        throw new IllegalArgumentException("Unknown attribute: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
