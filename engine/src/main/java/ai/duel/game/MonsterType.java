package ai.duel.game;

import java.util.Locale;

/**
 * Monster category. The second star of the pair is what a card of this type contributes as its
 * second guardian star.
 */
public enum MonsterType {
    DRAGON("Dragon", GuardianStar.MARS, GuardianStar.MOON),
    SPELLCASTER("Spellcaster", GuardianStar.MERCURY, GuardianStar.VENUS),
    WARRIOR("Warrior", GuardianStar.URANUS, GuardianStar.SUN),
    BEAST("Beast", GuardianStar.JUPITER, GuardianStar.SATURN),
    BEAST_WARRIOR("Beast-Warrior", GuardianStar.JUPITER, GuardianStar.URANUS),
    WINGED_BEAST("Winged-Beast", GuardianStar.SATURN, GuardianStar.JUPITER),
    FIEND("Fiend", GuardianStar.MOON, GuardianStar.VENUS),
    ZOMBIE("Zombie", GuardianStar.MOON, GuardianStar.PLUTO),
    MACHINE("Machine", GuardianStar.PLUTO, GuardianStar.URANUS),
    AQUA("Aqua", GuardianStar.NEPTUNE, GuardianStar.MOON),
    FISH("Fish", GuardianStar.NEPTUNE, GuardianStar.SATURN),
    SEA_SERPENT("Sea-Serpent", GuardianStar.NEPTUNE, GuardianStar.MARS),
    REPTILE("Reptile", GuardianStar.URANUS, GuardianStar.NEPTUNE),
    PYRO("Pyro", GuardianStar.MARS, GuardianStar.SUN),
    THUNDER("Thunder", GuardianStar.PLUTO, GuardianStar.SATURN),
    ROCK("Rock", GuardianStar.URANUS, GuardianStar.MARS),
    PLANT("Plant", GuardianStar.JUPITER, GuardianStar.SUN),
    INSECT("Insect", GuardianStar.JUPITER, GuardianStar.MOON),
    FAIRY("Fairy", GuardianStar.SUN, GuardianStar.VENUS),
    DINOSAUR("Dinosaur", GuardianStar.URANUS, GuardianStar.MARS);

    private final String label;
    private final GuardianStar primaryStar;
    private final GuardianStar secondaryStar;

    MonsterType(String label, GuardianStar primaryStar, GuardianStar secondaryStar) {
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
     * Resolves a type from its catalog label ("Beast-Warrior", "Sea-Serpent", ...).
     *
     * @throws IllegalArgumentException if the label is unknown
     */
    public static MonsterType fromLabel(String label) {
        if (label != null) {
            String wanted = label.trim().toLowerCase(Locale.ROOT);
            for (MonsterType type : values()) {
                if (type.label.toLowerCase(Locale.ROOT).equals(wanted)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown monster type: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
