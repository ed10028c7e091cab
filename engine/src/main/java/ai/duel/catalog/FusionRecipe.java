package ai.duel.catalog;

import ai.duel.game.Attribute;
import ai.duel.game.Card;
import ai.duel.game.MonsterType;
import java.util.Objects;

/**
 * Two material names and the stat block of the card they fuse into.
 * <p>
 * Material matching ignores case and order: a recipe registered as (Y, X) also matches (X, Y).
 */
public record FusionRecipe(
        String firstMaterial,
        String secondMaterial,
        String resultName,
        int resultAttack,
        int resultDefense,
        Attribute resultAttribute,
        MonsterType resultType) {

    /** Level given to every fusion result. */
    public static final int RESULT_LEVEL = 7;

    public FusionRecipe {
        Objects.requireNonNull(firstMaterial, "firstMaterial");
        Objects.requireNonNull(secondMaterial, "secondMaterial");
        Objects.requireNonNull(resultName, "resultName");
        Objects.requireNonNull(resultAttribute, "resultAttribute");
        Objects.requireNonNull(resultType, "resultType");
    }

    /**
     * Returns true if the two names are this recipe's materials, in either order.
     */
    public boolean matches(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return (firstMaterial.equalsIgnoreCase(a) && secondMaterial.equalsIgnoreCase(b))
                || (firstMaterial.equalsIgnoreCase(b) && secondMaterial.equalsIgnoreCase(a));
    }

    /**
     * Builds the result card definition.
     *
     * @param id identifier to give the result
     */
    public Card toCard(int id) {
        return new Card(id, resultName, resultType, resultAttack, resultDefense, resultAttribute, RESULT_LEVEL);
    }
}
