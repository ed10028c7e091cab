package ai.duel.catalog;

import ai.duel.game.Card;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only catalog of monster definitions and fusion recipes.
 * <p>
 * Built once at startup (see {@link CardCatalogLoader}) and passed to every component that needs
 * it. The catalog is immutable, so it can be shared by every copy of a match state.
 * <p>
 * Fusion results are synthesised per recipe with id {@code 9000 + recipe index}; when several
 * recipes match the same pair of materials, the first registered wins.
 */
public final class CardCatalog {
    /** Base identifier for synthesised fusion results. */
    public static final int FUSION_ID_BASE = 9000;

    private final List<Card> cards;
    private final List<FusionRecipe> recipes;
    private final Map<Integer, Card> byId = new HashMap<>();
    private final Map<String, Card> byName = new HashMap<>();
    private final Map<String, Card> fusionResults = new HashMap<>();

    public CardCatalog(List<Card> cards, List<FusionRecipe> recipes) {
        this.cards = Collections.unmodifiableList(new ArrayList<>(cards));
        this.recipes = Collections.unmodifiableList(new ArrayList<>(recipes));
        for (Card card : this.cards) {
            byId.put(card.getId(), card);
            byName.put(normalise(card.getName()), card);
        }
        for (int i = 0; i < this.recipes.size(); i++) {
            FusionRecipe recipe = this.recipes.get(i);
            fusionResults.putIfAbsent(pairKey(recipe.firstMaterial(), recipe.secondMaterial()),
                    recipe.toCard(FUSION_ID_BASE + i));
        }
    }

    /**
     * All monster definitions in load order.
     */
    public List<Card> cards() {
        return cards;
    }

    /**
     * All fusion recipes in load order.
     */
    public List<FusionRecipe> recipes() {
        return recipes;
    }

    public int size() {
        return cards.size();
    }

    public Optional<Card> findById(int id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Looks up a definition by exact name, ignoring case.
     */
    public Optional<Card> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(normalise(name)));
    }

    /**
     * Resolves the fusion of two material names, in either order.
     *
     * @return the result definition, or empty if no recipe combines them
     */
    public Optional<Card> fuse(String first, String second) {
        if (first == null || second == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(fusionResults.get(pairKey(first, second)));
    }

    /**
     * Resolves the fusion of two definitions by name.
     */
    public Optional<Card> fuse(Card first, Card second) {
        if (first == null || second == null) {
            return Optional.empty();
        }
        return fuse(first.getName(), second.getName());
    }

    private static String normalise(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    // Order-independent key: the two normalised names sorted and joined.
    private static String pairKey(String a, String b) {
        String x = normalise(a);
        String y = normalise(b);
        return x.compareTo(y) <= 0 ? x + '\u0000' + y : y + '\u0000' + x;
    }

    @Override
    public String toString() {
        return "CardCatalog(cards=" + cards.size() + ", recipes=" + recipes.size() + ")";
    }
}
