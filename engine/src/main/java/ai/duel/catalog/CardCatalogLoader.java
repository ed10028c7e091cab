package ai.duel.catalog;

import ai.duel.game.Attribute;
import ai.duel.game.Card;
import ai.duel.game.MonsterType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link CardCatalog} from two JSON documents: an array of monsters and an array of
 * fusion recipes.
 *
 * <pre>
 * [{"id": 1, "name": "Blue-Eyes White Dragon", "type": "Dragon", "attack": 3000,
 *   "defense": 2500, "attribute": "Light", "level": 8}, ...]
 *
 * [{"first": "Baby Dragon", "second": "Time Wizard", "name": "Thousand Dragon",
 *   "attack": 2400, "defense": 2000, "attribute": "Wind", "type": "Dragon"}, ...]
 * </pre>
 *
 * Types and attributes are given by their labels. Unknown JSON properties are ignored; unknown
 * labels and missing names fail the load.
 */
public class CardCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CardCatalogLoader.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /**
     * Loads both documents from the classpath.
     *
     * @param monstersResource classpath location of the monsters array, e.g. {@code catalog/monsters.json}
     * @param fusionsResource  classpath location of the recipes array
     * @throws IllegalStateException if a resource is missing or malformed
     */
    public CardCatalog loadFromClasspath(String monstersResource, String fusionsResource) {
        ClassLoader classLoader = CardCatalogLoader.class.getClassLoader();
        try (InputStream monsters = open(classLoader, monstersResource);
             InputStream fusions = open(classLoader, fusionsResource)) {
            CardCatalog catalog = load(monsters, fusions);
            log.info("Loaded {} monsters and {} fusion recipes from {} and {}",
                    catalog.size(), catalog.recipes().size(), monstersResource, fusionsResource);
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load card catalog from "
                    + monstersResource + " and " + fusionsResource, e);
        }
    }

    /**
     * Loads both documents from streams. The streams are read fully but not closed.
     */
    public CardCatalog load(InputStream monsters, InputStream fusions) throws IOException {
        List<MonsterEntry> monsterEntries = OBJECT_MAPPER.readValue(monsters, new TypeReference<List<MonsterEntry>>() { });
        List<FusionEntry> fusionEntries = OBJECT_MAPPER.readValue(fusions, new TypeReference<List<FusionEntry>>() { });

        List<Card> cards = new ArrayList<>(monsterEntries.size());
        for (MonsterEntry entry : monsterEntries) {
            cards.add(entry.toCard());
        }
        List<FusionRecipe> recipes = new ArrayList<>(fusionEntries.size());
        for (FusionEntry entry : fusionEntries) {
            recipes.add(entry.toRecipe());
        }
        if (log.isDebugEnabled()) {
            log.debug("Parsed {} monster entries and {} fusion entries", cards.size(), recipes.size());
        }
        return new CardCatalog(cards, recipes);
    }

    private static InputStream open(ClassLoader classLoader, String resource) throws IOException {
        InputStream in = classLoader.getResourceAsStream(resource);
        if (in == null) {
            throw new IOException("Classpath resource not found: " + resource);
        }
        return in;
    }

    private static String requireName(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Catalog entry is missing '" + field + "'");
        }
        return value.trim();
    }

    /**
     * JSON shape of one monster.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MonsterEntry {
        private int id;
        private String name;
        private String type;
        private int attack;
        private int defense;
        private String attribute;
        private int level;

        public MonsterEntry() {
            // Default constructor for JSON binding.
        }

        Card toCard() {
            return new Card(id, requireName(name, "name"), MonsterType.fromLabel(type), attack, defense,
                    Attribute.fromLabel(attribute), level);
        }

        public int getId() {
            return id;
        }

        public void setId(int id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public int getAttack() {
            return attack;
        }

        public void setAttack(int attack) {
            this.attack = attack;
        }

        public int getDefense() {
            return defense;
        }

        public void setDefense(int defense) {
            this.defense = defense;
        }

        public String getAttribute() {
            return attribute;
        }

        public void setAttribute(String attribute) {
            this.attribute = attribute;
        }

        public int getLevel() {
            return level;
        }

        public void setLevel(int level) {
            this.level = level;
        }
    }

    /**
     * JSON shape of one recipe: the two materials and the result's stat block.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FusionEntry {
        private String first;
        private String second;
        private String name;
        private int attack;
        private int defense;
        private String attribute;
        private String type;

        public FusionEntry() {
            // Default constructor for JSON binding.
        }

        FusionRecipe toRecipe() {
            return new FusionRecipe(requireName(first, "first"), requireName(second, "second"),
                    requireName(name, "name"), attack, defense, Attribute.fromLabel(attribute), MonsterType.fromLabel(type));
        }

        public String getFirst() {
            return first;
        }

        public void setFirst(String first) {
            this.first = first;
        }

        public String getSecond() {
            return second;
        }

        public void setSecond(String second) {
            this.second = second;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getAttack() {
            return attack;
        }

        public void setAttack(int attack) {
            this.attack = attack;
        }

        public int getDefense() {
            return defense;
        }

        public void setDefense(int defense) {
            this.defense = defense;
        }

        public String getAttribute() {
            return attribute;
        }

        public void setAttribute(String attribute) {
            this.attribute = attribute;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }
}
