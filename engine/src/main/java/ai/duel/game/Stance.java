package ai.duel.game;

import java.util.Locale;

/**
 * Battle position of a card on the field.
 * <p>
 * A defending card in {@link #ATTACK} contributes its attack stat and dies when it loses; in
 * {@link #DEFENSE} it contributes its defense stat, is destroyed only by a strictly stronger
 * attacker, and never makes its owner take damage.
 */
public enum Stance {
    ATTACK("ATK"),
    DEFENSE("DEF");

    private final String code;

    Stance(String code) {
        this.code = code;
    }

    /**
     * Short code used in commands and on the board ("ATK" / "DEF").
     */
    public String getCode() {
        return code;
    }

    /**
     * Parses "ATK"/"DEF" (or the full enum names), ignoring case.
     *
     * @return the stance, or {@code null} if the token is not recognised
     */
    public static Stance fromCode(String token) {
        if (token == null) {
            return null;
        }
        String t = token.trim().toUpperCase(Locale.ROOT);
        for (Stance stance : values()) {
            if (stance.code.equals(t) || stance.name().equals(t)) {
                return stance;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return code;
    }
}
