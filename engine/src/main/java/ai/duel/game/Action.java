package ai.duel.game;

import java.util.Locale;
import java.util.Objects;

/**
 * Structured form of a duel command.
 *
 * <p><b>Command shapes</b> (0-based hand indices):
 * <ul>
 *   <li>{@code play <index> <ATK|DEF> <1|2>}: put a hand card on the field</li>
 *   <li>{@code fuse <i> <j>}: combine two hand cards</li>
 *   <li>{@code pass}: keep the current field as it is</li>
 * </ul>
 *
 * <p>Plays and fusions may carry the card name they refer to ({@link #cardName()} /
 * {@link #resultName()}) for display. Names are not part of equality.
 */
public final class Action {

    public enum Type {
        PLAY,
        COMBINE,
        PASS
    }

    private static final Action PASS = new Action(Type.PASS, -1, null, null, -1, -1, null);

    private final Type type;
    private final int handIndex;
    private final Stance stance;
    private final StarChoice starChoice;
    private final int first;
    private final int second;
    private final String label;

    private Action(Type type, int handIndex, Stance stance, StarChoice starChoice, int first, int second, String label) {
        this.type = Objects.requireNonNull(type, "type");
        this.handIndex = handIndex;
        this.stance = stance;
        this.starChoice = starChoice;
        this.first = first;
        this.second = second;
        this.label = label;
    }

    /**
     * Play the card at {@code handIndex}.
     */
    public static Action play(int handIndex, Stance stance, StarChoice starChoice) {
        return play(handIndex, stance, starChoice, null);
    }

    /**
     * Play the card at {@code handIndex}, remembering its name for display.
     */
    public static Action play(int handIndex, Stance stance, StarChoice starChoice, String cardName) {
        return new Action(Type.PLAY, handIndex, Objects.requireNonNull(stance, "stance"),
                Objects.requireNonNull(starChoice, "starChoice"), -1, -1, cardName);
    }

    /**
     * Fuse the hand cards at {@code first} and {@code second}.
     */
    public static Action combine(int first, int second) {
        return combine(first, second, null);
    }

    /**
     * Fuse the hand cards at {@code first} and {@code second}, remembering the result name.
     */
    public static Action combine(int first, int second, String resultName) {
        return new Action(Type.COMBINE, -1, null, null, first, second, resultName);
    }

    public static Action pass() {
        return PASS;
    }

    public Type type() {
        return type;
    }

    public boolean isPlay() {
        return type == Type.PLAY;
    }

    public boolean isCombine() {
        return type == Type.COMBINE;
    }

    public boolean isPass() {
        return type == Type.PASS;
    }

    /**
     * Hand index for plays; -1 otherwise.
     */
    public int handIndex() {
        return handIndex;
    }

    /**
     * Stance for plays; null otherwise.
     */
    public Stance stance() {
        return stance;
    }

    /**
     * Star choice for plays; null otherwise.
     */
    public StarChoice starChoice() {
        return starChoice;
    }

    /**
     * First hand index for fusions; -1 otherwise.
     */
    public int first() {
        return first;
    }

    /**
     * Second hand index for fusions; -1 otherwise.
     */
    public int second() {
        return second;
    }

    /**
     * Name of the played card, if known.
     */
    public String cardName() {
        return type == Type.PLAY ? label : null;
    }

    /**
     * Name of the fusion result, if known.
     */
    public String resultName() {
        return type == Type.COMBINE ? label : null;
    }

    /**
     * Returns a copy of this play with a different stance and star, keeping index and name.
     */
    public Action withStanceAndStar(Stance newStance, StarChoice newStar) {
        if (type != Type.PLAY) {
            throw new IllegalStateException("Only plays carry a stance and star: " + this);
        }
        return play(handIndex, newStance, newStar, label);
    }

    /**
     * Normalised command string, e.g. {@code play 2 DEF 1}, {@code fuse 0 3}, {@code pass}.
     */
    public String toCommandString() {
        return switch (type) {
            case PLAY -> "play " + handIndex + " " + stance.getCode() + " " + starChoice.getNumber();
            case COMBINE -> "fuse " + first + " " + second;
            case PASS -> "pass";
        };
    }

    /**
     * Command string plus the card name when one is attached.
     */
    public String describe() {
        if (label == null) {
            return toCommandString();
        }
        return toCommandString() + " (" + label + ")";
    }

    @Override
    public String toString() {
        return toCommandString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Action other)) {
            return false;
        }
        return type == other.type
                && handIndex == other.handIndex
                && stance == other.stance
                && starChoice == other.starChoice
                && first == other.first
                && second == other.second;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, handIndex, stance, starChoice, first, second);
    }

    /**
     * Parses a command string.
     *
     * @throws IllegalArgumentException if the command is not a play, fuse or pass
     */
    public static Action parse(String command) {
        Action action = tryParse(command);
        if (action == null) {
            throw new IllegalArgumentException("Unrecognised command: " + command);
        }
        return action;
    }

    /**
     * Attempts to parse a command string.
     * <p>
     * Accepts {@code pass} (or {@code end}), {@code play <i> <ATK|DEF> <1|2>} where stance and star
     * default to ATK and 1 when omitted, and {@code fuse <i> <j>} (or {@code combine}).
     *
     * @return the action, or {@code null} if the command is blank or malformed
     */
    public static Action tryParse(String command) {
        if (command == null) {
            return null;
        }
        String trimmed = command.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        String[] parts = trimmed.split("\\s+");
        String verb = parts[0].toLowerCase(Locale.ROOT);
        switch (verb) {
            case "pass", "end" -> {
                return parts.length == 1 ? PASS : null;
            }
            case "play" -> {
                if (parts.length < 2 || parts.length > 4) {
                    return null;
                }
                Integer index = parseIndex(parts[1]);
                Stance stance = parts.length >= 3 ? Stance.fromCode(parts[2]) : Stance.ATTACK;
                StarChoice star = StarChoice.FIRST;
                if (parts.length == 4) {
                    Integer number = parseIndex(parts[3]);
                    star = number != null ? StarChoice.fromNumber(number) : null;
                }
                if (index == null || stance == null || star == null) {
                    return null;
                }
                return play(index, stance, star);
            }
            case "fuse", "combine" -> {
                if (parts.length != 3) {
                    return null;
                }
                Integer i = parseIndex(parts[1]);
                Integer j = parseIndex(parts[2]);
                if (i == null || j == null) {
                    return null;
                }
                return combine(i, j);
            }
            default -> {
                return null;
            }
        }
    }

    private static Integer parseIndex(String token) {
        try {
            int value = Integer.parseInt(token.trim());
            return value >= 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
