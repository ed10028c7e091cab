package ai.duel.game;

/**
 * Which of a card's two guardian stars is active.
 */
public enum StarChoice {
    FIRST(1),
    SECOND(2);

    private final int number;

    StarChoice(int number) {
        this.number = number;
    }

    /**
     * 1-based number used in commands.
     */
    public int getNumber() {
        return number;
    }

    /**
     * @return the choice for 1 or 2, otherwise {@code null}
     */
    public static StarChoice fromNumber(int number) {
        if (number == 1) {
            return FIRST;
        }
        if (number == 2) {
            return SECOND;
        }
        return null;
    }

    @Override
    public String toString() {
        return Integer.toString(number);
    }
}
