package ai.duel.player.ai;

/**
 * Named difficulty levels. The only thing a difficulty changes is the search depth.
 */
public enum Difficulty {
    EASY(2, "Easy"),
    NORMAL(4, "Normal"),
    HARD(6, "Hard"),
    EXPERT(8, "Expert");

    private final int depth;
    private final String displayName;

    Difficulty(int depth, String displayName) {
        this.depth = depth;
        this.displayName = displayName;
    }

    /**
     * Reference search depth for this level.
     */
    public int getDepth() {
        return depth;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Level for an arbitrary depth: up to 2 is Easy, up to 4 Normal, up to 6 Hard, deeper is Expert.
     */
    public static Difficulty forDepth(int depth) {
        if (depth <= EASY.depth) {
            return EASY;
        }
        if (depth <= NORMAL.depth) {
            return NORMAL;
        }
        if (depth <= HARD.depth) {
            return HARD;
        }
        return EXPERT;
    }
}
