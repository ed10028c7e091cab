package ai.duel.game;

/**
 * A pair of hand indices ({@code first < second}) whose cards fuse into {@code result}.
 * <p>
 * {@code result} is a fresh instance that is not owned by anyone until the fusion is executed.
 */
public record Combination(int first, int second, CardInstance result) {
}
