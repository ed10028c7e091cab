package ai.duel.game;

/**
 * Which branch of the battle table a confrontation took.
 */
public enum BattleOutcome {
    /** Attacker beat a defender in attack stance: defender destroyed, its owner takes the difference. */
    ATTACKER_WINS,
    /** Attacker beat a defender in defense stance: defender destroyed, no damage. */
    DEFENDER_DESTROYED,
    /** Defender in attack stance beat the attacker: attacker destroyed, its owner takes the difference. */
    DEFENDER_WINS,
    /** Defender in defense stance held: attacker's owner takes the difference, nothing destroyed. */
    REBOUND,
    /** Equal values against attack stance: both cards destroyed. */
    MUTUAL_DESTRUCTION,
    /** Equal values against defense stance: nothing happens. */
    STALEMATE
}
