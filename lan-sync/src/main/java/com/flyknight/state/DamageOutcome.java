package com.flyknight.state;

/**
 * Result of applying damage to an enemy in the store.
 *
 * @param kind    what happened
 * @param enemyId the targeted enemy
 * @param hp      remaining health; meaningful only for {@link Kind#DAMAGED}
 */
public record DamageOutcome(Kind kind, int enemyId, int hp) {

    public enum Kind {
        /** The enemy was not (or no longer) in the snapshot. */
        ABSENT,
        /** The enemy survived with {@code hp} left. */
        DAMAGED,
        /** The enemy's health dropped to zero or below and it was removed. */
        DIED
    }

    static DamageOutcome absent(int enemyId) {
        return new DamageOutcome(Kind.ABSENT, enemyId, 0);
    }

    static DamageOutcome damaged(int enemyId, int hp) {
        return new DamageOutcome(Kind.DAMAGED, enemyId, hp);
    }

    static DamageOutcome died(int enemyId) {
        return new DamageOutcome(Kind.DIED, enemyId, 0);
    }
}
