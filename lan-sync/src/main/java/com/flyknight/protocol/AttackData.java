package com.flyknight.protocol;

/**
 * Description of a swing as computed by the attacking client's combat logic.
 * The host relays it for visual feedback only; hits are reported separately
 * through {@code enemy_damage}.
 */
public record AttackData(double damage, double range, double angle, double x, double y) {
}
