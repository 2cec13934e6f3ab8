package com.flyknight.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Network view of a single player.
 *
 * Flat and self-describing: no references to other entities, so it can be
 * serialized verbatim. Produced each frame by the owning client's game loop
 * and absorbed by the host into the next broadcast.
 *
 * An empty equipment slot is simply absent from {@code equipped}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlayerView(
        @JsonProperty("player_id") int playerId,
        String name,
        double x,
        double y,
        double hp,
        @JsonProperty("max_hp") double maxHp,
        double stamina,
        @JsonProperty("max_stamina") double maxStamina,
        @JsonProperty("facing_angle") double facingAngle,
        @JsonProperty("is_attacking") boolean attacking,
        @JsonProperty("is_blocking") boolean blocking,
        @JsonProperty("is_sprinting") boolean sprinting,
        Map<String, EquippedItem> equipped) {

    public PlayerView {
        equipped = equipped == null ? Map.of() : Map.copyOf(equipped);
    }

    /**
     * Returns a copy owned by the given player. The host uses this to pin an
     * update to the session it arrived on, whatever id the client put in it.
     */
    public PlayerView withPlayerId(int newPlayerId) {
        if (newPlayerId == playerId) {
            return this;
        }
        return new PlayerView(newPlayerId, name, x, y, hp, maxHp, stamina, maxStamina,
                facingAngle, attacking, blocking, sprinting, equipped);
    }

    public PlayerView withPosition(double newX, double newY) {
        return new PlayerView(playerId, name, newX, newY, hp, maxHp, stamina, maxStamina,
                facingAngle, attacking, blocking, sprinting, equipped);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int playerId;
        private String name = "FlyKnight";
        private double x = 0;
        private double y = 0;
        private double hp = 100;
        private double maxHp = 100;
        private double stamina = 100;
        private double maxStamina = 100;
        private double facingAngle = 0;
        private boolean attacking;
        private boolean blocking;
        private boolean sprinting;
        private Map<String, EquippedItem> equipped = Map.of();

        public Builder playerId(int playerId) {
            this.playerId = playerId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder position(double x, double y) {
            this.x = x;
            this.y = y;
            return this;
        }

        public Builder hp(double hp, double maxHp) {
            this.hp = hp;
            this.maxHp = maxHp;
            return this;
        }

        public Builder stamina(double stamina, double maxStamina) {
            this.stamina = stamina;
            this.maxStamina = maxStamina;
            return this;
        }

        public Builder facingAngle(double facingAngle) {
            this.facingAngle = facingAngle;
            return this;
        }

        public Builder attacking(boolean attacking) {
            this.attacking = attacking;
            return this;
        }

        public Builder blocking(boolean blocking) {
            this.blocking = blocking;
            return this;
        }

        public Builder sprinting(boolean sprinting) {
            this.sprinting = sprinting;
            return this;
        }

        public Builder equipped(Map<String, EquippedItem> equipped) {
            this.equipped = equipped;
            return this;
        }

        public PlayerView build() {
            return new PlayerView(playerId, name, x, y, hp, maxHp, stamina, maxStamina,
                    facingAngle, attacking, blocking, sprinting, equipped);
        }
    }
}
