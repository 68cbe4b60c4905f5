package com.asrayaos.firstflame.participant;

import com.asrayaos.firstflame.config.SeedingConfig;
import com.asrayaos.firstflame.supabase.RitualStore;

/**
 * Picks the participant seeding strategy named by the configuration.
 */
public final class ParticipantSeeders {

    private ParticipantSeeders() {
    }

    public static ParticipantSeeder forConfig(SeedingConfig config, RitualStore store) {
        switch (config.getParticipantMode()) {
            case RPC:
                return new RpcParticipantSeeder(store);
            case UPSERTS:
                return new UpsertParticipantSeeder(store, config.isResetProgress());
            default:
                throw new IllegalArgumentException("Unknown participant mode: " + config.getParticipantMode());
        }
    }
}
