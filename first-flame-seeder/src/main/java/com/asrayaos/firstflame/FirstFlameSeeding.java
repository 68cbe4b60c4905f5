package com.asrayaos.firstflame;

import com.asrayaos.firstflame.config.SeedingConfig;
import com.asrayaos.firstflame.content.ContentValidator;
import com.asrayaos.firstflame.notify.Notifier;
import com.asrayaos.firstflame.participant.ParticipantSeeders;
import com.asrayaos.firstflame.quest.QuestRegistry;
import com.asrayaos.firstflame.seeding.SeedingOrchestrator;
import com.asrayaos.firstflame.seeding.SeedingOutcome;
import com.asrayaos.firstflame.seeding.SeedingService;
import com.asrayaos.firstflame.supabase.PostgrestRitualStore;
import com.asrayaos.firstflame.supabase.RitualStore;
import com.asrayaos.firstflame.supabase.RpcBroadcastPublisher;
import com.asrayaos.firstflame.supabase.StorageContentStore;
import com.asrayaos.firstflame.supabase.SupabaseClient;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;

/**
 * Wires the seeding components against a Supabase project and owns the shared HTTP client.
 * One instance serves any number of concurrent runs.
 */
public class FirstFlameSeeding implements SeedingService, Closeable {
    private static final Logger logger = LoggerFactory.getLogger(FirstFlameSeeding.class);

    private final SeedingConfig config;
    private final SupabaseClient client;
    private final SeedingOrchestrator orchestrator;

    private FirstFlameSeeding(SeedingConfig config, SupabaseClient client, SeedingOrchestrator orchestrator) {
        this.config = config;
        this.client = client;
        this.orchestrator = orchestrator;
    }

    /**
     * Builds the seeder from the process environment.
     *
     * @return a ready seeder
     * @throws com.asrayaos.firstflame.config.ConfigurationException if the credentials are missing
     */
    public static FirstFlameSeeding fromEnvironment() {
        return create(SeedingConfig.fromEnvironment(System.getenv()));
    }

    /**
     * Builds the seeder for the given configuration.
     *
     * @param config the resolved configuration
     * @return a ready seeder
     */
    public static FirstFlameSeeding create(SeedingConfig config) {
        ObjectMapper objectMapper = newObjectMapper();
        SupabaseClient client = new SupabaseClient(config, objectMapper);
        RitualStore store = new PostgrestRitualStore(client);

        SeedingOrchestrator orchestrator = new SeedingOrchestrator(
            new QuestRegistry(store, config),
            ParticipantSeeders.forConfig(config, store),
            new ContentValidator(new StorageContentStore(client, config.getBucket()), objectMapper, config),
            new Notifier(new RpcBroadcastPublisher(client), objectMapper, config.getChannel()));

        logger.info("First-Flame seeder configured: {}", config);
        return new FirstFlameSeeding(config, client, orchestrator);
    }

    static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public SeedingOutcome runSeeding(String userId) {
        return orchestrator.runSeeding(userId);
    }

    public SeedingConfig getConfig() {
        return config;
    }

    @Override
    public void close() throws IOException {
        client.close();
    }
}
