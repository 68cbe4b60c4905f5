package com.asrayaos.firstflame;

import com.asrayaos.firstflame.config.ConfigurationException;
import com.asrayaos.firstflame.seeding.SeedingOutcome;
import com.asrayaos.firstflame.seeding.SeedingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Runs seeding directly, without a scheduler, for each user id given on the command line.
 *
 * <p>Exit status: 0 when every run is done, 1 when any run failed, 2 on usage or
 * configuration errors.
 */
public class SeedFirstFlameCommand {
    private static final Logger logger = LoggerFactory.getLogger(SeedFirstFlameCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.println("Usage: SeedFirstFlameCommand <user-id> [<user-id>...]");
            System.exit(EXIT_USAGE);
        }

        FirstFlameSeeding seeding;
        try {
            seeding = FirstFlameSeeding.fromEnvironment();
        } catch (ConfigurationException e) {
            System.err.println("Configuration error: " + e.getMessage());
            System.exit(EXIT_USAGE);
            return;
        }

        int status;
        try {
            status = run(seeding, args, System.out);
        } finally {
            try {
                seeding.close();
            } catch (Exception e) {
                logger.warn("Error closing seeder: {}", e.getMessage());
            }
        }
        System.exit(status);
    }

    /**
     * Seeds every user in order and prints one line per outcome.
     *
     * @param service the seeding service
     * @param userIds the users to seed
     * @param out     where outcome lines are printed
     * @return the process exit status
     */
    static int run(SeedingService service, String[] userIds, PrintStream out) {
        int status = EXIT_OK;
        for (String userId : userIds) {
            SeedingOutcome outcome = service.runSeeding(userId);
            if (outcome.isDone()) {
                out.println(userId + " DONE quest=" + outcome.getQuestId());
            } else {
                out.println(userId + " FAILED(" + outcome.getReason().getStep() + ") "
                        + outcome.getFailure().getMessage());
                status = EXIT_FAILED;
            }
        }
        return status;
    }
}
