package com.asrayaos.firstflame.seeding;

/**
 * States of one seeding run. {@link #DONE} and {@link #FAILED} are terminal.
 */
public enum SeedingState {
    START,
    QUEST_READY,
    PARTICIPANT_READY,
    CONTENT_VALIDATED,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
