package io.github.drompincen.scenarioagent.protocol.api;

/**
 * One of the three answer shapes a resumption call may carry.
 */
public interface Answer {

    /** Identifier of the prompt being answered: clarification, selection or plan id. */
    String promptId();
}
