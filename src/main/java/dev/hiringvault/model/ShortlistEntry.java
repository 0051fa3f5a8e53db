package dev.hiringvault.model;

import lombok.Value;

/**
 * One exported shortlist line. The label is the alias unless the candidate was revealed.
 */
@Value
public class ShortlistEntry {
    String label;
    int score;
    boolean revealed;
}
