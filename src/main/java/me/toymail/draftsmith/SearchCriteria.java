package me.toymail.draftsmith;

/**
 * Which inbox messages a poll considers.
 */
public enum SearchCriteria {
    UNSEEN,
    ALL
}
