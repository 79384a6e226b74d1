package com.phillippitts.voicecompanion.service.follow;

/**
 * Decision taken for a debounced owner presence transition.
 */
public enum FollowAction {
    /** none to channel */
    JOIN,
    /** channel A to channel B */
    MOVE,
    /** channel to none */
    LEAVE,
    /** same channel (mute, deafen, ...) or none to none */
    IGNORE;

    static FollowAction classify(String before, String after) {
        if (before == null && after != null) {
            return JOIN;
        }
        if (before != null && after != null && !before.equals(after)) {
            return MOVE;
        }
        if (before != null && after == null) {
            return LEAVE;
        }
        return IGNORE;
    }
}
