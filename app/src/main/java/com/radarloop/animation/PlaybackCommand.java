package com.radarloop.animation;

/**
 * User commands understood by {@link AnimationSession#dispatch(PlaybackCommand)}.
 */
public enum PlaybackCommand {
    TOGGLE_PLAY,
    TOGGLE_PAUSE,
    STEP_FORWARD,
    STEP_BACKWARD;

    /**
     * Keyboard shortcuts: {@code ,} previous, {@code .} next, {@code /} pause or resume.
     *
     * @return the command bound to {@code key}, or null
     */
    public static PlaybackCommand fromKey(char key) {
        switch (key) {
            case ',':
                return STEP_BACKWARD;
            case '.':
                return STEP_FORWARD;
            case '/':
                return TOGGLE_PAUSE;
            default:
                return null;
        }
    }
}
