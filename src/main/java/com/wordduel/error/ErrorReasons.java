package com.wordduel.error;

public final class ErrorReasons {
    public static final String INVALID_IDENTITY = "invalid_identity";
    public static final String INVALID_DIFFICULTY = "invalid_difficulty";
    public static final String INVALID_LETTER = "invalid_letter";
    public static final String INVALID_WORD = "invalid_word";
    public static final String LETTER_ALREADY_GUESSED = "letter_already_guessed";

    public static final String SESSION_NOT_FOUND = "session_not_found";
    public static final String NO_ACTIVE_SESSION = "no_active_session";
    public static final String NOT_A_MEMBER = "not_a_member";
    public static final String NO_WORDS = "no_words";

    public static final String SESSION_COMPLETED = "session_completed";
    public static final String SESSION_NOT_ACTIVE = "session_not_active";
    public static final String SESSION_NOT_WAITING = "session_not_waiting";
    public static final String NOT_YOUR_TURN = "not_your_turn";
    public static final String ALREADY_JOINED = "already_joined";
    public static final String OPEN_SESSION_EXISTS = "open_session_exists";
    public static final String NOTHING_TO_REVEAL = "nothing_to_reveal";
    public static final String CONCURRENT_MODIFICATION = "concurrent_modification";

    public static final String INSUFFICIENT_FUNDS = "insufficient_funds";

    public static final String SESSION_EXPIRED = "session_expired";

    private ErrorReasons() {}
}
