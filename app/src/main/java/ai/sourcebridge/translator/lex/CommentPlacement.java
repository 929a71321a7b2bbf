package ai.sourcebridge.translator.lex;

/**
 * Where a comment sits relative to the statement it belongs to.
 */
public enum CommentPlacement {
    /** Own line, before the statement. */
    LEADING,
    /** Same line, after the statement. */
    TRAILING,
    /** Not a comment token. */
    NONE
}
