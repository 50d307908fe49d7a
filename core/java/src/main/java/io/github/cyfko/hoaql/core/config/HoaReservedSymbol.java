package io.github.cyfko.hoaql.core.config;

/**
 * Reserved tokens of the HOA format shared by the formula renderer and the document printer.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class HoaReservedSymbol {

    private HoaReservedSymbol() {}

    /**
     * Boolean constant TRUE in labels, acceptance conditions and header values.
     */
    public static final String TRUE = "t";

    /**
     * Boolean constant FALSE in labels, acceptance conditions and header values.
     */
    public static final String FALSE = "f";

    public static final String NOT = "!";
    public static final String AND = "&";
    public static final String OR = "|";

    /**
     * Separator between the header and the body.
     */
    public static final String BODY = "--BODY--";

    /**
     * Terminator of an automaton.
     */
    public static final String END = "--END--";
}
