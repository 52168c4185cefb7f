package skirmish.ai;

/**
 * Keys understood in AI profile files ({@code /ai/<Name>.ai}).
 */
public final class AiProps {
    /** Cache exact scores of already searched positions during a decision. */
    public static final String USE_TRANSPOSITION_TABLE = "UseTranspositionTable";
    /** Maximum number of cached positions before the least recently used are evicted. */
    public static final String TRANSPOSITION_TABLE_SIZE = "TranspositionTableSize";
    /** Print every scored move to stderr. */
    public static final String SEARCH_TRACE = "SearchTrace";
    /** Turns after which a simulated battle is called a draw. */
    public static final String MAX_TURNS = "MaxTurns";

    private AiProps() {
    }
}
