package skirmish.game;

/**
 * The moves a combatant can make on its turn.
 * {@link #NONE} is what a playstyle answers when no valid move exists.
 */
public enum Action {
    ATTACK('A'),
    SPECIAL('S'),
    NONE('X');

    private final char key;

    Action(char key) {
        this.key = key;
    }

    public char getKey() {
        return key;
    }

    public static Action fromKey(char key) {
        switch (Character.toUpperCase(key)) {
            case 'A': return ATTACK;
            case 'S': return SPECIAL;
            default: return NONE;
        }
    }
}
