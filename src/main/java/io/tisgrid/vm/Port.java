package io.tisgrid.vm;

import java.util.Locale;

/**
 * Communication endpoints. The four directions name real neighbors; ANY, LAST
 * and NIL are resolved by the node at run time.
 */
public enum Port {
    UP, DOWN, LEFT, RIGHT, ANY, LAST, NIL;

    /** Order in which a send to ANY offers the value to neighbors. */
    static final Port[] ANY_ORDER = {UP, LEFT, RIGHT, DOWN};

    public boolean isDirection() {
        return this == UP || this == DOWN || this == LEFT || this == RIGHT;
    }

    /** The port a neighbor sees this direction as: UP is the other node's DOWN. */
    public Port mirror() {
        switch (this) {
            case UP: return DOWN;
            case DOWN: return UP;
            case LEFT: return RIGHT;
            case RIGHT: return LEFT;
            default:
                throw new IllegalStateException(this + " has no mirrored direction");
        }
    }

    public String mnemonic() {
        return name().toLowerCase(Locale.ROOT);
    }
}
