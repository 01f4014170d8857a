package org.terminalheist.item;

public enum ItemType {
    // opens closed doors; kept after use
    KEYCARD('k'),

    // the data shard that unlocks the exit
    OBJECTIVE('$');

    public final char glyph;

    ItemType(char glyph) {
        this.glyph = glyph;
    }

    /** @return the item drawn with {@code c}, or null if none */
    public static ItemType fromGlyph(char c) {
        for (ItemType t : values()) {
            if (t.glyph == c) return t;
        }
        return null;
    }
}
