package org.levelforge.core.model;

/**
 * Tile codes of a generated level. Codes are stable and used by exported dumps.
 */
public enum TileType {
    EMPTY(0, ' '),
    WALL(1, '#'),
    FLOOR(2, '.'),
    DOOR(3, '+'),
    WATER(4, '~'),
    OBSTACLE(5, 'o'),
    SPAWN(6, 'S'),
    GOAL(7, 'G'),
    SECRET(8, '?'),
    TRAP(9, '^');

    private final int code;
    private final char glyph;

    TileType(int code, char glyph) {
        this.code = code;
        this.glyph = glyph;
    }

    public int code() {
        return code;
    }

    public char glyph() {
        return glyph;
    }

    /** Tiles a character can stand on. */
    public boolean isWalkable() {
        return switch (this) {
            case FLOOR, DOOR, SPAWN, GOAL -> true;
            default -> false;
        };
    }

    public static TileType fromCode(int code) {
        for (TileType t : values()) {
            if (t.code == code) return t;
        }
        throw new IllegalArgumentException("Unknown tile code: " + code);
    }
}
