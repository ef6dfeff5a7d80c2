package org.levelforge.core.io;

import org.levelforge.core.model.GameObject;
import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.ObjectType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Text rendering: one glyph per tile, rows separated by '\n'. Objects, when given, are
 * drawn over their tile.
 */
public class AsciiLevelRenderer {

    static final Map<ObjectType, Character> OBJECT_GLYPHS = new EnumMap<>(ObjectType.class);
    static {
        OBJECT_GLYPHS.put(ObjectType.ENEMY, 'E');
        OBJECT_GLYPHS.put(ObjectType.ITEM, 'i');
        OBJECT_GLYPHS.put(ObjectType.TREASURE, '$');
        OBJECT_GLYPHS.put(ObjectType.TRAP, 'x');
        OBJECT_GLYPHS.put(ObjectType.DECORATION, '*');
        OBJECT_GLYPHS.put(ObjectType.INTERACTIVE, '!');
        OBJECT_GLYPHS.put(ObjectType.QUEST_OBJECT, 'Q');
        OBJECT_GLYPHS.put(ObjectType.CHECKPOINT, 'C');
        OBJECT_GLYPHS.put(ObjectType.LIGHT_SOURCE, 'L');
        OBJECT_GLYPHS.put(ObjectType.COVER, '=');
    }

    public static String render(GeneratedLevel level) {
        return render(level, List.of());
    }

    public static String render(GeneratedLevel level, List<GameObject> objects) {
        char[][] rows = new char[level.height()][level.width()];
        for (int y = 0; y < level.height(); y++) {
            for (int x = 0; x < level.width(); x++) {
                rows[y][x] = level.tileAt(x, y).glyph();
            }
        }
        for (GameObject o : objects) {
            int x = o.position().x();
            int y = o.position().y();
            if (level.tiles().inBounds(x, y)) {
                rows[y][x] = OBJECT_GLYPHS.get(o.type());
            }
        }

        StringBuilder sb = new StringBuilder((level.width() + 1) * level.height());
        for (int y = 0; y < level.height(); y++) {
            if (y > 0) sb.append('\n');
            sb.append(rows[y]);
        }
        return sb.toString();
    }
}
