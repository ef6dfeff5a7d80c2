package org.levelforge.core.model;

public enum ObjectType {
    ENEMY("enemy"),
    ITEM("item"),
    TREASURE("treasure"),
    TRAP("trap"),
    DECORATION("decoration"),
    INTERACTIVE("interactive"),
    QUEST_OBJECT("quest_object"),
    CHECKPOINT("checkpoint"),
    LIGHT_SOURCE("light_source"),
    COVER("cover");

    private final String tag;

    ObjectType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
