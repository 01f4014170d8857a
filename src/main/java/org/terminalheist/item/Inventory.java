package org.terminalheist.item;

import java.util.EnumMap;
import java.util.Map;

/** Item counts carried by the player. Keycards are never used up, so counts only grow. */
public final class Inventory {
    private final Map<ItemType, Integer> counts = new EnumMap<>(ItemType.class);

    public int count(ItemType type) {
        return counts.getOrDefault(type, 0);
    }

    public boolean has(ItemType type) {
        return count(type) > 0;
    }

    public void add(ItemType type, int amount) {
        if (type == null || amount <= 0) return;
        counts.put(type, count(type) + amount);
    }

    public Map<ItemType, Integer> snapshot() {
        return new EnumMap<>(counts);
    }
}
