package org.terminalheist.game.event;

@FunctionalInterface
public interface GameEventListener {
    void onEvent(GameEvent event);
}
