package com.example.pawnsim.model.component;

import com.example.pawnsim.model.TileCoord;
import com.example.pawnsim.model.action.ActionDef;
import lombok.Data;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

@Data
public class ActionComponent {

    public static final long UNSET = -1;

    private ActionDef currentAction;
    private long actionStartTick;
    private final Deque<ActionDef> queue = new ArrayDeque<>();

    private List<TileCoord> currentPath;
    private int pathIndex;

    private long blockedSinceTick = UNSET;
    private long waitUntilTick = UNSET;

    public boolean isIdle() {
        return currentAction == null && queue.isEmpty();
    }

    public void enqueue(ActionDef action) {
        queue.addLast(action);
    }

    public void pushFront(ActionDef action) {
        queue.addFirst(action);
    }

    // Starts an action at the given tick with fresh movement state.
    public void begin(ActionDef action, long tick) {
        currentAction = action;
        actionStartTick = tick;
        resetMovement();
    }

    public void finishCurrent() {
        currentAction = null;
        resetMovement();
    }

    // Drops the current action and everything queued after it.
    public void clear() {
        finishCurrent();
        queue.clear();
    }

    public void resetMovement() {
        currentPath = null;
        pathIndex = 0;
        blockedSinceTick = UNSET;
        waitUntilTick = UNSET;
    }
}
