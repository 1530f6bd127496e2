package com.example.pawnsim.engine.system;

import com.example.pawnsim.content.BuffDef;
import com.example.pawnsim.content.BuildingDef;
import com.example.pawnsim.content.TerrainDef;
import com.example.pawnsim.engine.SimContext;
import com.example.pawnsim.engine.SimSystem;
import com.example.pawnsim.entity.EntityStore;
import com.example.pawnsim.model.EntityId;
import com.example.pawnsim.model.TileCoord;
import com.example.pawnsim.model.action.ActionDef;
import com.example.pawnsim.model.action.ActionType;
import com.example.pawnsim.model.action.ExpressionType;
import com.example.pawnsim.model.component.ActionComponent;
import com.example.pawnsim.model.component.BuffInstance;
import com.example.pawnsim.model.component.BuffSource;
import com.example.pawnsim.model.component.BuildingComponent;
import com.example.pawnsim.model.component.InventoryComponent;
import com.example.pawnsim.model.component.PawnComponent;
import com.example.pawnsim.model.component.PositionComponent;
import com.example.pawnsim.model.component.ResourceComponent;
import com.example.pawnsim.pathfinding.Pathfinder;
import com.example.pawnsim.world.BuildingFootprint;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Advances each pawn's current action by one tick and pulls the next one off the queue when it finishes.
 *
 * <p>Movement is paced by time: a pawn steps onto the next path tile once
 * {@value #MOVE_TICKS_PER_TILE} ticks per tile have passed since the move started.
 * A pawn whose next tile is taken by another pawn waits a random 5-20 ticks and then
 * re-plans around it; after {@value #MAX_BLOCKED_TICKS} blocked ticks it gives up and
 * drops its whole queue. Wandering pawns step aside at once for pawns with somewhere to be.
 *
 * <p>Building interactions only run from a use-area tile. A pawn that is not on one gets a
 * move inserted in front of the interaction; a building that turns out to be taken, gone
 * or unreachable cancels the whole plan. Shortfalls in stock or gold still cost the pawn its
 * time but deny the benefit.
 */
@Slf4j
public class ActionSystem implements SimSystem {

    public static final int MOVE_TICKS_PER_TILE = 10;
    public static final int MAX_BLOCKED_TICKS = 50;
    static final int MIN_WAIT_TICKS = 5;
    static final int MAX_WAIT_TICKS = 20;
    static final int RESULT_IDLE_TICKS = 20;

    @Override
    public void tick(SimContext ctx) {
        EntityStore entities = ctx.getEntities();
        for (EntityId pawn : entities.allPawns()) {
            Optional<ActionComponent> found = entities.getActions().get(pawn);
            if (found.isEmpty()) {
                continue;
            }
            ActionComponent ac = found.get();
            if (ac.getCurrentAction() == null) {
                if (ac.getQueue().isEmpty()) {
                    continue;
                }
                ac.begin(ac.getQueue().pollFirst(), ctx.now());
            }

            switch (ac.getCurrentAction().getType()) {
                case IDLE -> {
                    if (ctx.now() - ac.getActionStartTick() >= ac.getCurrentAction().getDurationTicks()) {
                        ac.finishCurrent();
                    }
                }
                case MOVE_TO -> executeMove(ctx, pawn, ac);
                case USE_BUILDING, WORK, DROP_OFF -> executeBuildingInteraction(ctx, pawn, ac);
                case PICK_UP -> executePickUp(ctx, pawn, ac);
                default -> ac.finishCurrent();
            }
        }
    }

    // =================================================
    // Movement
    // =================================================

    private void executeMove(SimContext ctx, EntityId pawn, ActionComponent ac) {
        ActionDef action = ac.getCurrentAction();
        Optional<PositionComponent> pos = ctx.getEntities().getPositions().get(pawn);
        TileCoord target = action.getTargetCoord();
        if (target == null || pos.isEmpty()) {
            ac.finishCurrent();
            return;
        }
        PositionComponent position = pos.get();
        Set<TileCoord> occupied = ctx.getEntities().pawnTiles(pawn);

        if (ac.getCurrentPath() == null) {
            Optional<List<TileCoord>> path = Pathfinder.findPath(ctx.getWorld(), position.getCoord(), target, occupied);
            if (path.isEmpty()) {
                log.debug("{} cannot reach {}; dropping '{}' and {} queued action(s)",
                        nameOf(ctx, pawn), target, action.getDisplayName(), ac.getQueue().size());
                ac.clear();
                return;
            }
            ac.setCurrentPath(path.get());
            ac.setPathIndex(0);
        }

        List<TileCoord> path = ac.getCurrentPath();
        long elapsed = ctx.now() - ac.getActionStartTick();
        int expected = (int) Math.min(elapsed / MOVE_TICKS_PER_TILE, path.size() - 1);

        if (expected > ac.getPathIndex()) {
            TileCoord next = path.get(ac.getPathIndex() + 1);

            if (!ctx.getWorld().isWalkable(next)) {
                // something was built on the path since it was planned
                Optional<List<TileCoord>> replanned = Pathfinder.findPath(ctx.getWorld(), position.getCoord(), target, occupied);
                if (replanned.isEmpty()) {
                    log.debug("{} lost its way to {}", nameOf(ctx, pawn), target);
                    ac.clear();
                } else {
                    restartPath(ctx, ac, replanned.get());
                }
                return;
            }

            Optional<EntityId> blocker = ctx.getEntities().pawnAt(next, pawn);
            if (blocker.isPresent()) {
                handleBlocked(ctx, pawn, ac, blocker.get(), position.getCoord(), target, occupied);
                return;
            }

            boolean wasBlocked = ac.getBlockedSinceTick() != ActionComponent.UNSET;
            ac.setBlockedSinceTick(ActionComponent.UNSET);
            ac.setWaitUntilTick(ActionComponent.UNSET);
            ac.setPathIndex(ac.getPathIndex() + 1);
            position.setCoord(next);
            if (wasBlocked) {
                // resume pacing from the tile just reached instead of catching up in one jump
                ac.setActionStartTick(ctx.now() - (long) ac.getPathIndex() * MOVE_TICKS_PER_TILE);
            }
        }

        if (position.getCoord().equals(target)) {
            ac.finishCurrent();
        }
    }

    private void handleBlocked(SimContext ctx, EntityId pawn, ActionComponent ac, EntityId blocker,
                               TileCoord from, TileCoord target, Set<TileCoord> occupied) {
        long now = ctx.now();
        if (ac.getBlockedSinceTick() == ActionComponent.UNSET) {
            ac.setBlockedSinceTick(now);
        }
        if (now - ac.getBlockedSinceTick() >= MAX_BLOCKED_TICKS) {
            log.debug("{} blocked for {} ticks on the way to {}; giving up", nameOf(ctx, pawn), MAX_BLOCKED_TICKS, target);
            ac.clear();
            return;
        }

        if (ac.getCurrentAction().isWander() && !isWandering(ctx, blocker)) {
            ac.finishCurrent();
            return;
        }

        if (ac.getWaitUntilTick() == ActionComponent.UNSET) {
            ac.setWaitUntilTick(now + MIN_WAIT_TICKS + ctx.getRandom().nextInt(MAX_WAIT_TICKS - MIN_WAIT_TICKS + 1));
            return;
        }
        if (now < ac.getWaitUntilTick()) {
            return;
        }

        ac.setWaitUntilTick(ActionComponent.UNSET);
        // the blocked clock keeps running until the pawn actually takes a step
        long blockedSince = ac.getBlockedSinceTick();
        Pathfinder.findPath(ctx.getWorld(), from, target, occupied).ifPresent(path -> {
            restartPath(ctx, ac, path);
            ac.setBlockedSinceTick(blockedSince);
        });
    }

    private void restartPath(SimContext ctx, ActionComponent ac, List<TileCoord> path) {
        ac.setCurrentPath(path);
        ac.setPathIndex(0);
        ac.setActionStartTick(ctx.now());
        ac.setBlockedSinceTick(ActionComponent.UNSET);
        ac.setWaitUntilTick(ActionComponent.UNSET);
    }

    private boolean isWandering(SimContext ctx, EntityId pawn) {
        return ctx.getEntities().getActions().get(pawn)
                .map(ActionComponent::getCurrentAction)
                .map(ActionDef::isWander)
                .orElse(false);
    }

    // =================================================
    // Buildings
    // =================================================

    private void executeBuildingInteraction(SimContext ctx, EntityId pawn, ActionComponent ac) {
        ActionDef action = ac.getCurrentAction();
        EntityId target = action.getTargetEntity();
        Optional<BuildingComponent> building = target == null ? Optional.empty() : ctx.getEntities().getBuildings().get(target);
        Optional<BuildingDef> def = building.flatMap(b -> ctx.getContent().getBuildings().find(b.getBuildingDefId()));
        Optional<TileCoord> anchor = target == null ? Optional.empty() : ctx.getEntities().positionOf(target);
        if (building.isEmpty() || def.isEmpty() || anchor.isEmpty()) {
            log.debug("{} dropped '{}': target building {} no longer exists", nameOf(ctx, pawn), action.getDisplayName(), target);
            ac.clear();
            return;
        }

        List<TileCoord> useTiles = BuildingFootprint.useAreaTiles(anchor.get(), def.get());
        if (!ensurePositioned(ctx, pawn, ac, useTiles, def.get().getName())) {
            return;
        }

        BuildingComponent bc = building.get();
        if (bc.isUsedByOther(pawn)) {
            log.debug("{} found {} taken by {}", nameOf(ctx, pawn), def.get().getName(), nameOf(ctx, bc.getUsedBy()));
            ac.clear();
            return;
        }
        if (!pawn.equals(bc.getUsedBy())) {
            bc.claim(pawn);
            ac.setCurrentAction(action.withDisplayName(activeLabel(action.getType(), def.get())));
            action = ac.getCurrentAction();
        }

        if (ctx.now() - ac.getActionStartTick() < action.getDurationTicks()) {
            return;
        }

        boolean success = switch (action.getType()) {
            case WORK -> completeWork(ctx, pawn, target, def.get(), action);
            case DROP_OFF -> completeDropOff(ctx, pawn, target, def.get(), action);
            default -> completeUse(ctx, pawn, target, def.get(), action);
        };

        if (success) {
            ctx.getEntities().getAttachments().get(target).ifPresent(a -> a.increment(pawn));
        }
        bc.release();
        ac.finishCurrent();
        if (ac.getQueue().isEmpty()) {
            ac.enqueue(ActionDef.idle(RESULT_IDLE_TICKS, success ? "Satisfied" : "Disappointed",
                    success ? ExpressionType.HAPPY : ExpressionType.COMPLAINT, def.get().getId()));
        }
    }

    private boolean completeUse(SimContext ctx, EntityId pawn, EntityId building, BuildingDef def, ActionDef action) {
        if (!def.isCanSellToConsumers()) {
            return false;
        }
        Optional<ResourceComponent> store = ctx.getEntities().getResources().get(building);
        int consumed = def.consumptionPerUse();
        if (store.isPresent() && store.get().getCurrentAmount() < consumed) {
            log.debug("{} is out of {}", def.getName(), store.get().getResourceType());
            return false;
        }
        if (!Economy.transfer(ctx.getEntities(), pawn, building, def.getCost())) {
            log.debug("{} cannot afford {} ({} gold)", nameOf(ctx, pawn), def.getName(), def.getCost());
            return false;
        }
        store.ifPresent(s -> s.take(consumed));
        satisfy(ctx, pawn, action);
        grantBuff(ctx, pawn, BuffSource.BUILDING, def.getId(), def.getGrantsBuffId());
        return true;
    }

    private boolean completeWork(SimContext ctx, EntityId pawn, EntityId building, BuildingDef def, ActionDef action) {
        if (!def.isCanBeWorkedAt() || !Economy.settleWork(ctx.getEntities(), pawn, building, def)) {
            return false;
        }
        ctx.getEntities().getResources().get(building).ifPresent(s -> s.store(def.getWorkProduction()));
        satisfy(ctx, pawn, action);
        grantBuff(ctx, pawn, BuffSource.WORK, def.getId(), def.getWorkBuffId());
        return true;
    }

    private boolean completeDropOff(SimContext ctx, EntityId pawn, EntityId building, BuildingDef def, ActionDef action) {
        Optional<InventoryComponent> inventory = ctx.getEntities().getInventory().get(pawn);
        Optional<ResourceComponent> store = ctx.getEntities().getResources().get(building);
        if (inventory.isEmpty() || store.isEmpty() || inventory.get().isEmpty()
                || !store.get().getResourceType().equals(inventory.get().getResourceType())) {
            return false;
        }
        int delivered = Math.min(Math.min(inventory.get().getAmount(), action.getResourceAmount()), store.get().room());
        if (delivered <= 0) {
            return false;
        }
        inventory.get().remove(delivered);
        store.get().store(delivered);
        Economy.payWholesale(ctx.getEntities(), building, action.getSourceEntity(), delivered, def.getWholesalePricePerUnit());

        // stowing leftovers is not paid work
        if (action.getSatisfiesNeedId() == null) {
            return true;
        }
        if (!Economy.settleWork(ctx.getEntities(), pawn, building, def)) {
            return false;
        }
        satisfy(ctx, pawn, action);
        grantBuff(ctx, pawn, BuffSource.WORK, def.getId(), def.getWorkBuffId());
        return true;
    }

    // =================================================
    // Hauling
    // =================================================

    private void executePickUp(SimContext ctx, EntityId pawn, ActionComponent ac) {
        ActionDef action = ac.getCurrentAction();
        Optional<InventoryComponent> inventory = ctx.getEntities().getInventory().get(pawn);
        if (inventory.isEmpty() || action.getResourceType() == null) {
            ac.clear();
            return;
        }

        EntityId source = action.getSourceEntity();
        Optional<ResourceComponent> store = Optional.empty();
        if (source != null) {
            store = ctx.getEntities().getResources().get(source);
            Optional<BuildingDef> def = ctx.getEntities().getBuildings().get(source)
                    .flatMap(b -> ctx.getContent().getBuildings().find(b.getBuildingDefId()));
            Optional<TileCoord> anchor = ctx.getEntities().positionOf(source);
            if (store.isEmpty() || def.isEmpty() || anchor.isEmpty()) {
                log.debug("{} dropped '{}': source {} no longer exists", nameOf(ctx, pawn), action.getDisplayName(), source);
                ac.clear();
                return;
            }
            if (!ensurePositioned(ctx, pawn, ac, BuildingFootprint.useAreaTiles(anchor.get(), def.get()), def.get().getName())) {
                return;
            }
        } else {
            TileCoord tile = action.getTargetCoord();
            if (tile == null) {
                ac.clear();
                return;
            }
            String place = ctx.getContent().getTerrains().find(ctx.getWorld().getTile(tile).getTerrainTypeId())
                    .map(TerrainDef::getName).orElse("harvest spot");
            if (!ensurePositioned(ctx, pawn, ac, Navigation.harvestTiles(ctx, tile), place)) {
                return;
            }
        }

        if (ctx.now() - ac.getActionStartTick() < action.getDurationTicks()) {
            return;
        }

        int available = store.map(s -> Math.min(action.getResourceAmount(), s.getCurrentAmount()))
                .orElse(action.getResourceAmount());
        int taken = inventory.get().add(action.getResourceType(), available);
        store.ifPresent(s -> s.take(taken));
        if (taken == 0) {
            log.debug("{} picked up nothing; abandoning delivery", nameOf(ctx, pawn));
            ac.clear();
            return;
        }
        ac.finishCurrent();
    }

    // =================================================
    // Shared
    // =================================================

    /**
     * True when the pawn already stands on one of {@code tiles}. Otherwise the current action is put
     * back at the head of the queue behind a move to the nearest free reachable tile, or the whole
     * plan is dropped when there is none.
     */
    private boolean ensurePositioned(SimContext ctx, EntityId pawn, ActionComponent ac, List<TileCoord> tiles, String placeName) {
        Optional<TileCoord> here = ctx.getEntities().positionOf(pawn);
        if (here.isEmpty()) {
            ac.clear();
            return false;
        }
        if (tiles.contains(here.get())) {
            return true;
        }
        Optional<TileCoord> destination = Navigation.nearestReachable(ctx, pawn, here.get(), tiles);
        if (destination.isEmpty()) {
            log.debug("{} cannot reach {}; dropping '{}' and {} queued action(s)",
                    nameOf(ctx, pawn), placeName, ac.getCurrentAction().getDisplayName(), ac.getQueue().size());
            ac.clear();
            return false;
        }
        ac.pushFront(ac.getCurrentAction());
        ac.begin(ActionDef.moveTo(destination.get(), "Going to " + placeName), ctx.now());
        return false;
    }

    private void satisfy(SimContext ctx, EntityId pawn, ActionDef action) {
        if (action.getSatisfiesNeedId() == null) {
            return;
        }
        ctx.getEntities().getNeeds().get(pawn)
                .ifPresent(needs -> needs.add(action.getSatisfiesNeedId(), action.getNeedSatisfactionAmount()));
    }

    /** Applies or refreshes a buff; the new instance runs for the buff's full duration from now. */
    private void grantBuff(SimContext ctx, EntityId pawn, BuffSource source, int sourceId, Integer buffDefId) {
        if (buffDefId == null) {
            return;
        }
        Optional<BuffDef> def = ctx.getContent().getBuffs().find(buffDefId);
        if (def.isEmpty()) {
            return;
        }
        long now = ctx.now();
        long end = def.get().getDurationTicks() > 0 ? now + def.get().getDurationTicks() : BuffInstance.PERMANENT;
        ctx.getEntities().getBuffs().get(pawn)
                .ifPresent(buffs -> buffs.apply(new BuffInstance(source, sourceId, buffDefId, def.get().getMoodOffset(), now, end)));
    }

    private static String activeLabel(ActionType type, BuildingDef def) {
        return switch (type) {
            case WORK -> "Working at " + def.getName();
            case DROP_OFF -> "Delivering to " + def.getName();
            default -> "Using " + def.getName();
        };
    }

    private static String nameOf(SimContext ctx, EntityId id) {
        return ctx.getEntities().getPawns().get(id).map(PawnComponent::getName).orElse("#" + id);
    }
}
