package com.example.pawnsim.engine.system;

import com.example.pawnsim.content.BuildingDef;
import com.example.pawnsim.content.BuildingWorkType;
import com.example.pawnsim.content.NeedDef;
import com.example.pawnsim.engine.SimContext;
import com.example.pawnsim.engine.SimSystem;
import com.example.pawnsim.entity.EntityStore;
import com.example.pawnsim.model.EntityId;
import com.example.pawnsim.model.TileCoord;
import com.example.pawnsim.model.action.ActionDef;
import com.example.pawnsim.model.action.ExpressionType;
import com.example.pawnsim.model.component.ActionComponent;
import com.example.pawnsim.model.component.AttachmentComponent;
import com.example.pawnsim.model.component.BuffComponent;
import com.example.pawnsim.model.component.BuffInstance;
import com.example.pawnsim.model.component.BuildingComponent;
import com.example.pawnsim.model.component.InventoryComponent;
import com.example.pawnsim.model.component.NeedsComponent;
import com.example.pawnsim.model.component.ResourceComponent;
import com.example.pawnsim.world.BuildingFootprint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class AiSystem implements SimSystem {

    static final float NEED_SATISFIED_THRESHOLD = 80f;
    static final float WORK_FILL_THRESHOLD = 0.9f;
    static final int MAX_OTHER_WORKERS = 2;

    static final int OWN_ATTACHMENT_WEIGHT = 3;
    static final int OTHERS_ATTACHMENT_WEIGHT = 1;
    static final int CONVERGING_PENALTY = 10;

    static final int HAUL_LOAD = 20;
    static final int PICK_UP_TICKS = 30;
    static final int HARVEST_CANDIDATES = 5;

    static final int WANDER_RANDOM_SAMPLES = 5;
    static final int WANDER_MAX_STEP = 3;
    static final int WANDER_BASE_IDLE_TICKS = 40;
    static final int WANDER_IDLE_PER_DIVERSITY = 10;
    static final int WANDER_MAX_DIVERSITY_BONUS = 4;
    static final int FALLBACK_IDLE_TICKS = 20;

    private static final int[][] DIRECTIONS = {{0, -1}, {1, 0}, {0, 1}, {-1, 0}};

    @Override
    public void tick(SimContext ctx) {
        EntityStore entities = ctx.getEntities();
        for (EntityId pawn : entities.allPawns()) {
            Optional<ActionComponent> actions = entities.getActions().get(pawn);
            Optional<NeedsComponent> needs = entities.getNeeds().get(pawn);
            Optional<TileCoord> position = entities.positionOf(pawn);
            if (actions.isEmpty() || needs.isEmpty() || position.isEmpty() || !actions.get().isIdle()) {
                continue;
            }
            if (!planForNeeds(ctx, pawn, position.get(), needs.get(), actions.get())) {
                wander(ctx, pawn, position.get(), actions.get());
            }
        }
    }

    private boolean planForNeeds(SimContext ctx, EntityId pawn, TileCoord from, NeedsComponent needs, ActionComponent actions) {
        for (NeedDef need : unsatisfiedNeeds(ctx, needs)) {
            boolean planned = need.isWorkNeed()
                    ? planWork(ctx, pawn, from, need, actions)
                    : planUse(ctx, pawn, from, need, actions);
            if (planned) {
                return true;
            }
        }
        return false;
    }

    /** Needs under the satisfied threshold, lowest value first. */
    private List<NeedDef> unsatisfiedNeeds(SimContext ctx, NeedsComponent needs) {
        List<Map.Entry<Integer, Float>> pending = new ArrayList<>();
        for (Map.Entry<Integer, Float> entry : needs.asMap().entrySet()) {
            if (entry.getValue() < NEED_SATISFIED_THRESHOLD) {
                pending.add(entry);
            }
        }
        pending.sort(Map.Entry.<Integer, Float>comparingByValue().thenComparing(Map.Entry.<Integer, Float>comparingByKey()));
        List<NeedDef> result = new ArrayList<>();
        for (Map.Entry<Integer, Float> entry : pending) {
            ctx.getContent().getNeeds().find(entry.getKey()).ifPresent(result::add);
        }
        return result;
    }

    // =================================================
    // Consuming
    // =================================================

    private boolean planUse(SimContext ctx, EntityId pawn, TileCoord from, NeedDef need, ActionComponent actions) {
        EntityStore entities = ctx.getEntities();
        List<Candidate> candidates = new ArrayList<>();
        for (EntityId building : entities.allBuildings()) {
            Optional<BuildingComponent> bc = entities.getBuildings().get(building);
            Optional<BuildingDef> def = bc.flatMap(b -> ctx.getContent().getBuildings().find(b.getBuildingDefId()));
            Optional<TileCoord> anchor = entities.positionOf(building);
            if (def.isEmpty() || anchor.isEmpty()) {
                continue;
            }
            BuildingDef d = def.get();
            if (d.getSatisfiesNeedId() == null || d.getSatisfiesNeedId() != need.getId()) {
                continue;
            }
            if (bc.get().isInUse() || !d.isCanSellToConsumers()) {
                continue;
            }
            Optional<ResourceComponent> store = entities.getResources().get(building);
            if (store.isPresent() && store.get().getCurrentAmount() < d.consumptionPerUse()) {
                continue;
            }
            if (!Economy.canAfford(entities, pawn, d.getCost())) {
                continue;
            }
            int converging = convergingPawns(ctx, building, pawn);
            float score = baseScore(ctx, pawn, building, from, anchor.get(), converging);
            candidates.add(new Candidate(building, d, anchor.get(), score));
        }

        for (Candidate c : ranked(candidates)) {
            if (isReachable(ctx, pawn, from, BuildingFootprint.useAreaTiles(c.anchor, c.def))) {
                actions.enqueue(ActionDef.useBuilding(c.building, c.def.getInteractionDurationTicks(),
                        need.getId(), c.def.getNeedSatisfactionAmount(), "Going to " + c.def.getName()));
                return true;
            }
        }
        return false;
    }

    // =================================================
    // Working
    // =================================================

    private boolean planWork(SimContext ctx, EntityId pawn, TileCoord from, NeedDef need, ActionComponent actions) {
        EntityStore entities = ctx.getEntities();
        List<Candidate> candidates = new ArrayList<>();
        for (EntityId building : entities.allBuildings()) {
            Optional<BuildingDef> def = entities.getBuildings().get(building)
                    .flatMap(b -> ctx.getContent().getBuildings().find(b.getBuildingDefId()));
            Optional<TileCoord> anchor = entities.positionOf(building);
            Optional<ResourceComponent> store = entities.getResources().get(building);
            if (def.isEmpty() || anchor.isEmpty() || store.isEmpty() || !def.get().isCanBeWorkedAt()) {
                continue;
            }
            float fill = store.get().fillRatio();
            if (fill >= WORK_FILL_THRESHOLD) {
                continue;
            }
            int converging = convergingPawns(ctx, building, pawn);
            if (converging >= MAX_OTHER_WORKERS) {
                continue;
            }
            float score = (1f - fill) * 100f + baseScore(ctx, pawn, building, from, anchor.get(), converging);
            candidates.add(new Candidate(building, def.get(), anchor.get(), score));
        }

        for (Candidate c : ranked(candidates)) {
            if (!isReachable(ctx, pawn, from, BuildingFootprint.useAreaTiles(c.anchor, c.def))) {
                continue;
            }
            if (c.def.getWorkType() == BuildingWorkType.DIRECT) {
                actions.enqueue(ActionDef.work(c.building, c.def.getWorkDurationTicks(), need.getId(),
                        c.def.getWorkSatisfactionAmount(), "Going to work at " + c.def.getName()));
                return true;
            }
            if (planHaul(ctx, pawn, from, need, c, actions)) {
                return true;
            }
        }
        return false;
    }

    private boolean planHaul(SimContext ctx, EntityId pawn, TileCoord from, NeedDef need, Candidate dest, ActionComponent actions) {
        Optional<InventoryComponent> inventory = ctx.getEntities().getInventory().get(pawn);
        Optional<ResourceComponent> destStore = ctx.getEntities().getResources().get(dest.building);
        if (inventory.isEmpty() || destStore.isEmpty()) {
            return false;
        }
        String resource = destStore.get().getResourceType();
        int load = Math.min(HAUL_LOAD, destStore.get().room());

        // already carrying the right goods: deliver straight away
        if (!inventory.get().isEmpty() && resource.equals(inventory.get().getResourceType())) {
            actions.enqueue(dropOff(dest, null, resource, inventory.get().getAmount(), need));
            return true;
        }
        if (!inventory.get().isEmpty()) {
            return planStow(ctx, pawn, from, inventory.get(), actions);
        }
        load = Math.min(load, inventory.get().roomFor(resource));
        if (load <= 0) {
            return false;
        }

        if (dest.def.getWorkType() == BuildingWorkType.HAUL_FROM_BUILDING) {
            Optional<Candidate> source = findSourceBuilding(ctx, pawn, from, dest);
            if (source.isEmpty()) {
                return false;
            }
            actions.enqueue(ActionDef.pickUpFromBuilding(source.get().building, resource, load, PICK_UP_TICKS,
                    "Collecting " + resource + " from " + source.get().def.getName()));
            actions.enqueue(dropOff(dest, source.get().building, resource, load, need));
            return true;
        }

        Optional<TileCoord> harvest = findHarvestTile(ctx, pawn, from, dest.def);
        if (harvest.isEmpty()) {
            return false;
        }
        actions.enqueue(ActionDef.pickUpFromTerrain(harvest.get(), resource, load, PICK_UP_TICKS, "Gathering " + resource));
        actions.enqueue(dropOff(dest, null, resource, load, need));
        return true;
    }

    private ActionDef dropOff(Candidate dest, EntityId source, String resource, int amount, NeedDef need) {
        return ActionDef.dropOff(dest.building, source, resource, amount, dest.def.getWorkDurationTicks(),
                need.getId(), dest.def.getWorkSatisfactionAmount(), "Hauling " + resource + " to " + dest.def.getName());
    }

    /** Leftover goods go to the nearest reachable free building that stores them and has room. */
    private boolean planStow(SimContext ctx, EntityId pawn, TileCoord from, InventoryComponent inventory, ActionComponent actions) {
        EntityStore entities = ctx.getEntities();
        String carried = inventory.getResourceType();
        List<Candidate> stores = new ArrayList<>();
        for (EntityId building : entities.allBuildings()) {
            Optional<BuildingComponent> bc = entities.getBuildings().get(building);
            Optional<ResourceComponent> store = entities.getResources().get(building);
            Optional<BuildingDef> def = bc.flatMap(b -> ctx.getContent().getBuildings().find(b.getBuildingDefId()));
            Optional<TileCoord> anchor = entities.positionOf(building);
            if (store.isEmpty() || def.isEmpty() || anchor.isEmpty() || bc.get().isInUse()) {
                continue;
            }
            if (!store.get().getResourceType().equals(carried) || store.get().room() <= 0) {
                continue;
            }
            stores.add(new Candidate(building, def.get(), anchor.get(), -from.manhattan(anchor.get())));
        }
        for (Candidate c : ranked(stores)) {
            if (isReachable(ctx, pawn, from, BuildingFootprint.useAreaTiles(c.anchor, c.def))) {
                int amount = Math.min(inventory.getAmount(), entities.getResources().get(c.building).orElseThrow().room());
                actions.enqueue(ActionDef.dropOff(c.building, null, carried, amount, PICK_UP_TICKS, null, 0f,
                        "Stowing " + carried + " at " + c.def.getName()));
                return true;
            }
        }
        return false;
    }

    /** Nearest reachable other building stocking the haul resource. */
    private Optional<Candidate> findSourceBuilding(SimContext ctx, EntityId pawn, TileCoord from, Candidate dest) {
        EntityStore entities = ctx.getEntities();
        String wanted = dest.def.getHaulSourceResourceType();
        List<Candidate> sources = new ArrayList<>();
        for (EntityId building : entities.allBuildings()) {
            if (building.equals(dest.building)) {
                continue;
            }
            Optional<ResourceComponent> store = entities.getResources().get(building);
            Optional<BuildingDef> def = entities.getBuildings().get(building)
                    .flatMap(b -> ctx.getContent().getBuildings().find(b.getBuildingDefId()));
            Optional<TileCoord> anchor = entities.positionOf(building);
            if (store.isEmpty() || def.isEmpty() || anchor.isEmpty()) {
                continue;
            }
            if (!store.get().getResourceType().equals(wanted) || store.get().getCurrentAmount() <= 0) {
                continue;
            }
            sources.add(new Candidate(building, def.get(), anchor.get(), -from.manhattan(anchor.get())));
        }
        for (Candidate source : ranked(sources)) {
            if (isReachable(ctx, pawn, from, BuildingFootprint.useAreaTiles(source.anchor, source.def))) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }

    private Optional<TileCoord> findHarvestTile(SimContext ctx, EntityId pawn, TileCoord from, BuildingDef dest) {
        if (dest.getHaulSourceTerrainKey() == null) {
            return Optional.empty();
        }
        Optional<Integer> terrainId = ctx.getContent().getTerrains().findId(dest.getHaulSourceTerrainKey());
        if (terrainId.isEmpty()) {
            return Optional.empty();
        }
        List<TileCoord> tiles = ctx.getWorld().tilesWithTerrain(terrainId.get());
        tiles.sort(Comparator.comparingInt(from::manhattan));
        int checked = 0;
        for (TileCoord tile : tiles) {
            if (checked++ >= HARVEST_CANDIDATES) {
                break;
            }
            if (isReachable(ctx, pawn, from, Navigation.harvestTiles(ctx, tile))) {
                return Optional.of(tile);
            }
        }
        return Optional.empty();
    }

    // =================================================
    // Scoring
    // =================================================

    /** Distance penalty plus attachment bias minus a penalty per pawn already heading there. */
    private float baseScore(SimContext ctx, EntityId pawn, EntityId building, TileCoord from, TileCoord anchor, int converging) {
        int own = 0;
        int others = 0;
        Optional<AttachmentComponent> attachment = ctx.getEntities().getAttachments().get(building);
        if (attachment.isPresent()) {
            own = attachment.get().get(pawn);
            others = attachment.get().sumExcluding(pawn);
        }
        return -from.manhattan(anchor)
                + OWN_ATTACHMENT_WEIGHT * own
                - OTHERS_ATTACHMENT_WEIGHT * others
                - CONVERGING_PENALTY * converging;
    }

    /** Other pawns whose current or queued actions target the building. */
    static int convergingPawns(SimContext ctx, EntityId building, EntityId self) {
        int count = 0;
        for (EntityId other : ctx.getEntities().allPawns()) {
            if (other.equals(self)) {
                continue;
            }
            Optional<ActionComponent> ac = ctx.getEntities().getActions().get(other);
            if (ac.isPresent() && targets(ac.get(), building)) {
                count++;
            }
        }
        return count;
    }

    private static boolean targets(ActionComponent ac, EntityId building) {
        if (ac.getCurrentAction() != null && building.equals(ac.getCurrentAction().getTargetEntity())) {
            return true;
        }
        for (ActionDef queued : ac.getQueue()) {
            if (building.equals(queued.getTargetEntity())) {
                return true;
            }
        }
        return false;
    }

    private static List<Candidate> ranked(List<Candidate> candidates) {
        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingDouble((Candidate c) -> -c.score).thenComparing(c -> c.building));
        return sorted;
    }

    private boolean isReachable(SimContext ctx, EntityId pawn, TileCoord from, List<TileCoord> tiles) {
        return tiles.contains(from) || Navigation.nearestReachable(ctx, pawn, from, tiles).isPresent();
    }

    // =================================================
    // Wandering
    // =================================================

    private void wander(SimContext ctx, EntityId pawn, TileCoord from, ActionComponent actions) {
        List<TileCoord> samples = new ArrayList<>();
        for (int i = 0; i < WANDER_RANDOM_SAMPLES; i++) {
            int x = ctx.getWorld().getMinX() + ctx.getRandom().nextInt(ctx.getWorld().getWidth());
            int y = ctx.getWorld().getMinY() + ctx.getRandom().nextInt(ctx.getWorld().getHeight());
            samples.add(TileCoord.of(x, y));
        }
        for (int[] d : DIRECTIONS) {
            int step = 1 + ctx.getRandom().nextInt(WANDER_MAX_STEP);
            samples.add(from.offset(d[0] * step, d[1] * step));
        }

        Set<TileCoord> occupied = ctx.getEntities().pawnTiles(pawn);
        List<TileCoord> best = new ArrayList<>();
        int bestScore = Integer.MIN_VALUE;
        for (TileCoord tile : samples) {
            if (tile.equals(from) || !ctx.getWorld().isWalkable(tile) || occupied.contains(tile) || best.contains(tile)) {
                continue;
            }
            int score = ctx.getDiversity().get(ctx.getWorld(), tile);
            if (score > bestScore) {
                bestScore = score;
                best.clear();
                best.add(tile);
            } else if (score == bestScore) {
                best.add(tile);
            }
        }

        if (best.isEmpty()) {
            actions.enqueue(ActionDef.idle(FALLBACK_IDLE_TICKS, "Idle", ExpressionType.QUESTION, null));
            return;
        }
        TileCoord target = best.get(ctx.getRandom().nextInt(best.size()));
        int idleTicks = WANDER_BASE_IDLE_TICKS + Math.min(bestScore, WANDER_MAX_DIVERSITY_BONUS) * WANDER_IDLE_PER_DIVERSITY;

        actions.enqueue(ActionDef.wander(target));
        actions.enqueue(idleWithMood(ctx, pawn, idleTicks));
    }

    /** Idle whose bubble shows the strongest buff, or failing that the lowest unsatisfied need. */
    private ActionDef idleWithMood(SimContext ctx, EntityId pawn, int ticks) {
        Optional<BuffInstance> strongest = ctx.getEntities().getBuffs().get(pawn)
                .map(BuffComponent::getActive)
                .flatMap(active -> active.stream().max(Comparator.comparingDouble(b -> Math.abs(b.getMoodOffset()))));
        if (strongest.isPresent()) {
            ExpressionType expression = strongest.get().getMoodOffset() >= 0 ? ExpressionType.HAPPY : ExpressionType.COMPLAINT;
            return ActionDef.idle(ticks, "Looking around", expression, strongest.get().getBuffDefId());
        }
        Optional<Map.Entry<Integer, Float>> lowest = ctx.getEntities().getNeeds().get(pawn)
                .flatMap(needs -> needs.asMap().entrySet().stream()
                        .filter(e -> e.getValue() < NEED_SATISFIED_THRESHOLD)
                        .min(Map.Entry.comparingByValue()));
        if (lowest.isPresent()) {
            return ActionDef.idle(ticks, "Looking around", ExpressionType.THOUGHT, lowest.get().getKey());
        }
        return ActionDef.idle(ticks, "Looking around");
    }

    private static final class Candidate {
        final EntityId building;
        final BuildingDef def;
        final TileCoord anchor;
        final float score;

        Candidate(EntityId building, BuildingDef def, TileCoord anchor, float score) {
            this.building = building;
            this.def = def;
            this.anchor = anchor;
            this.score = score;
        }
    }
}
